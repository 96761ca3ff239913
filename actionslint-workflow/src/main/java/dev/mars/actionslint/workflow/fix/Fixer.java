/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package dev.mars.actionslint.workflow.fix;

import dev.mars.actionslint.core.Edit;
import dev.mars.actionslint.core.Problem;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Applies the edits carried by problems to a source text in one pass.
 *
 * <p>Edits are sorted by descending start offset, keeping discovery order among equal starts,
 * and applied right to left so that earlier offsets stay valid. An edit that conflicts with an
 * edit already accepted, or that falls outside the text, is not applied and its problem is
 * reported as unfixed. The output is never re-parsed.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class Fixer {

    private static final Logger logger = Logger.getLogger(Fixer.class.getName());

    private Fixer() {
    }

    public static FixResult apply(String source, List<Problem> problems) {
        Objects.requireNonNull(source, "Source cannot be null");
        Objects.requireNonNull(problems, "Problems cannot be null");

        List<Problem> fixable = new ArrayList<>();
        for (Problem problem : problems) {
            if (problem.isFixable()) {
                fixable.add(problem);
            }
        }
        // List.sort is stable
        fixable.sort(Comparator.comparingInt((Problem p) -> p.getEdit().get().start()).reversed());

        List<Problem> applied = new ArrayList<>();
        List<Problem> unfixed = new ArrayList<>();
        List<Edit> accepted = new ArrayList<>();
        StringBuilder text = new StringBuilder(source);

        for (Problem problem : fixable) {
            Edit edit = problem.getEdit().get();
            if (edit.end() > source.length()) {
                logger.fine("Edit " + edit + " is outside the source, leaving " + problem.getRuleId() + " unfixed");
                unfixed.add(problem);
                continue;
            }
            if (accepted.stream().anyMatch(edit::conflictsWith)) {
                logger.fine("Edit " + edit + " conflicts with an applied edit, leaving " + problem.getRuleId() + " unfixed");
                unfixed.add(problem);
                continue;
            }
            // Every accepted edit starts at or after this one, so offsets before it are untouched
            text.replace(edit.start(), edit.end(), edit.replacement());
            accepted.add(edit);
            applied.add(problem);
        }

        if (!fixable.isEmpty()) {
            logger.fine("Applied " + applied.size() + " of " + fixable.size() + " edits");
        }
        return new FixResult(text.toString(), applied, unfixed);
    }
}
