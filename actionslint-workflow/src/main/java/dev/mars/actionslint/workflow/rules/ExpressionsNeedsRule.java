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

package dev.mars.actionslint.workflow.rules;

import dev.mars.actionslint.core.Problem;
import dev.mars.actionslint.workflow.expression.ContextReference;
import dev.mars.actionslint.workflow.expression.PathSegment;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Stream;

/**
 * Checks {@code needs.<job>} references against the dependencies the enclosing job declares.
 * Only direct dependencies are visible through the {@code needs} context.
 */
public class ExpressionsNeedsRule implements Rule {

    public static final String ID = "expressions-needs";

    static final List<String> ATTRIBUTES = List.of("result", "outputs");

    @Override
    public String id() {
        return ID;
    }

    @Override
    public Stream<Problem> check(RuleContext context) {
        List<Problem> problems = new ArrayList<>();
        for (ScopedReference scoped : context.getContextReferences()) {
            if (!"needs".equals(scoped.contextName()) || scoped.job() == null) {
                continue;
            }
            ContextReference reference = scoped.reference();
            if (!reference.hasSegment(1) || reference.segment(1).isWildcard()) {
                continue;
            }
            String jobId = scoped.job().getName();
            PathSegment needed = reference.segment(1);
            Set<String> direct = context.getGraph().directDependencies(jobId);
            if (!direct.contains(needed.name())) {
                problems.add(Problem.error(context.posAt(needed.offset()),
                        "Job '" + jobId + "' references 'needs." + needed.name() + "' in expression '"
                                + scoped.text() + "' but does not declare '" + needed.name() + "' in its needs", ID));
                continue;
            }
            if (!reference.hasSegment(2)) {
                continue;
            }
            PathSegment attribute = reference.segment(2);
            if (attribute.isWildcard() || ATTRIBUTES.contains(attribute.name())) {
                continue;
            }
            Optional<String> suggestion = Suggestions.closest(attribute.name(), ATTRIBUTES,
                    context.getSimilarityThreshold());
            problems.add(ExpressionsContextsRule.withRename(context, Problem.error(context.posAt(attribute.offset()),
                    "Unknown property '" + attribute.name() + "' of 'needs." + needed.name()
                            + "', expected 'result' or 'outputs'"
                            + suggestion.map(s -> ", did you mean '" + s + "'?").orElse(""), ID),
                    attribute, suggestion));
        }
        return problems.stream();
    }
}
