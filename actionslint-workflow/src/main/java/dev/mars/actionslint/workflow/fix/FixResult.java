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

import dev.mars.actionslint.core.Problem;

import java.util.List;
import java.util.Objects;

/**
 * Outcome of applying edits: the rewritten text, the problems whose edit was applied and the
 * problems whose edit was dropped.
 *
 * @param text      rewritten source
 * @param applied   problems fixed, in the order their edits were applied
 * @param unfixed   fixable problems left unfixed because of conflicts or invalid ranges
 */
public record FixResult(String text, List<Problem> applied, List<Problem> unfixed) {

    public FixResult {
        Objects.requireNonNull(text, "Text cannot be null");
        applied = List.copyOf(applied);
        unfixed = List.copyOf(unfixed);
    }

    public boolean hasChanges() {
        return !applied.isEmpty();
    }
}
