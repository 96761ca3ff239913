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

package dev.mars.actionslint.workflow.building;

import dev.mars.actionslint.core.Problem;
import dev.mars.actionslint.workflow.ast.Workflow;

import java.util.List;
import java.util.Objects;

/**
 * The workflow built from a token stream, possibly partial, and the structural problems found.
 */
public record BuildResult(Workflow workflow, List<Problem> problems) {

    public BuildResult {
        Objects.requireNonNull(workflow, "Workflow cannot be null");
        problems = List.copyOf(problems);
    }
}
