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

import dev.mars.actionslint.workflow.ast.Job;
import dev.mars.actionslint.workflow.ast.ScopedString;
import dev.mars.actionslint.workflow.ast.Step;
import dev.mars.actionslint.workflow.expression.ContextReference;
import dev.mars.actionslint.workflow.expression.EmbeddedExpression;

/**
 * A context reference found in an embedded expression, with the scalar that holds it.
 */
public record ScopedReference(ScopedString scope, EmbeddedExpression expression, ContextReference reference) {

    public Job job() {
        return scope.job();
    }

    public Step step() {
        return scope.step();
    }

    public String contextName() {
        return reference.root().name();
    }

    /**
     * The expression text as written between the delimiters, trimmed.
     */
    public String text() {
        return expression.text().trim();
    }
}
