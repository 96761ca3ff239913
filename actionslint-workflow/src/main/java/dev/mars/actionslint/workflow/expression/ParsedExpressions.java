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

package dev.mars.actionslint.workflow.expression;

import dev.mars.actionslint.core.Problem;

import java.util.List;

/**
 * The expressions found in one scalar and the syntax problems met while parsing them.
 */
public record ParsedExpressions(List<EmbeddedExpression> expressions, List<Problem> problems) {

    public static final ParsedExpressions NONE = new ParsedExpressions(List.of(), List.of());

    public ParsedExpressions {
        expressions = List.copyOf(expressions);
        problems = List.copyOf(problems);
    }
}
