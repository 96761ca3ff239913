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

import java.util.List;
import java.util.Objects;

/**
 * A call of one of the built-in functions, e.g. {@code contains(github.ref, 'main')}.
 */
public record FunctionCall(String name, int nameOffset, List<Expression> arguments, int start, int end)
        implements Expression {

    public FunctionCall {
        Objects.requireNonNull(name, "Function name cannot be null");
        arguments = List.copyOf(Objects.requireNonNull(arguments, "Arguments cannot be null"));
    }

    @Override
    public Kind kind() {
        return Kind.FUNCTION_CALL;
    }

    @Override
    public List<Expression> children() {
        return arguments;
    }
}
