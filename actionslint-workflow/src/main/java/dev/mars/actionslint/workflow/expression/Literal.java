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

import java.util.Objects;

/**
 * A literal value. For strings {@code value} holds the unescaped content; for other literal types
 * it is the source text.
 */
public record Literal(LiteralType type, String value, int start, int end) implements Expression {

    public Literal {
        Objects.requireNonNull(type, "Literal type cannot be null");
        Objects.requireNonNull(value, "Literal value cannot be null");
    }

    @Override
    public Kind kind() {
        return Kind.LITERAL;
    }
}
