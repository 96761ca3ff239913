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

import dev.mars.actionslint.core.Pos;

import java.util.Objects;

/**
 * One {@code ${{ ... }}} occurrence inside a scalar.
 *
 * @param text       the inner text between the delimiters
 * @param root       the parsed expression, a {@link RawExpression} when parsing failed
 * @param start      absolute offset of {@code $}
 * @param end        absolute offset just past the closing {@code }}}, or the end of the scalar
 *                   when the region is unterminated
 * @param innerStart absolute offset of the first character of {@code text}
 * @param pos        position of {@code start}
 */
public record EmbeddedExpression(String text, Expression root, int start, int end, int innerStart, Pos pos) {

    public EmbeddedExpression {
        Objects.requireNonNull(text, "Text cannot be null");
        Objects.requireNonNull(root, "Root cannot be null");
        Objects.requireNonNull(pos, "Position cannot be null");
    }

    public boolean isValid() {
        return root.kind() != Expression.Kind.RAW;
    }
}
