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

import dev.mars.actionslint.core.Pos;
import dev.mars.actionslint.workflow.ast.ScalarStyle;

import java.util.Objects;

/**
 * One token of the YAML stream consumed by {@link WorkflowAstBuilder}.
 *
 * <p>{@code start} and {@code end} delimit the token in the source ({@code end} exclusive). For
 * scalars {@code value} is the resolved text; for {@link TokenType#BLOCK_MARKER} tokens it is one
 * of the marker constants below.</p>
 *
 * @param type  the token type
 * @param start position of the first character of the token
 * @param end   position just past the token
 * @param value scalar text or marker name, empty for collection tokens
 * @param style scalar style, {@link ScalarStyle#PLAIN} for non-scalars
 * @param alias whether the scalar stands for an alias ({@code *name})
 */
public record YamlToken(TokenType type, Pos start, Pos end, String value, ScalarStyle style, boolean alias) {

    public static final String STREAM_START = "stream-start";
    public static final String STREAM_END = "stream-end";
    public static final String DOCUMENT_START = "document-start";
    public static final String DOCUMENT_END = "document-end";

    public YamlToken {
        Objects.requireNonNull(type, "Token type cannot be null");
        Objects.requireNonNull(start, "Start cannot be null");
        Objects.requireNonNull(end, "End cannot be null");
        Objects.requireNonNull(value, "Value cannot be null");
        Objects.requireNonNull(style, "Style cannot be null");
    }

    public static YamlToken scalar(String value, Pos start, Pos end, ScalarStyle style) {
        return new YamlToken(TokenType.SCALAR, start, end, value, style, false);
    }

    public static YamlToken alias(String name, Pos start, Pos end) {
        return new YamlToken(TokenType.SCALAR, start, end, "*" + name, ScalarStyle.PLAIN, true);
    }

    public static YamlToken of(TokenType type, Pos start, Pos end) {
        return new YamlToken(type, start, end, "", ScalarStyle.PLAIN, false);
    }

    public static YamlToken marker(String marker, Pos start, Pos end) {
        return new YamlToken(TokenType.BLOCK_MARKER, start, end, marker, ScalarStyle.PLAIN, false);
    }

    public boolean isMarker(String marker) {
        return type == TokenType.BLOCK_MARKER && value.equals(marker);
    }
}
