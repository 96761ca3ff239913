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

package dev.mars.actionslint.workflow.ast;

import dev.mars.actionslint.core.Pos;
import dev.mars.actionslint.workflow.expression.EmbeddedExpression;

import java.util.List;
import java.util.Objects;

/**
 * A scalar value of the workflow together with its source position.
 *
 * <p>Every scalar is represented this way, including mapping keys and job ids, so that each leaf
 * can be diagnosed and fixed individually. {@link #getPos()} points at the first character of the
 * value's content (after the opening quote for quoted scalars); for plain and quoted scalars
 * without escapes {@code source.substring(pos.offset(), pos.offset() + value.length())} equals
 * the value. {@link #getSourceEnd()} is the exclusive end offset of the whole token in the
 * source, closing quote included.</p>
 *
 * <p>Embedded {@code ${{ ... }}} expressions are parsed when the string is built and carry
 * absolute source offsets.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public final class SourceString implements YamlNode {

    private final String value;
    private final Pos pos;
    private final int sourceEnd;
    private final ScalarStyle style;
    private final List<EmbeddedExpression> expressions;

    public SourceString(String value, Pos pos, int sourceEnd, ScalarStyle style, List<EmbeddedExpression> expressions) {
        this.value = Objects.requireNonNull(value, "Value cannot be null");
        this.pos = Objects.requireNonNull(pos, "Position cannot be null");
        this.sourceEnd = sourceEnd;
        this.style = Objects.requireNonNull(style, "Style cannot be null");
        this.expressions = List.copyOf(expressions != null ? expressions : List.of());
    }

    /**
     * A plain string without expressions, mostly useful for tests and placeholders.
     */
    public static SourceString of(String value, Pos pos) {
        return new SourceString(value, pos, pos.offset() + value.length(), ScalarStyle.PLAIN, List.of());
    }

    /**
     * Empty stand-in used when the builder has to synthesize a missing scalar.
     */
    public static SourceString placeholder(Pos pos) {
        return new SourceString("", pos, pos.offset(), ScalarStyle.PLAIN, List.of());
    }

    @Override
    public Kind kind() {
        return Kind.SCALAR;
    }

    public String getValue() {
        return value;
    }

    @Override
    public Pos getPos() {
        return pos;
    }

    public int getSourceEnd() {
        return sourceEnd;
    }

    public ScalarStyle getStyle() {
        return style;
    }

    public List<EmbeddedExpression> getExpressions() {
        return expressions;
    }

    public boolean hasExpressions() {
        return !expressions.isEmpty();
    }

    public boolean isEmpty() {
        return value.isEmpty();
    }

    /**
     * True when the value is a verbatim copy of the source text at {@link #getPos()}, so an edit
     * computed from value indexes can be applied to the source directly.
     */
    public boolean isVerbatimIn(String source) {
        int start = pos.offset();
        int end = start + value.length();
        return !style.isBlock() && end <= source.length() && source.regionMatches(start, value, 0, value.length());
    }

    public boolean valueEquals(String other) {
        return value.equals(other);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        SourceString that = (SourceString) o;
        return sourceEnd == that.sourceEnd &&
               value.equals(that.value) &&
               pos.equals(that.pos) &&
               style == that.style &&
               expressions.equals(that.expressions);
    }

    @Override
    public int hashCode() {
        return Objects.hash(value, pos, sourceEnd, style, expressions);
    }

    @Override
    public String toString() {
        return value;
    }
}
