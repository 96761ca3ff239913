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

package dev.mars.actionslint.core;

/**
 * A position in a workflow source file.
 *
 * <p>{@code line} and {@code column} are zero-based, exactly as reported by the YAML tokenizer.
 * {@code offset} is the absolute UTF-16 character index into the original source text, so
 * {@code source.charAt(offset)} is the first character of whatever the position is attached to.</p>
 *
 * <p>{@link #toString()} renders the human-facing, one-based {@code line:column} form.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public record Pos(int line, int column, int offset) implements Comparable<Pos> {

    /** Position of the first character of a document. */
    public static final Pos START = new Pos(0, 0, 0);

    public Pos {
        if (line < 0 || column < 0 || offset < 0) {
            throw new IllegalArgumentException(
                    "Position components cannot be negative: line=" + line + ", column=" + column + ", offset=" + offset);
        }
    }

    /**
     * Returns a position {@code delta} characters further on the same line.
     */
    public Pos shift(int delta) {
        return new Pos(line, column + delta, offset + delta);
    }

    public int displayLine() {
        return line + 1;
    }

    public int displayColumn() {
        return column + 1;
    }

    @Override
    public int compareTo(Pos other) {
        return Integer.compare(offset, other.offset);
    }

    @Override
    public String toString() {
        return displayLine() + ":" + displayColumn();
    }
}
