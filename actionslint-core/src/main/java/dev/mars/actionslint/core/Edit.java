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

import java.util.Objects;

/**
 * A character-exact text replacement: remove {@code length} characters starting at the absolute
 * offset {@code start} and insert {@code replacement} in their place.
 *
 * <p>An edit is a pure instruction. It never touches the in-memory AST; the fixer consumes it
 * against the original source text.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public record Edit(int start, int length, String replacement) {

    public Edit {
        if (start < 0) {
            throw new IllegalArgumentException("Edit start cannot be negative: " + start);
        }
        if (length < 0) {
            throw new IllegalArgumentException("Edit length cannot be negative: " + length);
        }
        Objects.requireNonNull(replacement, "Replacement cannot be null");
    }

    public static Edit replace(int start, int length, String replacement) {
        return new Edit(start, length, replacement);
    }

    public static Edit insert(int offset, String text) {
        return new Edit(offset, 0, text);
    }

    public static Edit delete(int start, int length) {
        return new Edit(start, length, "");
    }

    /**
     * Exclusive end offset of the replaced range.
     */
    public int end() {
        return start + length;
    }

    /**
     * Two edits conflict when their replaced ranges intersect, or when both start at the same
     * offset (two insertions at one point have no well-defined order).
     */
    public boolean conflictsWith(Edit other) {
        if (start == other.start) {
            return true;
        }
        return start < other.end() && other.start < end();
    }

    /**
     * Applies this edit to {@code text}.
     *
     * @throws IndexOutOfBoundsException if the edit does not fit the text
     */
    public String applyTo(String text) {
        if (end() > text.length()) {
            throw new IndexOutOfBoundsException(
                    "Edit [" + start + ", " + end() + ") outside text of length " + text.length());
        }
        return text.substring(0, start) + replacement + text.substring(end());
    }
}
