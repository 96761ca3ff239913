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

import java.util.Arrays;
import java.util.Objects;

/**
 * Maps absolute character offsets of a source text to {@link Pos} values.
 *
 * <p>Line breaks are {@code \n}, {@code \r\n} and a lone {@code \r}, matching the YAML
 * tokenizer's notion of a line.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public final class LineMap {

    private final int length;
    private final int[] lineStarts;

    public LineMap(String source) {
        Objects.requireNonNull(source, "Source cannot be null");
        this.length = source.length();

        int[] starts = new int[16];
        int count = 0;
        starts[count++] = 0;
        for (int i = 0; i < length; i++) {
            char c = source.charAt(i);
            boolean lineBreak = c == '\n' || (c == '\r' && (i + 1 >= length || source.charAt(i + 1) != '\n'));
            if (lineBreak) {
                if (count == starts.length) {
                    starts = Arrays.copyOf(starts, count * 2);
                }
                starts[count++] = i + 1;
            }
        }
        this.lineStarts = Arrays.copyOf(starts, count);
    }

    /**
     * Returns the position of the character at {@code offset}. An offset equal to the source
     * length denotes the end of the text.
     *
     * @throws IllegalArgumentException if the offset lies outside {@code [0, length]}
     */
    public Pos posAt(int offset) {
        if (offset < 0 || offset > length) {
            throw new IllegalArgumentException("Offset " + offset + " outside source of length " + length);
        }
        int index = Arrays.binarySearch(lineStarts, offset);
        int line = index >= 0 ? index : -index - 2;
        return new Pos(line, offset - lineStarts[line], offset);
    }

    public int lineCount() {
        return lineStarts.length;
    }

    /**
     * Returns the offset of the first character of the given zero-based line.
     */
    public int lineStart(int line) {
        return lineStarts[line];
    }

    public int length() {
        return length;
    }
}
