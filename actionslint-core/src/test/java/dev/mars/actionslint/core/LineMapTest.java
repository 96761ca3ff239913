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

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link LineMap}.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
class LineMapTest {

    @Test
    void testSingleLine() {
        LineMap map = new LineMap("name: ci");

        assertEquals(1, map.lineCount());
        assertEquals(new Pos(0, 6, 6), map.posAt(6));
        assertEquals(new Pos(0, 8, 8), map.posAt(8));
    }

    @Test
    void testLineBreakStyles() {
        String source = "a\nb\r\nc\rd";
        LineMap map = new LineMap(source);

        assertEquals(4, map.lineCount());
        assertEquals(new Pos(1, 0, 2), map.posAt(2));
        assertEquals(new Pos(1, 1, 3), map.posAt(3));
        assertEquals(new Pos(2, 0, 5), map.posAt(5));
        assertEquals(new Pos(3, 0, 7), map.posAt(7));
        assertEquals(5, map.lineStart(2));
    }

    @Test
    void testEveryOffsetMapsBack() {
        String source = "on: push\njobs:\n  build:\n    runs-on: ubuntu-latest\n";
        LineMap map = new LineMap(source);

        for (int offset = 0; offset <= source.length(); offset++) {
            Pos pos = map.posAt(offset);
            assertEquals(offset, map.lineStart(pos.line()) + pos.column());
        }
    }

    @Test
    void testOffsetOutsideSource() {
        LineMap map = new LineMap("abc");

        assertThrows(IllegalArgumentException.class, () -> map.posAt(-1));
        assertThrows(IllegalArgumentException.class, () -> map.posAt(4));
    }

    @Test
    void testEmptySource() {
        LineMap map = new LineMap("");

        assertEquals(1, map.lineCount());
        assertEquals(Pos.START, map.posAt(0));
    }
}
