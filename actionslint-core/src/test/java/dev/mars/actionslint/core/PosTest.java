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

class PosTest {

    @Test
    void testDisplayIsOneBased() {
        Pos pos = new Pos(2, 4, 30);

        assertEquals(3, pos.displayLine());
        assertEquals(5, pos.displayColumn());
        assertEquals("3:5", pos.toString());
    }

    @Test
    void testShift() {
        assertEquals(new Pos(1, 7, 17), new Pos(1, 2, 12).shift(5));
    }

    @Test
    void testOrderingByOffset() {
        assertTrue(new Pos(0, 9, 9).compareTo(new Pos(1, 0, 10)) < 0);
        assertEquals(0, new Pos(1, 0, 10).compareTo(new Pos(1, 0, 10)));
    }

    @Test
    void testNegativeComponentsRejected() {
        assertThrows(IllegalArgumentException.class, () -> new Pos(-1, 0, 0));
        assertThrows(IllegalArgumentException.class, () -> new Pos(0, 0, -3));
    }
}
