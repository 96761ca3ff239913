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

import java.util.function.IntUnaryOperator;

/**
 * Maps indexes of a scalar value back to source offsets.
 *
 * <p>Plain and escape-free quoted scalars are verbatim copies of the source, so the mapping is a
 * shift. Block and escaped scalars are aligned greedily: each value character is matched with the
 * next equal source character inside the scalar's extent, and characters without a match
 * (escape sequences, folded line breaks) keep the previous position.</p>
 */
final class ValueOffsets {

    private ValueOffsets() {
    }

    static IntUnaryOperator shifted(int base) {
        return i -> base + i;
    }

    static IntUnaryOperator of(String source, int contentStart, int sourceEnd, String value) {
        int end = Math.min(sourceEnd, source.length());
        if (contentStart + value.length() <= end
                && source.regionMatches(contentStart, value, 0, value.length())) {
            return shifted(contentStart);
        }
        int[] map = new int[value.length() + 1];
        int cursor = contentStart;
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            int k = cursor;
            while (k < end && source.charAt(k) != c) {
                k++;
            }
            if (k < end) {
                map[i] = k;
                cursor = k + 1;
            } else {
                map[i] = Math.min(cursor, end);
            }
        }
        map[value.length()] = Math.min(cursor, end);
        return i -> map[Math.max(0, Math.min(i, map.length - 1))];
    }
}
