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
 * One segment of a context reference such as {@code steps}, {@code build} or {@code outputs} in
 * {@code steps.build.outputs}. {@code offset} is the absolute source offset of the first
 * character of the name; for bracket access ({@code a['b']}) it points at the opening quote.
 * A wildcard segment has the name {@code *}.
 */
public record PathSegment(String name, int offset, boolean bracketed) {

    public static final String WILDCARD = "*";

    public PathSegment {
        Objects.requireNonNull(name, "Segment name cannot be null");
    }

    public PathSegment(String name, int offset) {
        this(name, offset, false);
    }

    public boolean isWildcard() {
        return !bracketed && WILDCARD.equals(name);
    }

    /**
     * Exclusive end offset of the name. Only meaningful for dotted segments, whose source text
     * is exactly the name.
     */
    public int end() {
        return offset + name.length();
    }
}
