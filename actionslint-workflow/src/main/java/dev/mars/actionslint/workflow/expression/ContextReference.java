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

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * A dotted reference into one of the runtime contexts, e.g. {@code needs.build.outputs.version}.
 */
public record ContextReference(List<PathSegment> segments, int start, int end) implements Expression {

    public ContextReference {
        segments = List.copyOf(Objects.requireNonNull(segments, "Segments cannot be null"));
        if (segments.isEmpty()) {
            throw new IllegalArgumentException("A context reference needs at least one segment");
        }
    }

    @Override
    public Kind kind() {
        return Kind.CONTEXT_REFERENCE;
    }

    /**
     * The context name, i.e. the first segment.
     */
    public PathSegment root() {
        return segments.get(0);
    }

    public int size() {
        return segments.size();
    }

    public PathSegment segment(int index) {
        return segments.get(index);
    }

    public boolean hasSegment(int index) {
        return index < segments.size();
    }

    public String path() {
        return segments.stream().map(PathSegment::name).collect(Collectors.joining("."));
    }
}
