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

import java.util.List;
import java.util.Objects;

/**
 * An ordered YAML sequence.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public final class YamlSequence implements YamlNode {

    private final Pos pos;
    private final List<YamlNode> items;

    public YamlSequence(Pos pos, List<YamlNode> items) {
        this.pos = Objects.requireNonNull(pos, "Position cannot be null");
        this.items = List.copyOf(Objects.requireNonNull(items, "Items cannot be null"));
    }

    @Override
    public Kind kind() {
        return Kind.SEQUENCE;
    }

    @Override
    public Pos getPos() {
        return pos;
    }

    public List<YamlNode> getItems() {
        return items;
    }

    public int size() {
        return items.size();
    }

    public boolean isEmpty() {
        return items.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        YamlSequence that = (YamlSequence) o;
        return pos.equals(that.pos) && items.equals(that.items);
    }

    @Override
    public int hashCode() {
        return Objects.hash(pos, items);
    }

    @Override
    public String toString() {
        return "YamlSequence{size=" + items.size() + '}';
    }
}
