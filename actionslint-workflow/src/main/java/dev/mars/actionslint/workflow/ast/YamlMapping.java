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
import java.util.Optional;

/**
 * An ordered YAML mapping with scalar keys. Entries keep document order; the builder drops
 * duplicate keys, so every key value occurs at most once.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public final class YamlMapping implements YamlNode {

    private final Pos pos;
    private final List<Entry> entries;

    public YamlMapping(Pos pos, List<Entry> entries) {
        this.pos = Objects.requireNonNull(pos, "Position cannot be null");
        this.entries = List.copyOf(Objects.requireNonNull(entries, "Entries cannot be null"));
    }

    public static YamlMapping empty(Pos pos) {
        return new YamlMapping(pos, List.of());
    }

    @Override
    public Kind kind() {
        return Kind.MAPPING;
    }

    @Override
    public Pos getPos() {
        return pos;
    }

    public List<Entry> getEntries() {
        return entries;
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    public int size() {
        return entries.size();
    }

    public boolean containsKey(String key) {
        return getEntry(key).isPresent();
    }

    public Optional<Entry> getEntry(String key) {
        for (Entry entry : entries) {
            if (entry.key().valueEquals(key)) {
                return Optional.of(entry);
            }
        }
        return Optional.empty();
    }

    public Optional<YamlNode> get(String key) {
        return getEntry(key).map(Entry::value);
    }

    public Optional<SourceString> getScalar(String key) {
        return get(key).filter(YamlNode::isScalar).map(SourceString.class::cast);
    }

    public Optional<YamlMapping> getMapping(String key) {
        return get(key).filter(YamlNode::isMapping).map(YamlMapping.class::cast);
    }

    public Optional<YamlSequence> getSequence(String key) {
        return get(key).filter(YamlNode::isSequence).map(YamlSequence.class::cast);
    }

    public List<SourceString> keys() {
        return entries.stream().map(Entry::key).toList();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        YamlMapping that = (YamlMapping) o;
        return pos.equals(that.pos) && entries.equals(that.entries);
    }

    @Override
    public int hashCode() {
        return Objects.hash(pos, entries);
    }

    @Override
    public String toString() {
        return "YamlMapping{keys=" + keys() + '}';
    }

    /**
     * One key/value pair of a mapping.
     */
    public record Entry(SourceString key, YamlNode value) {
        public Entry {
            Objects.requireNonNull(key, "Key cannot be null");
            Objects.requireNonNull(value, "Value cannot be null");
        }
    }
}
