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

package dev.mars.actionslint.workflow.metadata;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * What the linter knows about a remote action: the inputs and outputs declared in its
 * {@code action.yml} and its version tags, newest first.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public final class ActionMetadata {

    private final String name;
    private final Map<String, ActionInput> inputs;
    private final Set<String> outputs;
    private final List<String> tags;
    private final Map<String, String> tagCommits;

    public ActionMetadata(String name, Map<String, ActionInput> inputs, Set<String> outputs, List<String> tags) {
        this(name, inputs, outputs, tags, Map.of());
    }

    /**
     * @param tagCommits commit SHA of each tag; tags missing from the map have no known commit
     */
    public ActionMetadata(String name, Map<String, ActionInput> inputs, Set<String> outputs, List<String> tags,
                          Map<String, String> tagCommits) {
        this.name = name;
        this.inputs = Collections.unmodifiableMap(new LinkedHashMap<>(Objects.requireNonNull(inputs, "Inputs cannot be null")));
        this.outputs = Collections.unmodifiableSet(new LinkedHashSet<>(Objects.requireNonNull(outputs, "Outputs cannot be null")));
        this.tags = List.copyOf(Objects.requireNonNull(tags, "Tags cannot be null"));
        this.tagCommits = Collections.unmodifiableMap(new LinkedHashMap<>(Objects.requireNonNull(tagCommits, "Tag commits cannot be null")));
    }

    /**
     * Reads the metadata from a loaded {@code action.yml} document.
     *
     * @param document the document as loaded by SnakeYAML
     * @param tags     version tags, newest first
     */
    public static ActionMetadata fromDocument(Map<?, ?> document, List<String> tags) {
        return fromDocument(document, tags, Map.of());
    }

    public static ActionMetadata fromDocument(Map<?, ?> document, List<String> tags, Map<String, String> tagCommits) {
        Object name = document.get("name");
        Map<String, ActionInput> inputs = new LinkedHashMap<>();
        if (document.get("inputs") instanceof Map<?, ?> declared) {
            for (Map.Entry<?, ?> entry : declared.entrySet()) {
                String inputName = String.valueOf(entry.getKey());
                boolean required = false;
                boolean hasDefault = false;
                if (entry.getValue() instanceof Map<?, ?> declaration) {
                    required = isTrue(declaration.get("required"));
                    hasDefault = declaration.containsKey("default");
                }
                inputs.put(inputName, new ActionInput(inputName, required, hasDefault));
            }
        }
        Set<String> outputs = new LinkedHashSet<>();
        if (document.get("outputs") instanceof Map<?, ?> declared) {
            for (Object key : declared.keySet()) {
                outputs.add(String.valueOf(key));
            }
        }
        return new ActionMetadata(name != null ? String.valueOf(name) : null, inputs, outputs,
                tags != null ? tags : new ArrayList<>(), tagCommits != null ? tagCommits : Map.of());
    }

    private static boolean isTrue(Object value) {
        return value instanceof Boolean ? (Boolean) value : value != null && "true".equalsIgnoreCase(value.toString().trim());
    }

    public Optional<String> getName() {
        return Optional.ofNullable(name);
    }

    public Map<String, ActionInput> getInputs() {
        return inputs;
    }

    public List<ActionInput> getMandatoryInputs() {
        return inputs.values().stream().filter(ActionInput::isMandatory).toList();
    }

    public boolean hasInput(String input) {
        return inputs.containsKey(input);
    }

    public Set<String> getOutputs() {
        return outputs;
    }

    public List<String> getTags() {
        return tags;
    }

    public Optional<String> getLatestTag() {
        return tags.isEmpty() ? Optional.empty() : Optional.of(tags.get(0));
    }

    public Map<String, String> getTagCommits() {
        return tagCommits;
    }

    /**
     * Finds the newest tag whose commit starts with the given (possibly abbreviated) SHA.
     */
    public Optional<String> findTagByCommit(String sha) {
        if (sha == null || sha.isEmpty()) {
            return Optional.empty();
        }
        String prefix = sha.toLowerCase(Locale.ROOT);
        for (String tag : tags) {
            String commit = tagCommits.get(tag);
            if (commit != null && commit.toLowerCase(Locale.ROOT).startsWith(prefix)) {
                return Optional.of(tag);
            }
        }
        return Optional.empty();
    }

    @Override
    public String toString() {
        return "ActionMetadata{" +
               "name='" + name + '\'' +
               ", inputs=" + inputs.keySet() +
               ", outputs=" + outputs +
               ", latestTag=" + getLatestTag().orElse(null) +
               '}';
    }
}
