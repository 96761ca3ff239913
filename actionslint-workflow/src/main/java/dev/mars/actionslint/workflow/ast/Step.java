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

import java.util.Objects;
import java.util.Optional;

/**
 * A step of a job. Exactly one of {@code uses} and {@code run} is expected; the builder keeps
 * whatever the source declares and leaves the check to the rules.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public final class Step {

    public static final String ID = "id";
    public static final String NAME = "name";
    public static final String USES = "uses";
    public static final String RUN = "run";
    public static final String WITH = "with";
    public static final String IF = "if";

    private final int index;
    private final SourceString id;
    private final SourceString name;
    private final SourceString uses;
    private final SourceString run;
    private final YamlMapping with;
    private final SourceString ifCondition;
    private final YamlMapping raw;
    private final boolean placeholder;

    private Step(int index, YamlMapping raw, boolean placeholder) {
        this.index = index;
        this.placeholder = placeholder;
        this.raw = Objects.requireNonNull(raw, "Step mapping cannot be null");
        this.id = raw.getScalar(ID).orElse(null);
        this.name = raw.getScalar(NAME).orElse(null);
        this.uses = raw.getScalar(USES).orElse(null);
        this.run = raw.getScalar(RUN).orElse(null);
        this.with = raw.getMapping(WITH).orElse(YamlMapping.empty(raw.getPos()));
        this.ifCondition = raw.getScalar(IF).orElse(null);
    }

    /**
     * Creates the step at position {@code index} of its job from its mapping.
     */
    public static Step of(int index, YamlMapping raw) {
        return new Step(index, raw, false);
    }

    /**
     * Stand-in for a step whose source was not a mapping.
     */
    public static Step placeholder(int index, Pos pos) {
        return new Step(index, YamlMapping.empty(pos), true);
    }

    public boolean isPlaceholder() {
        return placeholder;
    }

    public int getIndex() {
        return index;
    }

    public Optional<SourceString> getId() {
        return Optional.ofNullable(id);
    }

    public Optional<SourceString> getName() {
        return Optional.ofNullable(name);
    }

    public Optional<SourceString> getUses() {
        return Optional.ofNullable(uses);
    }

    public Optional<SourceString> getRun() {
        return Optional.ofNullable(run);
    }

    /**
     * The {@code with} inputs in declaration order, empty when absent.
     */
    public YamlMapping getWith() {
        return with;
    }

    public Optional<SourceString> getIfCondition() {
        return Optional.ofNullable(ifCondition);
    }

    public Pos getPos() {
        return raw.getPos();
    }

    public YamlMapping getRaw() {
        return raw;
    }

    /**
     * Human readable label used in messages: the id, the name or the one-based index.
     */
    public String describe() {
        if (id != null) {
            return "'" + id.getValue() + "'";
        }
        if (name != null) {
            return "'" + name.getValue() + "'";
        }
        return "#" + (index + 1);
    }

    @Override
    public String toString() {
        return "Step{" +
               "index=" + index +
               ", id=" + id +
               ", uses=" + uses +
               '}';
    }
}
