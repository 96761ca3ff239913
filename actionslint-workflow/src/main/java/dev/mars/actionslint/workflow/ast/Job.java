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
 * A job of the workflow.
 *
 * <p>{@link #getNeeds()} keeps every declared dependency in source order, unknown ids and
 * repetitions included; the dependency graph decides which of them become edges.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public final class Job {

    public static final String RUNS_ON = "runs-on";
    public static final String NEEDS = "needs";
    public static final String STEPS = "steps";
    public static final String IF = "if";
    public static final String USES = "uses";
    public static final String OUTPUTS = "outputs";

    private final SourceString id;
    private final YamlMapping raw;
    private final List<SourceString> needs;
    private final List<Step> steps;
    private final boolean placeholder;

    private Job(SourceString id, YamlMapping raw, List<SourceString> needs, List<Step> steps, boolean placeholder) {
        this.id = Objects.requireNonNull(id, "Job id cannot be null");
        this.raw = Objects.requireNonNull(raw, "Job mapping cannot be null");
        this.needs = List.copyOf(Objects.requireNonNull(needs, "Needs cannot be null"));
        this.steps = List.copyOf(Objects.requireNonNull(steps, "Steps cannot be null"));
        this.placeholder = placeholder;
    }

    public static Job of(SourceString id, YamlMapping raw, List<SourceString> needs, List<Step> steps) {
        return new Job(id, raw, needs, steps, false);
    }

    /**
     * Stand-in for a job whose body was not a mapping.
     */
    public static Job placeholder(SourceString id, Pos pos) {
        return new Job(id, YamlMapping.empty(pos), List.of(), List.of(), true);
    }

    /**
     * True when the job body was not a mapping and this job only stands in for it.
     */
    public boolean isPlaceholder() {
        return placeholder;
    }

    public SourceString getId() {
        return id;
    }

    public String getName() {
        return id.getValue();
    }

    public Optional<YamlNode> getRunsOn() {
        return raw.get(RUNS_ON);
    }

    public List<SourceString> getNeeds() {
        return needs;
    }

    public List<Step> getSteps() {
        return steps;
    }

    public Optional<SourceString> getIfCondition() {
        return raw.getScalar(IF);
    }

    /**
     * The reusable workflow called by this job, if any.
     */
    public Optional<SourceString> getUses() {
        return raw.getScalar(USES);
    }

    public YamlMapping getOutputs() {
        return raw.getMapping(OUTPUTS).orElse(YamlMapping.empty(raw.getPos()));
    }

    /**
     * Position of the job id key.
     */
    public Pos getPos() {
        return id.getPos();
    }

    public YamlMapping getRaw() {
        return raw;
    }

    @Override
    public String toString() {
        return "Job{" +
               "id=" + id +
               ", needs=" + needs +
               ", steps=" + steps.size() +
               '}';
    }
}
