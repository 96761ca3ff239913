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

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Root of the workflow AST. Read-only after construction; jobs keep declaration order.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public final class Workflow {

    public static final String NAME = "name";
    public static final String ON = "on";
    public static final String JOBS = "jobs";

    private final YamlMapping raw;
    private final Map<String, Job> jobs;
    private final List<SourceString> events;

    public Workflow(YamlMapping raw, List<Job> jobs) {
        this.raw = Objects.requireNonNull(raw, "Workflow mapping cannot be null");
        Map<String, Job> byId = new LinkedHashMap<>();
        for (Job job : Objects.requireNonNull(jobs, "Jobs cannot be null")) {
            byId.putIfAbsent(job.getName(), job);
        }
        this.jobs = Collections.unmodifiableMap(byId);
        this.events = List.copyOf(extractEvents(raw.get(ON).orElse(null)));
    }

    /**
     * Workflow for an empty or unusable document.
     */
    public static Workflow empty() {
        return new Workflow(YamlMapping.empty(Pos.START), List.of());
    }

    private static List<SourceString> extractEvents(YamlNode on) {
        List<SourceString> events = new ArrayList<>();
        if (on == null) {
            return events;
        }
        switch (on.kind()) {
            case SCALAR:
                events.add((SourceString) on);
                break;
            case SEQUENCE:
                for (YamlNode item : ((YamlSequence) on).getItems()) {
                    if (item.isScalar()) {
                        events.add((SourceString) item);
                    }
                }
                break;
            case MAPPING:
                events.addAll(((YamlMapping) on).keys());
                break;
            default:
                break;
        }
        return events;
    }

    public Optional<SourceString> getName() {
        return raw.getScalar(NAME);
    }

    public List<SourceString> getEvents() {
        return events;
    }

    public Optional<YamlNode> getEventsNode() {
        return raw.get(ON);
    }

    public Map<String, Job> getJobs() {
        return jobs;
    }

    public Optional<Job> getJob(String id) {
        return Optional.ofNullable(jobs.get(id));
    }

    public boolean hasJob(String id) {
        return jobs.containsKey(id);
    }

    public Pos getPos() {
        return raw.getPos();
    }

    public YamlMapping getRaw() {
        return raw;
    }

    @Override
    public String toString() {
        return "Workflow{" +
               "name=" + getName().map(SourceString::getValue).orElse(null) +
               ", events=" + events +
               ", jobs=" + jobs.keySet() +
               '}';
    }
}
