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

import java.util.Objects;
import java.util.Optional;

/**
 * A scalar of the workflow together with the job and step that enclose it.
 *
 * @param job   enclosing job, {@code null} at workflow level
 * @param step  enclosing step, {@code null} outside steps
 * @param value the scalar
 * @param key   whether the scalar is a mapping key
 */
public record ScopedString(Job job, Step step, SourceString value, boolean key) {

    public ScopedString {
        Objects.requireNonNull(value, "Value cannot be null");
    }

    public Optional<Job> enclosingJob() {
        return Optional.ofNullable(job);
    }

    public Optional<Step> enclosingStep() {
        return Optional.ofNullable(step);
    }
}
