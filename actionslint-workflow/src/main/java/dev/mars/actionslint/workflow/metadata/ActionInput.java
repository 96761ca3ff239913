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

import java.util.Objects;

/**
 * An input declared in an action's metadata file.
 */
public record ActionInput(String name, boolean required, boolean hasDefault) {

    public ActionInput {
        Objects.requireNonNull(name, "Input name cannot be null");
    }

    /**
     * Whether a step using the action must provide this input.
     */
    public boolean isMandatory() {
        return required && !hasDefault;
    }
}
