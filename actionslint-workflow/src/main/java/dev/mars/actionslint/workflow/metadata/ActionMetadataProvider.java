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

/**
 * Source of action metadata used by the rules that inspect {@code uses} references.
 * Implementations must be safe for concurrent use and must not throw.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public interface ActionMetadataProvider {

    /**
     * Looks up the metadata of a remote action.
     *
     * @param reference the action reference
     * @return the lookup outcome, never {@code null}
     */
    ActionMetadataResult lookup(ActionReference reference);
}
