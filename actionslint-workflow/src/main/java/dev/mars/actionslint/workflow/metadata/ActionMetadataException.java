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

import dev.mars.actionslint.core.exceptions.ActionsLintException;

/**
 * Exception raised inside the metadata client when the remote host cannot be reached or answers
 * with an unexpected status. Converted to an {@link ActionMetadataResult.Status#UNAVAILABLE}
 * result before it reaches a caller.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class ActionMetadataException extends ActionsLintException {

    public ActionMetadataException(String message) {
        super(message);
    }

    public ActionMetadataException(String message, Throwable cause) {
        super(message, cause);
    }
}
