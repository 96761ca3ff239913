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

package dev.mars.actionslint.workflow;

import dev.mars.actionslint.core.exceptions.ActionsLintException;

import java.nio.file.Path;

/**
 * Exception thrown when a workflow file cannot be read or its fixed content cannot be written.
 * Findings about the workflow itself are reported as problems, never through this exception.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class WorkflowLintException extends ActionsLintException {

    private final Path path;

    public WorkflowLintException(String message) {
        super(message);
        this.path = null;
    }

    public WorkflowLintException(Path path, String message, Throwable cause) {
        super(message, cause);
        this.path = path;
    }

    public Path getPath() {
        return path;
    }

    @Override
    public String getMessage() {
        return path != null ? super.getMessage() + " [" + path + "]" : super.getMessage();
    }
}
