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
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class WorkflowLintExceptionTest {

    @Test
    void testMessageOnly() {
        WorkflowLintException exception = new WorkflowLintException("Nothing to lint");

        assertEquals("Nothing to lint", exception.getMessage());
        assertNull(exception.getPath());
        assertNull(exception.getCause());
        assertInstanceOf(ActionsLintException.class, exception);
    }

    @Test
    void testPathAndCause() {
        IOException cause = new IOException("Permission denied");
        WorkflowLintException exception = new WorkflowLintException(Path.of("ci.yml"), "Failed to read workflow file", cause);

        assertEquals("Failed to read workflow file [ci.yml]", exception.getMessage());
        assertEquals(Path.of("ci.yml"), exception.getPath());
        assertSame(cause, exception.getCause());
    }
}
