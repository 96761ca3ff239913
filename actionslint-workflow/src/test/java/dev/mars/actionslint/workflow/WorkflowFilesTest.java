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

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class WorkflowFilesTest {

    @TempDir
    Path tempDir;

    @Test
    void testRepositoryRoot() throws Exception {
        Path workflows = Files.createDirectories(tempDir.resolve(".github").resolve("workflows"));
        Files.writeString(workflows.resolve("release.yaml"), "on: push\n");
        Files.writeString(workflows.resolve("ci.yml"), "on: push\n");
        Files.writeString(workflows.resolve("README.md"), "docs\n");
        Files.writeString(tempDir.resolve("root.yml"), "on: push\n");

        assertEquals(List.of(workflows.resolve("ci.yml"), workflows.resolve("release.yaml")),
                WorkflowFiles.discover(tempDir));
    }

    @Test
    void testPlainDirectory() throws Exception {
        Files.writeString(tempDir.resolve("b.yml"), "on: push\n");
        Files.writeString(tempDir.resolve("a.yml"), "on: push\n");
        Files.createDirectories(tempDir.resolve("nested.yml"));

        assertEquals(List.of(tempDir.resolve("a.yml"), tempDir.resolve("b.yml")), WorkflowFiles.discover(tempDir));
    }

    @Test
    void testSingleFile() throws Exception {
        Path file = Files.writeString(tempDir.resolve("workflow.txt"), "on: push\n");

        assertEquals(List.of(file), WorkflowFiles.discover(file));
    }

    @Test
    void testMissingTarget() {
        assertThrows(WorkflowLintException.class, () -> WorkflowFiles.discover(tempDir.resolve("missing")));
    }

    @Test
    void testIsWorkflowFile() {
        assertTrue(WorkflowFiles.isWorkflowFile(Path.of("ci.yml")));
        assertTrue(WorkflowFiles.isWorkflowFile(Path.of("ci.yaml")));
        assertFalse(WorkflowFiles.isWorkflowFile(Path.of("ci.json")));
    }
}
