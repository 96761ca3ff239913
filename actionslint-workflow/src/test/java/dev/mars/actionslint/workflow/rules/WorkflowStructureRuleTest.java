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

package dev.mars.actionslint.workflow.rules;

import dev.mars.actionslint.core.Problem;
import dev.mars.actionslint.workflow.TestWorkflows;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link WorkflowStructureRule}.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
class WorkflowStructureRuleTest {

    private static List<String> check(String source) {
        return new WorkflowStructureRule().check(TestWorkflows.context(source))
                .map(Problem::getMessage)
                .collect(Collectors.toList());
    }

    @Test
    void testValidWorkflow() {
        assertTrue(check("""
                on: push
                jobs:
                  build:
                    runs-on: ubuntu-latest
                    steps:
                      - uses: actions/checkout@v4
                      - run: make
                  call:
                    uses: octo-org/repo/.github/workflows/ci.yml@main
                """).isEmpty());
    }

    @Test
    void testMissingTriggerAndJobs() {
        assertEquals(List.of("Workflow is missing the 'on' trigger", "Workflow must define at least one job"),
                check("name: nothing\n"));
    }

    @Test
    void testJobProblems() {
        List<String> messages = check("""
                on: push
                jobs:
                  build:
                    steps:
                      - name: Checkout
                      - uses: actions/checkout@v4
                        run: make
                  empty:
                    runs-on: ubuntu-latest
                """);

        assertEquals(List.of(
                "Job 'build' is missing 'runs-on'",
                "Step 'Checkout' in job 'build' must have either 'uses' or 'run'",
                "Step #2 in job 'build' cannot have both 'uses' and 'run' keys",
                "Job 'empty' must declare 'steps' or 'uses'"), messages);
    }

    @Test
    void testReusableWorkflowCannotDeclareSteps() {
        List<String> messages = check("""
                on: push
                jobs:
                  call:
                    uses: octo-org/repo/.github/workflows/ci.yml@main
                    steps:
                      - run: make
                """);

        assertEquals(List.of("Job 'call' calls a reusable workflow and cannot declare 'steps'"), messages);
    }

    @Test
    void testEmptyDocumentIsLeftToTheBuilder() {
        assertTrue(check("").isEmpty());
    }
}
