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

import dev.mars.actionslint.config.LintConfiguration;
import dev.mars.actionslint.core.LintResult;
import dev.mars.actionslint.core.Problem;
import dev.mars.actionslint.core.Severity;
import dev.mars.actionslint.workflow.graph.DependencyGraph;
import dev.mars.actionslint.workflow.rules.ExpressionsNeedsRule;
import dev.mars.actionslint.workflow.rules.Rules;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End to end tests for {@link WorkflowLinter}.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
class WorkflowLinterTest {

    private static final String MISSPELT = """
            on: [push, pul_request]
            jobs:
              build:
                runson: ubuntu-latest
                steps:
                  - run: echo ${{ gihub.sha }}
            """;

    private WorkflowLinter linter;

    @TempDir
    Path tempDir;

    @BeforeEach
    void setUp() {
        linter = new WorkflowLinter(LintConfiguration.defaults());
    }

    @AfterEach
    void tearDown() {
        linter.close();
    }

    private static WorkflowLinter fixingLinter() {
        Properties properties = new Properties();
        properties.setProperty(LintConfiguration.FIX_ENABLED, "true");
        return new WorkflowLinter(new LintConfiguration(properties));
    }

    @Test
    void testNeedsValidationFixture() {
        LintResult result = linter.lint(TestWorkflows.resource("needs_validation_workflow.yml"), "needs.yml");
        List<Problem> problems = result.getProblems();

        assertEquals(2, problems.size());
        assertEquals(DependencyGraph.NEEDS_RULE, problems.get(0).getRuleId());
        assertEquals("Job 'test-invalid' depends on non-existent job 'missing-job'", problems.get(0).getMessage());
        assertEquals(20, problems.get(0).getPos().displayLine());
        assertEquals(ExpressionsNeedsRule.ID, problems.get(1).getRuleId());
        assertEquals(23, problems.get(1).getPos().displayLine());
        assertEquals(2, result.getErrorCount());
        assertFalse(result.isSuccessful(-1));
    }

    @Test
    void testCircularDependencyFixture() {
        LintResult result = linter.lint(TestWorkflows.resource("circular_dependencies_workflow.yml"), "cycle.yml");

        assertTrue(result.getProblems().stream()
                .anyMatch(p -> p.getRuleId().equals(DependencyGraph.CYCLE_RULE)));
    }

    @Test
    void testCleanWorkflow() {
        LintResult result = linter.lint("""
                name: CI
                on:
                  push:
                    branches: [main]
                jobs:
                  build:
                    runs-on: ubuntu-latest
                    outputs:
                      version: ${{ steps.version.outputs.value }}
                    steps:
                      - uses: actions/checkout@v4
                      - id: version
                        run: echo "value=1.0" >> "$GITHUB_OUTPUT"
                  publish:
                    needs: build
                    if: ${{ needs.build.result == 'success' && github.ref == 'refs/heads/main' }}
                    runs-on: ubuntu-latest
                    steps:
                      - run: echo ${{ needs.build.outputs.version }}
                """, "ci.yml");

        assertEquals(List.of(), result.getProblems());
        assertTrue(result.isSuccessful(0));
        assertTrue(result.getFixedSource().isEmpty());
    }

    @Test
    void testProblemsAreReportedInPipelineOrder() {
        LintResult result = linter.lint("""
                on: push
                jobs:
                  a:
                    needs: [ghost]
                    runson: ubuntu-latest
                    steps:
                      - run: make
                """, "order.yml");

        assertEquals(List.of(DependencyGraph.NEEDS_RULE, "workflow-structure", "syntax-keys"),
                result.getProblems().stream().map(Problem::getRuleId).toList());
    }

    @Test
    void testLintIsDeterministic() {
        List<Problem> first = linter.lint(MISSPELT, "a.yml").getProblems();
        List<Problem> second = linter.lint(MISSPELT, "a.yml").getProblems();

        assertEquals(first, second);
        assertEquals(4, first.size());
    }

    @Test
    void testFixesConverge() {
        try (WorkflowLinter fixing = fixingLinter()) {
            LintResult result = fixing.lint(MISSPELT, "misspelt.yml");

            assertEquals(3, result.getFixedProblems().size());
            String fixed = result.getFixedSource().orElseThrow();
            assertEquals("""
                    on: [push, pull_request]
                    jobs:
                      build:
                        runs-on: ubuntu-latest
                        steps:
                          - run: echo ${{ github.sha }}
                    """, fixed);

            LintResult again = fixing.lint(fixed, "misspelt.yml");
            assertTrue(again.getProblems().isEmpty());
        }
    }

    @Test
    void testUnfixedProblemsWithoutFixing() {
        LintResult result = linter.lint(MISSPELT, "misspelt.yml");

        assertEquals(3, result.getUnfixedProblems().size());
        assertFalse(result.hasFixes());
    }

    @Test
    void testWriteFixes() throws Exception {
        Path file = tempDir.resolve("ci.yml");
        Files.writeString(file, MISSPELT, StandardCharsets.UTF_8);

        try (WorkflowLinter fixing = fixingLinter()) {
            LintResult result = fixing.lint(file);

            assertTrue(fixing.writeFixes(file, result));
            assertFalse(fixing.writeFixes(file, result));
            assertTrue(Files.readString(file).contains("runs-on: ubuntu-latest"));
            assertTrue(fixing.lint(file).getProblems().isEmpty());
        }
    }

    @Test
    void testMissingFile() {
        WorkflowLintException exception = assertThrows(WorkflowLintException.class,
                () -> linter.lint(tempDir.resolve("missing.yml")));

        assertTrue(exception.getMessage().contains("missing.yml"));
    }

    @Test
    void testInvalidYaml() {
        LintResult result = linter.lint("on: push\njobs:\n  build: [unclosed\n", "broken.yml");

        assertTrue(result.getErrorCount() > 0);
        assertTrue(result.getProblems().stream().anyMatch(p -> p.getMessage().startsWith("Invalid YAML")));
    }

    @Test
    void testParallelRulesMatchSequentialRules() {
        Properties properties = new Properties();
        properties.setProperty(LintConfiguration.RULES_PARALLEL, "true");
        List<String> sources = List.of(TestWorkflows.resource("needs_validation_workflow.yml"), MISSPELT);

        try (WorkflowLinter parallel = new WorkflowLinter(new LintConfiguration(properties), null, Rules.defaults())) {
            for (String source : sources) {
                assertEquals(linter.lint(source, "x.yml").getProblems(), parallel.lint(source, "x.yml").getProblems());
            }
        }
    }

    @Test
    void testWarningsAreCounted() {
        LintResult result = linter.lint("""
                on: push
                jobs:
                  build:
                    runs-on: ubuntu-latest
                    steps:
                      - uses: actions/checkout
                """, "warn.yml");

        assertEquals(1, result.getWarningCount());
        assertEquals(Severity.WARNING, result.getProblems().get(0).getSeverity());
        assertTrue(result.isSuccessful(-1));
        assertTrue(result.isSuccessful(1));
        assertFalse(result.isSuccessful(0));
    }
}
