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

package dev.mars.actionslint.workflow.graph;

import dev.mars.actionslint.core.Problem;
import dev.mars.actionslint.core.Severity;
import dev.mars.actionslint.workflow.TestWorkflows;
import dev.mars.actionslint.workflow.ast.Workflow;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link DependencyGraph}.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
class DependencyGraphTest {

    private static DependencyGraph graph(String source) {
        Workflow workflow = TestWorkflows.parse(source);
        return DependencyGraph.of(workflow, source);
    }

    @Test
    void testEmptyGraph() {
        DependencyGraph graph = graph("on: push\njobs: {}\n");

        assertTrue(graph.getJobIds().isEmpty());
        assertTrue(graph.getExecutionOrder().isEmpty());
        assertFalse(graph.hasCycles());
        assertTrue(graph.getProblems().isEmpty());
    }

    @Test
    void testLinearDependency() {
        DependencyGraph graph = graph("""
                on: push
                jobs:
                  deploy:
                    needs: test
                  test:
                    needs: build
                  build:
                    runs-on: ubuntu-latest
                """);

        assertEquals(List.of("build", "test", "deploy"), graph.getExecutionOrder());
        assertEquals(List.of(List.of("build"), List.of("test"), List.of("deploy")), graph.getExecutionStages());
        assertEquals(Set.of("build", "test"), graph.getTransitiveDependencies("deploy"));
        assertEquals(Set.of("test"), graph.directDependencies("deploy"));
    }

    @Test
    void testStableOrderFollowsDeclaration() {
        DependencyGraph graph = graph("""
                on: push
                jobs:
                  zeta:
                    runs-on: a
                  alpha:
                    runs-on: a
                  report:
                    needs: [alpha, zeta]
                  mid:
                    needs: zeta
                """);

        assertEquals(List.of("zeta", "alpha", "report", "mid"), graph.getExecutionOrder());
        assertEquals(List.of(List.of("zeta", "alpha"), List.of("report", "mid")), graph.getExecutionStages());
        assertEquals(graph.getExecutionOrder(), graph("""
                on: push
                jobs:
                  zeta:
                    runs-on: a
                  alpha:
                    runs-on: a
                  report:
                    needs: [alpha, zeta]
                  mid:
                    needs: zeta
                """).getExecutionOrder());
    }

    @Test
    void testCircularFixtureReportsOneCycle() {
        DependencyGraph graph = graph(TestWorkflows.resource("circular_dependencies_workflow.yml"));

        assertTrue(graph.hasCycles());
        assertEquals(1, graph.getProblems().size());
        Problem problem = graph.getProblems().get(0);
        assertEquals(DependencyGraph.CYCLE_RULE, problem.getRuleId());
        assertEquals(Severity.ERROR, problem.getSeverity());
        assertEquals("Circular dependency detected: job-a -> job-c -> job-b -> job-a", problem.getMessage());
        // Anchored at job-b's 'needs: job-a'
        assertEquals(13, problem.getPos().line());
        assertEquals(List.of(List.of("job-a", "job-c", "job-b")), graph.getCycles());
        assertTrue(graph.getExecutionOrder().isEmpty());
    }

    @Test
    void testReferenceProblems() {
        DependencyGraph graph = graph("""
                on: push
                jobs:
                  build:
                    needs: build
                  test:
                    needs: [biuld]
                """);

        List<Problem> problems = graph.getProblems();
        assertEquals(2, problems.size());
        assertEquals("Job 'build' cannot depend on itself", problems.get(0).getMessage());
        assertEquals("Job 'test' depends on non-existent job 'biuld'", problems.get(1).getMessage());
        assertFalse(graph.hasCycles());
        assertEquals(List.of("build", "test"), graph.getExecutionOrder());
    }

    @Test
    void testRepeatedDependencyOffersLineDeletion() {
        String source = """
                on: push
                jobs:
                  build:
                    runs-on: a
                  test:
                    needs:
                      - build
                      - build
                """;
        DependencyGraph graph = graph(source);

        assertEquals(1, graph.getProblems().size());
        Problem problem = graph.getProblems().get(0);
        assertEquals(Severity.WARNING, problem.getSeverity());
        assertEquals("Job 'test' lists dependency 'build' more than once", problem.getMessage());
        String fixed = problem.getEdit().orElseThrow().applyTo(source);
        assertEquals(source.replace("      - build\n      - build\n", "      - build\n"), fixed);
    }

    @Test
    void testDirectDependenciesOfUnknownJob() {
        DependencyGraph graph = graph("on: push\njobs:\n  a:\n    runs-on: x\n");

        assertTrue(graph.directDependencies("missing").isEmpty());
    }
}
