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

import dev.mars.actionslint.core.Edit;
import dev.mars.actionslint.core.LineMap;
import dev.mars.actionslint.core.Problem;
import dev.mars.actionslint.workflow.ast.Job;
import dev.mars.actionslint.workflow.ast.SourceString;
import dev.mars.actionslint.workflow.ast.Workflow;

import java.util.*;

/**
 * Represents the dependency graph of the jobs of a workflow.
 * Provides reference validation, cycle detection and a stable topological order.
 *
 * <p>Nodes are the declared job ids in declaration order. Edges point from a job to the jobs it
 * needs and only exist for declared targets; self references are reported and never become
 * edges. The graph is immutable once built.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class DependencyGraph {

    public static final String NEEDS_RULE = "jobs-needs";
    public static final String CYCLE_RULE = "jobs-needs-cycle";

    private final Map<String, Job> jobs;
    private final Map<String, Map<String, SourceString>> dependencies;
    private final List<Problem> problems;
    private final List<List<String>> cycles;
    private final List<String> executionOrder;
    private final List<List<String>> stages;

    private DependencyGraph(Map<String, Job> jobs, Map<String, Map<String, SourceString>> dependencies,
                            List<Problem> problems) {
        this.jobs = jobs;
        this.dependencies = dependencies;
        this.cycles = new ArrayList<>();
        List<Problem> all = new ArrayList<>(problems);
        all.addAll(detectCycles());
        this.problems = List.copyOf(all);
        this.executionOrder = new ArrayList<>();
        this.stages = new ArrayList<>();
        topologicalSort();
    }

    /**
     * Builds the graph of a workflow.
     *
     * @param workflow the workflow
     * @param source   the workflow source, used to offer deletion of repeated needs entries;
     *                 may be {@code null}
     * @return the graph
     */
    public static DependencyGraph of(Workflow workflow, String source) {
        Objects.requireNonNull(workflow, "Workflow cannot be null");
        LineMap lineMap = source != null ? new LineMap(source) : null;
        Map<String, Job> jobs = workflow.getJobs();
        Map<String, Map<String, SourceString>> dependencies = new LinkedHashMap<>();
        List<Problem> problems = new ArrayList<>();

        for (Job job : jobs.values()) {
            String jobId = job.getName();
            Map<String, SourceString> edges = new LinkedHashMap<>();
            Set<String> seen = new HashSet<>();
            for (SourceString need : job.getNeeds()) {
                String dependency = need.getValue();
                if (!seen.add(dependency)) {
                    Problem duplicate = Problem.warning(need.getPos(),
                            "Job '" + jobId + "' lists dependency '" + dependency + "' more than once", NEEDS_RULE);
                    Edit deletion = lineDeletion(source, lineMap, need);
                    problems.add(deletion != null ? duplicate.withEdit(deletion) : duplicate);
                    continue;
                }
                if (dependency.equals(jobId)) {
                    problems.add(Problem.error(need.getPos(),
                            "Job '" + jobId + "' cannot depend on itself", NEEDS_RULE));
                } else if (!jobs.containsKey(dependency)) {
                    problems.add(Problem.error(need.getPos(),
                            "Job '" + jobId + "' depends on non-existent job '" + dependency + "'", NEEDS_RULE));
                } else {
                    edges.put(dependency, need);
                }
            }
            dependencies.put(jobId, edges);
        }
        return new DependencyGraph(jobs, dependencies, problems);
    }

    /**
     * Deletes the whole line of a block sequence entry ({@code - id}) when nothing else is on it.
     */
    private static Edit lineDeletion(String source, LineMap lineMap, SourceString need) {
        if (source == null || need.getStyle().isBlock()) {
            return null;
        }
        int line = need.getPos().line();
        int lineStart = lineMap.lineStart(line);
        int lineEnd = line + 1 < lineMap.lineCount() ? lineMap.lineStart(line + 1) : source.length();
        String before = source.substring(lineStart, need.getPos().offset());
        int valueEnd = Math.min(need.getSourceEnd(), lineEnd);
        String after = source.substring(valueEnd, lineEnd);
        if (!before.strip().equals("-") || !after.isBlank()) {
            return null;
        }
        return Edit.delete(lineStart, lineEnd - lineStart);
    }

    /**
     * Iterative three-colour depth-first search. Jobs are visited in declaration order and
     * dependencies in needs order; every back edge yields one problem at the needs entry that
     * closes the cycle.
     */
    private List<Problem> detectCycles() {
        List<Problem> found = new ArrayList<>();
        Map<String, Colour> colours = new HashMap<>();
        for (String jobId : jobs.keySet()) {
            colours.put(jobId, Colour.WHITE);
        }

        for (String rootId : jobs.keySet()) {
            if (colours.get(rootId) != Colour.WHITE) {
                continue;
            }
            Deque<Visit> stack = new ArrayDeque<>();
            List<String> path = new ArrayList<>();
            stack.push(new Visit(rootId, getDependencies(rootId).iterator()));
            colours.put(rootId, Colour.GRAY);
            path.add(rootId);

            while (!stack.isEmpty()) {
                Visit visit = stack.peek();
                if (!visit.next().hasNext()) {
                    colours.put(visit.jobId(), Colour.BLACK);
                    path.remove(path.size() - 1);
                    stack.pop();
                    continue;
                }
                String dependency = visit.next().next();
                Colour colour = colours.get(dependency);
                if (colour == Colour.WHITE) {
                    colours.put(dependency, Colour.GRAY);
                    path.add(dependency);
                    stack.push(new Visit(dependency, getDependencies(dependency).iterator()));
                } else if (colour == Colour.GRAY) {
                    List<String> cycle = new ArrayList<>(path.subList(path.indexOf(dependency), path.size()));
                    cycles.add(List.copyOf(cycle));
                    cycle.add(dependency);
                    SourceString closing = dependencies.get(visit.jobId()).get(dependency);
                    found.add(Problem.error(closing.getPos(),
                            "Circular dependency detected: " + String.join(" -> ", cycle), CYCLE_RULE));
                }
            }
        }
        return found;
    }

    /**
     * Kahn's algorithm; among the jobs whose dependencies are satisfied the earliest declared
     * one goes first. Jobs on or behind a cycle are left out.
     */
    private void topologicalSort() {
        Map<String, Integer> declarationIndex = new HashMap<>();
        Map<String, Integer> remaining = new HashMap<>();
        Map<String, List<String>> dependents = new HashMap<>();
        for (String jobId : jobs.keySet()) {
            declarationIndex.put(jobId, declarationIndex.size());
            remaining.put(jobId, getDependencies(jobId).size());
            for (String dependency : getDependencies(jobId)) {
                dependents.computeIfAbsent(dependency, k -> new ArrayList<>()).add(jobId);
            }
        }

        PriorityQueue<String> ready = new PriorityQueue<>(Comparator.comparing(declarationIndex::get));
        for (Map.Entry<String, Integer> entry : remaining.entrySet()) {
            if (entry.getValue() == 0) {
                ready.offer(entry.getKey());
            }
        }

        Map<String, Integer> level = new HashMap<>();
        while (!ready.isEmpty()) {
            String current = ready.poll();
            executionOrder.add(current);
            int stage = 0;
            for (String dependency : getDependencies(current)) {
                stage = Math.max(stage, level.get(dependency) + 1);
            }
            level.put(current, stage);
            while (stages.size() <= stage) {
                stages.add(new ArrayList<>());
            }
            stages.get(stage).add(current);

            for (String dependent : dependents.getOrDefault(current, List.of())) {
                int left = remaining.merge(dependent, -1, Integer::sum);
                if (left == 0) {
                    ready.offer(dependent);
                }
            }
        }
        for (List<String> stage : stages) {
            stage.sort(Comparator.comparing(declarationIndex::get));
        }
    }

    /**
     * Gets the declared job ids in declaration order.
     *
     * @return job ids
     */
    List<String> getJobIds() {
        return List.copyOf(jobs.keySet());
    }

    /**
     * Gets the direct dependencies of a job: the declared jobs it needs, in needs order, without
     * unknown ids, repetitions or itself.
     *
     * @param jobId the job id
     * @return the dependency ids, empty for unknown jobs
     */
    public Set<String> getDependencies(String jobId) {
        Map<String, SourceString> edges = dependencies.get(jobId);
        return edges != null ? Collections.unmodifiableSet(edges.keySet()) : Set.of();
    }

    /**
     * Same as {@link #getDependencies(String)}; the ground truth for the {@code needs} context.
     */
    public Set<String> directDependencies(String jobId) {
        return getDependencies(jobId);
    }

    /**
     * Gets every job reachable through needs edges, the job itself excluded.
     */
    Set<String> getTransitiveDependencies(String jobId) {
        Set<String> reached = new LinkedHashSet<>();
        Deque<String> pending = new ArrayDeque<>(getDependencies(jobId));
        while (!pending.isEmpty()) {
            String current = pending.pop();
            if (!current.equals(jobId) && reached.add(current)) {
                pending.addAll(getDependencies(current));
            }
        }
        return reached;
    }

    public boolean hasCycles() {
        return !cycles.isEmpty();
    }

    /**
     * Gets each detected cycle as the list of job ids along the needs edges, starting at the
     * job first reached by the search.
     */
    List<List<String>> getCycles() {
        return List.copyOf(cycles);
    }

    /**
     * Gets a topological order of the jobs: every job comes after all jobs it needs. Ties are
     * broken by declaration order. Jobs on or behind a cycle are omitted.
     */
    public List<String> getExecutionOrder() {
        return List.copyOf(executionOrder);
    }

    /**
     * Gets the jobs grouped into stages that can run in parallel. A job's stage is one more than
     * the latest stage among its dependencies.
     */
    public List<List<String>> getExecutionStages() {
        List<List<String>> copy = new ArrayList<>();
        for (List<String> stage : stages) {
            copy.add(List.copyOf(stage));
        }
        return copy;
    }

    /**
     * Problems found while building the graph: reference problems in job and needs order,
     * followed by cycle problems in discovery order.
     */
    public List<Problem> getProblems() {
        return problems;
    }

    private enum Colour {
        WHITE,
        GRAY,
        BLACK
    }

    private record Visit(String jobId, Iterator<String> next) {
    }
}
