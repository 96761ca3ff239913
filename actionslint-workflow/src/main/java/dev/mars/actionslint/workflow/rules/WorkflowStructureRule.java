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
import dev.mars.actionslint.workflow.ast.Job;
import dev.mars.actionslint.workflow.ast.Step;
import dev.mars.actionslint.workflow.ast.Workflow;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;

/**
 * Checks the mandatory parts of a workflow: the {@code on} trigger, at least one job, a runner
 * or reusable workflow for every job, and exactly one of {@code uses} and {@code run} per step.
 */
public class WorkflowStructureRule implements Rule {

    public static final String ID = "workflow-structure";

    @Override
    public String id() {
        return ID;
    }

    @Override
    public Stream<Problem> check(RuleContext context) {
        Workflow workflow = context.getWorkflow();
        List<Problem> problems = new ArrayList<>();
        if (workflow.getRaw().isEmpty()) {
            // Nothing was built; the builder has already reported why
            return Stream.empty();
        }

        if (!workflow.getRaw().containsKey(Workflow.ON)) {
            problems.add(Problem.error(workflow.getPos(), "Workflow is missing the 'on' trigger", ID));
        }
        if (workflow.getJobs().isEmpty()) {
            problems.add(Problem.error(
                    workflow.getRaw().getEntry(Workflow.JOBS).map(e -> e.key().getPos()).orElse(workflow.getPos()),
                    "Workflow must define at least one job", ID));
        }

        for (Job job : workflow.getJobs().values()) {
            if (job.isPlaceholder()) {
                continue;
            }
            checkJob(job, problems);
        }
        return problems.stream();
    }

    private void checkJob(Job job, List<Problem> problems) {
        String jobId = job.getName();
        boolean callsWorkflow = job.getUses().isPresent();
        if (callsWorkflow) {
            if (job.getRaw().containsKey(Job.STEPS)) {
                problems.add(Problem.error(job.getPos(),
                        "Job '" + jobId + "' calls a reusable workflow and cannot declare 'steps'", ID));
            }
            return;
        }
        if (job.getRunsOn().isEmpty()) {
            problems.add(Problem.error(job.getPos(), "Job '" + jobId + "' is missing 'runs-on'", ID));
        }
        if (job.getSteps().isEmpty() && !job.getRaw().containsKey(Job.STEPS)) {
            problems.add(Problem.error(job.getPos(), "Job '" + jobId + "' must declare 'steps' or 'uses'", ID));
        }
        for (Step step : job.getSteps()) {
            if (step.isPlaceholder()) {
                continue;
            }
            boolean uses = step.getUses().isPresent();
            boolean run = step.getRun().isPresent();
            if (uses && run) {
                problems.add(Problem.error(step.getPos(),
                        "Step " + step.describe() + " in job '" + jobId + "' cannot have both 'uses' and 'run' keys", ID));
            } else if (!uses && !run) {
                problems.add(Problem.error(step.getPos(),
                        "Step " + step.describe() + " in job '" + jobId + "' must have either 'uses' or 'run'", ID));
            }
        }
    }
}
