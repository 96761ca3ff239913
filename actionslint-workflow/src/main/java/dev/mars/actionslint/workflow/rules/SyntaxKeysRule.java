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
import dev.mars.actionslint.workflow.ast.SourceString;
import dev.mars.actionslint.workflow.ast.Step;
import dev.mars.actionslint.workflow.ast.YamlMapping;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Reports keys that GitHub does not accept at workflow, job and step level. A key close enough
 * to a known one gets a rename fix.
 */
public class SyntaxKeysRule implements Rule {

    public static final String ID = "syntax-keys";

    static final List<String> WORKFLOW_KEYS = List.of(
            "name", "run-name", "on", "permissions", "env", "defaults", "concurrency", "jobs");

    static final List<String> JOB_KEYS = List.of(
            "name", "permissions", "needs", "if", "runs-on", "environment", "concurrency", "outputs", "env",
            "defaults", "steps", "timeout-minutes", "strategy", "continue-on-error", "container", "services",
            "uses", "with", "secrets");

    static final List<String> STEP_KEYS = List.of(
            "id", "if", "name", "uses", "run", "working-directory", "shell", "with", "env",
            "continue-on-error", "timeout-minutes");

    @Override
    public String id() {
        return ID;
    }

    @Override
    public Stream<Problem> check(RuleContext context) {
        List<Problem> problems = new ArrayList<>();
        checkKeys(context, context.getWorkflow().getRaw(), WORKFLOW_KEYS, "the workflow", problems);
        for (Job job : context.getWorkflow().getJobs().values()) {
            checkKeys(context, job.getRaw(), JOB_KEYS, "job '" + job.getName() + "'", problems);
            for (Step step : job.getSteps()) {
                checkKeys(context, step.getRaw(), STEP_KEYS,
                        "step " + step.describe() + " of job '" + job.getName() + "'", problems);
            }
        }
        return problems.stream();
    }

    private void checkKeys(RuleContext context, YamlMapping mapping, List<String> known, String owner,
                           List<Problem> problems) {
        for (SourceString key : mapping.keys()) {
            if (known.contains(key.getValue())) {
                continue;
            }
            Optional<String> suggestion = Suggestions.closest(key.getValue(), known, context.getSimilarityThreshold());
            String message = "Unknown key '" + key.getValue() + "' in " + owner
                    + suggestion.map(s -> ", did you mean '" + s + "'?").orElse("");
            Problem problem = Problem.error(key.getPos(), message, ID);
            problems.add(suggestion
                    .flatMap(s -> context.replacement(key.getPos().offset(), key.getValue(), s))
                    .map(problem::withEdit)
                    .orElse(problem));
        }
    }
}
