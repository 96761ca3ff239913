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
import dev.mars.actionslint.workflow.expression.ContextReference;
import dev.mars.actionslint.workflow.expression.PathSegment;
import dev.mars.actionslint.workflow.metadata.ActionMetadata;
import dev.mars.actionslint.workflow.metadata.ActionMetadataResult;
import dev.mars.actionslint.workflow.metadata.ActionReference;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Checks {@code steps.<id>.<attribute>} references.
 *
 * <p>Inside a step only steps that run earlier in the same job are visible; at job level
 * ({@code outputs}, {@code if}, ...) every step of the job is. When metadata of the referenced
 * step's action is available, {@code steps.<id>.outputs.<name>} must name a declared output.</p>
 */
public class StepsIoMatchRule implements Rule {

    public static final String ID = "steps-io-match";

    static final List<String> ATTRIBUTES = List.of("outputs", "outcome", "conclusion");

    @Override
    public String id() {
        return ID;
    }

    @Override
    public Stream<Problem> check(RuleContext context) {
        List<Problem> problems = new ArrayList<>();
        for (ScopedReference scoped : context.getContextReferences()) {
            if (!"steps".equals(scoped.contextName()) || scoped.job() == null) {
                continue;
            }
            checkReference(context, scoped, problems);
        }
        return problems.stream();
    }

    private void checkReference(RuleContext context, ScopedReference scoped, List<Problem> problems) {
        ContextReference reference = scoped.reference();
        if (reference.size() < 3) {
            problems.add(Problem.error(context.posAt(reference.start()),
                    "Step reference '" + scoped.text() + "' must have the form steps.<step_id>.<attribute>", ID));
            return;
        }
        PathSegment stepSegment = reference.segment(1);
        if (stepSegment.isWildcard()) {
            return;
        }
        Job job = scoped.job();
        String stepId = stepSegment.name();
        Optional<Step> target = findStep(job, stepId);
        if (target.isEmpty()) {
            problems.add(Problem.error(context.posAt(stepSegment.offset()),
                    "Step '" + stepId + "' in job '" + job.getName() + "' does not exist. "
                            + "Available steps in this job: " + availableSteps(job), ID));
            return;
        }
        Step current = scoped.step();
        if (current != null && target.get().getIndex() >= current.getIndex()) {
            problems.add(Problem.error(context.posAt(stepSegment.offset()),
                    "Step '" + stepId + "' in job '" + job.getName() + "' is referenced before it runs", ID));
            return;
        }

        PathSegment attribute = reference.segment(2);
        if (attribute.isWildcard()) {
            return;
        }
        if (!ATTRIBUTES.contains(attribute.name())) {
            Optional<String> suggestion = Suggestions.closest(attribute.name(), ATTRIBUTES,
                    context.getSimilarityThreshold());
            problems.add(ExpressionsContextsRule.withRename(context, Problem.error(context.posAt(attribute.offset()),
                    "Unknown property '" + attribute.name() + "' of step '" + stepId
                            + "', expected one of 'outputs', 'outcome' or 'conclusion'"
                            + suggestion.map(s -> ", did you mean '" + s + "'?").orElse(""), ID),
                    attribute, suggestion));
            return;
        }
        if ("outputs".equals(attribute.name()) && reference.hasSegment(3)) {
            checkOutput(context, target.get(), reference.segment(3), problems);
        }
    }

    private void checkOutput(RuleContext context, Step step, PathSegment output, List<Problem> problems) {
        if (output.isWildcard() || context.getMetadataProvider().isEmpty()) {
            return;
        }
        Optional<ActionReference> action = step.getUses().map(SourceString::getValue).flatMap(ActionReference::parse);
        if (action.isEmpty()) {
            return;
        }
        ActionMetadataResult result = context.getMetadataProvider().get().lookup(action.get());
        Optional<ActionMetadata> metadata = result.getMetadata();
        if (metadata.isEmpty() || metadata.get().getOutputs().contains(output.name())) {
            return;
        }
        Optional<String> suggestion = Suggestions.closest(output.name(), metadata.get().getOutputs(),
                context.getSimilarityThreshold());
        problems.add(ExpressionsContextsRule.withRename(context, Problem.error(context.posAt(output.offset()),
                "Action '" + action.get().slug() + "' used by step " + step.describe()
                        + " has no output '" + output.name() + "'"
                        + suggestion.map(s -> ", did you mean '" + s + "'?").orElse(""), ID),
                output, suggestion));
    }

    private static Optional<Step> findStep(Job job, String stepId) {
        return job.getSteps().stream()
                .filter(step -> step.getId().map(id -> id.valueEquals(stepId)).orElse(false))
                .findFirst();
    }

    private static String availableSteps(Job job) {
        String available = job.getSteps().stream()
                .map(Step::getId)
                .flatMap(Optional::stream)
                .map(id -> "'" + id.getValue() + "'")
                .collect(Collectors.joining(", "));
        return available.isEmpty() ? "none" : available;
    }
}
