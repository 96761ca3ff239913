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

import dev.mars.actionslint.core.Edit;
import dev.mars.actionslint.core.Problem;
import dev.mars.actionslint.workflow.ast.Job;
import dev.mars.actionslint.workflow.ast.SourceString;
import dev.mars.actionslint.workflow.ast.Step;
import dev.mars.actionslint.workflow.ast.YamlMapping;
import dev.mars.actionslint.workflow.metadata.ActionInput;
import dev.mars.actionslint.workflow.metadata.ActionMetadata;
import dev.mars.actionslint.workflow.metadata.ActionMetadataProvider;
import dev.mars.actionslint.workflow.metadata.ActionMetadataResult;
import dev.mars.actionslint.workflow.metadata.ActionReference;
import dev.mars.actionslint.workflow.metadata.ActionVersion;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.logging.Logger;
import java.util.stream.Stream;

/**
 * Checks the {@code uses} value of steps that call remote actions.
 *
 * <p>A reference without a version is reported, and fixed by appending the latest tag when
 * metadata knows one. With metadata the {@code with} inputs are matched against the action's
 * declared inputs: mandatory inputs must be given and unknown inputs are reported.</p>
 *
 * <p>Versioned refs are compared with the action's latest tag. A partial ref such as {@code v4}
 * stands for the newest {@code v4.x.x} tag, and a commit SHA is matched against tag commits.
 * Outdated refs are fixed by replacing them with the latest tag.</p>
 */
public class JobsStepsUsesRule implements Rule {

    private static final Logger logger = Logger.getLogger(JobsStepsUsesRule.class.getName());

    public static final String ID = "jobs-steps-uses";

    @Override
    public String id() {
        return ID;
    }

    @Override
    public Stream<Problem> check(RuleContext context) {
        List<Problem> problems = new ArrayList<>();
        for (Job job : context.getWorkflow().getJobs().values()) {
            for (Step step : job.getSteps()) {
                if (step.isPlaceholder() || step.getUses().isEmpty()) {
                    continue;
                }
                SourceString uses = step.getUses().get();
                Optional<ActionReference> reference = ActionReference.parse(uses.getValue());
                if (reference.isPresent()) {
                    checkStep(context, step, uses, reference.get(), problems);
                }
            }
        }
        return problems.stream();
    }

    private void checkStep(RuleContext context, Step step, SourceString uses, ActionReference reference,
                           List<Problem> problems) {
        Optional<ActionMetadataProvider> provider = context.getMetadataProvider();
        ActionMetadataResult result = provider.map(p -> p.lookup(reference)).orElse(null);
        Optional<ActionMetadata> metadata = result != null ? result.getMetadata() : Optional.empty();

        if (!reference.hasRef()) {
            problems.add(missingVersion(context, uses, reference, metadata.flatMap(ActionMetadata::getLatestTag)));
        }
        if (result == null) {
            return;
        }
        if (metadata.isEmpty()) {
            logger.fine("No metadata for " + reference + ": " + result);
            problems.add(Problem.warning(uses.getPos(),
                    "Couldn't fetch metadata for " + reference.slug() + ". Continuing validation without", ID));
            return;
        }
        if (reference.hasRef()) {
            checkOutdatedVersion(context, uses, reference, metadata.get()).ifPresent(problems::add);
        }
        checkInputs(context, step, uses, reference, metadata.get(), problems);
    }

    private Optional<Problem> checkOutdatedVersion(RuleContext context, SourceString uses, ActionReference reference,
                                                   ActionMetadata metadata) {
        Optional<String> latestTag = metadata.getLatestTag();
        Optional<ActionVersion> latest = latestTag.flatMap(ActionVersion::parse);
        if (latest.isEmpty() || !latest.get().isComplete()) {
            return Optional.empty();
        }
        String slug = reference.slug();
        String ref = reference.ref();
        String current = latestTag.get();
        String message;

        Optional<ActionVersion> used = ActionVersion.isCommitSha(ref) ? Optional.empty() : ActionVersion.parse(ref);
        if (used.isPresent() && used.get().isComplete()) {
            Optional<String> level = used.get().outdatedLevel(latest.get());
            if (level.isEmpty()) {
                return Optional.empty();
            }
            message = "Action " + slug + " uses " + ref + " which is " + level.get()
                    + " version outdated. Current latest is " + current + ".";
        } else if (used.isPresent()) {
            Optional<String> resolved = resolve(used.get(), metadata);
            if (resolved.isEmpty()) {
                if (used.get().compareTo(latest.get()) >= 0) {
                    return Optional.empty();
                }
                message = "Action " + slug + " uses outdated " + ref
                        + " which cannot be resolved to any available version. Current latest is " + current + ".";
            } else {
                Optional<String> level = ActionVersion.parse(resolved.get()).flatMap(v -> v.outdatedLevel(latest.get()));
                if (level.isEmpty()) {
                    return Optional.empty();
                }
                message = "Action " + slug + " uses " + ref + " (resolves to " + resolved.get() + ") which is "
                        + level.get() + " version outdated. Current latest is " + current + ".";
            }
        } else if (ActionVersion.isCommitSha(ref)) {
            Optional<String> tag = metadata.findTagByCommit(ref);
            if (tag.isEmpty()) {
                message = "Action " + slug + " uses commit SHA which may be outdated. Current latest version is "
                        + current + ". Consider using versioned tags.";
            } else {
                Optional<ActionVersion> tagged = ActionVersion.parse(tag.get()).filter(ActionVersion::isComplete);
                Optional<String> level = tagged.flatMap(v -> v.outdatedLevel(latest.get()));
                if (level.isEmpty()) {
                    return Optional.empty();
                }
                message = "Action " + slug + " uses commit SHA (corresponds to " + tag.get() + ") which is "
                        + level.get() + " version outdated. Current latest is " + current + ".";
            }
        } else {
            return Optional.empty();
        }

        Problem problem = Problem.warning(uses.getPos(), message, ID);
        if (!uses.isVerbatimIn(context.getSource())) {
            return Optional.of(problem);
        }
        int refOffset = uses.getPos().offset() + uses.getValue().indexOf('@') + 1;
        return Optional.of(context.replacement(refOffset, ref, current).map(problem::withEdit).orElse(problem));
    }

    /**
     * The newest complete tag a partial ref such as {@code v4} stands for.
     */
    private Optional<String> resolve(ActionVersion partial, ActionMetadata metadata) {
        String best = null;
        ActionVersion bestVersion = null;
        for (String tag : metadata.getTags()) {
            Optional<ActionVersion> version = ActionVersion.parse(tag);
            if (version.isPresent() && partial.covers(version.get())
                    && (bestVersion == null || version.get().compareTo(bestVersion) > 0)) {
                best = tag;
                bestVersion = version.get();
            }
        }
        return Optional.ofNullable(best);
    }

    private Problem missingVersion(RuleContext context, SourceString uses, ActionReference reference,
                                   Optional<String> latestTag) {
        String slug = reference.slug();
        if (latestTag.isEmpty()) {
            return Problem.warning(uses.getPos(), "Using specific version of " + slug + " is recommended", ID);
        }
        String tag = latestTag.get();
        Problem problem = Problem.warning(uses.getPos(),
                "Using specific version of " + slug + " is recommended. Consider using " + slug + "@" + tag, ID);
        if (!uses.isVerbatimIn(context.getSource())) {
            return problem;
        }
        String value = uses.getValue();
        int end = uses.getPos().offset() + value.length();
        return problem.withEdit(Edit.insert(end, value.endsWith("@") ? tag : "@" + tag));
    }

    private void checkInputs(RuleContext context, Step step, SourceString uses, ActionReference reference,
                             ActionMetadata metadata, List<Problem> problems) {
        YamlMapping with = step.getWith();
        for (ActionInput input : metadata.getMandatoryInputs()) {
            if (!with.containsKey(input.name())) {
                problems.add(Problem.error(uses.getPos(),
                        "Step " + step.describe() + " is missing required input '" + input.name()
                                + "' of action " + reference.slug(), ID));
            }
        }
        for (SourceString key : with.keys()) {
            String name = key.getValue();
            if (metadata.hasInput(name)) {
                continue;
            }
            Optional<String> suggestion = Suggestions.closest(name, metadata.getInputs().keySet(),
                    context.getSimilarityThreshold());
            Problem problem = Problem.error(key.getPos(),
                    "Unknown input '" + name + "' for action " + reference.slug()
                            + suggestion.map(s -> ", did you mean '" + s + "'?").orElse(""), ID);
            problems.add(suggestion
                    .flatMap(s -> context.replacement(key.getPos().offset(), name, s))
                    .map(problem::withEdit)
                    .orElse(problem));
        }
    }
}
