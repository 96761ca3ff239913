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
import dev.mars.actionslint.workflow.ast.SourceString;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Reports unknown event names under {@code on}.
 */
public class EventTriggerRule implements Rule {

    public static final String ID = "event-trigger";

    static final List<String> EVENTS = List.of(
            "branch_protection_rule", "check_run", "check_suite", "create", "delete", "deployment",
            "deployment_status", "discussion", "discussion_comment", "fork", "gollum", "issue_comment",
            "issues", "label", "merge_group", "milestone", "page_build", "project", "project_card",
            "project_column", "public", "pull_request", "pull_request_review", "pull_request_review_comment",
            "pull_request_target", "push", "registry_package", "release", "repository_dispatch", "schedule",
            "status", "watch", "workflow_call", "workflow_dispatch", "workflow_run");

    @Override
    public String id() {
        return ID;
    }

    @Override
    public Stream<Problem> check(RuleContext context) {
        List<Problem> problems = new ArrayList<>();
        for (SourceString event : context.getWorkflow().getEvents()) {
            String name = event.getValue();
            if (name.isEmpty() || EVENTS.contains(name)) {
                continue;
            }
            Optional<String> suggestion = Suggestions.closest(name, EVENTS, context.getSimilarityThreshold());
            Problem problem = Problem.error(event.getPos(),
                    "Unknown event '" + name + "'" + suggestion.map(s -> ", did you mean '" + s + "'?").orElse(""), ID);
            problems.add(suggestion
                    .flatMap(s -> context.replacement(event.getPos().offset(), name, s))
                    .map(problem::withEdit)
                    .orElse(problem));
        }
        return problems.stream();
    }
}
