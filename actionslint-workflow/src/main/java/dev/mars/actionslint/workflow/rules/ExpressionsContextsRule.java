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
import dev.mars.actionslint.workflow.expression.PathSegment;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Checks context references in expressions: the context must exist, the properties of the
 * fixed-shape contexts ({@code github}, {@code runner}, {@code job}, {@code strategy}) must exist,
 * and {@code needs} and {@code steps} may only be used inside a job.
 */
public class ExpressionsContextsRule implements Rule {

    public static final String ID = "expressions-contexts";

    static final List<String> CONTEXTS = List.of(
            "github", "env", "vars", "job", "jobs", "steps", "runner", "secrets", "strategy", "matrix",
            "needs", "inputs");

    static final Map<String, List<String>> PROPERTIES = Map.of(
            "github", List.of(
                    "action", "action_path", "action_ref", "action_repository", "action_status", "actor",
                    "actor_id", "api_url", "base_ref", "env", "event", "event_name", "event_path", "graphql_url",
                    "head_ref", "job", "path", "ref", "ref_name", "ref_protected", "ref_type", "repository",
                    "repository_id", "repository_owner", "repository_owner_id", "repositoryUrl", "retention_days",
                    "run_id", "run_number", "run_attempt", "secret_source", "server_url", "sha", "token",
                    "triggering_actor", "workflow", "workflow_ref", "workflow_sha", "workspace"),
            "runner", List.of("name", "os", "arch", "temp", "tool_cache", "debug", "environment"),
            "job", List.of("container", "services", "status", "check_run_id"),
            "strategy", List.of("fail-fast", "job-index", "job-total", "max-parallel"));

    @Override
    public String id() {
        return ID;
    }

    @Override
    public Stream<Problem> check(RuleContext context) {
        List<Problem> problems = new ArrayList<>();
        double threshold = context.getSimilarityThreshold();
        for (ScopedReference scoped : context.getContextReferences()) {
            PathSegment root = scoped.reference().root();
            String name = root.name();

            if (!CONTEXTS.contains(name)) {
                Optional<String> suggestion = Suggestions.closest(name, CONTEXTS, threshold);
                problems.add(withRename(context, Problem.error(context.posAt(root.offset()),
                        "Unknown context '" + name + "' in expression '" + scoped.text() + "'"
                                + suggestion.map(s -> ", did you mean '" + s + "'?").orElse(""), ID),
                        root, suggestion));
                continue;
            }

            if (("needs".equals(name) || "steps".equals(name)) && scoped.job() == null) {
                problems.add(Problem.error(context.posAt(root.offset()),
                        "Context '" + name + "' is only available inside a job, in expression '"
                                + scoped.text() + "'", ID));
                continue;
            }

            List<String> properties = PROPERTIES.get(name);
            if (properties == null || !scoped.reference().hasSegment(1)) {
                continue;
            }
            PathSegment property = scoped.reference().segment(1);
            if (property.isWildcard() || properties.contains(property.name())) {
                continue;
            }
            Optional<String> suggestion = Suggestions.closest(property.name(), properties, threshold);
            problems.add(withRename(context, Problem.error(context.posAt(property.offset()),
                    "Unknown property '" + property.name() + "' of context '" + name + "' in expression '"
                            + scoped.text() + "'" + suggestion.map(s -> ", did you mean '" + s + "'?").orElse(""), ID),
                    property, suggestion));
        }
        return problems.stream();
    }

    static Problem withRename(RuleContext context, Problem problem, PathSegment segment, Optional<String> suggestion) {
        if (segment.bracketed()) {
            return problem;
        }
        return suggestion
                .flatMap(s -> context.replacement(segment.offset(), segment.name(), s))
                .map(problem::withEdit)
                .orElse(problem);
    }
}
