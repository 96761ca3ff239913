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
import dev.mars.actionslint.workflow.building.BuildResult;
import dev.mars.actionslint.workflow.building.TokenStream;
import dev.mars.actionslint.workflow.building.WorkflowAstBuilder;
import dev.mars.actionslint.workflow.building.YamlTokenizer;
import dev.mars.actionslint.workflow.fix.FixResult;
import dev.mars.actionslint.workflow.fix.Fixer;
import dev.mars.actionslint.workflow.graph.DependencyGraph;
import dev.mars.actionslint.workflow.metadata.ActionMetadataProvider;
import dev.mars.actionslint.workflow.metadata.GitHubActionMetadataClient;
import dev.mars.actionslint.workflow.observability.LintMetrics;
import dev.mars.actionslint.workflow.rules.Rule;
import dev.mars.actionslint.workflow.rules.RuleContext;
import dev.mars.actionslint.workflow.rules.RuleEngine;
import dev.mars.actionslint.workflow.rules.Rules;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * Lints GitHub Actions workflow documents.
 *
 * <p>A run tokenizes the source, builds the workflow tree, analyses the job dependency graph,
 * runs the rules and, when fixing is enabled, applies the offered edits. Problems are reported
 * in that order: builder problems first, then graph problems, then rule problems in rule
 * registration order. The linter is reusable across documents and must be closed to release
 * the rule executor.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class WorkflowLinter implements AutoCloseable {

    private static final Logger logger = Logger.getLogger(WorkflowLinter.class.getName());

    private final LintConfiguration configuration;
    private final ActionMetadataProvider metadataProvider;
    private final YamlTokenizer tokenizer;
    private final WorkflowAstBuilder builder;
    private final RuleEngine ruleEngine;
    private final LintMetrics metrics;

    public WorkflowLinter(LintConfiguration configuration) {
        this(configuration, defaultProvider(configuration), Rules.defaults());
    }

    public WorkflowLinter(LintConfiguration configuration, ActionMetadataProvider metadataProvider, List<Rule> rules) {
        this.configuration = Objects.requireNonNull(configuration, "Configuration cannot be null");
        this.metadataProvider = metadataProvider;
        this.tokenizer = new YamlTokenizer();
        this.builder = new WorkflowAstBuilder();
        this.ruleEngine = new RuleEngine(rules, configuration);
        this.metrics = LintMetrics.getInstance();
        logger.fine("Workflow linter created with " + rules.size() + " rules, " + configuration);
    }

    private static ActionMetadataProvider defaultProvider(LintConfiguration configuration) {
        return configuration.isMetadataEnabled() ? new GitHubActionMetadataClient(configuration) : null;
    }

    /**
     * Lints the workflow file at {@code path}.
     *
     * @throws WorkflowLintException if the file cannot be read
     */
    public LintResult lint(Path path) throws WorkflowLintException {
        Objects.requireNonNull(path, "Path cannot be null");
        String source;
        try {
            source = Files.readString(path, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new WorkflowLintException(path, "Failed to read workflow file", e);
        }
        return lint(source, path.toString());
    }

    /**
     * Lints {@code source}, reported under {@code name}.
     */
    public LintResult lint(String source, String name) {
        Objects.requireNonNull(source, "Source cannot be null");
        Objects.requireNonNull(name, "Name cannot be null");
        metrics.recordLintStarted();
        LintResult result = null;
        try {
            result = doLint(source, name);
            return result;
        } finally {
            metrics.recordLintCompleted(result != null ? result.getProblems() : List.of(),
                    result != null && result.isSuccessful(configuration.getMaxWarnings()));
        }
    }

    private LintResult doLint(String source, String name) {
        List<Problem> problems = new ArrayList<>();

        TokenStream tokens = tokenizer.tokenize(source);
        problems.addAll(tokens.problems());
        BuildResult built = builder.build(source, tokens.tokens());
        problems.addAll(built.problems());

        DependencyGraph graph = DependencyGraph.of(built.workflow(), source);
        problems.addAll(graph.getProblems());

        RuleContext context = new RuleContext(source, built.workflow(), graph, metadataProvider, configuration);
        problems.addAll(ruleEngine.run(context));

        LintResult result;
        if (configuration.isFixEnabled()) {
            FixResult fixed = Fixer.apply(source, problems);
            metrics.recordFixes(fixed.applied().size(), fixed.unfixed().size());
            result = new LintResult(name, problems, fixed.applied(), fixed.text());
        } else {
            result = new LintResult(name, problems);
        }
        logger.info("Linted " + name + ": " + result.getErrorCount() + " error(s), "
                + result.getWarningCount() + " warning(s), " + result.getFixedProblems().size() + " fixed");
        return result;
    }

    /**
     * Writes the fixed source of {@code result} to {@code path} when it differs from the content
     * on disk.
     *
     * @return whether the file was written
     * @throws WorkflowLintException if the file cannot be read or written
     */
    public boolean writeFixes(Path path, LintResult result) throws WorkflowLintException {
        Objects.requireNonNull(path, "Path cannot be null");
        Objects.requireNonNull(result, "Result cannot be null");
        Optional<String> fixed = result.getFixedSource();
        if (fixed.isEmpty() || !result.hasFixes()) {
            return false;
        }
        try {
            String current = Files.readString(path, StandardCharsets.UTF_8);
            if (current.equals(fixed.get())) {
                return false;
            }
            Files.writeString(path, fixed.get(), StandardCharsets.UTF_8);
            logger.info("Applied " + result.getFixedProblems().size() + " fix(es) to " + path);
            return true;
        } catch (IOException e) {
            throw new WorkflowLintException(path, "Failed to write fixed workflow", e);
        }
    }

    public LintConfiguration getConfiguration() {
        return configuration;
    }

    @Override
    public void close() {
        ruleEngine.close();
    }
}
