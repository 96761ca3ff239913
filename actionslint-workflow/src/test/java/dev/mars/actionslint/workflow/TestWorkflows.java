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
import dev.mars.actionslint.workflow.ast.Workflow;
import dev.mars.actionslint.workflow.building.WorkflowAstBuilder;
import dev.mars.actionslint.workflow.building.YamlTokenizer;
import dev.mars.actionslint.workflow.graph.DependencyGraph;
import dev.mars.actionslint.workflow.metadata.ActionMetadataProvider;
import dev.mars.actionslint.workflow.rules.RuleContext;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;

/**
 * Helpers shared by the workflow tests.
 */
public final class TestWorkflows {

    private TestWorkflows() {
    }

    public static Workflow parse(String source) {
        return new WorkflowAstBuilder().build(source, new YamlTokenizer().tokenize(source).tokens()).workflow();
    }

    public static RuleContext context(String source) {
        return context(source, null, LintConfiguration.defaults());
    }

    public static RuleContext context(String source, ActionMetadataProvider provider, LintConfiguration configuration) {
        Workflow workflow = parse(source);
        return new RuleContext(source, workflow, DependencyGraph.of(workflow, source), provider, configuration);
    }

    /**
     * Reads a fixture from {@code src/test/resources/workflows}.
     */
    public static String resource(String name) {
        try (InputStream input = TestWorkflows.class.getResourceAsStream("/workflows/" + name)) {
            if (input == null) {
                throw new IllegalArgumentException("Missing test resource: " + name);
            }
            return new String(input.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
