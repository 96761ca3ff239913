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

import dev.mars.actionslint.config.LintConfiguration;
import dev.mars.actionslint.core.Edit;
import dev.mars.actionslint.core.LineMap;
import dev.mars.actionslint.core.Pos;
import dev.mars.actionslint.workflow.ast.ScopedString;
import dev.mars.actionslint.workflow.ast.Workflow;
import dev.mars.actionslint.workflow.ast.WorkflowScalars;
import dev.mars.actionslint.workflow.expression.ContextReference;
import dev.mars.actionslint.workflow.expression.EmbeddedExpression;
import dev.mars.actionslint.workflow.expression.Expressions;
import dev.mars.actionslint.workflow.graph.DependencyGraph;
import dev.mars.actionslint.workflow.metadata.ActionMetadataProvider;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Everything a rule may read. Immutable and shared by all rules of a run.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public final class RuleContext {

    private final String source;
    private final LineMap lineMap;
    private final Workflow workflow;
    private final DependencyGraph graph;
    private final ActionMetadataProvider metadataProvider;
    private final LintConfiguration configuration;
    private final List<ScopedString> scalars;
    private final List<ScopedReference> references;

    public RuleContext(String source, Workflow workflow, DependencyGraph graph,
                       ActionMetadataProvider metadataProvider, LintConfiguration configuration) {
        this.source = Objects.requireNonNull(source, "Source cannot be null");
        this.lineMap = new LineMap(source);
        this.workflow = Objects.requireNonNull(workflow, "Workflow cannot be null");
        this.graph = Objects.requireNonNull(graph, "Graph cannot be null");
        this.metadataProvider = metadataProvider;
        this.configuration = Objects.requireNonNull(configuration, "Configuration cannot be null");
        this.scalars = List.copyOf(WorkflowScalars.of(workflow));
        this.references = List.copyOf(collectReferences(scalars));
    }

    private static List<ScopedReference> collectReferences(List<ScopedString> scalars) {
        List<ScopedReference> found = new ArrayList<>();
        for (ScopedString scalar : scalars) {
            for (EmbeddedExpression expression : scalar.value().getExpressions()) {
                for (ContextReference reference : Expressions.contextReferences(expression.root())) {
                    found.add(new ScopedReference(scalar, expression, reference));
                }
            }
        }
        return found;
    }

    public String getSource() {
        return source;
    }

    public Workflow getWorkflow() {
        return workflow;
    }

    public DependencyGraph getGraph() {
        return graph;
    }

    /**
     * The metadata collaborator; empty when metadata lookups are disabled.
     */
    public Optional<ActionMetadataProvider> getMetadataProvider() {
        return Optional.ofNullable(metadataProvider);
    }

    public LintConfiguration getConfiguration() {
        return configuration;
    }

    /**
     * Every scalar of the workflow in document order, with its enclosing job and step.
     */
    public List<ScopedString> getScalars() {
        return scalars;
    }

    /**
     * Every context reference of every embedded expression, in document order.
     */
    public List<ScopedReference> getContextReferences() {
        return references;
    }

    public Pos posAt(int offset) {
        return lineMap.posAt(Math.max(0, Math.min(offset, source.length())));
    }

    public double getSimilarityThreshold() {
        return configuration.getSimilarityThreshold();
    }

    /**
     * An edit replacing {@code oldText} at {@code offset} by {@code newText}, offered only when
     * the source really holds {@code oldText} there.
     */
    public Optional<Edit> replacement(int offset, String oldText, String newText) {
        if (offset < 0 || !source.startsWith(oldText, offset)) {
            return Optional.empty();
        }
        return Optional.of(Edit.replace(offset, oldText.length(), newText));
    }
}
