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

package dev.mars.actionslint.workflow.observability;

import dev.mars.actionslint.core.Problem;
import io.opentelemetry.api.GlobalOpenTelemetry;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.metrics.DoubleHistogram;
import io.opentelemetry.api.metrics.LongCounter;
import io.opentelemetry.api.metrics.Meter;

import java.util.concurrent.atomic.AtomicLong;
import java.util.logging.Logger;

/**
 * OpenTelemetry metrics for the workflow linter.
 *
 * Provides 7 lint metrics:
 * - actionslint.lint.active (gauge) - Lint runs in progress
 * - actionslint.lint.runs (counter) - Workflow documents linted
 * - actionslint.problems (counter) - Problems reported, by rule and severity
 * - actionslint.rule.failures (counter) - Rules that threw or timed out
 * - actionslint.fixes.applied (counter) - Edits applied by the fixer
 * - actionslint.fixes.conflicts (counter) - Edits dropped because they conflicted
 * - actionslint.rule.duration.ms (histogram) - Time spent per rule
 *
 * <p>Without an installed OpenTelemetry SDK all instruments are no-ops.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class LintMetrics {

    private static final Logger logger = Logger.getLogger(LintMetrics.class.getName());
    private static final String METER_NAME = "actionslint-workflow";

    // Singleton instance
    private static LintMetrics instance;

    // Counters
    private final LongCounter lintRuns;
    private final LongCounter problems;
    private final LongCounter ruleFailures;
    private final LongCounter fixesApplied;
    private final LongCounter fixConflicts;

    // Histograms
    private final DoubleHistogram ruleDuration;

    // Gauges (backed by AtomicLong)
    private final AtomicLong activeRuns = new AtomicLong(0);

    // Attribute keys
    private static final AttributeKey<String> RULE_KEY = AttributeKey.stringKey("rule");
    private static final AttributeKey<String> SEVERITY_KEY = AttributeKey.stringKey("severity");
    private static final AttributeKey<String> OUTCOME_KEY = AttributeKey.stringKey("outcome");

    private LintMetrics() {
        Meter meter = GlobalOpenTelemetry.getMeter(METER_NAME);

        lintRuns = meter.counterBuilder("actionslint.lint.runs")
                .setDescription("Number of workflow documents linted")
                .setUnit("1")
                .build();

        problems = meter.counterBuilder("actionslint.problems")
                .setDescription("Number of problems reported")
                .setUnit("1")
                .build();

        ruleFailures = meter.counterBuilder("actionslint.rule.failures")
                .setDescription("Number of rule executions that failed or timed out")
                .setUnit("1")
                .build();

        fixesApplied = meter.counterBuilder("actionslint.fixes.applied")
                .setDescription("Number of edits applied to workflow sources")
                .setUnit("1")
                .build();

        fixConflicts = meter.counterBuilder("actionslint.fixes.conflicts")
                .setDescription("Number of edits left unapplied because of a conflict")
                .setUnit("1")
                .build();

        ruleDuration = meter.histogramBuilder("actionslint.rule.duration.ms")
                .setDescription("Rule execution time in milliseconds")
                .setUnit("ms")
                .build();

        meter.gaugeBuilder("actionslint.lint.active")
                .setDescription("Number of lint runs in progress")
                .ofLongs()
                .buildWithCallback(measurement -> measurement.record(activeRuns.get()));

        logger.fine("LintMetrics initialized");
    }

    /**
     * Get the singleton instance of LintMetrics.
     */
    public static synchronized LintMetrics getInstance() {
        if (instance == null) {
            instance = new LintMetrics();
        }
        return instance;
    }

    public void recordLintStarted() {
        activeRuns.incrementAndGet();
    }

    /**
     * Record a finished lint run and the problems it reported.
     */
    public void recordLintCompleted(Iterable<Problem> reported, boolean successful) {
        activeRuns.decrementAndGet();
        lintRuns.add(1, Attributes.of(OUTCOME_KEY, successful ? "success" : "failure"));
        for (Problem problem : reported) {
            problems.add(1, Attributes.builder()
                    .put(RULE_KEY, problem.getRuleId())
                    .put(SEVERITY_KEY, problem.getSeverity().getLabel())
                    .build());
        }
    }

    public void recordRuleDuration(String ruleId, double millis) {
        ruleDuration.record(millis, Attributes.of(RULE_KEY, ruleId));
    }

    /**
     * Record a rule that threw or exceeded its time limit.
     */
    public void recordRuleFailure(String ruleId, String reason) {
        ruleFailures.add(1, Attributes.builder()
                .put(RULE_KEY, ruleId)
                .put(OUTCOME_KEY, reason)
                .build());
    }

    public void recordFixes(int applied, int conflicts) {
        if (applied > 0) {
            fixesApplied.add(applied);
        }
        if (conflicts > 0) {
            fixConflicts.add(conflicts);
        }
    }

    public long getActiveRuns() {
        return activeRuns.get();
    }
}
