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
import dev.mars.actionslint.core.Pos;
import dev.mars.actionslint.core.Problem;
import dev.mars.actionslint.workflow.observability.LintMetrics;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Collectors;

/**
 * Runs a fixed list of rules over a {@link RuleContext}.
 *
 * <p>Every rule is isolated: a rule that throws, or that exceeds the configured timeout when
 * rules run in parallel, is reported as one WARNING and the remaining rules still run. Problems
 * are always returned grouped by rule in registration order, whatever the execution mode.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class RuleEngine implements AutoCloseable {

    private static final Logger logger = Logger.getLogger(RuleEngine.class.getName());

    private final List<Rule> rules;
    private final boolean parallel;
    private final Duration timeout;
    private final LintMetrics metrics;
    private final ExecutorService executorService;
    private volatile boolean shutdown = false;

    public RuleEngine(List<Rule> rules, LintConfiguration configuration) {
        this.rules = List.copyOf(Objects.requireNonNull(rules, "Rules cannot be null"));
        Objects.requireNonNull(configuration, "Configuration cannot be null");
        Set<String> ids = new HashSet<>();
        for (Rule rule : this.rules) {
            if (!ids.add(rule.id())) {
                throw new IllegalArgumentException("Duplicate rule id: " + rule.id());
            }
        }
        this.parallel = configuration.isParallelRules();
        this.timeout = configuration.getRuleTimeout();
        this.metrics = LintMetrics.getInstance();
        this.executorService = parallel ? Executors.newCachedThreadPool(new RuleThreadFactory()) : null;
    }

    public List<Rule> getRules() {
        return rules;
    }

    public boolean isParallel() {
        return parallel;
    }

    /**
     * Runs every rule and returns their problems in registration order.
     */
    public List<Problem> run(RuleContext context) {
        Objects.requireNonNull(context, "Context cannot be null");
        if (shutdown) {
            throw new IllegalStateException("Rule engine is shutdown");
        }
        return parallel ? runParallel(context) : runSequential(context);
    }

    private List<Problem> runSequential(RuleContext context) {
        List<Problem> problems = new ArrayList<>();
        for (Rule rule : rules) {
            problems.addAll(runRule(rule, context));
        }
        return problems;
    }

    private List<Problem> runParallel(RuleContext context) {
        List<Future<List<Problem>>> futures = new ArrayList<>(rules.size());
        for (Rule rule : rules) {
            futures.add(executorService.submit(() -> runRule(rule, context)));
        }

        long deadline = System.nanoTime() + timeout.toNanos();
        List<Problem> problems = new ArrayList<>();
        for (int i = 0; i < rules.size(); i++) {
            Rule rule = rules.get(i);
            Future<List<Problem>> future = futures.get(i);
            try {
                long remaining = Math.max(0, deadline - System.nanoTime());
                problems.addAll(future.get(remaining, TimeUnit.NANOSECONDS));
            } catch (TimeoutException e) {
                future.cancel(true);
                logger.warning("Rule " + rule.id() + " timed out after " + timeout.toMillis() + " ms");
                metrics.recordRuleFailure(rule.id(), "timeout");
                problems.add(Problem.warning(Pos.START,
                        "Rule '" + rule.id() + "' timed out after " + timeout.toMillis() + " ms", rule.id()));
            } catch (ExecutionException e) {
                Throwable cause = e.getCause() != null ? e.getCause() : e;
                problems.add(failure(rule, cause));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                futures.forEach(f -> f.cancel(true));
                throw new IllegalStateException("Interrupted while waiting for rule " + rule.id(), e);
            }
        }
        return problems;
    }

    private List<Problem> runRule(Rule rule, RuleContext context) {
        long started = System.nanoTime();
        try {
            return rule.check(context).collect(Collectors.toList());
        } catch (RuntimeException e) {
            return List.of(failure(rule, e));
        } finally {
            double millis = (System.nanoTime() - started) / 1_000_000.0;
            metrics.recordRuleDuration(rule.id(), millis);
            if (logger.isLoggable(Level.FINE)) {
                logger.fine("Rule " + rule.id() + " finished in " + String.format("%.2f", millis) + " ms");
            }
        }
    }

    private Problem failure(Rule rule, Throwable cause) {
        logger.log(Level.WARNING, "Rule " + rule.id() + " failed: " + cause.getMessage());
        if (logger.isLoggable(Level.FINE)) {
            logger.log(Level.FINE, "Rule failure details for: " + rule.id(), cause);
        }
        metrics.recordRuleFailure(rule.id(), cause.getClass().getSimpleName());
        String message = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
        return Problem.warning(Pos.START, "Rule '" + rule.id() + "' failed: " + message, rule.id());
    }

    @Override
    public void close() {
        shutdown = true;
        if (executorService != null) {
            executorService.shutdownNow();
            logger.fine("Rule engine shutdown initiated");
        }
    }

    private static final class RuleThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable, "actionslint-rule-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
