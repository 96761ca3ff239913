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

package dev.mars.actionslint.core;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Outcome of linting one workflow document.
 *
 * <p>{@link #getProblems()} holds every problem in report order. When fixes were requested,
 * {@link #getFixedProblems()} lists the problems whose edit was applied to produce
 * {@link #getFixedSource()}; those no longer count towards {@link #getRemainingProblems()}.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public final class LintResult {

    private final String name;
    private final List<Problem> problems;
    private final List<Problem> fixedProblems;
    private final String fixedSource;

    public LintResult(String name, List<Problem> problems) {
        this(name, problems, List.of(), null);
    }

    public LintResult(String name, List<Problem> problems, List<Problem> fixedProblems, String fixedSource) {
        this.name = Objects.requireNonNull(name, "Name cannot be null");
        this.problems = List.copyOf(Objects.requireNonNull(problems, "Problems cannot be null"));
        this.fixedProblems = List.copyOf(fixedProblems != null ? fixedProblems : List.of());
        this.fixedSource = fixedSource;
    }

    public String getName() {
        return name;
    }

    public List<Problem> getProblems() {
        return problems;
    }

    public List<Problem> getFixedProblems() {
        return fixedProblems;
    }

    /**
     * Problems still present after fixing, in report order.
     */
    public List<Problem> getRemainingProblems() {
        if (fixedProblems.isEmpty()) {
            return problems;
        }
        Set<Problem> fixed = Collections.newSetFromMap(new IdentityHashMap<>());
        fixed.addAll(fixedProblems);
        List<Problem> remaining = new ArrayList<>();
        for (Problem problem : problems) {
            if (!fixed.contains(problem)) {
                remaining.add(problem);
            }
        }
        return List.copyOf(remaining);
    }

    /**
     * Problems that offered an edit which was not applied, because fixing was off or because the
     * edit conflicted with another one.
     */
    public List<Problem> getUnfixedProblems() {
        return getRemainingProblems().stream().filter(Problem::isFixable).toList();
    }

    public Optional<String> getFixedSource() {
        return Optional.ofNullable(fixedSource);
    }

    public boolean hasFixes() {
        return !fixedProblems.isEmpty();
    }

    public int getErrorCount() {
        return (int) getRemainingProblems().stream().filter(Problem::isError).count();
    }

    public int getWarningCount() {
        return (int) getRemainingProblems().stream().filter(p -> p.getSeverity() == Severity.WARNING).count();
    }

    /**
     * A run is successful when no error remains and the remaining warnings do not exceed
     * {@code maxWarnings}. A negative {@code maxWarnings} disables the warning limit.
     */
    public boolean isSuccessful(int maxWarnings) {
        if (getErrorCount() > 0) {
            return false;
        }
        return maxWarnings < 0 || getWarningCount() <= maxWarnings;
    }

    @Override
    public String toString() {
        return "LintResult{" +
               "name='" + name + '\'' +
               ", errors=" + getErrorCount() +
               ", warnings=" + getWarningCount() +
               ", fixed=" + fixedProblems.size() +
               '}';
    }
}
