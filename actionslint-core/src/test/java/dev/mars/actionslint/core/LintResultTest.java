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

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link LintResult}.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
class LintResultTest {

    private Problem error;
    private Problem fixableWarning;
    private Problem warning;

    @BeforeEach
    void setUp() {
        error = Problem.error(new Pos(1, 2, 10), "Job 'test' depends on non-existent job 'biuld'", "jobs-needs");
        fixableWarning = Problem.warning(new Pos(3, 4, 40), "Unknown key", "syntax-keys")
                .withEdit(Edit.replace(40, 6, "runs-on"));
        warning = Problem.warning(new Pos(5, 0, 60), "Using specific version", "jobs-steps-uses");
    }

    @Test
    void testCounts() {
        LintResult result = new LintResult("ci.yml", List.of(error, fixableWarning, warning));

        assertEquals(1, result.getErrorCount());
        assertEquals(2, result.getWarningCount());
        assertFalse(result.isSuccessful(-1));
        assertFalse(result.hasFixes());
        assertTrue(result.getFixedSource().isEmpty());
        assertEquals(List.of(fixableWarning), result.getUnfixedProblems());
    }

    @Test
    void testFixedProblemsNoLongerCount() {
        LintResult result = new LintResult("ci.yml", List.of(fixableWarning, warning), List.of(fixableWarning), "fixed");

        assertEquals(List.of(warning), result.getRemainingProblems());
        assertEquals(1, result.getWarningCount());
        assertTrue(result.getUnfixedProblems().isEmpty());
        assertEquals("fixed", result.getFixedSource().orElseThrow());
    }

    @Test
    void testWarningLimit() {
        LintResult result = new LintResult("ci.yml", List.of(fixableWarning, warning));

        assertTrue(result.isSuccessful(-1));
        assertTrue(result.isSuccessful(2));
        assertFalse(result.isSuccessful(1));
    }

    @Test
    void testProblemsAreImmutable() {
        LintResult result = new LintResult("ci.yml", List.of(error));

        assertThrows(UnsupportedOperationException.class, () -> result.getProblems().add(warning));
    }
}
