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

import dev.mars.actionslint.core.Pos;
import dev.mars.actionslint.core.Problem;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class LintMetricsTest {

    @Test
    void testSingleton() {
        assertSame(LintMetrics.getInstance(), LintMetrics.getInstance());
    }

    @Test
    void testActiveRuns() {
        LintMetrics metrics = LintMetrics.getInstance();
        long before = metrics.getActiveRuns();

        metrics.recordLintStarted();
        assertEquals(before + 1, metrics.getActiveRuns());

        metrics.recordLintCompleted(List.of(Problem.error(Pos.START, "broken", "syntax-keys")), false);
        assertEquals(before, metrics.getActiveRuns());
    }

    @Test
    void testRecordingWithoutSdkDoesNotFail() {
        LintMetrics metrics = LintMetrics.getInstance();

        assertDoesNotThrow(() -> {
            metrics.recordRuleDuration("syntax-keys", 1.5);
            metrics.recordRuleFailure("syntax-keys", "timeout");
            metrics.recordFixes(2, 1);
            metrics.recordFixes(0, 0);
        });
    }
}
