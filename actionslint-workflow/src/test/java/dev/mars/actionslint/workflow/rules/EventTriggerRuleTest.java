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
import dev.mars.actionslint.workflow.TestWorkflows;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class EventTriggerRuleTest {

    private static List<Problem> check(String source) {
        return new EventTriggerRule().check(TestWorkflows.context(source)).collect(Collectors.toList());
    }

    @Test
    void testKnownEventForms() {
        assertTrue(check("on: push\njobs: {}\n").isEmpty());
        assertTrue(check("on: [push, pull_request]\njobs: {}\n").isEmpty());
        assertTrue(check("on:\n  workflow_dispatch:\n  schedule:\n    - cron: '0 0 * * *'\njobs: {}\n").isEmpty());
    }

    @Test
    void testUnknownEventWithRename() {
        String source = "on: [push, pul_request]\njobs: {}\n";
        List<Problem> problems = check(source);

        assertEquals(1, problems.size());
        assertEquals("Unknown event 'pul_request', did you mean 'pull_request'?", problems.get(0).getMessage());
        assertEquals("on: [push, pull_request]\njobs: {}\n", problems.get(0).getEdit().orElseThrow().applyTo(source));
    }

    @Test
    void testUnknownEventWithoutSuggestion() {
        List<Problem> problems = check("on:\n  deploy-everything:\njobs: {}\n");

        assertEquals(1, problems.size());
        assertEquals("Unknown event 'deploy-everything'", problems.get(0).getMessage());
        assertFalse(problems.get(0).isFixable());
    }
}
