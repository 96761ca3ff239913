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

/**
 * Tests for {@link SyntaxKeysRule}.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
class SyntaxKeysRuleTest {

    private static final String SOURCE = """
            on: push
            jobs:
              build:
                runson: ubuntu-latest
                timeout-minute: 10
                steps:
                  - run: make
                    working-directry: src
                    colour: red
            flavour: vanilla
            """;

    private static List<Problem> check(String source) {
        return new SyntaxKeysRule().check(TestWorkflows.context(source)).collect(Collectors.toList());
    }

    @Test
    void testUnknownKeysAtEveryLevel() {
        List<String> messages = check(SOURCE).stream().map(Problem::getMessage).collect(Collectors.toList());

        assertEquals(List.of(
                "Unknown key 'flavour' in the workflow",
                "Unknown key 'runson' in job 'build', did you mean 'runs-on'?",
                "Unknown key 'timeout-minute' in job 'build', did you mean 'timeout-minutes'?",
                "Unknown key 'working-directry' in step #1 of job 'build', did you mean 'working-directory'?",
                "Unknown key 'colour' in step #1 of job 'build'"), messages);
    }

    @Test
    void testRenameEdits() {
        List<Problem> problems = check(SOURCE);

        Problem runsOn = problems.get(1);
        assertTrue(runsOn.isFixable());
        assertEquals(SOURCE.replace("runson:", "runs-on:"), runsOn.getEdit().orElseThrow().applyTo(SOURCE));
        assertFalse(problems.get(0).isFixable());
        assertFalse(problems.get(4).isFixable());
    }

    @Test
    void testKnownKeys() {
        assertTrue(check("""
                name: CI
                on: push
                permissions: read-all
                jobs:
                  build:
                    runs-on: ubuntu-latest
                    strategy:
                      matrix:
                        anything: [1, 2]
                    steps:
                      - id: a
                        uses: actions/checkout@v4
                        with:
                          whatever: 1
                """).isEmpty());
    }
}
