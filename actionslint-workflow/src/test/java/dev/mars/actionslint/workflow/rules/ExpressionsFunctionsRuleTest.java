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

class ExpressionsFunctionsRuleTest {

    private static List<Problem> check(String expression) {
        String source = "on: push\njobs:\n  build:\n    runs-on: ubuntu-latest\n    steps:\n"
                + "      - run: echo ${{ " + expression + " }}\n";
        return new ExpressionsFunctionsRule().check(TestWorkflows.context(source)).collect(Collectors.toList());
    }

    private static List<String> messages(String expression) {
        return check(expression).stream().map(Problem::getMessage).collect(Collectors.toList());
    }

    @Test
    void testKnownFunctions() {
        assertTrue(check("contains(github.ref, 'main') && startsWith(github.ref, 'refs/')").isEmpty());
        assertTrue(check("format('{0}-{1}', github.sha, github.ref)").isEmpty());
        assertTrue(check("hashFiles('**/pom.xml', '**/*.gradle')").isEmpty());
        assertTrue(check("join(matrix.os) || success() || always()").isEmpty());
    }

    @Test
    void testFunctionNamesAreCaseInsensitive() {
        assertTrue(check("TOJSON(github) && fromjson('{}')").isEmpty());
    }

    @Test
    void testUnknownFunctionWithRename() {
        String source = "on: push\njobs:\n  build:\n    runs-on: ubuntu-latest\n    steps:\n"
                + "      - run: echo ${{ contain(github.ref, 'main') }}\n";
        List<Problem> problems = new ExpressionsFunctionsRule().check(TestWorkflows.context(source))
                .collect(Collectors.toList());

        assertEquals(1, problems.size());
        assertEquals("Unknown function 'contain', did you mean 'contains'?", problems.get(0).getMessage());
        assertEquals(source.replace("contain(", "contains("), problems.get(0).getEdit().orElseThrow().applyTo(source));
    }

    @Test
    void testUnknownFunctionWithoutSuggestion() {
        assertEquals(List.of("Unknown function 'explode'"), messages("explode(github.sha)"));
    }

    @Test
    void testArgumentCounts() {
        assertEquals(List.of("Function 'contains' expects 2 arguments but got 1"), messages("contains(github.ref)"));
        assertEquals(List.of("Function 'toJSON' expects 1 argument but got 2"), messages("toJSON(github, env)"));
        assertEquals(List.of("Function 'format' expects at least 1 argument but got 0"), messages("format()"));
        assertEquals(List.of("Function 'join' expects 1 to 2 arguments but got 3"), messages("join(a.b, ',', 'x')"));
        assertEquals(List.of("Function 'success' expects 0 arguments but got 1"), messages("success(github)"));
    }

    @Test
    void testNestedCalls() {
        assertEquals(List.of("Function 'fromJSON' expects 1 argument but got 0"),
                messages("contains(fromJSON(), 'x')"));
    }
}
