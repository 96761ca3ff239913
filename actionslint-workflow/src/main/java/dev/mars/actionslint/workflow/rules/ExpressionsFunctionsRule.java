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
import dev.mars.actionslint.workflow.ast.ScopedString;
import dev.mars.actionslint.workflow.expression.EmbeddedExpression;
import dev.mars.actionslint.workflow.expression.Expressions;
import dev.mars.actionslint.workflow.expression.FunctionCall;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Checks calls of the built-in expression functions: the name must be known (case-insensitively)
 * and the argument count must fit.
 */
public class ExpressionsFunctionsRule implements Rule {

    public static final String ID = "expressions-functions";

    private static final int UNBOUNDED = Integer.MAX_VALUE;

    /**
     * Function name to minimum and maximum argument count.
     */
    static final Map<String, int[]> FUNCTIONS = new LinkedHashMap<>();

    static {
        FUNCTIONS.put("contains", new int[]{2, 2});
        FUNCTIONS.put("startsWith", new int[]{2, 2});
        FUNCTIONS.put("endsWith", new int[]{2, 2});
        FUNCTIONS.put("format", new int[]{1, UNBOUNDED});
        FUNCTIONS.put("join", new int[]{1, 2});
        FUNCTIONS.put("toJSON", new int[]{1, 1});
        FUNCTIONS.put("fromJSON", new int[]{1, 1});
        FUNCTIONS.put("hashFiles", new int[]{1, UNBOUNDED});
        FUNCTIONS.put("success", new int[]{0, 0});
        FUNCTIONS.put("always", new int[]{0, 0});
        FUNCTIONS.put("cancelled", new int[]{0, 0});
        FUNCTIONS.put("failure", new int[]{0, 0});
    }

    @Override
    public String id() {
        return ID;
    }

    @Override
    public Stream<Problem> check(RuleContext context) {
        List<Problem> problems = new ArrayList<>();
        for (ScopedString scalar : context.getScalars()) {
            for (EmbeddedExpression expression : scalar.value().getExpressions()) {
                for (FunctionCall call : Expressions.functionCalls(expression.root())) {
                    checkCall(context, call, problems);
                }
            }
        }
        return problems.stream();
    }

    private void checkCall(RuleContext context, FunctionCall call, List<Problem> problems) {
        String known = canonicalName(call.name());
        if (known == null) {
            Optional<String> suggestion = Suggestions.closestIgnoreCase(call.name(), FUNCTIONS.keySet(),
                    context.getSimilarityThreshold());
            Problem problem = Problem.error(context.posAt(call.nameOffset()),
                    "Unknown function '" + call.name() + "'"
                            + suggestion.map(s -> ", did you mean '" + s + "'?").orElse(""), ID);
            problems.add(suggestion
                    .flatMap(s -> context.replacement(call.nameOffset(), call.name(), s))
                    .map(problem::withEdit)
                    .orElse(problem));
            return;
        }
        int[] arity = FUNCTIONS.get(known);
        int count = call.arguments().size();
        if (count < arity[0] || count > arity[1]) {
            problems.add(Problem.error(context.posAt(call.nameOffset()),
                    "Function '" + known + "' expects " + describe(arity) + " but got " + count, ID));
        }
    }

    private static String canonicalName(String name) {
        String lower = name.toLowerCase(Locale.ROOT);
        for (String function : FUNCTIONS.keySet()) {
            if (function.toLowerCase(Locale.ROOT).equals(lower)) {
                return function;
            }
        }
        return null;
    }

    private static String describe(int[] arity) {
        if (arity[0] == arity[1]) {
            return arity[0] + (arity[0] == 1 ? " argument" : " arguments");
        }
        if (arity[1] == UNBOUNDED) {
            return "at least " + arity[0] + (arity[0] == 1 ? " argument" : " arguments");
        }
        return arity[0] + " to " + arity[1] + " arguments";
    }
}
