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

package dev.mars.actionslint.workflow.expression;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Traversal helpers for expression trees.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public final class Expressions {

    private Expressions() {
    }

    /**
     * Returns every node of the tree in pre-order (parents before children, children in source
     * order). Iterative, so deeply nested input does not exhaust the call stack.
     */
    public static List<Expression> walk(Expression root) {
        List<Expression> nodes = new ArrayList<>();
        Deque<Expression> stack = new ArrayDeque<>();
        stack.push(root);
        while (!stack.isEmpty()) {
            Expression current = stack.pop();
            nodes.add(current);
            List<Expression> children = current.children();
            for (int i = children.size() - 1; i >= 0; i--) {
                stack.push(children.get(i));
            }
        }
        return nodes;
    }

    public static List<ContextReference> contextReferences(Expression root) {
        List<ContextReference> references = new ArrayList<>();
        for (Expression node : walk(root)) {
            if (node.kind() == Expression.Kind.CONTEXT_REFERENCE) {
                references.add((ContextReference) node);
            }
        }
        return references;
    }

    public static List<FunctionCall> functionCalls(Expression root) {
        List<FunctionCall> calls = new ArrayList<>();
        for (Expression node : walk(root)) {
            if (node.kind() == Expression.Kind.FUNCTION_CALL) {
                calls.add((FunctionCall) node);
            }
        }
        return calls;
    }
}
