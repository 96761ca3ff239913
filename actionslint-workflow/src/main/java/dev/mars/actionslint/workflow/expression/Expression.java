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

import java.util.List;

/**
 * A node of a parsed {@code ${{ ... }}} micro-expression.
 *
 * <p>The node kinds form a closed set; each kind has exactly one implementing record.
 * {@link #start()} and {@link #end()} are absolute offsets into the workflow source
 * ({@code end} exclusive).</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public interface Expression {

    enum Kind {
        CONTEXT_REFERENCE,
        FUNCTION_CALL,
        LITERAL,
        BINARY,
        UNARY,
        RAW
    }

    Kind kind();

    int start();

    int end();

    /**
     * Direct children in source order.
     */
    default List<Expression> children() {
        return List.of();
    }
}
