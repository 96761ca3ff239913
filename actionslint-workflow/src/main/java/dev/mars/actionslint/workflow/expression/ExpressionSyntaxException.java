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

import dev.mars.actionslint.core.exceptions.ActionsLintException;

/**
 * Exception thrown when the text of a micro-expression cannot be parsed.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class ExpressionSyntaxException extends ActionsLintException {

    private final int offset;

    public ExpressionSyntaxException(String message, int offset) {
        super(message);
        this.offset = offset;
    }

    /**
     * Absolute source offset of the offending character.
     */
    public int getOffset() {
        return offset;
    }
}
