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

package dev.mars.actionslint.workflow.ast;

import dev.mars.actionslint.core.Pos;

/**
 * A node of the position-preserving YAML tree that backs the workflow AST.
 *
 * <p>The set of node kinds is fixed: {@link SourceString} for scalars, {@link YamlMapping} and
 * {@link YamlSequence} for collections. Callers switch on {@link #kind()} rather than testing
 * concrete types.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public interface YamlNode {

    enum Kind {
        SCALAR,
        MAPPING,
        SEQUENCE
    }

    Kind kind();

    Pos getPos();

    default boolean isScalar() {
        return kind() == Kind.SCALAR;
    }

    default boolean isMapping() {
        return kind() == Kind.MAPPING;
    }

    default boolean isSequence() {
        return kind() == Kind.SEQUENCE;
    }
}
