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

import java.util.stream.Stream;

/**
 * A lint rule. Rules read the immutable {@link RuleContext} and report problems; they never
 * mutate the workflow or the source. Several rules may run concurrently on the same context.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public interface Rule {

    /**
     * Stable identifier reported with every problem of this rule.
     */
    String id();

    /**
     * Checks the workflow. The returned stream is consumed completely by the engine; a
     * {@link RuntimeException} thrown while producing it is reported as a rule failure.
     */
    Stream<Problem> check(RuleContext context);
}
