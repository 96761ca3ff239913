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

import java.util.List;

/**
 * The rule set shipped with the linter.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public final class Rules {

    private Rules() {
    }

    /**
     * All built-in rules in registration order. Problems of a run are reported in this order.
     */
    public static List<Rule> defaults() {
        return List.of(
                new WorkflowStructureRule(),
                new SyntaxKeysRule(),
                new EventTriggerRule(),
                new JobsStepsUsesRule(),
                new StepsIoMatchRule(),
                new ExpressionsContextsRule(),
                new ExpressionsFunctionsRule(),
                new ExpressionsNeedsRule());
    }
}
