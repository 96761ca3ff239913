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

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

/**
 * Lists every scalar of a workflow in document order with its enclosing job and step.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public final class WorkflowScalars {

    private WorkflowScalars() {
    }

    public static List<ScopedString> of(Workflow workflow) {
        Map<YamlNode, Job> jobsByBody = new IdentityHashMap<>();
        Map<YamlNode, Step> stepsByBody = new IdentityHashMap<>();
        for (Job job : workflow.getJobs().values()) {
            jobsByBody.put(job.getRaw(), job);
            for (Step step : job.getSteps()) {
                stepsByBody.put(step.getRaw(), step);
            }
        }

        List<ScopedString> scalars = new ArrayList<>();
        Deque<Visit> stack = new ArrayDeque<>();
        stack.push(new Visit(workflow.getRaw(), null, null, false));
        while (!stack.isEmpty()) {
            Visit visit = stack.pop();
            YamlNode node = visit.node();
            Job job = jobsByBody.getOrDefault(node, visit.job());
            Step step = stepsByBody.getOrDefault(node, visit.step());
            switch (node.kind()) {
                case SCALAR:
                    scalars.add(new ScopedString(job, step, (SourceString) node, visit.key()));
                    break;
                case MAPPING: {
                    List<YamlMapping.Entry> entries = ((YamlMapping) node).getEntries();
                    for (int i = entries.size() - 1; i >= 0; i--) {
                        stack.push(new Visit(entries.get(i).value(), job, step, false));
                        stack.push(new Visit(entries.get(i).key(), job, step, true));
                    }
                    break;
                }
                case SEQUENCE: {
                    List<YamlNode> items = ((YamlSequence) node).getItems();
                    for (int i = items.size() - 1; i >= 0; i--) {
                        stack.push(new Visit(items.get(i), job, step, false));
                    }
                    break;
                }
                default:
                    break;
            }
        }
        return scalars;
    }

    private record Visit(YamlNode node, Job job, Step step, boolean key) {
    }
}
