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

module dev.mars.actionslint.workflow {
    requires java.logging;
    requires java.net.http;
    requires jdk.httpserver;  // For tests using the embedded HTTP server
    requires transitive dev.mars.actionslint.core;

    // Third-party libraries used in main sources
    requires org.yaml.snakeyaml;
    requires com.fasterxml.jackson.databind;
    requires io.opentelemetry.api;
    requires org.apache.commons.lang3;

    exports dev.mars.actionslint.workflow;
    exports dev.mars.actionslint.workflow.ast;
    exports dev.mars.actionslint.workflow.building;
    exports dev.mars.actionslint.workflow.cli;
    exports dev.mars.actionslint.workflow.expression;
    exports dev.mars.actionslint.workflow.fix;
    exports dev.mars.actionslint.workflow.graph;
    exports dev.mars.actionslint.workflow.metadata;
    exports dev.mars.actionslint.workflow.observability;
    exports dev.mars.actionslint.workflow.rules;
}
