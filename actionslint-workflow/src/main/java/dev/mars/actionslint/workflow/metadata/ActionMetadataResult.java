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

package dev.mars.actionslint.workflow.metadata;

import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of a metadata lookup. Lookups never fail by exception; a collaborator outage is an
 * {@link Status#UNAVAILABLE} result.
 */
public final class ActionMetadataResult {

    public enum Status {
        FOUND,
        NOT_FOUND,
        UNAVAILABLE
    }

    private static final ActionMetadataResult NOT_FOUND = new ActionMetadataResult(Status.NOT_FOUND, null, null);

    private final Status status;
    private final ActionMetadata metadata;
    private final String reason;

    private ActionMetadataResult(Status status, ActionMetadata metadata, String reason) {
        this.status = status;
        this.metadata = metadata;
        this.reason = reason;
    }

    public static ActionMetadataResult found(ActionMetadata metadata) {
        return new ActionMetadataResult(Status.FOUND, Objects.requireNonNull(metadata, "Metadata cannot be null"), null);
    }

    public static ActionMetadataResult notFound() {
        return NOT_FOUND;
    }

    public static ActionMetadataResult unavailable(String reason) {
        return new ActionMetadataResult(Status.UNAVAILABLE, null, reason);
    }

    public Status getStatus() {
        return status;
    }

    public boolean isFound() {
        return status == Status.FOUND;
    }

    public Optional<ActionMetadata> getMetadata() {
        return Optional.ofNullable(metadata);
    }

    public Optional<String> getReason() {
        return Optional.ofNullable(reason);
    }

    @Override
    public String toString() {
        return "ActionMetadataResult{status=" + status + (reason != null ? ", reason='" + reason + '\'' : "") + '}';
    }
}
