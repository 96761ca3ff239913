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

package dev.mars.actionslint.core;

import java.util.Objects;
import java.util.Optional;

/**
 * A single diagnostic finding: where it is, how severe it is, what is wrong and which rule found
 * it. A problem may carry an {@link Edit} that would fix it.
 *
 * <p>Problems are immutable. Whether an edit was actually applied is recorded by the fixer's
 * result, not on the problem itself.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public final class Problem {

    private final Pos pos;
    private final Severity severity;
    private final String message;
    private final String ruleId;
    private final Edit edit;

    public Problem(Pos pos, Severity severity, String message, String ruleId) {
        this(pos, severity, message, ruleId, null);
    }

    public Problem(Pos pos, Severity severity, String message, String ruleId, Edit edit) {
        this.pos = Objects.requireNonNull(pos, "Position cannot be null");
        this.severity = Objects.requireNonNull(severity, "Severity cannot be null");
        this.message = Objects.requireNonNull(message, "Message cannot be null");
        this.ruleId = Objects.requireNonNull(ruleId, "Rule id cannot be null");
        this.edit = edit;
    }

    public static Problem error(Pos pos, String message, String ruleId) {
        return new Problem(pos, Severity.ERROR, message, ruleId);
    }

    public static Problem warning(Pos pos, String message, String ruleId) {
        return new Problem(pos, Severity.WARNING, message, ruleId);
    }

    /**
     * Returns a copy of this problem carrying the given edit.
     */
    public Problem withEdit(Edit edit) {
        return new Problem(pos, severity, message, ruleId, Objects.requireNonNull(edit, "Edit cannot be null"));
    }

    public Pos getPos() {
        return pos;
    }

    public Severity getSeverity() {
        return severity;
    }

    public String getMessage() {
        return message;
    }

    public String getRuleId() {
        return ruleId;
    }

    public Optional<Edit> getEdit() {
        return Optional.ofNullable(edit);
    }

    public boolean isFixable() {
        return edit != null;
    }

    public boolean isError() {
        return severity == Severity.ERROR;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Problem that = (Problem) o;
        return pos.equals(that.pos) &&
               severity == that.severity &&
               message.equals(that.message) &&
               ruleId.equals(that.ruleId) &&
               Objects.equals(edit, that.edit);
    }

    @Override
    public int hashCode() {
        return Objects.hash(pos, severity, message, ruleId, edit);
    }

    @Override
    public String toString() {
        return pos + ": " + severity.getLabel() + ": " + message + " (" + ruleId + ")";
    }
}
