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

import java.util.Comparator;
import java.util.Optional;

/**
 * A semantic version taken from an action ref such as {@code v4}, {@code v4.1} or {@code v4.1.7}.
 * Minor and patch are {@code null} when the ref leaves them out.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public record ActionVersion(int major, Integer minor, Integer patch) implements Comparable<ActionVersion> {

    private static final Comparator<ActionVersion> ORDER = Comparator
            .comparingInt(ActionVersion::major)
            .thenComparingInt(version -> valueOf(version.minor()))
            .thenComparingInt(version -> valueOf(version.patch()));

    /**
     * Parses a ref, ignoring a leading {@code v}. Refs that are not one to three numeric
     * components yield an empty result.
     */
    public static Optional<ActionVersion> parse(String ref) {
        if (ref == null) {
            return Optional.empty();
        }
        String text = ref.startsWith("v") || ref.startsWith("V") ? ref.substring(1) : ref;
        if (text.isEmpty()) {
            return Optional.empty();
        }
        String[] parts = text.split("\\.", -1);
        if (parts.length > 3) {
            return Optional.empty();
        }
        try {
            int major = parseComponent(parts[0]);
            Integer minor = parts.length > 1 ? parseComponent(parts[1]) : null;
            Integer patch = parts.length > 2 ? parseComponent(parts[2]) : null;
            return Optional.of(new ActionVersion(major, minor, patch));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }

    private static int parseComponent(String part) {
        if (part.isEmpty() || !part.chars().allMatch(Character::isDigit)) {
            throw new NumberFormatException("Not a version component: '" + part + "'");
        }
        return Integer.parseInt(part);
    }

    /**
     * True for refs that look like a commit SHA: at least seven lower-case hex digits.
     */
    public static boolean isCommitSha(String ref) {
        return ref != null && ref.length() >= 7 && ref.length() <= 40
                && ref.chars().allMatch(c -> (c >= '0' && c <= '9') || (c >= 'a' && c <= 'f'));
    }

    public boolean isComplete() {
        return minor != null && patch != null;
    }

    /**
     * Whether a partial version such as {@code v4.1} matches the complete version {@code other}.
     */
    public boolean covers(ActionVersion other) {
        return other.isComplete()
                && major == other.major()
                && (minor == null || minor.equals(other.minor()))
                && (patch == null || patch.equals(other.patch()));
    }

    /**
     * How far this version lags behind {@code latest}: {@code "major"}, {@code "minor"} or
     * {@code "patch"}, or empty when it is not older.
     */
    public Optional<String> outdatedLevel(ActionVersion latest) {
        if (compareTo(latest) >= 0) {
            return Optional.empty();
        }
        if (major < latest.major()) {
            return Optional.of("major");
        }
        if (valueOf(minor) < valueOf(latest.minor())) {
            return Optional.of("minor");
        }
        return Optional.of("patch");
    }

    @Override
    public int compareTo(ActionVersion other) {
        return ORDER.compare(this, other);
    }

    private static int valueOf(Integer component) {
        return component != null ? component : 0;
    }
}
