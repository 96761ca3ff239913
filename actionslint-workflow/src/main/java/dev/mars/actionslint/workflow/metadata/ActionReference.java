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
 * A remote action reference of the form {@code owner/repo[/path]@ref}, as written in a step's
 * {@code uses}.
 *
 * @param owner repository owner
 * @param repo  repository name
 * @param path  path of the action inside the repository, {@code null} for the root
 * @param ref   tag, branch or commit, {@code null} when the reference has no {@code @ref}
 */
public record ActionReference(String owner, String repo, String path, String ref) {

    public ActionReference {
        Objects.requireNonNull(owner, "Owner cannot be null");
        Objects.requireNonNull(repo, "Repository cannot be null");
    }

    /**
     * Parses a {@code uses} value. Local actions ({@code ./...}), Docker images
     * ({@code docker://...}), reusable workflow files and malformed values yield empty.
     */
    public static Optional<ActionReference> parse(String uses) {
        if (uses == null) {
            return Optional.empty();
        }
        String value = uses.trim();
        if (value.isEmpty() || value.startsWith("./") || value.startsWith("../") || value.startsWith("docker://")
                || value.contains("${{")) {
            return Optional.empty();
        }
        String slug = value;
        String ref = null;
        int at = value.indexOf('@');
        if (at >= 0) {
            slug = value.substring(0, at);
            ref = value.substring(at + 1);
            if (ref.isEmpty()) {
                ref = null;
            }
        }
        String[] parts = slug.split("/", 3);
        if (parts.length < 2 || parts[0].isEmpty() || parts[1].isEmpty()) {
            return Optional.empty();
        }
        String path = parts.length == 3 && !parts[2].isEmpty() ? parts[2] : null;
        if (path != null && (path.endsWith(".yml") || path.endsWith(".yaml"))) {
            return Optional.empty();
        }
        return Optional.of(new ActionReference(parts[0], parts[1], path, ref));
    }

    /**
     * Whether a {@code uses} value points at a remote action and thus can be looked up.
     */
    public static boolean isRemote(String uses) {
        return parse(uses).isPresent();
    }

    /**
     * {@code owner/repo[/path]} without the ref.
     */
    public String slug() {
        return path != null ? owner + "/" + repo + "/" + path : owner + "/" + repo;
    }

    public String repository() {
        return owner + "/" + repo;
    }

    public Optional<String> getRef() {
        return Optional.ofNullable(ref);
    }

    public boolean hasRef() {
        return ref != null;
    }

    @Override
    public String toString() {
        return ref != null ? slug() + "@" + ref : slug();
    }
}
