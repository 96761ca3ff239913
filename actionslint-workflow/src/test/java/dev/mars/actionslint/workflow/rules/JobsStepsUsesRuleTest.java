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

import dev.mars.actionslint.config.LintConfiguration;
import dev.mars.actionslint.core.Problem;
import dev.mars.actionslint.core.Severity;
import dev.mars.actionslint.workflow.TestWorkflows;
import dev.mars.actionslint.workflow.metadata.ActionInput;
import dev.mars.actionslint.workflow.metadata.ActionMetadata;
import dev.mars.actionslint.workflow.metadata.ActionMetadataProvider;
import dev.mars.actionslint.workflow.metadata.ActionMetadataResult;
import dev.mars.actionslint.workflow.metadata.ActionReference;
import dev.mars.actionslint.workflow.metadata.GitHubActionMetadataClient;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.ServerSocket;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link JobsStepsUsesRule}.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
class JobsStepsUsesRuleTest {

    private static final ActionMetadata CHECKOUT = new ActionMetadata("Checkout",
            Map.of("fetch-depth", new ActionInput("fetch-depth", false, true),
                    "token", new ActionInput("token", true, false),
                    "repository", new ActionInput("repository", true, true)),
            Set.of("ref"), List.of("v4", "v3"));

    private static final ActionMetadata SETUP_JAVA = new ActionMetadata("Setup Java", Map.of(), Set.of(),
            List.of("v4.2.1", "v4.1.0", "v3.6.0"),
            Map.of("v4.2.1", "99aa4f1c0b7e5d2a8c3f6e1b4d7a0c9e2f5b8d1a",
                    "v4.1.0", "1a2b3c4d5e6f708192a3b4c5d6e7f80912a3b4c5",
                    "v3.6.0", "0f1e2d3c4b5a69788796a5b4c3d2e1f00f1e2d3c"));

    private List<ActionReference> lookups;

    @BeforeEach
    void setUp() {
        lookups = new ArrayList<>();
    }

    private ActionMetadataProvider provider(ActionMetadataResult result) {
        return reference -> {
            lookups.add(reference);
            return result;
        };
    }

    private static List<Problem> check(String source, ActionMetadataProvider provider) {
        return new JobsStepsUsesRule().check(TestWorkflows.context(source, provider, LintConfiguration.defaults()))
                .collect(Collectors.toList());
    }

    private static String workflow(String steps) {
        return "on: push\njobs:\n  build:\n    runs-on: ubuntu-latest\n    steps:\n" + steps;
    }

    @Test
    void testMissingVersionWithoutMetadata() {
        List<Problem> problems = check(workflow("""
                      - uses: actions/checkout
                      - uses: actions/setup-java@v4
                      - uses: ./local-action
                      - uses: docker://alpine:3.19
                """), null);

        assertEquals(1, problems.size());
        assertEquals("Using specific version of actions/checkout is recommended", problems.get(0).getMessage());
        assertEquals(Severity.WARNING, problems.get(0).getSeverity());
        assertFalse(problems.get(0).isFixable());
    }

    @Test
    void testMissingVersionFixedWithLatestTag() {
        String source = workflow("""
                      - uses: actions/checkout
                        with:
                          token: x
                """);
        List<Problem> problems = check(source, provider(ActionMetadataResult.found(CHECKOUT)));

        assertEquals(1, problems.size());
        Problem problem = problems.get(0);
        assertEquals("Using specific version of actions/checkout is recommended. "
                + "Consider using actions/checkout@v4", problem.getMessage());
        assertEquals(source.replace("actions/checkout", "actions/checkout@v4"),
                problem.getEdit().orElseThrow().applyTo(source));
        assertEquals("actions/checkout", lookups.get(0).slug());
    }

    @Test
    void testInputsCheckedAgainstMetadata() {
        String source = workflow("""
                      - uses: actions/checkout@v4
                        with:
                          fetch-dept: 1
                          flavour: vanilla
                """);
        List<Problem> problems = check(source, provider(ActionMetadataResult.found(CHECKOUT)));

        assertEquals(List.of(
                "Step #1 is missing required input 'token' of action actions/checkout",
                "Unknown input 'fetch-dept' for action actions/checkout, did you mean 'fetch-depth'?",
                "Unknown input 'flavour' for action actions/checkout"),
                problems.stream().map(Problem::getMessage).collect(Collectors.toList()));
        assertEquals(source.replace("fetch-dept:", "fetch-depth:"),
                problems.get(1).getEdit().orElseThrow().applyTo(source));
        assertTrue(problems.stream().allMatch(Problem::isError));
    }

    @Test
    void testMetadataUnavailable() {
        List<Problem> problems = check(workflow("""
                      - id: co
                        uses: actions/checkout@v4
                """), provider(ActionMetadataResult.unavailable("HTTP 500")));

        assertEquals(1, problems.size());
        assertEquals("Couldn't fetch metadata for actions/checkout. Continuing validation without",
                problems.get(0).getMessage());
        assertEquals(Severity.WARNING, problems.get(0).getSeverity());
    }

    @Test
    void testMetadataNotFoundWithoutVersion() {
        List<Problem> problems = check(workflow("""
                      - uses: octo-org/missing-action
                """), provider(ActionMetadataResult.notFound()));

        assertEquals(List.of(
                "Using specific version of octo-org/missing-action is recommended",
                "Couldn't fetch metadata for octo-org/missing-action. Continuing validation without"),
                problems.stream().map(Problem::getMessage).collect(Collectors.toList()));
    }

    @Test
    void testLocalActionsAreNotLookedUp() {
        assertTrue(check(workflow("""
                      - uses: ./.github/actions/build
                """), provider(ActionMetadataResult.notFound())).isEmpty());
        assertTrue(lookups.isEmpty());
    }

    @Test
    void testOutdatedFullVersions() {
        String source = workflow("""
                      - uses: actions/setup-java@v3.6.0
                      - uses: actions/setup-java@v4.1.0
                      - uses: actions/setup-java@v4.2.1
                """);
        List<Problem> problems = check(source, provider(ActionMetadataResult.found(SETUP_JAVA)));

        assertEquals(List.of(
                "Action actions/setup-java uses v3.6.0 which is major version outdated. Current latest is v4.2.1.",
                "Action actions/setup-java uses v4.1.0 which is minor version outdated. Current latest is v4.2.1."),
                problems.stream().map(Problem::getMessage).collect(Collectors.toList()));
        assertTrue(problems.stream().allMatch(p -> p.getSeverity() == Severity.WARNING));
        assertEquals(source.replaceFirst("@v3\\.6\\.0", "@v4.2.1"),
                problems.get(0).getEdit().orElseThrow().applyTo(source));
    }

    @Test
    void testPartialVersionsResolveToNewestMatchingTag() {
        List<Problem> problems = check(workflow("""
                      - uses: actions/setup-java@v4
                      - uses: actions/setup-java@v4.1
                      - uses: actions/setup-java@v3
                      - uses: actions/setup-java@v2
                """), provider(ActionMetadataResult.found(SETUP_JAVA)));

        assertEquals(List.of(
                "Action actions/setup-java uses v4.1 (resolves to v4.1.0) which is minor version outdated. "
                        + "Current latest is v4.2.1.",
                "Action actions/setup-java uses v3 (resolves to v3.6.0) which is major version outdated. "
                        + "Current latest is v4.2.1.",
                "Action actions/setup-java uses outdated v2 which cannot be resolved to any available version. "
                        + "Current latest is v4.2.1."),
                problems.stream().map(Problem::getMessage).collect(Collectors.toList()));
    }

    @Test
    void testCommitShaMatchedAgainstTagCommits() {
        String source = workflow("""
                      - uses: actions/setup-java@1a2b3c4d
                      - uses: actions/setup-java@fedcba9876
                      - uses: actions/setup-java@99aa4f1c
                      - uses: actions/setup-java@main
                """);
        List<Problem> problems = check(source, provider(ActionMetadataResult.found(SETUP_JAVA)));

        assertEquals(List.of(
                "Action actions/setup-java uses commit SHA (corresponds to v4.1.0) which is minor version outdated. "
                        + "Current latest is v4.2.1.",
                "Action actions/setup-java uses commit SHA which may be outdated. Current latest version is v4.2.1. "
                        + "Consider using versioned tags."),
                problems.stream().map(Problem::getMessage).collect(Collectors.toList()));
        assertEquals(source.replace("@fedcba9876", "@v4.2.1"),
                problems.get(1).getEdit().orElseThrow().applyTo(source));
    }

    @Test
    void testOutdatedCheckSkippedWhenLatestTagIsPartial() {
        assertTrue(check(workflow("""
                      - uses: actions/checkout@v3
                        with:
                          token: x
                """), provider(ActionMetadataResult.found(CHECKOUT))).isEmpty());
    }

    @Test
    void testInvalidRefDoesNotHideOtherFindings() throws IOException {
        int port;
        try (ServerSocket socket = new ServerSocket(0)) {
            port = socket.getLocalPort();
        }
        String closedUrl = "http://localhost:" + port;
        GitHubActionMetadataClient client = new GitHubActionMetadataClient(closedUrl, closedUrl, null,
                Duration.ofSeconds(2), 0);

        List<Problem> problems = check(workflow("""
                      - uses: actions/checkout
                      - uses: foo/bar@v 1
                """), client);

        assertEquals(List.of(
                "Using specific version of actions/checkout is recommended",
                "Couldn't fetch metadata for actions/checkout. Continuing validation without",
                "Couldn't fetch metadata for foo/bar. Continuing validation without"),
                problems.stream().map(Problem::getMessage).collect(Collectors.toList()));
    }
}
