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

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.mars.actionslint.config.LintConfiguration;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.logging.Logger;

/**
 * Action metadata client for GitHub.
 * Reads {@code action.yml} (or {@code action.yaml}) from the raw content host and the version
 * tags from the REST API.
 *
 * <p>Requests are bounded by a timeout and retried on I/O errors and server-side statuses.
 * Results are cached per reference for the lifetime of the client. {@link #lookup} never throws:
 * a missing metadata file is {@code NOT_FOUND}, an unreachable host {@code UNAVAILABLE}.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class GitHubActionMetadataClient implements ActionMetadataProvider {

    private static final Logger logger = Logger.getLogger(GitHubActionMetadataClient.class.getName());

    private static final List<String> DEFAULT_REFS = List.of("main", "master");
    private static final List<String> METADATA_FILES = List.of("action.yml", "action.yaml");

    private final String rawBaseUrl;
    private final String apiBaseUrl;
    private final String authHeader;
    private final Duration timeout;
    private final int retries;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final Yaml yaml;
    private final ConcurrentMap<String, ActionMetadataResult> cache = new ConcurrentHashMap<>();

    public GitHubActionMetadataClient(LintConfiguration configuration) {
        this(configuration.getMetadataRawUrl(), configuration.getMetadataApiUrl(), configuration.getMetadataToken(),
                configuration.getMetadataTimeout(), configuration.getMetadataRetries());
    }

    public GitHubActionMetadataClient(String rawBaseUrl, String apiBaseUrl, String token, Duration timeout, int retries) {
        this.rawBaseUrl = stripTrailingSlash(Objects.requireNonNull(rawBaseUrl, "Raw base URL cannot be null"));
        this.apiBaseUrl = stripTrailingSlash(Objects.requireNonNull(apiBaseUrl, "API base URL cannot be null"));
        this.authHeader = token != null ? "Bearer " + token : null;
        this.timeout = Objects.requireNonNull(timeout, "Timeout cannot be null");
        this.retries = Math.max(0, retries);
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(timeout)
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
        this.objectMapper = new ObjectMapper();
        this.yaml = new Yaml(new SafeConstructor(new LoaderOptions()));
    }

    @Override
    public ActionMetadataResult lookup(ActionReference reference) {
        Objects.requireNonNull(reference, "Reference cannot be null");
        return cache.computeIfAbsent(reference.toString(), key -> fetch(reference));
    }

    private ActionMetadataResult fetch(ActionReference reference) {
        try {
            Map<?, ?> document = fetchDocument(reference);
            if (document == null) {
                logger.info("No action metadata found for " + reference);
                return ActionMetadataResult.notFound();
            }
            Map<String, String> tags = fetchTags(reference);
            return ActionMetadataResult.found(
                    ActionMetadata.fromDocument(document, new ArrayList<>(tags.keySet()), tags));
        } catch (ActionMetadataException e) {
            logger.warning("Couldn't fetch metadata for " + reference + ": " + e.getMessage());
            return ActionMetadataResult.unavailable(e.getMessage());
        }
    }

    private Map<?, ?> fetchDocument(ActionReference reference) throws ActionMetadataException {
        List<String> refs = reference.hasRef() ? List.of(reference.ref()) : DEFAULT_REFS;
        String directory = reference.path() != null ? reference.path() + "/" : "";
        for (String ref : refs) {
            for (String file : METADATA_FILES) {
                String url = rawBaseUrl + "/" + reference.repository() + "/" + ref + "/" + directory + file;
                HttpResponse<String> response = get(url, false);
                if (response.statusCode() == 200) {
                    return parseDocument(reference, response.body());
                }
                if (response.statusCode() != 404) {
                    throw new ActionMetadataException("HTTP " + response.statusCode() + " from " + url);
                }
            }
        }
        return null;
    }

    private Map<?, ?> parseDocument(ActionReference reference, String body) throws ActionMetadataException {
        try {
            Object loaded = yaml.load(body);
            if (loaded instanceof Map<?, ?> document) {
                return document;
            }
            throw new ActionMetadataException("Metadata of " + reference + " is not a mapping");
        } catch (YAMLException e) {
            throw new ActionMetadataException("Couldn't parse metadata of " + reference, e);
        }
    }

    /**
     * Tags are an enrichment; failing to read them leaves the map empty. Maps each tag name, in
     * API order, to the SHA of its commit ({@code null} when absent).
     */
    private Map<String, String> fetchTags(ActionReference reference) {
        String url = apiBaseUrl + "/repos/" + reference.repository() + "/tags";
        Map<String, String> tags = new LinkedHashMap<>();
        try {
            HttpResponse<String> response = get(url, true);
            if (response.statusCode() != 200) {
                logger.fine("Tags of " + reference.repository() + " unavailable: HTTP " + response.statusCode());
                return tags;
            }
            JsonNode root = objectMapper.readTree(response.body());
            if (root != null && root.isArray()) {
                for (JsonNode tag : root) {
                    JsonNode name = tag.get("name");
                    if (name != null && name.isTextual()) {
                        JsonNode sha = tag.path("commit").path("sha");
                        tags.put(name.asText(), sha.isTextual() ? sha.asText() : null);
                    }
                }
            }
        } catch (ActionMetadataException | IOException e) {
            logger.fine("Couldn't read tags of " + reference.repository() + ": " + e.getMessage());
        }
        return tags;
    }

    private HttpResponse<String> get(String url, boolean api) throws ActionMetadataException {
        HttpRequest.Builder builder;
        try {
            builder = HttpRequest.newBuilder()
                    .uri(URI.create(url))
                    .timeout(timeout)
                    .GET();
        } catch (IllegalArgumentException e) {
            throw new ActionMetadataException("Invalid request URL " + url + ": " + e.getMessage(), e);
        }
        if (api) {
            builder.header("Accept", "application/vnd.github+json");
            if (authHeader != null) {
                builder.header("Authorization", authHeader);
            }
        }
        HttpRequest request = builder.build();

        ActionMetadataException lastFailure = null;
        for (int attempt = 0; attempt <= retries; attempt++) {
            try {
                HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
                if (!isRetryable(response.statusCode()) || attempt == retries) {
                    return response;
                }
                logger.fine("Retrying " + url + " after HTTP " + response.statusCode());
            } catch (IOException e) {
                lastFailure = new ActionMetadataException("Request to " + url + " failed: " + e.getMessage(), e);
                logger.fine("Attempt " + (attempt + 1) + " for " + url + " failed: " + e.getMessage());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new ActionMetadataException("Interrupted while requesting " + url, e);
            }
        }
        throw lastFailure;
    }

    private static boolean isRetryable(int status) {
        return status == 429 || status >= 500;
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }

    /**
     * Number of cached lookups.
     */
    int getCacheSize() {
        return cache.size();
    }
}
