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

package dev.mars.actionslint.config;

import org.junit.jupiter.api.Test;

import java.nio.file.Paths;
import java.time.Duration;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link LintConfiguration}.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
class LintConfigurationTest {

    @Test
    void testDefaults() {
        LintConfiguration config = LintConfiguration.defaults();

        assertFalse(config.isFixEnabled());
        assertEquals(-1, config.getMaxWarnings());
        assertEquals(Paths.get(".github/workflows"), config.getWorkflowsDirectory());
        assertFalse(config.isParallelRules());
        assertEquals(Duration.ofSeconds(30), config.getRuleTimeout());
        assertFalse(config.isMetadataEnabled());
        assertEquals("https://raw.githubusercontent.com", config.getMetadataRawUrl());
        assertEquals("https://api.github.com", config.getMetadataApiUrl());
        assertEquals(Duration.ofSeconds(5), config.getMetadataTimeout());
        assertEquals(2, config.getMetadataRetries());
        assertNull(config.getMetadataToken());
        assertEquals(0.8, config.getSimilarityThreshold(), 1e-9);
    }

    @Test
    void testOverrides() {
        Properties properties = new Properties();
        properties.setProperty(LintConfiguration.FIX_ENABLED, "true");
        properties.setProperty(LintConfiguration.MAX_WARNINGS, "3");
        properties.setProperty(LintConfiguration.RULES_PARALLEL, "true");
        properties.setProperty(LintConfiguration.METADATA_TOKEN, " secret ");
        properties.setProperty(LintConfiguration.SIMILARITY_THRESHOLD, "0.6");

        LintConfiguration config = new LintConfiguration(properties);

        assertTrue(config.isFixEnabled());
        assertEquals(3, config.getMaxWarnings());
        assertTrue(config.isParallelRules());
        assertEquals("secret", config.getMetadataToken());
        assertEquals(0.6, config.getSimilarityThreshold(), 1e-9);
    }

    @Test
    void testInvalidValuesFallBackToDefaults() {
        Properties properties = new Properties();
        properties.setProperty(LintConfiguration.MAX_WARNINGS, "many");
        properties.setProperty(LintConfiguration.RULES_TIMEOUT_MS, "soon");
        properties.setProperty(LintConfiguration.SIMILARITY_THRESHOLD, "1.5");
        properties.setProperty(LintConfiguration.METADATA_RETRIES, "-4");

        LintConfiguration config = new LintConfiguration(properties);

        assertEquals(-1, config.getMaxWarnings());
        assertEquals(Duration.ofSeconds(30), config.getRuleTimeout());
        assertEquals(0.8, config.getSimilarityThreshold(), 1e-9);
        assertEquals(0, config.getMetadataRetries());
    }

    @Test
    void testSetProperty() {
        LintConfiguration config = LintConfiguration.defaults();
        config.setProperty(LintConfiguration.FIX_ENABLED, "true");

        assertTrue(config.isFixEnabled());
        assertEquals("true", config.getProperty(LintConfiguration.FIX_ENABLED));
        assertEquals("fallback", config.getProperty("actionslint.unknown", "fallback"));
    }
}
