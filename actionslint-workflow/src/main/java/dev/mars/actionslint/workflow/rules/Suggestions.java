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

import org.apache.commons.lang3.StringUtils;

import java.util.Collection;
import java.util.Locale;
import java.util.Optional;

/**
 * Finds the closest known name for a misspelt one.
 *
 * <p>Similarity is {@code 1 - levenshtein(a, b) / max(|a|, |b|)}. The best candidate is
 * returned when its similarity reaches the threshold; ties go to the earlier candidate.</p>
 */
public final class Suggestions {

    private Suggestions() {
    }

    @SuppressWarnings("deprecation")
    public static double similarity(String a, String b) {
        int longest = Math.max(a.length(), b.length());
        if (longest == 0) {
            return 1.0;
        }
        return 1.0 - (double) StringUtils.getLevenshteinDistance(a, b) / longest;
    }

    public static Optional<String> closest(String value, Collection<String> candidates, double threshold) {
        String best = null;
        double bestScore = -1;
        for (String candidate : candidates) {
            if (candidate.equals(value)) {
                continue;
            }
            double score = similarity(value, candidate);
            if (score > bestScore) {
                best = candidate;
                bestScore = score;
            }
        }
        return best != null && bestScore >= threshold ? Optional.of(best) : Optional.empty();
    }

    /**
     * Like {@link #closest} but compares case-insensitively and returns the candidate as written.
     */
    public static Optional<String> closestIgnoreCase(String value, Collection<String> candidates, double threshold) {
        String best = null;
        double bestScore = -1;
        String lower = value.toLowerCase(Locale.ROOT);
        for (String candidate : candidates) {
            double score = similarity(lower, candidate.toLowerCase(Locale.ROOT));
            if (score > bestScore) {
                best = candidate;
                bestScore = score;
            }
        }
        return best != null && bestScore >= threshold && !best.equals(value) ? Optional.of(best) : Optional.empty();
    }
}
