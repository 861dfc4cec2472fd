/*
 * Copyright 2025 AxonOps
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

package com.axonops.strsearch.metrics;

/**
 * Metric name constants for strsearch instrumentation.
 *
 * <p>All names are relative; {@link DropwizardMetricsAdapter} prepends its prefix.
 *
 * <h2>Matcher construction</h2>
 *
 * <p>Building a matcher derives its tables from the pattern (skip table, suffix table or
 * failure table). Construction is linear in the pattern length and is meant to happen once
 * per pattern, so a high build count relative to searches usually means callers use the
 * one-shot functions where a reusable matcher would do.
 *
 * <h2>Searches</h2>
 *
 * <p>Every {@code search} call records its latency and whether the pattern was found.
 * {@code matches + misses == operations} always holds.
 *
 * @since 1.0.0
 */
public final class MetricNames {

    private MetricNames() {
        // Constants only
    }

    /**
     * Total matchers built since startup (all algorithms).
     *
     * <p>Type: Counter
     */
    public static final String MATCHERS_BUILT = "matchers.built.total.count";

    /**
     * Matcher table construction latency.
     *
     * <p>Type: Timer (nanoseconds)
     */
    public static final String MATCHERS_BUILD_LATENCY = "matchers.build.latency";

    /**
     * Total search calls across all matchers.
     *
     * <p>Type: Counter
     */
    public static final String SEARCH_OPERATIONS = "search.operations.total.count";

    /**
     * Search latency, from entry to result.
     *
     * <p>Type: Timer (nanoseconds)
     */
    public static final String SEARCH_LATENCY = "search.latency";

    /**
     * Searches that found the pattern (including empty patterns).
     *
     * <p>Type: Counter
     */
    public static final String SEARCH_MATCHES = "search.matches.total.count";

    /**
     * Searches that returned the not-found position.
     *
     * <p>Type: Counter
     */
    public static final String SEARCH_MISSES = "search.misses.total.count";
}
