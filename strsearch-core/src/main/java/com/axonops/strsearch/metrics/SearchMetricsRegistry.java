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
 * Abstract metrics registry interface for strsearch-java.
 *
 * <p>Allows the library to work with or without Dropwizard Metrics dependency.
 * Implementations can use Dropwizard Metrics, custom metrics systems, or no-op.
 *
 * <p><strong>Metric Types (following Dropwizard patterns):</strong>
 * <ul>
 *   <li><strong>Counter:</strong> Atomic long counter (incrementing values)</li>
 *   <li><strong>Timer:</strong> Measures duration in nanoseconds with histogram</li>
 * </ul>
 *
 * <p><strong>Thread Safety:</strong> All implementations must be thread-safe. A single
 * matcher shared between threads reports every search to the same registry.
 *
 * @since 1.0.0
 */
public interface SearchMetricsRegistry {

    /**
     * Increment a counter by 1.
     *
     * @param name metric name (e.g., "search.operations.total.count")
     */
    void incrementCounter(String name);

    /**
     * Record a timer measurement in nanoseconds.
     *
     * <p>Timers maintain histograms of duration measurements, allowing
     * calculation of percentiles (P50, P99, etc.).
     *
     * @param name metric name (e.g., "search.latency")
     * @param durationNanos duration in nanoseconds
     */
    void recordTimer(String name, long durationNanos);
}
