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

package com.axonops.strsearch.dropwizard;

import com.axonops.strsearch.config.SearchConfig;
import com.axonops.strsearch.metrics.DropwizardMetricsAdapter;
import com.codahale.metrics.MetricRegistry;
import com.codahale.metrics.jmx.JmxReporter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Convenience factory for SearchConfig with Dropwizard Metrics integration.
 *
 * <p>Provides easy setup for applications using Dropwizard Metrics, including automatic JMX
 * exposure.
 *
 * <p><strong>Usage Examples:</strong>
 * <pre>{@code
 * // Framework-provided registry:
 * SearchConfig config = SearchMetricsConfig.withMetrics(frameworkRegistry, "com.myapp.search");
 *
 * // Standalone app:
 * MetricRegistry registry = new MetricRegistry();
 * SearchConfig config = SearchMetricsConfig.withMetrics(registry);
 *
 * SequenceMatcher<Byte> matcher = StringSearch.compile(needle, Algorithm.BOYER_MOORE, config);
 * }</pre>
 *
 * <p><strong>JMX Exposure:</strong> a single JmxReporter is started for the first registry
 * seen (unless disabled), so all strsearch metrics are visible via JMX.
 *
 * @since 1.0.0
 */
public final class SearchMetricsConfig {
    private static final Logger logger = LoggerFactory.getLogger(SearchMetricsConfig.class);
    private static volatile JmxReporter jmxReporter;

    private SearchMetricsConfig() {
        // Utility class
    }

    /**
     * Creates SearchConfig with Dropwizard Metrics integration and automatic JMX.
     *
     * @param registry the Dropwizard MetricRegistry to use
     * @param metricPrefix the metric namespace prefix
     * @return configured SearchConfig with metrics enabled
     */
    public static SearchConfig withMetrics(MetricRegistry registry, String metricPrefix) {
        return withMetrics(registry, metricPrefix, true);
    }

    /**
     * Creates SearchConfig with Dropwizard Metrics integration.
     *
     * @param registry the Dropwizard MetricRegistry to use
     * @param metricPrefix the metric namespace prefix
     * @param enableJmx whether to automatically set up JMX exposure
     * @return configured SearchConfig with metrics enabled
     */
    public static SearchConfig withMetrics(MetricRegistry registry, String metricPrefix, boolean enableJmx) {
        Objects.requireNonNull(registry, "registry cannot be null");
        Objects.requireNonNull(metricPrefix, "metricPrefix cannot be null");

        if (enableJmx) {
            ensureJmxReporter(registry);
        }

        return SearchConfig.builder()
            .metricsRegistry(new DropwizardMetricsAdapter(registry, metricPrefix))
            .build();
    }

    /**
     * Creates SearchConfig with Dropwizard Metrics using the default prefix
     * {@code "com.axonops.strsearch"}.
     *
     * @param registry the Dropwizard MetricRegistry to use
     * @return configured SearchConfig with metrics enabled
     */
    public static SearchConfig withMetrics(MetricRegistry registry) {
        return withMetrics(registry, DropwizardMetricsAdapter.DEFAULT_PREFIX, true);
    }

    /**
     * @return true if a JmxReporter has been started and not yet shut down
     */
    public static boolean isJmxReporterRunning() {
        return jmxReporter != null;
    }

    private static synchronized void ensureJmxReporter(MetricRegistry registry) {
        if (jmxReporter == null) {
            try {
                logger.info("StrSearch: Registering JmxReporter for metrics");
                JmxReporter reporter = JmxReporter.forRegistry(registry).build();
                reporter.start();
                jmxReporter = reporter;
                logger.info("StrSearch: JmxReporter started - metrics available via JMX");
            } catch (RuntimeException e) {
                // Not fatal - registry may already have JMX exposure
                logger.warn("StrSearch: Failed to start JmxReporter (may already be configured)", e);
            }
        }
    }

    /**
     * Stops the JmxReporter started by this class, if any.
     */
    public static synchronized void shutdown() {
        if (jmxReporter != null) {
            logger.info("StrSearch: Stopping JmxReporter");
            jmxReporter.stop();
            jmxReporter = null;
        }
    }
}
