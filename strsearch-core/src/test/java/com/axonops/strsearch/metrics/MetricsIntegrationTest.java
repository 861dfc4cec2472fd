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

import com.axonops.strsearch.api.Algorithm;
import com.axonops.strsearch.api.SequenceMatcher;
import com.axonops.strsearch.api.StringSearch;
import com.axonops.strsearch.api.SymbolSequence;
import com.axonops.strsearch.config.SearchConfig;
import com.axonops.strsearch.test.TestUtils;
import com.codahale.metrics.Counter;
import com.codahale.metrics.MetricRegistry;
import com.codahale.metrics.Timer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

/**
 * Integration tests verifying metrics are actually collected during operations.
 *
 * Builds matchers with a Dropwizard-backed config, then performs real searches
 * and verifies the registry is updated correctly.
 */
class MetricsIntegrationTest {

    private MetricRegistry registry;
    private SearchConfig config;

    @BeforeEach
    void setup() {
        registry = new MetricRegistry();
        config = TestUtils.metricsConfig(registry, "test.search");
    }

    @Test
    void testMatcherBuildMetrics() {
        StringSearch.compile("test", Algorithm.BOYER_MOORE, config);

        Counter built = registry.counter("test.search.matchers.built.total.count");
        Timer buildTime = registry.timer("test.search.matchers.build.latency");
        assertThat(built.getCount()).isEqualTo(1);
        assertThat(buildTime.getCount()).isEqualTo(1);

        // Every algorithm reports builds
        StringSearch.compile("test", Algorithm.BOYER_MOORE_HORSPOOL, config);
        StringSearch.compile("test", Algorithm.KNUTH_MORRIS_PRATT, config);

        assertThat(built.getCount()).isEqualTo(3);
        assertThat(buildTime.getCount()).isEqualTo(3);
    }

    @Test
    void testSearchHitMissMetrics() {
        SequenceMatcher<Character> matcher = StringSearch.compile("needle", Algorithm.KNUTH_MORRIS_PRATT, config);

        matcher.search(SymbolSequence.of("haystack with a needle"));
        matcher.search(SymbolSequence.of("haystack"));

        assertThat(registry.counter("test.search.search.operations.total.count").getCount()).isEqualTo(2);
        assertThat(registry.counter("test.search.search.matches.total.count").getCount()).isEqualTo(1);
        assertThat(registry.counter("test.search.search.misses.total.count").getCount()).isEqualTo(1);

        Timer latency = registry.timer("test.search.search.latency");
        assertThat(latency.getCount()).isEqualTo(2);
    }

    @Test
    void testEmptyPatternCountsAsMatch() {
        SequenceMatcher<Character> matcher = StringSearch.compile("", Algorithm.BOYER_MOORE, config);

        assertThat(matcher.search(SymbolSequence.of(""))).isEqualTo(0);

        assertThat(registry.counter("test.search.search.matches.total.count").getCount()).isEqualTo(1);
        assertThat(registry.counter("test.search.search.misses.total.count").getCount()).isEqualTo(0);
    }

    @Test
    void testShortCorpusCountsAsMiss() {
        SequenceMatcher<Character> matcher = StringSearch.compile("AAAA", Algorithm.BOYER_MOORE_HORSPOOL, config);

        assertThat(matcher.search(SymbolSequence.of("AAA"))).isEqualTo(3);

        assertThat(registry.counter("test.search.search.misses.total.count").getCount()).isEqualTo(1);
    }

    @Test
    void testAdapterPrefix() {
        DropwizardMetricsAdapter adapter = new DropwizardMetricsAdapter(registry);
        assertThat(adapter.prefix()).isEqualTo(DropwizardMetricsAdapter.DEFAULT_PREFIX);

        adapter.incrementCounter(MetricNames.SEARCH_MATCHES);
        adapter.recordTimer(MetricNames.SEARCH_LATENCY, 1_000);

        assertThat(registry.counter("com.axonops.strsearch.search.matches.total.count").getCount()).isEqualTo(1);
        assertThat(registry.timer("com.axonops.strsearch.search.latency").getCount()).isEqualTo(1);
    }

    @Test
    void testNoOpRegistryAcceptsEverything() {
        SearchMetricsRegistry noop = NoOpMetricsRegistry.INSTANCE;

        assertThatCode(() -> {
            noop.incrementCounter("a");
            noop.recordTimer("b", 100);
        }).doesNotThrowAnyException();
    }
}
