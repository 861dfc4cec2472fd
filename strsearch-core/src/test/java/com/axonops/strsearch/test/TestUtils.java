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

package com.axonops.strsearch.test;

import com.axonops.strsearch.api.SymbolSequence;
import com.axonops.strsearch.config.SearchConfig;
import com.axonops.strsearch.metrics.DropwizardMetricsAdapter;
import com.axonops.strsearch.table.SkipTableStrategy;
import com.codahale.metrics.MetricRegistry;

import java.util.Objects;
import java.util.Random;

/**
 * Test utilities shared by matcher tests.
 *
 * <p>Provides:
 * <ul>
 *   <li>A brute-force reference search every algorithm must agree with</li>
 *   <li>Config helpers for table strategies and metrics</li>
 *   <li>Deterministic random byte data</li>
 * </ul>
 */
public final class TestUtils {

    private TestUtils() {
    }

    /**
     * Reference implementation: tries every alignment left to right.
     *
     * @return leftmost match start, or {@code corpus.length()} if not found
     */
    public static <T> int naiveSearch(SymbolSequence<T> corpus, SymbolSequence<T> pattern) {
        int n = corpus.length();
        int m = pattern.length();
        for (int pos = 0; pos + m <= n; pos++) {
            int j = 0;
            while (j < m && Objects.equals(corpus.symbolAt(pos + j), pattern.symbolAt(j))) {
                j++;
            }
            if (j == m) {
                return pos;
            }
        }
        return n;
    }

    public static int naiveSearch(String corpus, String pattern) {
        return naiveSearch(SymbolSequence.of(corpus), SymbolSequence.of(pattern));
    }

    public static SearchConfig configWith(SkipTableStrategy strategy) {
        return SearchConfig.builder().skipTableStrategy(strategy).build();
    }

    public static SearchConfig metricsConfig(MetricRegistry registry, String prefix) {
        return SearchConfig.builder()
            .metricsRegistry(new DropwizardMetricsAdapter(registry, prefix))
            .build();
    }

    /**
     * Random bytes drawn from {@code symbols}; a small symbol set makes matches likely.
     */
    public static byte[] randomBytes(Random random, int length, byte[] symbols) {
        byte[] out = new byte[length];
        for (int i = 0; i < length; i++) {
            out[i] = symbols[random.nextInt(symbols.length)];
        }
        return out;
    }
}
