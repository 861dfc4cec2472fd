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

package com.axonops.strsearch.api;

import com.axonops.strsearch.config.SearchConfig;
import com.axonops.strsearch.metrics.MetricNames;
import com.axonops.strsearch.metrics.SearchMetricsRegistry;
import com.axonops.strsearch.util.PatternHasher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Shared boundary handling and instrumentation for the three matchers.
 *
 * <p>{@link #search} settles the trivial cases (empty pattern, corpus shorter than the
 * pattern) and records metrics; subclasses only implement {@link #doSearch} for
 * {@code 0 < patternLength <= corpusLength}.
 */
abstract class AbstractSequenceMatcher<T> implements SequenceMatcher<T> {
    private static final Logger logger = LoggerFactory.getLogger(AbstractSequenceMatcher.class);

    /** Private copy of the caller's pattern. */
    protected final SymbolSequence<T> pattern;
    protected final int patternLength;
    private final SearchMetricsRegistry metrics;

    AbstractSequenceMatcher(SymbolSequence<T> pattern, SearchConfig config) {
        Objects.requireNonNull(pattern, "pattern cannot be null");
        Objects.requireNonNull(config, "config cannot be null");
        this.pattern = SymbolSequence.copyOf(pattern);
        this.patternLength = this.pattern.length();
        this.metrics = config.metricsRegistry();
    }

    @Override
    public final int search(SymbolSequence<T> corpus) {
        Objects.requireNonNull(corpus, "corpus cannot be null");
        long startNanos = System.nanoTime();

        int corpusLength = corpus.length();
        int result;
        if (patternLength == 0) {
            result = 0;
        } else if (corpusLength < patternLength) {
            result = corpusLength;
        } else {
            result = doSearch(corpus, corpusLength);
        }

        metrics.recordTimer(MetricNames.SEARCH_LATENCY, System.nanoTime() - startNanos);
        metrics.incrementCounter(MetricNames.SEARCH_OPERATIONS);
        if (patternLength == 0 || result != corpusLength) {
            metrics.incrementCounter(MetricNames.SEARCH_MATCHES);
        } else {
            metrics.incrementCounter(MetricNames.SEARCH_MISSES);
        }
        return result;
    }

    /**
     * @param corpus corpus with {@code corpusLength >= patternLength > 0}
     * @return leftmost match start, or {@code corpusLength}
     */
    protected abstract int doSearch(SymbolSequence<T> corpus, int corpusLength);

    @Override
    public final int patternLength() {
        return patternLength;
    }

    /**
     * Records construction metrics once the subclass constructor has finished.
     */
    static <M extends AbstractSequenceMatcher<?>> M built(M matcher, long startNanos) {
        long durationNanos = System.nanoTime() - startNanos;
        AbstractSequenceMatcher<?> m = matcher;
        m.metrics.recordTimer(MetricNames.MATCHERS_BUILD_LATENCY, durationNanos);
        m.metrics.incrementCounter(MetricNames.MATCHERS_BUILT);
        logger.trace("StrSearch: {} matcher built - hash: {}, patternLength: {}, timeNs: {}",
            m.algorithm().displayName(), PatternHasher.hash(m.pattern), m.patternLength, durationNanos);
        return matcher;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[patternLength=" + patternLength
            + ", hash=" + PatternHasher.hash(pattern) + "]";
    }
}
