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

import java.util.Objects;

/**
 * Knuth-Morris-Pratt exact search.
 *
 * <p>Precomputes a failure table and scans the corpus left to right. After a mismatch the
 * failure table says how much of the current partial match is still usable, so no corpus
 * symbol is compared again once it has been matched: search time is linear in the corpus
 * length.
 *
 * <p>Needs only equality, so the alphabet is ignored.
 *
 * <p>Thread-safe: immutable after construction.
 *
 * @param <T> symbol type
 * @since 1.0.0
 */
public final class KmpMatcher<T> extends AbstractSequenceMatcher<T> {

    private final int[] failure;

    private KmpMatcher(SymbolSequence<T> pattern, SearchConfig config) {
        super(pattern, config);
        this.failure = buildFailureTable(this.pattern);

        config.tableListener().onFailureTableBuilt(failure.clone());
    }

    public static <T> KmpMatcher<T> compile(SymbolSequence<T> pattern) {
        return compile(pattern, SearchConfig.DEFAULT);
    }

    public static <T> KmpMatcher<T> compile(SymbolSequence<T> pattern, SearchConfig config) {
        long startNanos = System.nanoTime();
        return built(new KmpMatcher<>(pattern, config), startNanos);
    }

    /**
     * Overload matching {@link Algorithm#compile}; {@code alphabet} is not needed.
     */
    public static <T> KmpMatcher<T> compile(SymbolSequence<T> pattern, Alphabet<T> alphabet, SearchConfig config) {
        Objects.requireNonNull(alphabet, "alphabet cannot be null");
        return compile(pattern, config);
    }

    @Override
    protected int doSearch(SymbolSequence<T> corpus, int corpusLength) {
        // idx stays in [0, m), matchStart in [0, n - m + 1]
        final int lastMatch = corpusLength - patternLength;
        int idx = 0;
        int matchStart = 0;
        while (matchStart <= lastMatch) {
            while (Objects.equals(pattern.symbolAt(idx), corpus.symbolAt(matchStart + idx))) {
                if (++idx == patternLength) {
                    return matchStart;
                }
            }
            matchStart += idx - failure[idx];
            idx = failure[idx] >= 0 ? failure[idx] : 0;
        }
        return corpusLength;
    }

    /**
     * {@code failure[i]} is the length of the longest proper prefix of the first {@code i}
     * symbols that is also their suffix; {@code failure[0]} is -1.
     */
    static <T> int[] buildFailureTable(SymbolSequence<T> pattern) {
        final int count = pattern.length();
        int[] failure = new int[count + 1];
        failure[0] = -1;
        for (int i = 1; i <= count; i++) {
            T previous = pattern.symbolAt(i - 1);
            int j = failure[i - 1];
            while (j >= 0 && !Objects.equals(pattern.symbolAt(j), previous)) {
                j = failure[j];
            }
            failure[i] = j + 1;
        }
        return failure;
    }

    @Override
    public Algorithm algorithm() {
        return Algorithm.KNUTH_MORRIS_PRATT;
    }

    int[] failureTable() {
        return failure.clone();
    }
}
