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
import com.axonops.strsearch.table.PrefixFunction;
import com.axonops.strsearch.table.SkipTable;

import java.util.Arrays;
import java.util.Objects;

/**
 * Boyer-Moore exact search.
 *
 * <p>Uses two tables: a bad-character table telling how far to skip when the mismatching
 * corpus symbol occurs elsewhere in the pattern (or not at all), and a good-suffix table
 * telling how far to skip given the suffix already matched. Each mismatch advances by the
 * larger of the two safe shifts.
 *
 * <p>References:
 * <ul>
 *   <li>http://www.cs.utexas.edu/users/moore/best-ideas/string-searching/</li>
 *   <li>http://www.cs.ucdavis.edu/~gusfield/cs224f09/bnotes.pdf</li>
 * </ul>
 *
 * <p>Thread-safe: immutable after construction.
 *
 * @param <T> symbol type
 * @since 1.0.0
 */
public final class BoyerMooreMatcher<T> extends AbstractSequenceMatcher<T> {

    private final SkipTable<T> skip;
    private final int[] suffix;

    private BoyerMooreMatcher(SymbolSequence<T> pattern, Alphabet<T> alphabet, SearchConfig config) {
        super(pattern, config);
        Objects.requireNonNull(alphabet, "alphabet cannot be null");

        this.skip = config.skipTableStrategy().create(alphabet, patternLength, -1, config.maxArrayAlphabetSize());
        for (int i = 0; i < patternLength; i++) {
            skip.insert(this.pattern.symbolAt(i), i);
        }
        this.suffix = buildSuffixTable(this.pattern);

        config.tableListener().onSkipTableBuilt(Algorithm.BOYER_MOORE, SkipTable.unmodifiable(skip));
        config.tableListener().onSuffixTableBuilt(suffix.clone());
    }

    public static <T> BoyerMooreMatcher<T> compile(SymbolSequence<T> pattern) {
        return compile(pattern, Alphabet.unbounded(), SearchConfig.DEFAULT);
    }

    public static <T> BoyerMooreMatcher<T> compile(SymbolSequence<T> pattern, Alphabet<T> alphabet) {
        return compile(pattern, alphabet, SearchConfig.DEFAULT);
    }

    /**
     * Builds the bad-character and good-suffix tables for {@code pattern}.
     *
     * @param pattern pattern to search for (copied)
     * @param alphabet symbol capability of the pattern
     * @param config build configuration
     * @return immutable matcher
     * @throws IllegalArgumentException if the configured skip table strategy cannot serve {@code alphabet}
     */
    public static <T> BoyerMooreMatcher<T> compile(SymbolSequence<T> pattern, Alphabet<T> alphabet, SearchConfig config) {
        long startNanos = System.nanoTime();
        return built(new BoyerMooreMatcher<>(pattern, alphabet, config), startNanos);
    }

    @Override
    protected int doSearch(SymbolSequence<T> corpus, int corpusLength) {
        final int lastPos = corpusLength - patternLength;
        int pos = 0;
        while (pos <= lastPos) {
            int j = patternLength;
            while (Objects.equals(pattern.symbolAt(j - 1), corpus.symbolAt(pos + j - 1))) {
                j--;
                if (j == 0) {
                    return pos;
                }
            }

            // Mismatch at pattern index j - 1: take the larger of the bad-character and good-suffix shifts
            int k = skip.lookup(corpus.symbolAt(pos + j - 1));
            int shift = j - k - 1;
            if (k < j && shift > suffix[j]) {
                pos += shift;
            } else {
                pos += suffix[j];
            }
        }
        return corpusLength;
    }

    /**
     * Entry {@code i} is the shift for a matched suffix of length {@code m - i}.
     *
     * <p>Every entry starts at the pattern's period. A border of length {@code l} of the first
     * {@code i + 1} reversed symbols means the suffix of length {@code l} reoccurs {@code i - l + 1}
     * positions to the left; the minimum over all such {@code i} wins.
     */
    static <T> int[] buildSuffixTable(SymbolSequence<T> pattern) {
        final int count = pattern.length();
        int[] suffix = new int[count + 1];
        if (count == 0) {
            return suffix;
        }

        int[] prefix = PrefixFunction.compute(pattern);
        int[] prefixReversed = PrefixFunction.compute(SymbolSequence.reversed(pattern));

        Arrays.fill(suffix, count - prefix[count - 1]);
        for (int i = 0; i < count; i++) {
            int j = count - prefixReversed[i];
            int k = i - prefixReversed[i] + 1;
            if (suffix[j] > k) {
                suffix[j] = k;
            }
        }
        return suffix;
    }

    @Override
    public Algorithm algorithm() {
        return Algorithm.BOYER_MOORE;
    }

    SkipTable<T> skipTable() {
        return skip;
    }

    int[] suffixTable() {
        return suffix.clone();
    }
}
