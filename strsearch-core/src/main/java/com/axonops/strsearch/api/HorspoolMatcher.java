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
import com.axonops.strsearch.table.SkipTable;

import java.util.Objects;

/**
 * Boyer-Moore-Horspool exact search.
 *
 * <p>Keeps a single bad-character table keyed on the corpus symbol aligned with the pattern's
 * last position; the shift does not depend on where the mismatch happened. Simpler and often
 * faster than {@link BoyerMooreMatcher} for short patterns, at the cost of a worse worst case.
 *
 * <p>See http://www-igm.univ-mlv.fr/~lecroq/string/node18.html
 *
 * <p>Thread-safe: immutable after construction.
 *
 * @param <T> symbol type
 * @since 1.0.0
 */
public final class HorspoolMatcher<T> extends AbstractSequenceMatcher<T> {

    private final SkipTable<T> skip;

    private HorspoolMatcher(SymbolSequence<T> pattern, Alphabet<T> alphabet, SearchConfig config) {
        super(pattern, config);
        Objects.requireNonNull(alphabet, "alphabet cannot be null");

        // Absent symbols shift by the whole pattern; the last symbol is left out
        this.skip = config.skipTableStrategy().create(alphabet, patternLength, patternLength, config.maxArrayAlphabetSize());
        for (int i = 0; i < patternLength - 1; i++) {
            skip.insert(this.pattern.symbolAt(i), patternLength - 1 - i);
        }

        config.tableListener().onSkipTableBuilt(Algorithm.BOYER_MOORE_HORSPOOL, SkipTable.unmodifiable(skip));
    }

    public static <T> HorspoolMatcher<T> compile(SymbolSequence<T> pattern) {
        return compile(pattern, Alphabet.unbounded(), SearchConfig.DEFAULT);
    }

    public static <T> HorspoolMatcher<T> compile(SymbolSequence<T> pattern, Alphabet<T> alphabet) {
        return compile(pattern, alphabet, SearchConfig.DEFAULT);
    }

    /**
     * Builds the skip table for {@code pattern}.
     *
     * @throws IllegalArgumentException if the configured skip table strategy cannot serve {@code alphabet}
     */
    public static <T> HorspoolMatcher<T> compile(SymbolSequence<T> pattern, Alphabet<T> alphabet, SearchConfig config) {
        long startNanos = System.nanoTime();
        return built(new HorspoolMatcher<>(pattern, alphabet, config), startNanos);
    }

    @Override
    protected int doSearch(SymbolSequence<T> corpus, int corpusLength) {
        final int last = patternLength - 1;
        final int lastPos = corpusLength - patternLength;
        int pos = 0;
        while (pos <= lastPos) {
            int j = last;
            while (Objects.equals(pattern.symbolAt(j), corpus.symbolAt(pos + j))) {
                if (j == 0) {
                    return pos;
                }
                j--;
            }
            pos += skip.lookup(corpus.symbolAt(pos + last));
        }
        return corpusLength;
    }

    @Override
    public Algorithm algorithm() {
        return Algorithm.BOYER_MOORE_HORSPOOL;
    }

    SkipTable<T> skipTable() {
        return skip;
    }
}
