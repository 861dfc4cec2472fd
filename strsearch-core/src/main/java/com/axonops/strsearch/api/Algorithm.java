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

/**
 * Exact search algorithms.
 *
 * <p>All three return identical results for every pattern and corpus; they differ in cost.
 * Boyer-Moore and Horspool skip ahead using a bad-character table and usually examine far
 * fewer corpus symbols than there are, especially for long patterns over large alphabets.
 * Knuth-Morris-Pratt scans left to right and never re-examines a corpus symbol, which gives it
 * the most predictable running time.
 *
 * @since 1.0.0
 */
public enum Algorithm {

    BOYER_MOORE("Boyer-Moore") {
        @Override
        public <T> SequenceMatcher<T> compile(SymbolSequence<T> pattern, Alphabet<T> alphabet, SearchConfig config) {
            return BoyerMooreMatcher.compile(pattern, alphabet, config);
        }
    },

    BOYER_MOORE_HORSPOOL("Boyer-Moore-Horspool") {
        @Override
        public <T> SequenceMatcher<T> compile(SymbolSequence<T> pattern, Alphabet<T> alphabet, SearchConfig config) {
            return HorspoolMatcher.compile(pattern, alphabet, config);
        }
    },

    KNUTH_MORRIS_PRATT("Knuth-Morris-Pratt") {
        @Override
        public <T> SequenceMatcher<T> compile(SymbolSequence<T> pattern, Alphabet<T> alphabet, SearchConfig config) {
            return KmpMatcher.compile(pattern, alphabet, config);
        }
    };

    private final String displayName;

    Algorithm(String displayName) {
        this.displayName = displayName;
    }

    /**
     * Builds a matcher for {@code pattern} using this algorithm.
     *
     * @param pattern pattern to search for, copied by the matcher
     * @param alphabet symbol capability, decides the skip table representation
     * @param config build configuration
     * @return immutable matcher
     */
    public abstract <T> SequenceMatcher<T> compile(SymbolSequence<T> pattern, Alphabet<T> alphabet, SearchConfig config);

    public String displayName() {
        return displayName;
    }
}
