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

/**
 * A pattern prepared for exact substring search.
 *
 * <p>Built once from a pattern (see {@link Algorithm#compile}), then applied to any number of
 * corpora. Implementations are immutable: tables are derived during construction and never
 * touched again, so one matcher can serve concurrent searches from many threads.
 *
 * <p>{@link #search} returns the leftmost position at which the pattern starts, or
 * {@code corpus.length()} (one past the end) when it does not occur. An empty pattern matches
 * at position 0 of every corpus.
 *
 * <pre>{@code
 * SequenceMatcher<Character> m = KmpMatcher.compile(SymbolSequence.of("ABABCABAB"));
 * int pos = m.search(SymbolSequence.of("ABABDABACDABABCABAB")); // 10
 * }</pre>
 *
 * @param <T> symbol type
 * @since 1.0.0
 */
public interface SequenceMatcher<T> {

    /**
     * Searches {@code corpus} for the pattern this matcher was built from.
     *
     * @param corpus sequence to search, borrowed for the duration of the call
     * @return leftmost match start, or {@code corpus.length()} if not found
     */
    int search(SymbolSequence<T> corpus);

    /**
     * @return true if the pattern occurs in {@code corpus}
     */
    default boolean contains(SymbolSequence<T> corpus) {
        return patternLength() == 0 || search(corpus) != corpus.length();
    }

    int patternLength();

    Algorithm algorithm();
}
