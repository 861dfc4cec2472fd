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
 * Main entry point for one-shot searches.
 *
 * <p>Each one-shot call builds a transient matcher and discards it. When the same pattern is
 * searched for repeatedly, keep the matcher from {@link #compile} instead so its tables are
 * built once.
 *
 * <p>Thread-safe: All methods can be called concurrently from multiple threads.
 *
 * @since 1.0.0
 */
public final class StringSearch {

    private StringSearch() {
        // Utility class
    }

    // ========== Reusable Matchers ==========

    public static SequenceMatcher<Character> compile(String pattern, Algorithm algorithm) {
        return compile(pattern, algorithm, SearchConfig.DEFAULT);
    }

    /**
     * Builds a matcher for a string pattern. Chars use {@link Alphabet#CHARS}, so the skip
     * table is an array only if {@code config} allows 65536-symbol arrays.
     */
    public static SequenceMatcher<Character> compile(String pattern, Algorithm algorithm, SearchConfig config) {
        Objects.requireNonNull(pattern, "pattern cannot be null");
        Objects.requireNonNull(algorithm, "algorithm cannot be null");
        return algorithm.compile(SymbolSequence.of(pattern), Alphabet.CHARS, config);
    }

    public static SequenceMatcher<Byte> compile(byte[] pattern, Algorithm algorithm) {
        return compile(pattern, algorithm, SearchConfig.DEFAULT);
    }

    public static SequenceMatcher<Byte> compile(byte[] pattern, Algorithm algorithm, SearchConfig config) {
        Objects.requireNonNull(pattern, "pattern cannot be null");
        Objects.requireNonNull(algorithm, "algorithm cannot be null");
        return algorithm.compile(SymbolSequence.of(pattern), Alphabet.BYTES, config);
    }

    // ========== One-Shot Searches ==========

    /**
     * Finds the leftmost occurrence of {@code pattern} in {@code corpus}.
     *
     * @return match start, or {@code corpus.length()} if not found
     */
    public static int indexOf(String corpus, String pattern, Algorithm algorithm) {
        Objects.requireNonNull(corpus, "corpus cannot be null");
        return compile(pattern, algorithm).search(SymbolSequence.of(corpus));
    }

    /**
     * Finds the leftmost occurrence of {@code pattern} in {@code corpus}.
     *
     * @return match start, or {@code corpus.length} if not found
     */
    public static int indexOf(byte[] corpus, byte[] pattern, Algorithm algorithm) {
        Objects.requireNonNull(corpus, "corpus cannot be null");
        return compile(pattern, algorithm).search(SymbolSequence.of(corpus));
    }

    /**
     * Generic one-shot search.
     *
     * @param corpus sequence to search
     * @param pattern sequence to search for
     * @param alphabet symbol capability of both sequences
     * @param algorithm algorithm to use
     * @return match start, or {@code corpus.length()} if not found
     */
    public static <T> int search(SymbolSequence<T> corpus, SymbolSequence<T> pattern, Alphabet<T> alphabet,
                                 Algorithm algorithm) {
        Objects.requireNonNull(corpus, "corpus cannot be null");
        Objects.requireNonNull(algorithm, "algorithm cannot be null");
        return algorithm.compile(pattern, alphabet, SearchConfig.DEFAULT).search(corpus);
    }

    public static <T> int boyerMooreSearch(SymbolSequence<T> corpus, SymbolSequence<T> pattern) {
        return BoyerMooreMatcher.compile(pattern).search(corpus);
    }

    public static <T> int boyerMooreHorspoolSearch(SymbolSequence<T> corpus, SymbolSequence<T> pattern) {
        return HorspoolMatcher.compile(pattern).search(corpus);
    }

    public static <T> int knuthMorrisPrattSearch(SymbolSequence<T> corpus, SymbolSequence<T> pattern) {
        return KmpMatcher.compile(pattern).search(corpus);
    }
}
