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

package com.axonops.strsearch.table;

import com.axonops.strsearch.api.Alphabet;

import java.util.Objects;

/**
 * How a matcher backs its bad-character table.
 *
 * <p>The strategy is resolved once, when the matcher is built; the search loop only ever
 * sees the resulting {@link SkipTable}.
 *
 * @since 1.0.0
 */
public enum SkipTableStrategy {

    /** Dense array; requires a bounded alphabet no larger than the configured limit. */
    ARRAY,

    /** Hash map; works for any symbol type. */
    MAP,

    /** Array when the alphabet is bounded and small enough, map otherwise. */
    AUTO;

    /**
     * Creates an empty table for a pattern of {@code patternLength} symbols.
     *
     * @param alphabet symbol capability of the pattern
     * @param patternLength pattern length, used to presize map tables
     * @param defaultValue value returned for symbols never inserted
     * @param maxArrayAlphabetSize largest alphabet that may be backed by an array
     * @throws IllegalArgumentException if {@link #ARRAY} is requested for an unbounded alphabet or
     *     one larger than {@code maxArrayAlphabetSize}
     */
    public <T> SkipTable<T> create(Alphabet<T> alphabet, int patternLength, int defaultValue,
                                   int maxArrayAlphabetSize) {
        Objects.requireNonNull(alphabet, "alphabet cannot be null");
        switch (this) {
            case ARRAY:
                if (!fitsArray(alphabet, maxArrayAlphabetSize)) {
                    throw new IllegalArgumentException("StrSearch: ARRAY skip table needs a bounded alphabet of at most "
                        + maxArrayAlphabetSize + " symbols, got " + alphabet);
                }
                return new ArraySkipTable<>(alphabet, defaultValue);
            case MAP:
                return new MapSkipTable<>(patternLength, defaultValue);
            default:
                return fitsArray(alphabet, maxArrayAlphabetSize)
                    ? new ArraySkipTable<>(alphabet, defaultValue)
                    : new MapSkipTable<>(patternLength, defaultValue);
        }
    }

    private static boolean fitsArray(Alphabet<?> alphabet, int maxArrayAlphabetSize) {
        return alphabet.isBounded() && alphabet.size() <= maxArrayAlphabetSize;
    }
}
