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

import com.axonops.strsearch.api.SymbolSequence;

import java.util.Objects;

/**
 * Prefix function of a symbol sequence.
 *
 * <p>{@code prefix[i]} is the length of the longest proper prefix of {@code s[0..i]} that is
 * also a suffix of it. Boyer-Moore derives its good-suffix table from the prefix function of
 * the pattern and of the reversed pattern.
 *
 * @since 1.0.0
 */
public final class PrefixFunction {

    private PrefixFunction() {
        // Utility class
    }

    /**
     * @param sequence non-empty sequence
     * @return prefix function, same length as {@code sequence}
     * @throws IllegalArgumentException if {@code sequence} is empty
     */
    public static <T> int[] compute(SymbolSequence<T> sequence) {
        Objects.requireNonNull(sequence, "sequence cannot be null");
        int count = sequence.length();
        if (count == 0) {
            throw new IllegalArgumentException("prefix function of an empty sequence is undefined");
        }

        int[] prefix = new int[count];
        int k = 0;
        for (int i = 1; i < count; i++) {
            T current = sequence.symbolAt(i);
            while (k > 0 && !Objects.equals(sequence.symbolAt(k), current)) {
                k = prefix[k - 1];
            }
            if (Objects.equals(sequence.symbolAt(k), current)) {
                k++;
            }
            prefix[i] = k;
        }
        return prefix;
    }
}
