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

import java.util.Arrays;
import java.util.BitSet;
import java.util.Objects;

/**
 * Skip table backed by a dense {@code int[]} indexed by the symbol's unsigned index.
 *
 * <p>Lookup is a single array read, with no hashing or boxing of the stored value. Requires a
 * bounded {@link Alphabet}; memory is {@code 4 * alphabet.size()} bytes regardless of the
 * pattern, which is why {@link SkipTableStrategy#AUTO} only picks it for small alphabets.
 *
 * @param <T> symbol type
 * @since 1.0.0
 */
public final class ArraySkipTable<T> implements SkipTable<T> {

    private final Alphabet<T> alphabet;
    private final int[] skip;
    private final BitSet occupied;
    private final int defaultValue;

    /**
     * @throws IllegalArgumentException if {@code alphabet} is unbounded
     */
    public ArraySkipTable(Alphabet<T> alphabet, int defaultValue) {
        this.alphabet = Objects.requireNonNull(alphabet, "alphabet cannot be null");
        if (!alphabet.isBounded()) {
            throw new IllegalArgumentException("ArraySkipTable requires a bounded alphabet, got " + alphabet);
        }
        this.defaultValue = defaultValue;
        this.skip = new int[alphabet.size()];
        this.occupied = new BitSet(skip.length);
        Arrays.fill(skip, defaultValue);
    }

    @Override
    public void insert(T symbol, int value) {
        int index = alphabet.indexOf(symbol);
        occupied.set(index);
        skip[index] = value;
    }

    @Override
    public int lookup(T symbol) {
        return skip[alphabet.indexOf(symbol)];
    }

    @Override
    public int defaultValue() {
        return defaultValue;
    }

    @Override
    public int size() {
        return occupied.cardinality();
    }

    @Override
    public String describe() {
        StringBuilder sb = new StringBuilder("ArraySkipTable{default=").append(defaultValue);
        for (int i = 0; i < skip.length; i++) {
            if (skip[i] != defaultValue) {
                sb.append(", ").append(i).append('=').append(skip[i]);
            }
        }
        return sb.append('}').toString();
    }

    @Override
    public String toString() {
        return "ArraySkipTable[alphabetSize=" + skip.length + ", entries=" + size() + "]";
    }
}
