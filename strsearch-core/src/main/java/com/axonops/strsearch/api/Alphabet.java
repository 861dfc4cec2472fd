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

import java.util.Objects;
import java.util.function.ToIntFunction;

/**
 * Describes what a matcher may assume about a symbol type.
 *
 * <p>Every symbol type supports equality ({@link Objects#equals}). A <em>bounded</em> alphabet
 * additionally maps each symbol to a small unsigned index in {@code [0, size())}, which lets
 * skip tables use a dense array instead of a hash map (see
 * {@link com.axonops.strsearch.table.SkipTableStrategy}).
 *
 * <p>Example:
 * <pre>{@code
 * SequenceMatcher<Byte> m = BoyerMooreMatcher.compile(SymbolSequence.of(needle), Alphabet.BYTES);
 * }</pre>
 *
 * @param <T> symbol type
 * @since 1.0.0
 */
public interface Alphabet<T> {

    /** Unsigned bytes, 256 symbols. */
    Alphabet<Byte> BYTES = bounded(256, b -> b & 0xFF);

    /** UTF-16 code units, 65536 symbols. */
    Alphabet<Character> CHARS = bounded(65536, c -> c);

    /**
     * @return true if {@link #indexOf(Object)} is defined for every symbol
     */
    boolean isBounded();

    /**
     * @return number of distinct indexes, or 0 for an unbounded alphabet
     */
    int size();

    /**
     * Maps a symbol to its unsigned index.
     *
     * @throws UnsupportedOperationException for an unbounded alphabet
     */
    int indexOf(T symbol);

    /**
     * Alphabet for any symbol type with {@code equals}/{@code hashCode}; skip tables fall back
     * to hashing.
     */
    @SuppressWarnings("unchecked")
    static <T> Alphabet<T> unbounded() {
        return (Alphabet<T>) UnboundedAlphabet.INSTANCE;
    }

    /**
     * Bounded alphabet of {@code size} symbols indexed by {@code index}. The function must
     * return values in {@code [0, size)} for every symbol that can occur.
     */
    static <T> Alphabet<T> bounded(int size, ToIntFunction<? super T> index) {
        if (size <= 0) {
            throw new IllegalArgumentException("alphabet size must be positive: " + size);
        }
        Objects.requireNonNull(index, "index cannot be null");
        return new Alphabet<>() {
            @Override
            public boolean isBounded() {
                return true;
            }

            @Override
            public int size() {
                return size;
            }

            @Override
            public int indexOf(T symbol) {
                return index.applyAsInt(symbol);
            }

            @Override
            public String toString() {
                return "Alphabet[bounded, size=" + size + "]";
            }
        };
    }

    /**
     * Bounded alphabet over the constants of an enum, indexed by ordinal.
     */
    static <E extends Enum<E>> Alphabet<E> ofEnum(Class<E> type) {
        Objects.requireNonNull(type, "type cannot be null");
        return bounded(type.getEnumConstants().length, Enum::ordinal);
    }
}
