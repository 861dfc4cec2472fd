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

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * A finite, randomly-indexable sequence of symbols.
 *
 * <p>Both patterns and corpora are supplied as symbol sequences. Positions reported by
 * matchers are relative to the sequence passed in, so a view created with
 * {@link #of(byte[], int, int)} yields offsets from the start of the view.
 *
 * <p>Implementations returned by the factories here are thin wrappers and do not copy;
 * use {@link #copyOf(SymbolSequence)} for an immutable snapshot.
 *
 * @param <T> symbol type
 * @since 1.0.0
 */
public interface SymbolSequence<T> {

    /**
     * @return number of symbols
     */
    int length();

    /**
     * Returns the symbol at {@code index}. Callers keep {@code index} within
     * {@code [0, length())}; wrappers do not re-check it.
     *
     * @param index zero-based position
     * @return symbol at that position
     */
    T symbolAt(int index);

    default boolean isEmpty() {
        return length() == 0;
    }

    static SymbolSequence<Byte> of(byte[] bytes) {
        Objects.requireNonNull(bytes, "bytes cannot be null");
        return of(bytes, 0, bytes.length);
    }

    /**
     * View over {@code bytes[offset, offset + length)}.
     *
     * @throws IndexOutOfBoundsException if the range does not fit the array
     */
    static SymbolSequence<Byte> of(byte[] bytes, int offset, int length) {
        Objects.requireNonNull(bytes, "bytes cannot be null");
        Objects.checkFromIndexSize(offset, length, bytes.length);
        return new SymbolSequence<>() {
            @Override
            public int length() {
                return length;
            }

            @Override
            public Byte symbolAt(int index) {
                return bytes[offset + index];
            }
        };
    }

    static SymbolSequence<Character> of(CharSequence chars) {
        Objects.requireNonNull(chars, "chars cannot be null");
        return new SymbolSequence<>() {
            @Override
            public int length() {
                return chars.length();
            }

            @Override
            public Character symbolAt(int index) {
                return chars.charAt(index);
            }
        };
    }

    /**
     * Wraps a list. The list should offer constant-time {@link List#get(int)}.
     */
    static <T> SymbolSequence<T> of(List<T> symbols) {
        Objects.requireNonNull(symbols, "symbols cannot be null");
        return new SymbolSequence<>() {
            @Override
            public int length() {
                return symbols.size();
            }

            @Override
            public T symbolAt(int index) {
                return symbols.get(index);
            }
        };
    }

    @SafeVarargs
    static <T> SymbolSequence<T> of(T... symbols) {
        Objects.requireNonNull(symbols, "symbols cannot be null");
        return of(Arrays.asList(symbols));
    }

    /**
     * Immutable snapshot of {@code source}. Later changes to the array or list backing
     * {@code source} are not visible through the copy.
     */
    static <T> SymbolSequence<T> copyOf(SymbolSequence<T> source) {
        Objects.requireNonNull(source, "source cannot be null");
        int length = source.length();
        Object[] symbols = new Object[length];
        for (int i = 0; i < length; i++) {
            symbols[i] = source.symbolAt(i);
        }
        return new SymbolSequence<>() {
            @Override
            public int length() {
                return symbols.length;
            }

            @Override
            @SuppressWarnings("unchecked")
            public T symbolAt(int index) {
                return (T) symbols[index];
            }
        };
    }

    /**
     * Reversed view of {@code source}.
     */
    static <T> SymbolSequence<T> reversed(SymbolSequence<T> source) {
        Objects.requireNonNull(source, "source cannot be null");
        return new SymbolSequence<>() {
            @Override
            public int length() {
                return source.length();
            }

            @Override
            public T symbolAt(int index) {
                return source.symbolAt(source.length() - 1 - index);
            }
        };
    }
}
