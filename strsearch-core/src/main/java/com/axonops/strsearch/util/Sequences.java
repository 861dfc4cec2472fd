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

package com.axonops.strsearch.util;

import com.axonops.strsearch.api.SymbolSequence;

import java.util.Objects;
import java.util.function.Predicate;

/**
 * "None of" tests over sequences.
 *
 * <p>Every method returns {@code true} for an empty sequence. Handy for validating a pattern
 * before building a matcher, e.g. rejecting patterns that contain a separator symbol:
 * <pre>{@code
 * if (!Sequences.noneOfEqual(pattern, (byte) '\n')) {
 *     throw new IllegalArgumentException("pattern spans lines");
 * }
 * }</pre>
 *
 * @since 1.0.0
 */
public final class Sequences {

    private Sequences() {
        // Utility class
    }

    /**
     * @return true if no element satisfies {@code predicate}
     */
    public static <T> boolean noneOf(Iterable<T> elements, Predicate<? super T> predicate) {
        Objects.requireNonNull(elements, "elements cannot be null");
        Objects.requireNonNull(predicate, "predicate cannot be null");
        for (T element : elements) {
            if (predicate.test(element)) {
                return false;
            }
        }
        return true;
    }

    /**
     * @return true if no symbol satisfies {@code predicate}
     */
    public static <T> boolean noneOf(SymbolSequence<T> sequence, Predicate<? super T> predicate) {
        Objects.requireNonNull(sequence, "sequence cannot be null");
        Objects.requireNonNull(predicate, "predicate cannot be null");
        for (int i = 0; i < sequence.length(); i++) {
            if (predicate.test(sequence.symbolAt(i))) {
                return false;
            }
        }
        return true;
    }

    /**
     * @return true if no element equals {@code value} (compared with {@link Objects#equals})
     */
    public static boolean noneOfEqual(Iterable<?> elements, Object value) {
        Objects.requireNonNull(elements, "elements cannot be null");
        for (Object element : elements) {
            if (Objects.equals(value, element)) {
                return false;
            }
        }
        return true;
    }

    public static boolean noneOfEqual(SymbolSequence<?> sequence, Object value) {
        Objects.requireNonNull(sequence, "sequence cannot be null");
        for (int i = 0; i < sequence.length(); i++) {
            if (Objects.equals(value, sequence.symbolAt(i))) {
                return false;
            }
        }
        return true;
    }

    public static boolean noneOfEqual(byte[] bytes, byte value) {
        Objects.requireNonNull(bytes, "bytes cannot be null");
        for (byte b : bytes) {
            if (b == value) {
                return false;
            }
        }
        return true;
    }
}
