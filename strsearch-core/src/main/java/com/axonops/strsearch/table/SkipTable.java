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

/**
 * Bad-character table: maps a symbol to a shift distance.
 *
 * <p>Filled once while a matcher is built, by scanning the pattern left to right, so a later
 * {@link #insert} for the same symbol overwrites an earlier one and the stored value ends up
 * describing the rightmost occurrence. Read-only once the matcher is published.
 *
 * <p>Thread-safe for concurrent {@link #lookup} after construction; {@link #insert} is not
 * meant to be called once the table is shared.
 *
 * @param <T> symbol type
 * @since 1.0.0
 */
public interface SkipTable<T> {

    /**
     * Records {@code value} for {@code symbol}, replacing any earlier value.
     */
    void insert(T symbol, int value);

    /**
     * @return the stored value, or {@link #defaultValue()} if {@code symbol} was never inserted
     */
    int lookup(T symbol);

    int defaultValue();

    /**
     * @return number of distinct symbols stored
     */
    int size();

    /**
     * Human-readable listing of the stored entries, for diagnostics.
     */
    String describe();

    /**
     * Read-only view of {@code table}; {@link #insert} throws {@link UnsupportedOperationException}.
     */
    static <T> SkipTable<T> unmodifiable(SkipTable<T> table) {
        if (table instanceof UnmodifiableSkipTable) {
            return table;
        }
        return new UnmodifiableSkipTable<>(table);
    }
}
