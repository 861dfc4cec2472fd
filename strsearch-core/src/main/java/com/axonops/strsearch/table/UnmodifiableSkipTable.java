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

import java.util.Objects;

final class UnmodifiableSkipTable<T> implements SkipTable<T> {

    private final SkipTable<T> table;

    UnmodifiableSkipTable(SkipTable<T> table) {
        this.table = Objects.requireNonNull(table, "table cannot be null");
    }

    @Override
    public void insert(T symbol, int value) {
        throw new UnsupportedOperationException("StrSearch: skip table is read-only once built");
    }

    @Override
    public int lookup(T symbol) {
        return table.lookup(symbol);
    }

    @Override
    public int defaultValue() {
        return table.defaultValue();
    }

    @Override
    public int size() {
        return table.size();
    }

    @Override
    public String describe() {
        return table.describe();
    }

    @Override
    public String toString() {
        return table.toString();
    }
}
