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

import java.util.HashMap;
import java.util.Map;

/**
 * Skip table backed by a {@link HashMap}, for symbol types without a small unsigned index.
 *
 * <p>Holds one entry per distinct pattern symbol. Symbols need consistent
 * {@code equals}/{@code hashCode}.
 *
 * @param <T> symbol type
 * @since 1.0.0
 */
public final class MapSkipTable<T> implements SkipTable<T> {

    private final Map<T, Integer> skip;
    private final int defaultValue;

    public MapSkipTable(int patternLength, int defaultValue) {
        this.skip = new HashMap<>(Math.max(16, (int) (patternLength / 0.75f) + 1));
        this.defaultValue = defaultValue;
    }

    @Override
    public void insert(T symbol, int value) {
        skip.put(symbol, value);
    }

    @Override
    public int lookup(T symbol) {
        Integer value = skip.get(symbol);
        return value == null ? defaultValue : value;
    }

    @Override
    public int defaultValue() {
        return defaultValue;
    }

    @Override
    public int size() {
        return skip.size();
    }

    @Override
    public String describe() {
        StringBuilder sb = new StringBuilder("MapSkipTable{default=").append(defaultValue);
        for (Map.Entry<T, Integer> e : skip.entrySet()) {
            if (e.getValue() != defaultValue) {
                sb.append(", ").append(e.getKey()).append('=').append(e.getValue());
            }
        }
        return sb.append('}').toString();
    }

    @Override
    public String toString() {
        return "MapSkipTable[entries=" + skip.size() + "]";
    }
}
