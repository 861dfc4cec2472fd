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

package com.axonops.strsearch.codec;

import java.util.Objects;
import java.util.function.LongConsumer;

/**
 * Destination for decoded values. The sink states its element width up front, which fixes how
 * many hex digits make up one value.
 *
 * @since 1.0.0
 */
public interface HexSink {

    /**
     * @return element width in bytes: 1, 2, 4 or 8
     */
    int width();

    /**
     * Receives one decoded element; only the low {@code 8 * width()} bits are significant.
     */
    void accept(long value);

    /**
     * Sink of the given width forwarding to {@code consumer}.
     *
     * @throws IllegalArgumentException if {@code width} is not 1, 2, 4 or 8
     */
    static HexSink ofWidth(int width, LongConsumer consumer) {
        Objects.requireNonNull(consumer, "consumer cannot be null");
        Hex.checkWidth(width);
        return new HexSink() {
            @Override
            public int width() {
                return width;
            }

            @Override
            public void accept(long value) {
                consumer.accept(value);
            }
        };
    }
}
