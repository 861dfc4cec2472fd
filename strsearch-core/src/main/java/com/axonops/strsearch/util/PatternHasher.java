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

/**
 * Utility for hashing patterns for logging purposes.
 *
 * <p>Pattern hashing provides privacy and readability in logs:
 * <ul>
 *   <li>Privacy: Don't log potentially sensitive search terms or binary needles</li>
 *   <li>Readability: Logs aren't cluttered with long patterns</li>
 *   <li>Debuggability: Same pattern always gets same hash, easy to grep/trace</li>
 * </ul>
 *
 * @since 1.0.0
 */
public final class PatternHasher {

    private PatternHasher() {
        // Utility class
    }

    /**
     * Creates a compact hex hash of a pattern for logging.
     *
     * <p>Combines the symbols' {@code hashCode} the way {@link java.util.List#hashCode()} does,
     * so the hash is deterministic for value-based symbol types.
     *
     * @param pattern the pattern
     * @return hex string (e.g., "7a3f2b1c")
     */
    public static String hash(SymbolSequence<?> pattern) {
        if (pattern == null) {
            return "null";
        }
        int h = 1;
        for (int i = 0; i < pattern.length(); i++) {
            h = 31 * h + Objects.hashCode(pattern.symbolAt(i));
        }
        return Integer.toHexString(h);
    }
}
