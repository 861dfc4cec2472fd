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

import com.axonops.strsearch.api.Algorithm;

/**
 * Instrumentation hook invoked once per table, right after a matcher builds it.
 *
 * <p>Callbacks run on the constructing thread, before the matcher is returned. Listeners must
 * treat the tables as read-only; the arrays passed in are copies.
 *
 * @since 1.0.0
 * @see LoggingTableListener
 */
public interface TableListener {

    /** Listener that ignores every callback (default). */
    TableListener NONE = new TableListener() {
    };

    /**
     * Bad-character table of a Boyer-Moore or Horspool matcher.
     */
    default void onSkipTableBuilt(Algorithm algorithm, SkipTable<?> table) {
    }

    /**
     * Good-suffix table of a Boyer-Moore matcher, length {@code patternLength + 1}.
     */
    default void onSuffixTableBuilt(int[] suffix) {
    }

    /**
     * Failure table of a Knuth-Morris-Pratt matcher, length {@code patternLength + 1}.
     */
    default void onFailureTableBuilt(int[] failure) {
    }
}
