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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link TableListener} that dumps every table at DEBUG.
 *
 * <p>Skip tables list only their non-default entries; suffix tables list the first entry and
 * every entry that differs from it.
 *
 * @since 1.0.0
 */
public final class LoggingTableListener implements TableListener {
    private static final Logger logger = LoggerFactory.getLogger(LoggingTableListener.class);

    public static final LoggingTableListener INSTANCE = new LoggingTableListener();

    private LoggingTableListener() {
    }

    @Override
    public void onSkipTableBuilt(Algorithm algorithm, SkipTable<?> table) {
        if (logger.isDebugEnabled()) {
            logger.debug("StrSearch: {} skip table ({} entries): {}", algorithm, table.size(), table.describe());
        }
    }

    @Override
    public void onSuffixTableBuilt(int[] suffix) {
        if (logger.isDebugEnabled()) {
            logger.debug("StrSearch: {} suffix table: {}", Algorithm.BOYER_MOORE, describeSuffix(suffix));
        }
    }

    @Override
    public void onFailureTableBuilt(int[] failure) {
        if (logger.isDebugEnabled()) {
            logger.debug("StrSearch: {} failure table: {}", Algorithm.KNUTH_MORRIS_PRATT, describeTable(failure));
        }
    }

    static String describeSuffix(int[] suffix) {
        if (suffix.length == 0) {
            return "{}";
        }
        StringBuilder sb = new StringBuilder("{0=").append(suffix[0]);
        for (int i = 1; i < suffix.length; i++) {
            if (suffix[i] != suffix[0]) {
                sb.append(", ").append(i).append('=').append(suffix[i]);
            }
        }
        return sb.append('}').toString();
    }

    static String describeTable(int[] table) {
        StringBuilder sb = new StringBuilder().append(table.length).append(": {");
        for (int value : table) {
            sb.append(' ').append(value);
        }
        return sb.append(" }").toString();
    }
}
