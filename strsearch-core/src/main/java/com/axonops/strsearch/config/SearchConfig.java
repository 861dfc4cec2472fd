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

package com.axonops.strsearch.config;

import com.axonops.strsearch.metrics.NoOpMetricsRegistry;
import com.axonops.strsearch.metrics.SearchMetricsRegistry;
import com.axonops.strsearch.table.SkipTableStrategy;
import com.axonops.strsearch.table.TableListener;
import java.util.Objects;

/**
 * Configuration applied when a matcher is built.
 *
 * <p>Immutable configuration using Java 17 records. A matcher keeps the configuration it was
 * built with; changing configuration means building a new matcher.
 *
 * <h2>Skip Tables</h2>
 *
 * <p>Boyer-Moore and Horspool keep a bad-character table. {@code skipTableStrategy} decides its
 * representation:
 *
 * <ul>
 *   <li><b>AUTO</b> (default) - dense array when the pattern's {@link
 *       com.axonops.strsearch.api.Alphabet} is bounded and has at most {@code
 *       maxArrayAlphabetSize} symbols, hash map otherwise. Bytes get an array, chars a map.
 *   <li><b>ARRAY</b> - always an array; building fails for unbounded or oversized alphabets
 *   <li><b>MAP</b> - always a hash map
 * </ul>
 *
 * <h2>Configuration Examples</h2>
 *
 * <pre>{@code
 * // Array tables for char patterns too (256KB per table)
 * SearchConfig config = SearchConfig.builder()
 *     .maxArrayAlphabetSize(65536)
 *     .build();
 *
 * // Metrics plus table dumps while debugging
 * SearchConfig config = SearchConfig.builder()
 *     .metricsRegistry(new DropwizardMetricsAdapter(registry, "myapp.search"))
 *     .tableListener(LoggingTableListener.INSTANCE)
 *     .build();
 * }</pre>
 *
 * @param skipTableStrategy representation of bad-character tables
 * @param maxArrayAlphabetSize largest alphabet backed by an array table (1..65536)
 * @param metricsRegistry metrics implementation (use {@link NoOpMetricsRegistry} for zero
 *     overhead)
 * @param tableListener hook invoked after each table is built
 * @since 1.0.0
 * @see com.axonops.strsearch.metrics.MetricNames
 */
public record SearchConfig(
    SkipTableStrategy skipTableStrategy,
    int maxArrayAlphabetSize,
    SearchMetricsRegistry metricsRegistry,
    TableListener tableListener) {

  /** Largest alphabet an array skip table may cover. */
  public static final int MAX_ARRAY_ALPHABET_SIZE = 1 << 16;

  /**
   * Default configuration: AUTO tables capped at 256 symbols (one byte), metrics disabled, no
   * table listener.
   */
  public static final SearchConfig DEFAULT =
      new SearchConfig(
          SkipTableStrategy.AUTO,
          256, // one-byte alphabets
          NoOpMetricsRegistry.INSTANCE, // Metrics disabled (zero overhead)
          TableListener.NONE);

  /** Compact constructor with validation. */
  public SearchConfig {
    Objects.requireNonNull(skipTableStrategy, "skipTableStrategy cannot be null");
    Objects.requireNonNull(metricsRegistry, "metricsRegistry cannot be null");
    Objects.requireNonNull(tableListener, "tableListener cannot be null");
    if (maxArrayAlphabetSize <= 0 || maxArrayAlphabetSize > MAX_ARRAY_ALPHABET_SIZE) {
      throw new IllegalArgumentException(
          "maxArrayAlphabetSize must be in 1.."
              + MAX_ARRAY_ALPHABET_SIZE
              + " (got "
              + maxArrayAlphabetSize
              + ")");
    }
  }

  /**
   * Creates a builder starting from {@link #DEFAULT}.
   *
   * @return new builder with default values
   */
  public static Builder builder() {
    return new Builder();
  }

  /**
   * Builder for custom configuration. All fields start with the values of {@link #DEFAULT}.
   */
  public static class Builder {
    private SkipTableStrategy skipTableStrategy = DEFAULT.skipTableStrategy();
    private int maxArrayAlphabetSize = DEFAULT.maxArrayAlphabetSize();
    private SearchMetricsRegistry metricsRegistry = DEFAULT.metricsRegistry();
    private TableListener tableListener = DEFAULT.tableListener();

    /**
     * Set the skip table representation.
     *
     * <p><b>Default: AUTO</b>
     *
     * @param strategy table strategy (must not be null)
     * @return this builder
     */
    public Builder skipTableStrategy(SkipTableStrategy strategy) {
      this.skipTableStrategy = Objects.requireNonNull(strategy, "skipTableStrategy cannot be null");
      return this;
    }

    /**
     * Set the largest alphabet that may be backed by an array table.
     *
     * <p><b>Default: 256</b>
     *
     * @param size alphabet size limit (1..65536)
     * @return this builder
     */
    public Builder maxArrayAlphabetSize(int size) {
      this.maxArrayAlphabetSize = size;
      return this;
    }

    /**
     * Set metrics registry for instrumentation.
     *
     * <p><b>Default: {@link NoOpMetricsRegistry} (zero overhead)</b>
     *
     * @param metricsRegistry metrics implementation (must not be null)
     * @return this builder
     * @throws NullPointerException if metricsRegistry is null
     */
    public Builder metricsRegistry(SearchMetricsRegistry metricsRegistry) {
      this.metricsRegistry =
          Objects.requireNonNull(metricsRegistry, "metricsRegistry cannot be null");
      return this;
    }

    /**
     * Set the hook invoked after each table is built.
     *
     * <p><b>Default: {@link TableListener#NONE}</b>
     *
     * @param tableListener listener (must not be null)
     * @return this builder
     */
    public Builder tableListener(TableListener tableListener) {
      this.tableListener = Objects.requireNonNull(tableListener, "tableListener cannot be null");
      return this;
    }

    /**
     * Build immutable configuration.
     *
     * @return validated immutable configuration
     * @throws IllegalArgumentException if configuration is invalid
     */
    public SearchConfig build() {
      return new SearchConfig(
          skipTableStrategy, maxArrayAlphabetSize, metricsRegistry, tableListener);
    }
  }
}
