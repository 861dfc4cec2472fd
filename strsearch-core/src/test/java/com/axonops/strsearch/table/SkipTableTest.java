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

import com.axonops.strsearch.api.Alphabet;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for skip table implementations and strategy selection.
 */
class SkipTableTest {

    @Test
    void testArrayTable_InsertAndLookup() {
        ArraySkipTable<Byte> table = new ArraySkipTable<>(Alphabet.BYTES, -1);
        table.insert((byte) 'A', 0);
        table.insert((byte) -1, 1);
        table.insert((byte) 'A', 2);

        assertThat(table.lookup((byte) 'A')).isEqualTo(2);
        assertThat(table.lookup((byte) -1)).isEqualTo(1);
        assertThat(table.lookup((byte) 0)).isEqualTo(-1);
        assertThat(table.size()).isEqualTo(2);
        assertThat(table.defaultValue()).isEqualTo(-1);
    }

    @Test
    void testArrayTable_Describe() {
        ArraySkipTable<Byte> table = new ArraySkipTable<>(Alphabet.BYTES, 9);
        table.insert((byte) 1, 3);
        table.insert((byte) 255, 4);

        assertThat(table.describe()).isEqualTo("ArraySkipTable{default=9, 1=3, 255=4}");
        assertThat(table.toString()).isEqualTo("ArraySkipTable[alphabetSize=256, entries=2]");
    }

    @Test
    void testArrayTable_RejectsUnboundedAlphabet() {
        assertThatThrownBy(() -> new ArraySkipTable<>(Alphabet.unbounded(), 0))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("bounded");
    }

    @Test
    void testMapTable_InsertAndLookup() {
        MapSkipTable<String> table = new MapSkipTable<>(3, 3);
        table.insert("to", 2);
        table.insert("be", 1);
        table.insert("to", 0);

        assertThat(table.lookup("to")).isEqualTo(0);
        assertThat(table.lookup("be")).isEqualTo(1);
        assertThat(table.lookup("or")).isEqualTo(3);
        assertThat(table.size()).isEqualTo(2);
        assertThat(table.describe()).startsWith("MapSkipTable{default=3");
    }

    @Test
    void testSize_InsertingDefaultValueCountsSymbolOnce() {
        for (SkipTableStrategy strategy : List.of(SkipTableStrategy.ARRAY, SkipTableStrategy.MAP)) {
            SkipTable<Byte> table = strategy.create(Alphabet.BYTES, 4, -1, 256);
            table.insert((byte) 1, -1);
            table.insert((byte) 1, 3);
            table.insert((byte) 2, -1);

            assertThat(table.size()).as("%s", strategy).isEqualTo(2);
            assertThat(table.lookup((byte) 1)).as("%s", strategy).isEqualTo(3);
            assertThat(table.lookup((byte) 2)).as("%s", strategy).isEqualTo(-1);
        }
    }

    @Test
    void testUnmodifiable_DelegatesReadsAndRejectsInsert() {
        ArraySkipTable<Byte> table = new ArraySkipTable<>(Alphabet.BYTES, -1);
        table.insert((byte) 7, 2);
        SkipTable<Byte> view = SkipTable.unmodifiable(table);

        assertThat(view.lookup((byte) 7)).isEqualTo(2);
        assertThat(view.lookup((byte) 8)).isEqualTo(-1);
        assertThat(view.defaultValue()).isEqualTo(-1);
        assertThat(view.size()).isEqualTo(1);
        assertThat(view.describe()).isEqualTo(table.describe());
        assertThat(SkipTable.unmodifiable(view)).isSameAs(view);

        assertThatThrownBy(() -> view.insert((byte) 7, 0))
            .isInstanceOf(UnsupportedOperationException.class)
            .hasMessageContaining("read-only");
        assertThat(table.lookup((byte) 7)).isEqualTo(2);
    }

    @Test
    void testStrategy_Auto() {
        assertThat(SkipTableStrategy.AUTO.create(Alphabet.BYTES, 4, -1, 256))
            .isInstanceOf(ArraySkipTable.class);
        assertThat(SkipTableStrategy.AUTO.create(Alphabet.CHARS, 4, -1, 256))
            .isInstanceOf(MapSkipTable.class);
        assertThat(SkipTableStrategy.AUTO.create(Alphabet.CHARS, 4, -1, 65536))
            .isInstanceOf(ArraySkipTable.class);
        assertThat(SkipTableStrategy.AUTO.create(Alphabet.unbounded(), 4, -1, 65536))
            .isInstanceOf(MapSkipTable.class);
    }

    @Test
    void testStrategy_Explicit() {
        assertThat(SkipTableStrategy.MAP.create(Alphabet.BYTES, 4, -1, 256))
            .isInstanceOf(MapSkipTable.class);
        assertThat(SkipTableStrategy.ARRAY.create(Alphabet.BYTES, 4, -1, 256))
            .isInstanceOf(ArraySkipTable.class);
        assertThatThrownBy(() -> SkipTableStrategy.ARRAY.create(Alphabet.BYTES, 4, -1, 255))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("at most 255");
    }

    @Test
    void testStrategy_TablesStartAtDefault() {
        for (SkipTableStrategy strategy : SkipTableStrategy.values()) {
            SkipTable<Byte> table = strategy.create(Alphabet.BYTES, 0, 7, 256);
            assertThat(table.size()).as("%s", strategy).isEqualTo(0);
            for (int b = -128; b < 128; b++) {
                assertThat(table.lookup((byte) b)).isEqualTo(7);
            }
        }
    }
}
