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
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class SequencesTest {

    @Test
    void testNoneOf_Iterable() {
        List<Integer> values = List.of(1, 3, 5);

        assertThat(Sequences.noneOf(values, v -> v % 2 == 0)).isTrue();
        assertThat(Sequences.noneOf(values, v -> v > 4)).isFalse();
        assertThat(Sequences.noneOf(List.<Integer>of(), v -> true)).isTrue();
    }

    @Test
    void testNoneOf_Sequence() {
        SymbolSequence<Character> seq = SymbolSequence.of("abc");

        assertThat(Sequences.noneOf(seq, Character::isDigit)).isTrue();
        assertThat(Sequences.noneOf(seq, c -> c == 'b')).isFalse();
    }

    @Test
    void testNoneOfEqual() {
        assertThat(Sequences.noneOfEqual(List.of("a", "b"), "c")).isTrue();
        assertThat(Sequences.noneOfEqual(List.of("a", "b"), "b")).isFalse();
        assertThat(Sequences.noneOfEqual(Arrays.asList("a", null), null)).isFalse();
        assertThat(Sequences.noneOfEqual(SymbolSequence.of("xyz"), 'y')).isFalse();
        assertThat(Sequences.noneOfEqual(SymbolSequence.of("xyz"), "y")).isTrue();
    }

    @Test
    void testNoneOfEqual_Bytes() {
        byte[] bytes = {1, 2, -1};

        assertThat(Sequences.noneOfEqual(bytes, (byte) 0)).isTrue();
        assertThat(Sequences.noneOfEqual(bytes, (byte) 0xFF)).isFalse();
        assertThat(Sequences.noneOfEqual(new byte[0], (byte) 0)).isTrue();
    }
}
