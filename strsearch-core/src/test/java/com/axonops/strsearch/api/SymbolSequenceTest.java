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

package com.axonops.strsearch.api;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class SymbolSequenceTest {

    @Test
    void testOfBytes_SignedValuesPreserved() {
        SymbolSequence<Byte> seq = SymbolSequence.of(new byte[] {0, -1, 127});

        assertThat(seq.length()).isEqualTo(3);
        assertThat(seq.symbolAt(1)).isEqualTo((byte) -1);
        assertThat(seq.isEmpty()).isFalse();
    }

    @Test
    void testOfBytes_Slice() {
        byte[] data = {10, 20, 30, 40, 50};
        SymbolSequence<Byte> seq = SymbolSequence.of(data, 1, 3);

        assertThat(seq.length()).isEqualTo(3);
        assertThat(seq.symbolAt(0)).isEqualTo((byte) 20);
        assertThat(seq.symbolAt(2)).isEqualTo((byte) 40);
    }

    @Test
    void testOfBytes_SliceOutOfBounds() {
        byte[] data = new byte[4];

        assertThatThrownBy(() -> SymbolSequence.of(data, 2, 3))
            .isInstanceOf(IndexOutOfBoundsException.class);
        assertThatThrownBy(() -> SymbolSequence.of(data, -1, 1))
            .isInstanceOf(IndexOutOfBoundsException.class);
    }

    @Test
    void testOfCharSequence() {
        SymbolSequence<Character> seq = SymbolSequence.of(new StringBuilder("h\u00e9llo"));

        assertThat(seq.length()).isEqualTo(5);
        assertThat(seq.symbolAt(1)).isEqualTo('\u00e9');
        assertThat(SymbolSequence.of("").isEmpty()).isTrue();
    }

    @Test
    void testOfList_IsView() {
        List<Integer> list = new ArrayList<>(List.of(1, 2, 3));
        SymbolSequence<Integer> seq = SymbolSequence.of(list);
        list.add(4);

        assertThat(seq.length()).isEqualTo(4);
        assertThat(seq.symbolAt(3)).isEqualTo(4);
    }

    @Test
    void testCopyOf_IsSnapshot() {
        List<Integer> list = new ArrayList<>(List.of(1, 2, 3));
        SymbolSequence<Integer> copy = SymbolSequence.copyOf(SymbolSequence.of(list));
        list.set(0, 9);
        list.add(4);

        assertThat(copy.length()).isEqualTo(3);
        assertThat(copy.symbolAt(0)).isEqualTo(1);
    }

    @Test
    void testReversed() {
        SymbolSequence<Character> seq = SymbolSequence.reversed(SymbolSequence.of("abc"));

        assertThat(seq.length()).isEqualTo(3);
        assertThat(seq.symbolAt(0)).isEqualTo('c');
        assertThat(seq.symbolAt(2)).isEqualTo('a');
    }

    @Test
    void testNullArguments() {
        assertThatThrownBy(() -> SymbolSequence.of((byte[]) null))
            .isInstanceOf(NullPointerException.class);
        assertThatThrownBy(() -> SymbolSequence.of((CharSequence) null))
            .isInstanceOf(NullPointerException.class);
        assertThatThrownBy(() -> SymbolSequence.copyOf(null))
            .isInstanceOf(NullPointerException.class);
    }
}
