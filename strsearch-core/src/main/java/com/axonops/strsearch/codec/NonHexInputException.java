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

/**
 * Thrown when the input contains a character outside {@code 0-9}, {@code A-F}, {@code a-f}.
 *
 * @since 1.0.0
 */
public final class NonHexInputException extends HexDecodeException {

    private final char character;

    public NonHexInputException(char character, int index) {
        super("StrSearch: Non-hex character '" + character + "' at index " + index, index);
        this.character = character;
    }

    public char getCharacter() {
        return character;
    }
}
