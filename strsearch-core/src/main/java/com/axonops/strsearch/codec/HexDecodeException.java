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
 * Base exception for hexadecimal decoding failures.
 *
 * <p>Sealed class ensuring exhaustive handling of all decoding errors.
 *
 * @since 1.0.0
 */
public sealed class HexDecodeException extends RuntimeException
    permits NonHexInputException,
            NotEnoughInputException {

    private final int index;

    HexDecodeException(String message, int index) {
        super(message);
        this.index = index;
    }

    /**
     * @return position in the input where decoding stopped
     */
    public int getIndex() {
        return index;
    }
}
