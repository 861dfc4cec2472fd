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
 * Thrown when the input ends in the middle of a decode unit, e.g. an odd number of digits
 * decoded into bytes.
 *
 * @since 1.0.0
 */
public final class NotEnoughInputException extends HexDecodeException {

    private final int unitDigits;

    public NotEnoughInputException(int index, int unitDigits) {
        super("StrSearch: Not enough input at index " + index + " to complete a " + unitDigits + "-digit unit", index);
        this.unitDigits = unitDigits;
    }

    /**
     * @return digits needed per decoded element
     */
    public int getUnitDigits() {
        return unitDigits;
    }
}
