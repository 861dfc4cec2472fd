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

import java.util.Objects;
import java.util.function.LongConsumer;

/**
 * Converts integral sequences to uppercase hexadecimal text and back, in the manner of
 * MySQL's {@code HEX} and {@code UNHEX}.
 *
 * <p>Each element is written as {@code 2 * width} digits, most significant first: a byte
 * becomes two digits, a short or char four, an int eight, a long sixteen. Decoding accepts
 * upper- and lowercase digits.
 *
 * <pre>{@code
 * Hex.encode(new byte[] {0x0A, (byte) 0xFF});   // "0AFF"
 * Hex.decodeBytes("0aff");                      // {0x0A, (byte) 0xFF}
 * Hex.encode("AB");                             // "00410042"
 * }</pre>
 *
 * <p>Useful for logging binary patterns and corpora. Not used by the matchers themselves.
 *
 * @since 1.0.0
 */
public final class Hex {

    private static final char[] DIGITS = "0123456789ABCDEF".toCharArray();

    private Hex() {
        // Utility class
    }

    // ========== Encoding ==========

    public static String encode(byte[] values) {
        Objects.requireNonNull(values, "values cannot be null");
        StringBuilder out = new StringBuilder(values.length * 2);
        for (byte value : values) {
            encode(value, 1, out);
        }
        return out.toString();
    }

    public static String encode(short[] values) {
        Objects.requireNonNull(values, "values cannot be null");
        StringBuilder out = new StringBuilder(values.length * 4);
        for (short value : values) {
            encode(value, 2, out);
        }
        return out.toString();
    }

    public static String encode(char[] values) {
        Objects.requireNonNull(values, "values cannot be null");
        StringBuilder out = new StringBuilder(values.length * 4);
        for (char value : values) {
            encode(value, 2, out);
        }
        return out.toString();
    }

    /**
     * Encodes each UTF-16 code unit as four digits.
     */
    public static String encode(CharSequence values) {
        Objects.requireNonNull(values, "values cannot be null");
        StringBuilder out = new StringBuilder(values.length() * 4);
        for (int i = 0; i < values.length(); i++) {
            encode(values.charAt(i), 2, out);
        }
        return out.toString();
    }

    public static String encode(int[] values) {
        Objects.requireNonNull(values, "values cannot be null");
        StringBuilder out = new StringBuilder(values.length * 8);
        for (int value : values) {
            encode(value, 4, out);
        }
        return out.toString();
    }

    public static String encode(long[] values) {
        Objects.requireNonNull(values, "values cannot be null");
        StringBuilder out = new StringBuilder(values.length * 16);
        for (long value : values) {
            encode(value, 8, out);
        }
        return out.toString();
    }

    /**
     * Appends the low {@code 8 * width} bits of {@code value} as {@code 2 * width} digits.
     *
     * @throws IllegalArgumentException if {@code width} is not 1, 2, 4 or 8
     */
    public static StringBuilder encode(long value, int width, StringBuilder out) {
        Objects.requireNonNull(out, "out cannot be null");
        checkWidth(width);
        for (int shift = 8 * width - 4; shift >= 0; shift -= 4) {
            out.append(DIGITS[(int) (value >>> shift) & 0x0F]);
        }
        return out;
    }

    // ========== Decoding ==========

    /**
     * Decodes {@code hex} into {@code sink}, {@code 2 * sink.width()} digits per element.
     * Elements decoded before a failure have already been delivered to the sink.
     *
     * @throws NonHexInputException if a character is not a hex digit
     * @throws NotEnoughInputException if the input ends inside an element
     */
    public static void decode(CharSequence hex, HexSink sink) {
        Objects.requireNonNull(hex, "hex cannot be null");
        Objects.requireNonNull(sink, "sink cannot be null");
        int unitDigits = 2 * checkWidth(sink.width());

        int length = hex.length();
        int pos = 0;
        while (pos < length) {
            long value = 0;
            for (int i = 0; i < unitDigits; i++, pos++) {
                if (pos == length) {
                    throw new NotEnoughInputException(pos, unitDigits);
                }
                value = (value << 4) | digit(hex.charAt(pos), pos);
            }
            sink.accept(value);
        }
    }

    public static byte[] decodeBytes(CharSequence hex) {
        byte[] out = new byte[hex.length() / 2];
        decode(hex, HexSink.ofWidth(1, new Filler() {
            @Override
            public void accept(long value) {
                out[next++] = (byte) value;
            }
        }));
        return out;
    }

    public static short[] decodeShorts(CharSequence hex) {
        short[] out = new short[hex.length() / 4];
        decode(hex, HexSink.ofWidth(2, new Filler() {
            @Override
            public void accept(long value) {
                out[next++] = (short) value;
            }
        }));
        return out;
    }

    public static char[] decodeChars(CharSequence hex) {
        char[] out = new char[hex.length() / 4];
        decode(hex, HexSink.ofWidth(2, new Filler() {
            @Override
            public void accept(long value) {
                out[next++] = (char) value;
            }
        }));
        return out;
    }

    /**
     * Inverse of {@link #encode(CharSequence)}.
     */
    public static String decodeString(CharSequence hex) {
        return new String(decodeChars(hex));
    }

    public static int[] decodeInts(CharSequence hex) {
        int[] out = new int[hex.length() / 8];
        decode(hex, HexSink.ofWidth(4, new Filler() {
            @Override
            public void accept(long value) {
                out[next++] = (int) value;
            }
        }));
        return out;
    }

    public static long[] decodeLongs(CharSequence hex) {
        long[] out = new long[hex.length() / 16];
        decode(hex, HexSink.ofWidth(8, new Filler() {
            @Override
            public void accept(long value) {
                out[next++] = value;
            }
        }));
        return out;
    }

    static int checkWidth(int width) {
        if (width != 1 && width != 2 && width != 4 && width != 8) {
            throw new IllegalArgumentException("width must be 1, 2, 4 or 8 bytes (got " + width + ")");
        }
        return width;
    }

    private static int digit(char c, int index) {
        if (c >= '0' && c <= '9') {
            return c - '0';
        }
        if (c >= 'A' && c <= 'F') {
            return c - 'A' + 10;
        }
        if (c >= 'a' && c <= 'f') {
            return c - 'a' + 10;
        }
        throw new NonHexInputException(c, index);
    }

    /** Consumer that writes into an array at a running index. */
    private abstract static class Filler implements LongConsumer {
        int next;
    }
}
