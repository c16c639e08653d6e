/*
 *
 * Copyright (c) 2024, FabricBitGen contributors.
 * All rights reserved.
 *
 * This file is part of FabricBitGen.
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
 *
 */
package com.fabricbitgen.util;

/**
 * Converts child indices into fixed-width binary address codes for frame
 * decoders.
 */
public class AddressEncoder {

    private AddressEncoder() {

    }

    /**
     * Encodes a non-negative integer into a binary vector of exactly the given
     * width. The most significant bit is stored at index 0 and unused upper
     * bits are zero.
     * @param value The integer to encode.
     * @param width Number of bits in the resulting vector.
     * @return The encoded bits, most significant first.
     * @throws IllegalArgumentException If value is negative, width is negative
     * or value does not fit in width bits.
     */
    public static boolean[] encode(int value, int width) {
        if (width < 0) {
            throw new IllegalArgumentException("ERROR: Invalid address width " + width);
        }
        if (value < 0) {
            throw new IllegalArgumentException("ERROR: Cannot encode negative value " + value);
        }
        if (width < Integer.SIZE - 1 && value >= (1 << width)) {
            throw new IllegalArgumentException("ERROR: Value " + value
                    + " does not fit in an address of " + width + " bit(s)");
        }
        boolean[] code = new boolean[width];
        int temp = value;
        for (int i = width - 1; i >= 0; i--) {
            code[i] = (temp & 1) == 1;
            temp >>>= 1;
        }
        return code;
    }

    /**
     * Renders an address code as a string of '0' and '1' characters, in the
     * same order as stored.
     * @param code The address code.
     * @return The binary string, empty for an empty code.
     */
    public static String toBinaryString(boolean[] code) {
        StringBuilder sb = new StringBuilder(code.length);
        for (boolean b : code) {
            sb.append(b ? '1' : '0');
        }
        return sb.toString();
    }
}
