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
package com.fabricbitgen.bitstream;

import java.util.Arrays;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import com.fabricbitgen.config.ConfigBlock;
import com.fabricbitgen.config.ConfigBlockTree;

public class TestFabricBitstream {

    @Test
    public void testAddressAndDin() {
        ConfigBlockTree tree = new ConfigBlockTree();
        ConfigBlock top = tree.createBlock("fpga_top", null);
        tree.addBits(top, 1, 0);

        FabricBitstream bitstream = new FabricBitstream();
        Assertions.assertTrue(bitstream.isEmpty());
        FabricBit bit = bitstream.addBit(tree.getBit(0));
        boolean[] address = {true, false};
        bitstream.setBitAddress(bit, address);
        bitstream.setBitDin(bit, true);
        address[0] = false;

        Assertions.assertEquals("10 1", bit.toString());
        bit.getAddress()[1] = true;
        Assertions.assertEquals(2, bit.getAddressSize());
        Assertions.assertEquals("10 1", bit.toString());
    }

    @Test
    public void testReverse() {
        ConfigBlockTree tree = new ConfigBlockTree();
        ConfigBlock top = tree.createBlock("fpga_top", null);
        tree.addBits(top, 1, 1, 0);

        FabricBitstream bitstream = new FabricBitstream();
        tree.getBits().forEach(bitstream::addBit);
        Assertions.assertEquals(Arrays.asList(true, true, false), bitstream.getValues());
        bitstream.reverse();
        Assertions.assertEquals(Arrays.asList(false, true, true), bitstream.getValues());
        Assertions.assertSame(tree.getBit(2), bitstream.getBit(0).getConfigBit());
        Assertions.assertEquals(3, bitstream.size());
        Assertions.assertThrows(UnsupportedOperationException.class, () -> bitstream.getBits().clear());
    }
}
