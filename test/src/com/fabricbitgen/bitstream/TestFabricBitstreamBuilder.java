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

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import com.fabricbitgen.config.ConfigBlock;
import com.fabricbitgen.config.ConfigBlockTree;
import com.fabricbitgen.module.ModuleManager;
import com.fabricbitgen.support.TestFabricHelper;
import com.fabricbitgen.util.Params;

public class TestFabricBitstreamBuilder {

    private static FabricBitstream build(TestFabricHelper f, ConfigProtocolType type) {
        return FabricBitstreamBuilder.build(f.blockTree, f.moduleManager, new ConfigProtocol(type), false);
    }

    @Test
    public void testStandalone() {
        TestFabricHelper f = TestFabricHelper.createChainFabric();
        Assertions.assertEquals(Arrays.asList(true, false, false), build(f, ConfigProtocolType.STANDALONE).getValues());
    }

    @Test
    public void testScanChainIsReversedStandalone() {
        TestFabricHelper f = TestFabricHelper.createChainFabric();
        FabricBitstream standalone = build(f, ConfigProtocolType.STANDALONE);
        FabricBitstream scanChain = build(f, ConfigProtocolType.SCAN_CHAIN);

        Assertions.assertEquals(Arrays.asList(false, false, true), scanChain.getValues());
        List<FabricBit> reversed = new ArrayList<>(standalone.getBits());
        Collections.reverse(reversed);
        Assertions.assertEquals(reversed, scanChain.getBits());
    }

    @Test
    public void testFrameBased() {
        TestFabricHelper f = TestFabricHelper.createFrameFabric();
        FabricBitstream bitstream = build(f, ConfigProtocolType.FRAME_BASED);
        Assertions.assertEquals("00 1", bitstream.getBit(0).toString());
        Assertions.assertEquals("01 0", bitstream.getBit(1).toString());
    }

    @ParameterizedTest
    @EnumSource(value = ConfigProtocolType.class, names = {"STANDALONE", "SCAN_CHAIN"})
    public void testChainIdempotent(ConfigProtocolType type) {
        TestFabricHelper f = TestFabricHelper.createChainFabric();
        Assertions.assertEquals(build(f, type).getBits(), build(f, type).getBits());
    }

    @Test
    public void testFrameIdempotent() {
        TestFabricHelper f = TestFabricHelper.createHierarchicalFrameFabric();
        FabricBitstream first = build(f, ConfigProtocolType.FRAME_BASED);
        FabricBitstream second = build(f, ConfigProtocolType.FRAME_BASED);
        Assertions.assertEquals(first.getBits(), second.getBits());
    }

    @Test
    public void testMemoryBankFailsSizeCheck() {
        TestFabricHelper f = TestFabricHelper.createChainFabric();
        FabricBitstreamException e = Assertions.assertThrows(FabricBitstreamException.class,
                () -> build(f, ConfigProtocolType.MEMORY_BANK));
        Assertions.assertEquals("ERROR: Fabric bitstream of MEMORY_BANK protocol has 0 bits, expected 3 bits"
                + " from the configuration bit database", e.getMessage());
    }

    @Test
    public void testMemoryBankWithoutBits() {
        TestFabricHelper f = new TestFabricHelper();
        f.addChild(f.top, f.topBlock, "empty");
        Assertions.assertTrue(build(f, ConfigProtocolType.MEMORY_BANK).isEmpty());
    }

    @Test
    public void testInvalidProtocol() {
        TestFabricHelper f = TestFabricHelper.createChainFabric();
        Assertions.assertThrows(FabricBitstreamException.class,
                () -> FabricBitstreamBuilder.build(f.blockTree, f.moduleManager, new ConfigProtocol(null), false));
        Assertions.assertThrows(FabricBitstreamException.class,
                () -> FabricBitstreamBuilder.build(f.blockTree, f.moduleManager, null, false));
    }

    @Test
    public void testMissingTopModule() {
        TestFabricHelper f = TestFabricHelper.createChainFabric();
        ModuleManager other = new ModuleManager();
        other.createModule("not_top");
        FabricBitstreamException e = Assertions.assertThrows(FabricBitstreamException.class,
                () -> FabricBitstreamBuilder.build(f.blockTree, other,
                        new ConfigProtocol(ConfigProtocolType.STANDALONE), false));
        Assertions.assertEquals("ERROR: Couldn't find top module 'fpga_top'", e.getMessage());
    }

    @Test
    public void testMultipleRootBlocks() {
        TestFabricHelper f = TestFabricHelper.createChainFabric();
        f.blockTree.createBlock("stray", null);
        FabricBitstreamException e = Assertions.assertThrows(FabricBitstreamException.class,
                () -> build(f, ConfigProtocolType.STANDALONE));
        Assertions.assertTrue(e.getMessage().startsWith("ERROR: Expected exactly 1 top configuration block, found 2"));
    }

    @Test
    public void testRootNameMismatch() {
        TestFabricHelper f = new TestFabricHelper();
        ConfigBlockTree tree = new ConfigBlockTree();
        tree.createBlock("fpga_core", null);
        FabricBitstreamException e = Assertions.assertThrows(FabricBitstreamException.class,
                () -> FabricBitstreamBuilder.build(tree, f.moduleManager,
                        new ConfigProtocol(ConfigProtocolType.STANDALONE), false));
        Assertions.assertEquals("ERROR: Top configuration block 'fpga_core' does not match top module 'fpga_top'",
                e.getMessage());
    }

    @Test
    public void testDroppedBitsFailSizeCheck() {
        TestFabricHelper f = new TestFabricHelper();
        f.addLeaf(f.top, f.topBlock, "mem_x", 1);
        // A hierarchical block whose module chains nothing
        ConfigBlock wrapper = f.addChild(f.top, f.topBlock, "wrapper");
        f.blockTree.addBits(f.blockTree.createBlock("inner", wrapper), 1);
        f.addDecoder(f.top, "decoder1", 1);

        FabricBitstream partial = new FabricBitstream();
        new FrameBitstreamBuilder(f.blockTree, f.moduleManager).build(f.topBlock, f.top, partial);
        Assertions.assertEquals(1, partial.size());
        Assertions.assertEquals("0 1", partial.getBit(0).toString());
        Assertions.assertEquals(1, FabricBitstreamBuilder.reportUntouchedBits(f.blockTree, partial));

        boolean report = Params.FBG_REPORT_UNTOUCHED_BITS;
        Params.FBG_REPORT_UNTOUCHED_BITS = true;
        try {
            FabricBitstreamException e = Assertions.assertThrows(FabricBitstreamException.class,
                    () -> build(f, ConfigProtocolType.FRAME_BASED));
            Assertions.assertTrue(e.getMessage().contains("has 1 bits, expected 2 bits"));
        } finally {
            Params.FBG_REPORT_UNTOUCHED_BITS = report;
        }
    }

    @Test
    public void testVerboseBuild() {
        TestFabricHelper f = TestFabricHelper.createChainFabric();
        FabricBitstream bitstream = FabricBitstreamBuilder.build(f.blockTree, f.moduleManager,
                new ConfigProtocol(ConfigProtocolType.STANDALONE), true);
        Assertions.assertEquals(3, bitstream.size());
    }

    @Test
    public void testVerboseOutput() {
        TestFabricHelper f = TestFabricHelper.createFrameFabric();
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        PrintStream origOut = System.out;
        System.setOut(new PrintStream(out, true));
        try {
            FabricBitstreamBuilder.build(f.blockTree, f.moduleManager,
                    new ConfigProtocol(ConfigProtocolType.FRAME_BASED), true);
        } finally {
            System.setOut(origOut);
        }

        String[] lines = out.toString().split("\\R");
        Assertions.assertEquals(5, lines.length);
        Assertions.assertTrue(lines[0].startsWith("====="));
        Assertions.assertTrue(lines[1].startsWith("== ") && lines[1].contains("Fabric bitstream (FRAME_BASED)"));
        Assertions.assertEquals("Built 2 configuration bits for fabric", lines[3]);
        Assertions.assertTrue(lines[4].startsWith("Build fabric dependent bitstream:"));
        Assertions.assertTrue(lines[4].trim().endsWith("s"));
    }
}
