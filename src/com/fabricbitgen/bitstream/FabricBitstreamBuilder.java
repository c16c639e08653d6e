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

import java.util.BitSet;
import java.util.List;

import org.jetbrains.annotations.NotNull;

import com.fabricbitgen.config.ConfigBit;
import com.fabricbitgen.config.ConfigBlock;
import com.fabricbitgen.config.ConfigBlockTree;
import com.fabricbitgen.module.ConfigurableChild;
import com.fabricbitgen.module.Module;
import com.fabricbitgen.module.ModuleManager;
import com.fabricbitgen.util.MessageGenerator;
import com.fabricbitgen.util.Params;
import com.fabricbitgen.util.RuntimeTracker;

/**
 * Reorganizes the configuration bit database for a specific fabric, so that
 * configuration bits come out in the sequence that can be loaded directly
 * through its configuration protocol.
 * <p>
 * This does not modify the bit database, nor does it decide the value of
 * any bit.  The result only references bits of the database.
 */
public class FabricBitstreamBuilder {

    private FabricBitstreamBuilder() {

    }

    /**
     * Builds the fabric bitstream starting from the top module, named
     * {@link Params#FBG_TOP_MODULE_NAME}, and the single root block of the
     * database.
     * @param blockTree The configuration bit database.
     * @param moduleManager The modules of the fabric.
     * @param configProtocol The configuration protocol of the fabric.
     * @param verbose Reports the number of bits built and the runtime if true.
     * @return The fabric bitstream.
     * @throws FabricBitstreamException If the two hierarchies do not match or
     * the protocol is not supported.
     */
    @NotNull
    public static FabricBitstream build(ConfigBlockTree blockTree, ModuleManager moduleManager,
                                        ConfigProtocol configProtocol, boolean verbose) {
        verbose = verbose || Params.FBG_VERBOSE;
        RuntimeTracker timer = new RuntimeTracker("Build fabric dependent bitstream");
        timer.start();

        String topModuleName = Params.FBG_TOP_MODULE_NAME;
        Module topModule = moduleManager.findModule(topModuleName);
        if (topModule == null) {
            throw new FabricBitstreamException("ERROR: Couldn't find top module '" + topModuleName + "'");
        }

        List<ConfigBlock> topBlocks = blockTree.getRootBlocks();
        if (topBlocks.size() != 1) {
            throw new FabricBitstreamException("ERROR: Expected exactly 1 top configuration block, found "
                    + topBlocks.size() + " " + topBlocks);
        }
        ConfigBlock topBlock = topBlocks.get(0);
        if (!topModuleName.equals(blockTree.getBlockName(topBlock))) {
            throw new FabricBitstreamException("ERROR: Top configuration block '" + blockTree.getBlockName(topBlock)
                    + "' does not match top module '" + topModuleName + "'");
        }

        FabricBitstream fabricBitstream = build(blockTree, topBlock, moduleManager, topModule, configProtocol);

        timer.stop();
        if (verbose) {
            MessageGenerator.printHeader("Fabric bitstream (" + configProtocol + ")");
            MessageGenerator.briefMessage("Built " + fabricBitstream.size() + " configuration bits for fabric");
            MessageGenerator.briefMessage(timer.toString());
        }
        return fabricBitstream;
    }

    /**
     * Builds the fabric bitstream of the given top-level block/module pair,
     * dispatching on the configuration protocol.  The bitstream must contain
     * every bit of the database.
     * @param blockTree The configuration bit database.
     * @param topBlock The block matching topModule.
     * @param moduleManager The modules of the fabric.
     * @param topModule The module to start from.
     * @param configProtocol The configuration protocol of the fabric.
     * @return The fabric bitstream.
     */
    @NotNull
    public static FabricBitstream build(ConfigBlockTree blockTree, ConfigBlock topBlock,
                                        ModuleManager moduleManager, Module topModule,
                                        ConfigProtocol configProtocol) {
        FabricBitstream fabricBitstream = new FabricBitstream();
        ConfigProtocolType type = configProtocol == null ? null : configProtocol.getType();
        if (type == null) {
            throw new FabricBitstreamException("ERROR: Invalid configuration protocol " + configProtocol);
        }

        switch (type) {
            case STANDALONE:
                new ChainBitstreamBuilder(blockTree, moduleManager).build(topBlock, topModule, fabricBitstream);
                break;
            case SCAN_CHAIN:
                new ChainBitstreamBuilder(blockTree, moduleManager).build(topBlock, topModule, fabricBitstream);
                fabricBitstream.reverse();
                break;
            case MEMORY_BANK:
                // Memory bank bits are placed elsewhere
                break;
            case FRAME_BASED:
                new FrameBitstreamBuilder(blockTree, moduleManager).build(topBlock, topModule, fabricBitstream);
                break;
            default:
                throw new FabricBitstreamException("ERROR: Invalid configuration protocol " + configProtocol);
        }

        int expected = blockTree.getBits().size();
        if (expected != fabricBitstream.size()) {
            if (Params.FBG_REPORT_UNTOUCHED_BITS) {
                reportUntouchedBits(blockTree, fabricBitstream);
            }
            throw new FabricBitstreamException("ERROR: Fabric bitstream of " + type + " protocol has "
                    + fabricBitstream.size() + " bits, expected " + expected
                    + " bits from the configuration bit database");
        }
        return fabricBitstream;
    }

    /**
     * Prints every configuration bit of the database that does not appear in
     * the fabric bitstream, along with the hierarchy of its block.
     * @return Number of untouched bits.
     */
    public static int reportUntouchedBits(ConfigBlockTree blockTree, FabricBitstream fabricBitstream) {
        BitSet touched = new BitSet(blockTree.getBits().size());
        for (FabricBit bit : fabricBitstream) {
            touched.set(bit.getConfigBit().getId());
        }
        int untouched = 0;
        for (ConfigBit bit : blockTree.getBits()) {
            if (!touched.get(bit.getId())) {
                MessageGenerator.briefError("bit (parent_block = "
                        + blockTree.getBlockHierarchyName(bit.getParentBlock()) + ") is not touched!");
                untouched++;
            }
        }
        return untouched;
    }

    /**
     * Finds the block matching a configurable child of parentModule, by the
     * child's instance name.
     */
    static ConfigBlock findChildBlock(ConfigBlockTree blockTree, ConfigBlock parentBlock,
                                      ModuleManager moduleManager, Module parentModule,
                                      ConfigurableChild child) {
        String instanceName = moduleManager.getInstanceName(parentModule, child.getModule(),
                child.getInstanceIndex());
        ConfigBlock childBlock = blockTree.findChildBlock(parentBlock, instanceName);
        if (childBlock == null) {
            throw new FabricBitstreamException("ERROR: Couldn't find configuration block '" + instanceName
                    + "' under " + blockTree.getBlockHierarchyName(parentBlock) + " for instance of module "
                    + child.getModule().getName() + " in module " + parentModule.getName());
        }
        return childBlock;
    }

    /**
     * Ensures a hierarchical block carries no configuration bits itself.
     */
    static void checkNoBits(ConfigBlockTree blockTree, ConfigBlock block) {
        int numBits = blockTree.getBlockBits(block).size();
        if (numBits != 0) {
            throw new FabricBitstreamException("ERROR: Hierarchical configuration block "
                    + blockTree.getBlockHierarchyName(block) + " owns " + numBits
                    + " configuration bit(s), only leaf blocks may own bits");
        }
    }
}
