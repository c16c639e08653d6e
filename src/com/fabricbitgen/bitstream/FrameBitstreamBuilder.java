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

import java.util.ArrayList;
import java.util.List;

import com.fabricbitgen.config.ConfigBit;
import com.fabricbitgen.config.ConfigBlock;
import com.fabricbitgen.config.ConfigBlockTree;
import com.fabricbitgen.module.ConfigurableChild;
import com.fabricbitgen.module.Module;
import com.fabricbitgen.module.ModulePort;
import com.fabricbitgen.module.ModuleManager;
import com.fabricbitgen.util.AddressEncoder;
import com.fabricbitgen.util.MessageGenerator;
import com.fabricbitgen.util.Params;

/**
 * Builds the bitstream of the frame-based configuration protocol.  Follows
 * the same depth-first walk as {@link ChainBitstreamBuilder} and additionally
 * assigns every bit the address of its memory.
 * <p>
 * A module with two or more configurable children ends its list with a frame
 * decoder.  The decoder is not walked; the width of its address port tells
 * how many bits are used to select each of the other children.  The address
 * of a bit is the concatenation of these selections from the top module
 * down:
 * <pre>
 *   &lt;address in top&gt; ... &lt;address in parent module&gt;
 * </pre>
 * The data input of each bit is its configuration value.
 */
public class FrameBitstreamBuilder {

    private final ConfigBlockTree blockTree;

    private final ModuleManager moduleManager;

    private final String decoderAddressPortName;

    public FrameBitstreamBuilder(ConfigBlockTree blockTree, ModuleManager moduleManager) {
        this(blockTree, moduleManager, Params.FBG_DECODER_ADDRESS_PORT_NAME);
    }

    public FrameBitstreamBuilder(ConfigBlockTree blockTree, ModuleManager moduleManager,
                                 String decoderAddressPortName) {
        this.blockTree = blockTree;
        this.moduleManager = moduleManager;
        this.decoderAddressPortName = decoderAddressPortName;
    }

    /**
     * Builds the addressed bitstream below a top-level block/module pair.
     * @param topBlock The root block.
     * @param topModule The module matching the root block.
     * @param fabricBitstream The bitstream to append to.
     */
    public void build(ConfigBlock topBlock, Module topModule, FabricBitstream fabricBitstream) {
        List<ConfigBlock> blocks = new ArrayList<>();
        blocks.add(topBlock);
        List<Module> modules = new ArrayList<>();
        modules.add(topModule);
        build(blocks, modules, new boolean[0], fabricBitstream);
    }

    /**
     * Appends the addressed bits below the last block of parentBlocks.
     * @param parentBlocks Blocks from the top down to the current one.
     * @param parentModules Modules matching parentBlocks, one per level.
     * @param addrCode Address accumulated from the levels above.
     * @param fabricBitstream The bitstream to append to.
     */
    public void build(List<ConfigBlock> parentBlocks, List<Module> parentModules,
                      boolean[] addrCode, FabricBitstream fabricBitstream) {
        ConfigBlock parentBlock = parentBlocks.get(parentBlocks.size() - 1);
        Module parentModule = parentModules.get(parentModules.size() - 1);

        if (blockTree.hasChildren(parentBlock)) {
            List<ConfigurableChild> children = moduleManager.getConfigurableChildren(parentModule);
            int numChildren = children.size();

            if (numChildren == 0) {
                MessageGenerator.briefWarning("Module " + parentModule.getName()
                        + " has no configurable children, skipping the bits below "
                        + blockTree.getBlockHierarchyName(parentBlock));
                return;
            }

            // A single child needs no decoder, its address passes through
            int addrWidth = 0;
            if (numChildren > 1) {
                numChildren--;
                addrWidth = getDecoderAddressWidth(parentModule, children.get(numChildren).getModule());
            }

            for (int childId = 0; childId < numChildren; childId++) {
                ConfigurableChild child = children.get(childId);
                ConfigBlock childBlock = FabricBitstreamBuilder.findChildBlock(blockTree, parentBlock,
                        moduleManager, parentModule, child);

                List<ConfigBlock> childBlocks = new ArrayList<>(parentBlocks);
                childBlocks.add(childBlock);
                List<Module> childModules = new ArrayList<>(parentModules);
                childModules.add(child.getModule());

                boolean[] childAddrCode = addrCode;
                if (addrWidth > 0) {
                    childAddrCode = concat(addrCode, encodeChildAddress(parentModule, childId, addrWidth));
                }

                build(childBlocks, childModules, childAddrCode, fabricBitstream);
            }
            FabricBitstreamBuilder.checkNoBits(blockTree, parentBlock);
        }

        for (ConfigBit bit : blockTree.getBlockBits(parentBlock)) {
            FabricBit fabricBit = fabricBitstream.addBit(bit);
            fabricBitstream.setBitAddress(fabricBit, addrCode);
            fabricBitstream.setBitDin(fabricBit, blockTree.getBitValue(bit));
        }
    }

    private int getDecoderAddressWidth(Module parentModule, Module decoder) {
        ModulePort addrPort = moduleManager.findPort(decoder, decoderAddressPortName);
        if (addrPort == null) {
            throw new FabricBitstreamException("ERROR: Decoder " + decoder.getName() + " in module "
                    + parentModule.getName() + " has no address port named '" + decoderAddressPortName + "'");
        }
        return addrPort.getWidth();
    }

    private static boolean[] encodeChildAddress(Module parentModule, int childId, int addrWidth) {
        try {
            return AddressEncoder.encode(childId, addrWidth);
        } catch (IllegalArgumentException e) {
            throw new FabricBitstreamException("ERROR: Decoder of module " + parentModule.getName()
                    + " is too narrow (" + addrWidth + " address bits) to select configurable child "
                    + childId, e);
        }
    }

    private static boolean[] concat(boolean[] head, boolean[] tail) {
        boolean[] result = new boolean[head.length + tail.length];
        System.arraycopy(head, 0, result, 0, head.length);
        System.arraycopy(tail, 0, result, head.length, tail.length);
        return result;
    }
}
