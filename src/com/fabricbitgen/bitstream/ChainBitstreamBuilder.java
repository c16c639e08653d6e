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

import java.util.List;

import com.fabricbitgen.config.ConfigBit;
import com.fabricbitgen.config.ConfigBlock;
import com.fabricbitgen.config.ConfigBlockTree;
import com.fabricbitgen.module.ConfigurableChild;
import com.fabricbitgen.module.Module;
import com.fabricbitgen.module.ModuleManager;
import com.fabricbitgen.util.MessageGenerator;

/**
 * Builds the bitstream of configuration chain-like protocols (standalone
 * memories and scan chains).  Walks all configurable children of a module
 * depth-first, using each child's instance name to find the matching block
 * of configuration bits.  The resulting order follows the configurable
 * children of every module, which is the order memories are chained in.
 */
public class ChainBitstreamBuilder {

    private final ConfigBlockTree blockTree;

    private final ModuleManager moduleManager;

    public ChainBitstreamBuilder(ConfigBlockTree blockTree, ModuleManager moduleManager) {
        this.blockTree = blockTree;
        this.moduleManager = moduleManager;
    }

    /**
     * Appends the bits below parentBlock to the bitstream, in chain order.
     * @param parentBlock The block matching parentModule.
     * @param parentModule The module to walk.
     * @param fabricBitstream The bitstream to append to.
     */
    public void build(ConfigBlock parentBlock, Module parentModule, FabricBitstream fabricBitstream) {
        // Dive into the children first
        if (blockTree.hasChildren(parentBlock)) {
            List<ConfigurableChild> children = moduleManager.getConfigurableChildren(parentModule);
            if (children.isEmpty()) {
                MessageGenerator.briefWarning("Module " + parentModule.getName()
                        + " has no configurable children, skipping the bits below "
                        + blockTree.getBlockHierarchyName(parentBlock));
            }
            for (ConfigurableChild child : children) {
                ConfigBlock childBlock = FabricBitstreamBuilder.findChildBlock(blockTree, parentBlock,
                        moduleManager, parentModule, child);
                build(childBlock, child.getModule(), fabricBitstream);
            }
            FabricBitstreamBuilder.checkNoBits(blockTree, parentBlock);
        }

        for (ConfigBit bit : blockTree.getBlockBits(parentBlock)) {
            fabricBitstream.addBit(bit);
        }
    }
}
