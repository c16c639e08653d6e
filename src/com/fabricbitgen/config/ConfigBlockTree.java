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
package com.fabricbitgen.config;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;

import org.jetbrains.annotations.NotNull;

/**
 * Database of configuration blocks and the configuration bits they own,
 * independent of the physical fabric.  Blocks and bits are kept in
 * creation order and addressed by their integer id.
 */
public class ConfigBlockTree {

    private final List<ConfigBlock> blocks = new ArrayList<>();

    private final List<ConfigBit> bits = new ArrayList<>();

    /**
     * Creates a new block.
     * @param name Name of the block, used as the join key against module instance names.
     * @param parent Parent block, or null to create a root block.
     * @return The newly created block.
     */
    public ConfigBlock createBlock(String name, ConfigBlock parent) {
        if (name == null || name.isEmpty()) {
            throw new RuntimeException("ERROR: ConfigBlock name must not be empty");
        }
        ConfigBlock block = new ConfigBlock(blocks.size(), name, parent);
        if (parent != null) {
            checkOwner(parent);
            parent.addChild(block);
        }
        blocks.add(block);
        return block;
    }

    /**
     * Creates a new configuration bit owned by the provided block.
     * @param block The block owning the bit.
     * @param value The configuration value of the bit.
     * @return The newly created bit.
     */
    public ConfigBit addBit(ConfigBlock block, boolean value) {
        checkOwner(block);
        ConfigBit bit = new ConfigBit(bits.size(), value, block);
        block.addBit(bit);
        bits.add(bit);
        return bit;
    }

    /**
     * Convenience method to add several bits at once, given as 0/1 values.
     * @param block The block owning the bits.
     * @param values Values of the bits, each 0 or 1.
     * @return The newly created bits in the order provided.
     */
    public List<ConfigBit> addBits(ConfigBlock block, int... values) {
        List<ConfigBit> added = new ArrayList<>(values.length);
        for (int value : values) {
            if (value != 0 && value != 1) {
                throw new RuntimeException("ERROR: Invalid configuration bit value " + value);
            }
            added.add(addBit(block, value == 1));
        }
        return added;
    }

    private void checkOwner(ConfigBlock block) {
        if (block.getId() >= blocks.size() || blocks.get(block.getId()) != block) {
            throw new RuntimeException("ERROR: ConfigBlock " + block.getName() + " does not belong to this tree");
        }
    }

    public List<ConfigBlock> getBlocks() {
        return Collections.unmodifiableList(blocks);
    }

    /**
     * @return Every configuration bit in the database, in creation order
     */
    public List<ConfigBit> getBits() {
        return Collections.unmodifiableList(bits);
    }

    public ConfigBlock getBlock(int id) {
        return blocks.get(id);
    }

    public ConfigBit getBit(int id) {
        return bits.get(id);
    }

    /**
     * Finds all blocks without a parent.
     * @return The root blocks, in creation order.
     */
    public List<ConfigBlock> getRootBlocks() {
        List<ConfigBlock> roots = new ArrayList<>();
        for (ConfigBlock block : blocks) {
            if (block.isRoot()) {
                roots.add(block);
            }
        }
        return roots;
    }

    public Collection<ConfigBlock> getChildren(ConfigBlock block) {
        return block.getChildren();
    }

    /**
     * Finds the child block of the given name.
     * @param parent The parent block.
     * @param name Name of the child block.
     * @return The child block, or null if none found by that name.
     */
    public ConfigBlock findChildBlock(ConfigBlock parent, String name) {
        return parent.getChild(name);
    }

    public boolean hasChildren(ConfigBlock block) {
        return block.hasChildren();
    }

    public List<ConfigBit> getBlockBits(ConfigBlock block) {
        return block.getBits();
    }

    public boolean getBitValue(ConfigBit bit) {
        return bit.getValue();
    }

    public String getBlockName(ConfigBlock block) {
        return block.getName();
    }

    /**
     * Gets the blocks from the root down to and including the provided block.
     * @param block The bottom block of the hierarchy.
     * @return The list of blocks, root first.
     */
    @NotNull
    public List<ConfigBlock> getBlockHierarchy(ConfigBlock block) {
        List<ConfigBlock> hierarchy = new ArrayList<>();
        for (ConfigBlock b = block; b != null; b = b.getParent()) {
            hierarchy.add(b);
        }
        Collections.reverse(hierarchy);
        return hierarchy;
    }

    /**
     * Builds the full hierarchical name of a block, such as "/fpga_top/grid_1_1_/mem".
     * @param block The block to name.
     * @return The hierarchical name, each level prefixed by '/'.
     */
    @NotNull
    public String getBlockHierarchyName(ConfigBlock block) {
        StringBuilder sb = new StringBuilder();
        for (ConfigBlock b : getBlockHierarchy(block)) {
            sb.append('/');
            sb.append(b.getName());
        }
        return sb.toString();
    }
}
