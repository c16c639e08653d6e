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

import java.util.Arrays;
import java.util.List;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

public class TestConfigBlockTree {

    @Test
    public void testHierarchy() {
        ConfigBlockTree tree = new ConfigBlockTree();
        ConfigBlock top = tree.createBlock("fpga_top", null);
        ConfigBlock grid = tree.createBlock("grid_clb_1_", top);
        ConfigBlock mem = tree.createBlock("mem_lut_0_", grid);
        List<ConfigBit> bits = tree.addBits(mem, 1, 0, 1);

        Assertions.assertEquals(Arrays.asList(top), tree.getRootBlocks());
        Assertions.assertSame(grid, tree.findChildBlock(top, "grid_clb_1_"));
        Assertions.assertNull(tree.findChildBlock(top, "mem_lut_0_"));
        Assertions.assertEquals(bits, tree.getBlockBits(mem));
        Assertions.assertTrue(tree.getBlockBits(grid).isEmpty());
        Assertions.assertEquals(3, tree.getBits().size());
        Assertions.assertTrue(tree.getBitValue(bits.get(0)));
        Assertions.assertFalse(tree.getBitValue(bits.get(1)));
        Assertions.assertSame(mem, bits.get(2).getParentBlock());
        Assertions.assertEquals(2, bits.get(2).getId());
        Assertions.assertSame(mem, tree.getBlock(mem.getId()));

        Assertions.assertEquals(Arrays.asList(top, grid, mem), tree.getBlocks());
        Assertions.assertTrue(tree.hasChildren(grid));
        Assertions.assertFalse(tree.hasChildren(mem));
        Assertions.assertEquals(Arrays.asList(top, grid, mem), tree.getBlockHierarchy(mem));
        Assertions.assertEquals("/fpga_top/grid_clb_1_/mem_lut_0_", tree.getBlockHierarchyName(mem));
    }

    @Test
    public void testChildOrder() {
        ConfigBlockTree tree = new ConfigBlockTree();
        ConfigBlock top = tree.createBlock("top", null);
        ConfigBlock b = tree.createBlock("b", top);
        ConfigBlock a = tree.createBlock("a", top);
        Assertions.assertEquals(Arrays.asList(b, a), List.copyOf(tree.getChildren(top)));
    }

    @Test
    public void testMultipleRoots() {
        ConfigBlockTree tree = new ConfigBlockTree();
        tree.createBlock("top0", null);
        tree.createBlock("top1", null);
        Assertions.assertEquals(2, tree.getRootBlocks().size());
    }

    @Test
    public void testNameCollision() {
        ConfigBlockTree tree = new ConfigBlockTree();
        ConfigBlock top = tree.createBlock("top", null);
        ConfigBlock first = tree.createBlock("mem_0_", top);
        RuntimeException e = Assertions.assertThrows(RuntimeException.class,
                () -> tree.createBlock("mem_0_", top));
        Assertions.assertEquals("ERROR: Name collision inside ConfigBlock top, trying to add block mem_0_"
                + " which already exists inside this block.", e.getMessage());
        Assertions.assertSame(first, tree.findChildBlock(top, "mem_0_"));
    }

    @Test
    public void testInvalidBitValue() {
        ConfigBlockTree tree = new ConfigBlockTree();
        ConfigBlock top = tree.createBlock("top", null);
        Assertions.assertThrows(RuntimeException.class, () -> tree.addBits(top, 2));
    }

    @Test
    public void testForeignBlock() {
        ConfigBlockTree tree = new ConfigBlockTree();
        ConfigBlockTree other = new ConfigBlockTree();
        tree.createBlock("top", null);
        other.createBlock("a", null);
        ConfigBlock foreign = other.createBlock("b", null);
        Assertions.assertThrows(RuntimeException.class, () -> tree.addBit(foreign, true));
    }
}
