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
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A named node of the configuration bit database.  Can be both a leaf
 * block owning configuration bits or a hierarchical block owning other
 * blocks.  The name is the instance name of the matching module instance
 * in the fabric.
 */
public class ConfigBlock {

    private final int id;

    private final String name;

    private final ConfigBlock parent;

    private Map<String, ConfigBlock> children;

    private List<ConfigBit> bits;

    protected ConfigBlock(int id, String name, ConfigBlock parent) {
        this.id = id;
        this.name = name;
        this.parent = parent;
    }

    /**
     * @return Index of this block in its tree's block list
     */
    public int getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    /**
     * @return the parent block, or null if this is a root block
     */
    public ConfigBlock getParent() {
        return parent;
    }

    public boolean isRoot() {
        return parent == null;
    }

    /**
     * Adds a child block, checking for a name collision.
     * @param child The block to add.
     */
    protected void addChild(ConfigBlock child) {
        if (children == null) children = new LinkedHashMap<>();
        ConfigBlock collision = children.put(child.getName(), child);
        if (collision != null && collision != child) {
            children.put(collision.getName(), collision);
            throw new RuntimeException("ERROR: Name collision inside ConfigBlock " +
                    getName() + ", trying to add block " + child.getName() +
                    " which already exists inside this block.");
        }
    }

    protected void addBit(ConfigBit bit) {
        if (bits == null) bits = new ArrayList<>();
        bits.add(bit);
    }

    /**
     * Gets the child blocks in the order they were added.
     * @return The child blocks, empty for a leaf block.
     */
    public Collection<ConfigBlock> getChildren() {
        return children == null ? Collections.emptyList() : Collections.unmodifiableCollection(children.values());
    }

    /**
     * Gets the named child block.
     * @param childName Name of the child block.
     * @return The child block, or null if none found by that name.
     */
    public ConfigBlock getChild(String childName) {
        return children == null ? null : children.get(childName);
    }

    public boolean hasChildren() {
        return children != null && !children.isEmpty();
    }

    /**
     * Gets the configuration bits owned directly by this block, in storage order.
     * @return The owned bits, empty for a hierarchical block.
     */
    public List<ConfigBit> getBits() {
        return bits == null ? Collections.emptyList() : Collections.unmodifiableList(bits);
    }

    @Override
    public String toString() {
        return name;
    }
}
