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

/**
 * A single configuration bit owned by a leaf {@link ConfigBlock}. The value is
 * assigned by the producer of the {@link ConfigBlockTree} and never changes.
 */
public class ConfigBit {

    private final int id;

    private final boolean value;

    private final ConfigBlock parentBlock;

    protected ConfigBit(int id, boolean value, ConfigBlock parentBlock) {
        this.id = id;
        this.value = value;
        this.parentBlock = parentBlock;
    }

    /**
     * @return Index of this bit in its tree's bit list
     */
    public int getId() {
        return id;
    }

    public boolean getValue() {
        return value;
    }

    /**
     * @return the block owning this bit
     */
    public ConfigBlock getParentBlock() {
        return parentBlock;
    }

    @Override
    public String toString() {
        return "bit" + id + "=" + (value ? '1' : '0');
    }
}
