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
package com.fabricbitgen.module;

/**
 * Represents a port on a {@link Module}.  Only the name and width are
 * needed to build a fabric bitstream.
 */
public class ModulePort {

    private final Module parentModule;

    private final String name;

    private final int width;

    protected ModulePort(Module parentModule, String name, int width) {
        if (width < 1) {
            throw new RuntimeException("ERROR: Port " + name + " on module "
                    + parentModule.getName() + " must be at least 1 bit wide, got " + width);
        }
        this.parentModule = parentModule;
        this.name = name;
        this.width = width;
    }

    public Module getParentModule() {
        return parentModule;
    }

    public String getName() {
        return name;
    }

    public int getWidth() {
        return width;
    }

    @Override
    public String toString() {
        return width == 1 ? name : name + "[" + (width - 1) + ":0]";
    }
}
