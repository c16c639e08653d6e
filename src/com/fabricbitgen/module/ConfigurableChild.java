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

import java.util.Objects;

/**
 * One entry of a module's configurable children: a child module together
 * with the index of its instance inside the parent.
 */
public class ConfigurableChild {

    private final Module module;

    private final int instanceIndex;

    public ConfigurableChild(Module module, int instanceIndex) {
        this.module = module;
        this.instanceIndex = instanceIndex;
    }

    public Module getModule() {
        return module;
    }

    public int getInstanceIndex() {
        return instanceIndex;
    }

    @Override
    public int hashCode() {
        return Objects.hash(module, instanceIndex);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj)
            return true;
        if (obj == null || getClass() != obj.getClass())
            return false;
        ConfigurableChild other = (ConfigurableChild) obj;
        return instanceIndex == other.instanceIndex && Objects.equals(module, other.module);
    }

    @Override
    public String toString() {
        return "<" + module.getName() + "," + instanceIndex + ">";
    }
}
