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

/**
 * Describes the configuration protocol of a fabric.
 */
public class ConfigProtocol {

    private final ConfigProtocolType type;

    public ConfigProtocol(ConfigProtocolType type) {
        this.type = type;
    }

    public ConfigProtocolType getType() {
        return type;
    }

    @Override
    public String toString() {
        return String.valueOf(type);
    }
}
