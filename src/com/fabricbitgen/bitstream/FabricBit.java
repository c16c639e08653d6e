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

import java.util.Arrays;

import com.fabricbitgen.config.ConfigBit;
import com.fabricbitgen.util.AddressEncoder;

/**
 * One bit of a {@link FabricBitstream}.  References a configuration bit and,
 * for frame-based protocols, carries the address and data input presented to
 * the frame decoders.
 */
public class FabricBit {

    private static final boolean[] NO_ADDRESS = new boolean[0];

    private final ConfigBit configBit;

    private boolean[] address = NO_ADDRESS;

    private boolean din;

    protected FabricBit(ConfigBit configBit) {
        this.configBit = configBit;
    }

    public ConfigBit getConfigBit() {
        return configBit;
    }

    /**
     * @return A copy of the address, most significant bit first. Empty for chain protocols.
     */
    public boolean[] getAddress() {
        return address.clone();
    }

    public int getAddressSize() {
        return address.length;
    }

    protected void setAddress(boolean[] address) {
        this.address = address.clone();
    }

    public boolean getDin() {
        return din;
    }

    protected void setDin(boolean din) {
        this.din = din;
    }

    @Override
    public String toString() {
        if (address.length == 0) {
            return configBit.toString();
        }
        return AddressEncoder.toBinaryString(address) + " " + (din ? '1' : '0');
    }

    @Override
    public int hashCode() {
        return 31 * (31 * configBit.getId() + Arrays.hashCode(address)) + Boolean.hashCode(din);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj)
            return true;
        if (obj == null || getClass() != obj.getClass())
            return false;
        FabricBit other = (FabricBit) obj;
        return configBit.getId() == other.configBit.getId()
                && din == other.din
                && Arrays.equals(address, other.address);
    }
}
