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
import java.util.Collections;
import java.util.Iterator;
import java.util.List;

import com.fabricbitgen.config.ConfigBit;

/**
 * The configuration bits of a fabric in the order they are loaded.  Built
 * once by a {@link FabricBitstreamBuilder} and handed over to the caller.
 */
public class FabricBitstream implements Iterable<FabricBit> {

    private final List<FabricBit> bits = new ArrayList<>();

    /**
     * Appends a bit to the end of the bitstream.
     * @param configBit The configuration bit being loaded.
     * @return The new fabric bit.
     */
    public FabricBit addBit(ConfigBit configBit) {
        FabricBit bit = new FabricBit(configBit);
        bits.add(bit);
        return bit;
    }

    public void setBitAddress(FabricBit bit, boolean[] address) {
        bit.setAddress(address);
    }

    public void setBitDin(FabricBit bit, boolean din) {
        bit.setDin(din);
    }

    /**
     * Reverses the order of the bits, in place.
     */
    public void reverse() {
        Collections.reverse(bits);
    }

    public List<FabricBit> getBits() {
        return Collections.unmodifiableList(bits);
    }

    public FabricBit getBit(int index) {
        return bits.get(index);
    }

    public int size() {
        return bits.size();
    }

    public boolean isEmpty() {
        return bits.isEmpty();
    }

    /**
     * Gets the configuration values in load order, as chain protocols shift them in.
     * @return The values, one per fabric bit.
     */
    public List<Boolean> getValues() {
        List<Boolean> values = new ArrayList<>(bits.size());
        for (FabricBit bit : bits) {
            values.add(bit.getConfigBit().getValue());
        }
        return values;
    }

    @Override
    public Iterator<FabricBit> iterator() {
        return getBits().iterator();
    }

    @Override
    public String toString() {
        return "FabricBitstream[" + bits.size() + " bits]";
    }
}
