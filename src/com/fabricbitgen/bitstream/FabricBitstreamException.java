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
 * Raised when a fabric bitstream cannot be built, because the configuration
 * bit database and the module hierarchy disagree or the protocol is not
 * supported.  No partial bitstream is returned.
 */
public class FabricBitstreamException extends RuntimeException {

    public FabricBitstreamException(String message) {
        super(message);
    }

    public FabricBitstreamException(String message, Throwable cause) {
        super(message, cause);
    }
}
