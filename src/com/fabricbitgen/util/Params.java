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
package com.fabricbitgen.util;

/**
 * Aims to be a centralized helper class to manage global FabricBitGen settings.
 */
public class Params {

    public static String FBG_TOP_MODULE_NAME_NAME = "FBG_TOP_MODULE_NAME";

    public static String FBG_DECODER_ADDRESS_PORT_NAME_NAME = "FBG_DECODER_ADDRESS_PORT_NAME";

    public static String FBG_REPORT_UNTOUCHED_BITS_NAME = "FBG_REPORT_UNTOUCHED_BITS";

    public static String FBG_VERBOSE_NAME = "FBG_VERBOSE";

    public static String FBG_DEFAULT_TOP_MODULE_NAME = "fpga_top";

    public static String FBG_DEFAULT_DECODER_ADDRESS_PORT_NAME = "address";

    /**
     * Name of the top-level module of the fabric. The root configuration block
     * must carry the same name.
     */
    public static String FBG_TOP_MODULE_NAME = getParamOrDefaultSetting(FBG_TOP_MODULE_NAME_NAME,
            FBG_DEFAULT_TOP_MODULE_NAME);

    /**
     * Name of the address port on frame decoders. Its width decides how many
     * address bits a level of the hierarchy contributes.
     */
    public static String FBG_DECODER_ADDRESS_PORT_NAME = getParamOrDefaultSetting(FBG_DECODER_ADDRESS_PORT_NAME_NAME,
            FBG_DEFAULT_DECODER_ADDRESS_PORT_NAME);

    /**
     * Flag to have the bitstream builder list every configuration bit missing
     * from the fabric bitstream when the final size check fails. This walks the
     * whole bit database and is meant for debugging only.
     */
    public static boolean FBG_REPORT_UNTOUCHED_BITS = isParamSet(FBG_REPORT_UNTOUCHED_BITS_NAME);

    /**
     * Forces verbose reporting of bitstream builds regardless of the caller's
     * setting.
     */
    public static boolean FBG_VERBOSE = isParamSet(FBG_VERBOSE_NAME);

    /**
     * Checks if the named FabricBitGen parameter is set via an environment variable
     * or by a JVM parameter of the same name.
     *
     * @param key Name of the global FabricBitGen parameter
     * @return True if the parameter is set (as defined by {@link #isSet(String)}),
     *         false otherwise
     */
    public static boolean isParamSet(String key) {
        return isSet(System.getenv(key)) || isSet(System.getProperty(key));
    }

    /**
     * Checks if a parameter is set by examining the provided value.
     *
     * @param value An environment variable or JVM parameter value
     * @return True if (1) value is not null, (2) is not an empty string, (3) is not
     *         0 and (4) is not false (case-insensitive).
     */
    public static boolean isSet(String value) {
        return !( value == null
               || value.length() == 0
               || value.equals("0")
               || value.toLowerCase().equals("false")
               );
    }

    /**
     * Gets the string value of the provided parameter name.
     *
     * @param key Name of the system parameter to get.
     * @return The set string value of the parameter, or null if none was set.
     */
    public static String getParamValue(String key) {
        String value = System.getenv(key);
        if (value == null) {
            value = System.getProperty(key);
        }
        return value;
    }

    /**
     * Checks the parameter value of the provided key. If it is set to a non-empty
     * string, it returns the set value. Otherwise it will return the default value.
     *
     * @param key          Name of the system parameter to check.
     * @param defaultValue The default value to return if the parameter is not set.
     * @return The system parameter value if is set, otherwise it returns
     *         defaultValue.
     */
    public static String getParamOrDefaultSetting(String key, String defaultValue) {
        String value = getParamValue(key);
        return (value == null || value.isEmpty()) ? defaultValue : value;
    }

}
