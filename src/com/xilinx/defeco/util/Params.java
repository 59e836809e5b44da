/*
 * Copyright (c) 2026, Advanced Micro Devices, Inc.
 * All rights reserved.
 *
 * This file is part of DefEco.
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

package com.xilinx.defeco.util;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Aims to be a centralized helper class to manage global DefEco settings. Each
 * setting can be provided either as an environment variable or as a JVM
 * parameter (-Dname=value) of the same name.
 */
public class Params {

    public static String DEFECO_BUFFER_MARKERS_NAME = "DEFECO_BUFFER_MARKERS";

    public static String DEFECO_OUTPUT_PINS_NAME = "DEFECO_OUTPUT_PINS";

    public static String DEFECO_INPUT_PINS_NAME = "DEFECO_INPUT_PINS";

    public static String DEFECO_MAX_ORDER_ITERATIONS_NAME = "DEFECO_MAX_ORDER_ITERATIONS";

    public static String DEFECO_VERBOSE_NAME = "DEFECO_VERBOSE";

    public static final List<String> DEFECO_DEFAULT_BUFFER_MARKERS = Collections.unmodifiableList(
            Arrays.asList("BUF", "HB1", "HB2"));

    public static final List<String> DEFECO_DEFAULT_OUTPUT_PINS = Collections.unmodifiableList(
            Arrays.asList("Y", "Z", "Q"));

    public static final List<String> DEFECO_DEFAULT_INPUT_PINS = Collections.unmodifiableList(
            Arrays.asList("A", "D", "IN"));

    public static int DEFECO_DEFAULT_MAX_ORDER_ITERATIONS = 1000;

    /**
     * Checks if the named DefEco parameter is set via an environment variable
     * or by a JVM parameter of the same name.
     *
     * @param key Name of the global DefEco parameter
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
     * Gets the integer value of the provided parameter name.
     *
     * @param key Name of the system parameter to get.
     * @return The set integer value of the parameter, or null if none was set. If
     *         the property is set to a value that is not a parsable integer, a
     *         warning message is produced and returns null.
     */
    public static Integer getParamIntValue(String key) {
        String value = getParamValue(key);
        if (value != null) {
            try {
                return Integer.parseInt(value.trim());
            } catch (NumberFormatException e) {
                MessageGenerator.briefError("WARNING: Couldn't interpret the value '" + value
                        + "' from the parameter '" + key + "' as an integer.");
            }
        }
        return null;
    }

    /**
     * Gets the string value of the provided parameter name. Environment variables
     * take precedence over JVM parameters.
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
     * Reads an integer parameter, falling back to a default.
     *
     * @param key          Name of the system parameter to check.
     * @param defaultValue Returned if the parameter is unset or not an integer.
     * @return The parameter value or defaultValue.
     */
    public static int getParamOrDefaultIntSetting(String key, int defaultValue) {
        Integer setValue = getParamIntValue(key);
        return setValue == null ? defaultValue : setValue;
    }

    /**
     * Reads a comma separated list parameter. Empty entries are ignored.
     *
     * @param key          Name of the system parameter to check.
     * @param defaultValue The list returned if the parameter is not set or only
     *                     holds empty entries.
     * @return The parsed list or defaultValue.
     */
    public static List<String> getParamOrDefaultListSetting(String key, List<String> defaultValue) {
        String value = getParamValue(key);
        if (value == null) {
            return defaultValue;
        }
        List<String> entries = splitList(value);
        return entries.isEmpty() ? defaultValue : entries;
    }

    /**
     * Splits a comma separated string into its trimmed, non-empty entries.
     * @param value The string to split.
     * @return A new list of entries, in the order given.
     */
    public static List<String> splitList(String value) {
        List<String> entries = new ArrayList<>();
        for (String s : value.split(",")) {
            String entry = s.trim();
            if (!entry.isEmpty()) {
                entries.add(entry);
            }
        }
        return entries;
    }
}
