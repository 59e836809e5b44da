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

package com.xilinx.defeco.eco;

import java.util.Collection;
import java.util.regex.Pattern;

/**
 * Helpers to reason about standard cell type names such as {@code INVx1},
 * {@code INVxp5} or {@code BUFx2_ASAP7_75t_R}, where the drive strength is
 * encoded as a size marker 'x' followed by an integer or a fractional
 * ('p' prefixed) magnitude.
 */
public class CellTypeTools {

    public static final String SIZE_MARKER = "x";

    /** Size marker, integer or fractional strength, optional trailing letters */
    private static final Pattern SIZE_SUFFIX = Pattern.compile("x(?:\\d+|p\\d+)[a-zA-Z]*");

    /**
     * Strips every drive strength encoding from a cell type name.
     * @param cellType The cell type name
     * @return The cell type with each strength replaced by the bare size marker,
     *         e.g. both {@code INVx8} and {@code INVxp5} become {@code INVx}
     */
    public static String getBaseFunction(String cellType) {
        return SIZE_SUFFIX.matcher(cellType).replaceAll(SIZE_MARKER);
    }

    /**
     * Checks if two cell types implement the same logic function, i.e. only
     * their drive strengths differ.
     * @param origType Cell type in the original design
     * @param modType Cell type in the modified design
     * @return True if both types share the same base function
     */
    public static boolean isSameFunction(String origType, String modType) {
        return getBaseFunction(origType).equals(getBaseFunction(modType));
    }

    /**
     * Checks if a cell type belongs to one of the buffer families.
     * @param cellType The cell type name
     * @param bufferMarkers Substrings identifying buffer families (e.g. BUF, HB1)
     * @return True if the cell type contains any of the markers
     */
    public static boolean isBufferType(String cellType, Collection<String> bufferMarkers) {
        for (String marker : bufferMarkers) {
            if (cellType.contains(marker)) {
                return true;
            }
        }
        return false;
    }
}
