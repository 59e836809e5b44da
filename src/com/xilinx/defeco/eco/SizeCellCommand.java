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

import java.util.Objects;

/**
 * Replaces the cell type of an existing instance with another drive strength
 * variant of the same function: {@code size_cell <instance> <new_cell_type>}.
 */
public class SizeCellCommand implements ECOCommand {

    public static final String COMMAND = "size_cell";

    private final String instanceName;

    private final String originalCellType;

    private final String cellType;

    public SizeCellCommand(String instanceName, String originalCellType, String cellType) {
        this.instanceName = Objects.requireNonNull(instanceName);
        this.originalCellType = Objects.requireNonNull(originalCellType);
        this.cellType = Objects.requireNonNull(cellType);
    }

    @Override
    public String getInstanceName() {
        return instanceName;
    }

    public String getOriginalCellType() {
        return originalCellType;
    }

    @Override
    public String getCellType() {
        return cellType;
    }

    @Override
    public String toCommandString() {
        return COMMAND + " " + instanceName + " " + cellType;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        SizeCellCommand that = (SizeCellCommand) o;
        return instanceName.equals(that.instanceName)
                && originalCellType.equals(that.originalCellType)
                && cellType.equals(that.cellType);
    }

    @Override
    public int hashCode() {
        return Objects.hash(instanceName, originalCellType, cellType);
    }

    @Override
    public String toString() {
        return toCommandString();
    }
}
