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

package com.xilinx.defeco.def;

import java.util.Objects;

/**
 * A placed cell instance from the COMPONENTS section: its instance name and
 * the name of its cell type (logic function plus drive strength variant).
 */
public class DEFComponent {

    private final String name;

    private final String cellType;

    public DEFComponent(String name, String cellType) {
        this.name = Objects.requireNonNull(name);
        this.cellType = Objects.requireNonNull(cellType);
    }

    public String getName() {
        return name;
    }

    public String getCellType() {
        return cellType;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        DEFComponent that = (DEFComponent) o;
        return name.equals(that.name) && cellType.equals(that.cellType);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, cellType);
    }

    @Override
    public String toString() {
        return name + " (" + cellType + ")";
    }
}
