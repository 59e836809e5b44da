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

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

import com.xilinx.defeco.def.DEFConnection;

/**
 * Splices a new buffer into an existing net: the listed loads move onto the
 * buffer's output net.
 * {@code insert_buffer {<load1> <load2> ...} <buffer_type> <buffer_instance> <output_net>}
 */
public class InsertBufferCommand implements ECOCommand {

    public static final String COMMAND = "insert_buffer";

    private final String bufferName;

    private final String bufferType;

    private final List<DEFConnection> loads;

    private final String outputNetName;

    private final String inputNetName;

    /**
     * @param bufferName Instance name of the new buffer
     * @param bufferType Cell type of the new buffer
     * @param loads Terminals driven by the buffer, in net order, must not be empty
     * @param outputNetName The net the buffer drives
     * @param inputNetName The net feeding the buffer, null if unknown
     */
    public InsertBufferCommand(String bufferName, String bufferType, List<DEFConnection> loads,
            String outputNetName, String inputNetName) {
        this.bufferName = Objects.requireNonNull(bufferName);
        this.bufferType = Objects.requireNonNull(bufferType);
        this.outputNetName = Objects.requireNonNull(outputNetName);
        this.inputNetName = inputNetName;
        if (loads.isEmpty()) {
            throw new IllegalArgumentException("Buffer " + bufferName + " must drive at least one load");
        }
        this.loads = Collections.unmodifiableList(new ArrayList<>(loads));
    }

    @Override
    public String getInstanceName() {
        return bufferName;
    }

    @Override
    public String getCellType() {
        return bufferType;
    }

    public List<DEFConnection> getLoads() {
        return loads;
    }

    public String getOutputNetName() {
        return outputNetName;
    }

    /**
     * @return The net feeding the buffer's input, or null if none was found
     */
    public String getInputNetName() {
        return inputNetName;
    }

    /**
     * @return Instance names of all loads, in load order
     */
    public Set<String> getReferencedInstanceNames() {
        Set<String> names = new LinkedHashSet<>();
        for (DEFConnection load : loads) {
            names.add(load.getInstanceName());
        }
        return names;
    }

    /**
     * Top-level I/O pins are named after the net they sit on, so a load on a
     * top-level pin references that net by name.
     * @return Net names referenced by the loads, in load order
     */
    public Set<String> getReferencedNetNames() {
        Set<String> names = new LinkedHashSet<>();
        for (DEFConnection load : loads) {
            if (load.isTopLevelPin()) {
                names.add(load.getPinName());
            }
        }
        return names;
    }

    @Override
    public String toCommandString() {
        StringBuilder sb = new StringBuilder(COMMAND);
        sb.append(" {");
        boolean first = true;
        for (DEFConnection load : loads) {
            if (!first) sb.append(' ');
            sb.append(load.getFullName());
            first = false;
        }
        sb.append("} ").append(bufferType).append(' ').append(bufferName).append(' ').append(outputNetName);
        return sb.toString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        InsertBufferCommand that = (InsertBufferCommand) o;
        return bufferName.equals(that.bufferName) && bufferType.equals(that.bufferType)
                && loads.equals(that.loads) && outputNetName.equals(that.outputNetName)
                && Objects.equals(inputNetName, that.inputNetName);
    }

    @Override
    public int hashCode() {
        return Objects.hash(bufferName, bufferType, loads, outputNetName, inputNetName);
    }

    @Override
    public String toString() {
        return toCommandString();
    }
}
