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
import java.util.List;

import com.xilinx.defeco.diagnostics.ECODiagnostic;

/**
 * The ECO changelist transforming one design into another: all sizing
 * commands followed by the buffer insertions in dependency order, along with
 * the diagnostics collected while producing them.
 */
public class ECOChangelist {

    private final List<SizeCellCommand> sizingCommands;

    private final BufferOrdering bufferOrdering;

    private final List<ECODiagnostic> diagnostics;

    public ECOChangelist(List<SizeCellCommand> sizingCommands, BufferOrdering bufferOrdering,
            List<ECODiagnostic> diagnostics) {
        this.sizingCommands = Collections.unmodifiableList(new ArrayList<>(sizingCommands));
        this.bufferOrdering = bufferOrdering;
        this.diagnostics = Collections.unmodifiableList(new ArrayList<>(diagnostics));
    }

    public List<SizeCellCommand> getSizingCommands() {
        return sizingCommands;
    }

    public List<InsertBufferCommand> getBufferingCommands() {
        return bufferOrdering.getCommands();
    }

    public BufferOrdering getBufferOrdering() {
        return bufferOrdering;
    }

    /**
     * @return True if some buffers could not be ordered by their dependencies
     */
    public boolean isFallback() {
        return bufferOrdering.isFallback();
    }

    public List<ECODiagnostic> getDiagnostics() {
        return diagnostics;
    }

    public List<ECODiagnostic> getWarnings() {
        List<ECODiagnostic> warnings = new ArrayList<>();
        for (ECODiagnostic d : diagnostics) {
            if (d.isWarning()) {
                warnings.add(d);
            }
        }
        return warnings;
    }

    /**
     * @return All commands, sizing first, in emission order
     */
    public List<ECOCommand> getCommands() {
        List<ECOCommand> commands = new ArrayList<>(sizingCommands);
        commands.addAll(getBufferingCommands());
        return commands;
    }

    public List<String> getCommandLines() {
        List<String> lines = new ArrayList<>();
        for (ECOCommand cmd : getCommands()) {
            lines.add(cmd.toCommandString());
        }
        return lines;
    }

    public int getTotalChangeCount() {
        return sizingCommands.size() + getBufferingCommands().size();
    }

    public boolean isEmpty() {
        return getTotalChangeCount() == 0;
    }

    @Override
    public String toString() {
        return "ECOChangelist(" + sizingCommands.size() + " sizing, " + getBufferingCommands().size()
                + " buffering)";
    }
}
