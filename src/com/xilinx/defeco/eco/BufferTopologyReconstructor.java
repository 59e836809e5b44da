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
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.xilinx.defeco.def.DEFComponent;
import com.xilinx.defeco.def.DEFConnection;
import com.xilinx.defeco.def.DEFDesign;
import com.xilinx.defeco.def.DEFNet;
import com.xilinx.defeco.diagnostics.ECODiagnostic;
import com.xilinx.defeco.diagnostics.ECODiagnosticType;

/**
 * Locates each new buffer in the modified design's connectivity: the net its
 * output pin drives, the net feeding its input pin and the loads it drives.
 */
public class BufferTopologyReconstructor {

    /** A buffer pin attachment together with the net it sits on */
    private static class PinOnNet {
        private final DEFNet net;
        private final DEFConnection connection;

        PinOnNet(DEFNet net, DEFConnection connection) {
            this.net = net;
            this.connection = connection;
        }
    }

    private final Set<String> outputPins;

    private final Set<String> inputPins;

    public BufferTopologyReconstructor(Collection<String> outputPins, Collection<String> inputPins) {
        this.outputPins = new HashSet<>(outputPins);
        this.inputPins = new HashSet<>(inputPins);
    }

    public BufferTopologyReconstructor(ECOAnalyzerConfig config) {
        this(config.getOutputPins(), config.getInputPins());
    }

    /**
     * Builds one insertion command per resolvable candidate, keeping candidate
     * order. Unresolvable candidates are dropped with a diagnostic.
     * @param modified The design the candidates were found in
     * @param candidates New buffer instances of the modified design
     * @param diagnostics Receives warnings about dropped or ambiguous buffers
     * @return The insertion commands, unordered with respect to dependencies
     */
    public List<InsertBufferCommand> reconstruct(DEFDesign modified, List<DEFComponent> candidates,
            List<ECODiagnostic> diagnostics) {
        Map<String, List<PinOnNet>> pinIndex = indexCandidatePins(modified, candidates);
        List<InsertBufferCommand> commands = new ArrayList<>();
        for (DEFComponent buffer : candidates) {
            InsertBufferCommand cmd = reconstruct(modified.getName(), buffer,
                    pinIndex.getOrDefault(buffer.getName(), Collections.emptyList()), diagnostics);
            if (cmd != null) {
                commands.add(cmd);
            }
        }
        return commands;
    }

    /**
     * Single pass over all nets collecting, per candidate, its pin attachments
     * in net order.
     */
    private static Map<String, List<PinOnNet>> indexCandidatePins(DEFDesign modified,
            List<DEFComponent> candidates) {
        Map<String, List<PinOnNet>> pinIndex = new HashMap<>();
        for (DEFComponent buffer : candidates) {
            pinIndex.put(buffer.getName(), new ArrayList<>());
        }
        for (DEFNet net : modified.getNets().values()) {
            for (DEFConnection c : net.getConnections()) {
                List<PinOnNet> pins = pinIndex.get(c.getInstanceName());
                if (pins != null) {
                    pins.add(new PinOnNet(net, c));
                }
            }
        }
        return pinIndex;
    }

    private InsertBufferCommand reconstruct(String source, DEFComponent buffer, List<PinOnNet> pins,
            List<ECODiagnostic> diagnostics) {
        String name = buffer.getName();
        DEFNet outputNet = null;
        DEFNet inputNet = null;
        List<String> extraOutputNets = new ArrayList<>();
        for (PinOnNet pin : pins) {
            String pinName = pin.connection.getPinName();
            if (outputPins.contains(pinName)) {
                if (outputNet == null) {
                    outputNet = pin.net;
                } else if (outputNet != pin.net) {
                    extraOutputNets.add(pin.net.getName());
                }
            } else if (inputNet == null && inputPins.contains(pinName)) {
                inputNet = pin.net;
            }
        }

        if (outputNet == null) {
            diagnostics.add(new ECODiagnostic(ECODiagnosticType.UNRESOLVABLE_BUFFER, source, name,
                    "Buffer " + buffer + " has no output pin " + outputPins
                            + " on any net, no insertion command generated"));
            return null;
        }
        if (!extraOutputNets.isEmpty()) {
            List<String> related = new ArrayList<>();
            related.add(outputNet.getName());
            related.addAll(extraOutputNets);
            diagnostics.add(new ECODiagnostic(ECODiagnosticType.MULTIPLE_OUTPUT_NETS, source, name,
                    "Buffer " + name + " drives several nets " + related + ", using "
                            + outputNet.getName(), related));
        }

        List<DEFConnection> loads = new ArrayList<>();
        for (DEFConnection c : outputNet.getConnections()) {
            if (!c.getInstanceName().equals(name)) {
                loads.add(c);
            }
        }
        if (loads.isEmpty()) {
            diagnostics.add(new ECODiagnostic(ECODiagnosticType.UNRESOLVABLE_BUFFER, source, name,
                    "Buffer " + name + " drives no loads on net " + outputNet.getName()
                            + ", no insertion command generated"));
            return null;
        }
        return new InsertBufferCommand(name, buffer.getCellType(), loads, outputNet.getName(),
                inputNet == null ? null : inputNet.getName());
    }
}
