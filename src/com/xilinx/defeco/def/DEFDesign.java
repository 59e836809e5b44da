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

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.xilinx.defeco.diagnostics.ECODiagnostic;

/**
 * The structural facts extracted from one DEF document: which cell type each
 * instance has and which (instance, pin) terminals each net connects. A
 * DEFDesign is immutable once {@link DEFParser} returns it; both maps keep
 * document order.
 */
public class DEFDesign {

    private final String name;

    private final Map<String, DEFComponent> components;

    private final Map<String, DEFNet> nets;

    private final Map<DEFSection, Integer> declaredCounts;

    private final List<ECODiagnostic> diagnostics;

    DEFDesign(String name, Map<String, DEFComponent> components, Map<String, DEFNet> nets,
            Map<DEFSection, Integer> declaredCounts, List<ECODiagnostic> diagnostics) {
        this.name = name;
        this.components = Collections.unmodifiableMap(new LinkedHashMap<>(components));
        this.nets = Collections.unmodifiableMap(new LinkedHashMap<>(nets));
        this.declaredCounts = declaredCounts.isEmpty() ? Collections.emptyMap()
                : Collections.unmodifiableMap(new EnumMap<>(declaredCounts));
        this.diagnostics = Collections.unmodifiableList(new ArrayList<>(diagnostics));
    }

    /**
     * @return The name of the document (typically its file name), may be null
     */
    public String getName() {
        return name;
    }

    /**
     * @return Instance name to component, in document order
     */
    public Map<String, DEFComponent> getComponents() {
        return components;
    }

    public DEFComponent getComponent(String instanceName) {
        return components.get(instanceName);
    }

    /**
     * @param instanceName Name of the instance
     * @return The cell type of the instance or null if there is no such instance
     */
    public String getCellType(String instanceName) {
        DEFComponent c = components.get(instanceName);
        return c == null ? null : c.getCellType();
    }

    public boolean containsInstance(String instanceName) {
        return components.containsKey(instanceName);
    }

    /**
     * @return Net name to net, in document order. Nets without connections are
     *         not included.
     */
    public Map<String, DEFNet> getNets() {
        return nets;
    }

    public DEFNet getNet(String netName) {
        return nets.get(netName);
    }

    /**
     * @param section The section of interest
     * @return True if the section was found with both its start and end markers
     */
    public boolean hasSection(DEFSection section) {
        return declaredCounts.containsKey(section);
    }

    /**
     * @param section The section of interest
     * @return The record count declared on the section's start marker, or null if
     *         the section is absent
     */
    public Integer getDeclaredCount(DEFSection section) {
        return declaredCounts.get(section);
    }

    /**
     * @return Diagnostics produced while extracting this design
     */
    public List<ECODiagnostic> getDiagnostics() {
        return diagnostics;
    }

    @Override
    public String toString() {
        return (name == null ? "DEFDesign" : name) + " [" + components.size() + " components, "
                + nets.size() + " nets]";
    }
}
