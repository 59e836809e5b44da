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
import java.util.List;

import com.xilinx.defeco.def.DEFComponent;
import com.xilinx.defeco.def.DEFDesign;
import com.xilinx.defeco.diagnostics.ECODiagnostic;
import com.xilinx.defeco.diagnostics.ECODiagnosticType;

/**
 * Compares the components of an original and a modified {@link DEFDesign} and
 * classifies the per-cell differences: same-function type changes become
 * {@link SizeCellCommand}s and new cells of a buffer family become buffer
 * insertion candidates. Other differences are only reported as diagnostics.
 */
public class DEFDiffClassifier {

    private final Collection<String> bufferMarkers;

    public DEFDiffClassifier(Collection<String> bufferMarkers) {
        this.bufferMarkers = bufferMarkers;
    }

    public DEFDiffClassifier(ECOAnalyzerConfig config) {
        this(config.getBufferMarkers());
    }

    public DEFDiffResult classify(DEFDesign original, DEFDesign modified) {
        List<ECODiagnostic> diagnostics = new ArrayList<>();
        List<SizeCellCommand> sizeCommands = findSizingChanges(original, modified, diagnostics);
        List<DEFComponent> candidates = findBufferCandidates(original, modified, diagnostics);
        return new DEFDiffResult(sizeCommands, candidates, diagnostics);
    }

    private List<SizeCellCommand> findSizingChanges(DEFDesign original, DEFDesign modified,
            List<ECODiagnostic> diagnostics) {
        List<SizeCellCommand> sizeCommands = new ArrayList<>();
        for (DEFComponent orig : original.getComponents().values()) {
            DEFComponent mod = modified.getComponent(orig.getName());
            if (mod == null) {
                diagnostics.add(new ECODiagnostic(ECODiagnosticType.REMOVED_CELL, original.getName(),
                        orig.getName(), "Cell " + orig + " is not present in the modified design"));
                continue;
            }
            String origType = orig.getCellType();
            String modType = mod.getCellType();
            if (origType.equals(modType)) {
                continue;
            }
            if (CellTypeTools.isSameFunction(origType, modType)) {
                sizeCommands.add(new SizeCellCommand(orig.getName(), origType, modType));
            } else {
                diagnostics.add(new ECODiagnostic(ECODiagnosticType.FUNCTION_CHANGE, modified.getName(),
                        orig.getName(), "Cell " + orig.getName() + " changed function from " + origType
                                + " to " + modType + ", no sizing command generated"));
            }
        }
        return sizeCommands;
    }

    private List<DEFComponent> findBufferCandidates(DEFDesign original, DEFDesign modified,
            List<ECODiagnostic> diagnostics) {
        List<DEFComponent> candidates = new ArrayList<>();
        for (DEFComponent mod : modified.getComponents().values()) {
            if (original.containsInstance(mod.getName())) {
                continue;
            }
            if (CellTypeTools.isBufferType(mod.getCellType(), bufferMarkers)) {
                candidates.add(mod);
            } else {
                diagnostics.add(new ECODiagnostic(ECODiagnosticType.UNCLASSIFIED_NEW_CELL,
                        modified.getName(), mod.getName(),
                        "New cell " + mod + " is not a buffer, no command generated"));
            }
        }
        return candidates;
    }
}
