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

import com.xilinx.defeco.def.DEFComponent;
import com.xilinx.defeco.diagnostics.ECODiagnostic;

/**
 * Outcome of {@link DEFDiffClassifier#classify}: the resize commands and the
 * new buffer instances that still need their position in the net topology
 * reconstructed.
 */
public class DEFDiffResult {

    private final List<SizeCellCommand> sizeCommands;

    private final List<DEFComponent> bufferCandidates;

    private final List<ECODiagnostic> diagnostics;

    public DEFDiffResult(List<SizeCellCommand> sizeCommands, List<DEFComponent> bufferCandidates,
            List<ECODiagnostic> diagnostics) {
        this.sizeCommands = Collections.unmodifiableList(new ArrayList<>(sizeCommands));
        this.bufferCandidates = Collections.unmodifiableList(new ArrayList<>(bufferCandidates));
        this.diagnostics = Collections.unmodifiableList(new ArrayList<>(diagnostics));
    }

    /**
     * @return Resize commands, in the original design's component order
     */
    public List<SizeCellCommand> getSizeCommands() {
        return sizeCommands;
    }

    /**
     * @return New buffer instances, in the modified design's component order
     */
    public List<DEFComponent> getBufferCandidates() {
        return bufferCandidates;
    }

    public List<ECODiagnostic> getDiagnostics() {
        return diagnostics;
    }
}
