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

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

import org.jetbrains.annotations.NotNull;

import com.xilinx.defeco.def.DEFDesign;
import com.xilinx.defeco.def.DEFParser;
import com.xilinx.defeco.def.DEFTools;
import com.xilinx.defeco.diagnostics.ECODiagnostic;
import com.xilinx.defeco.tests.CodePerfTracker;

/**
 * Runs the complete analysis on an original and a modified design: cell
 * classification, buffer topology reconstruction and dependency ordering.
 */
public class ECOAnalyzer {

    public static final String ORIGINAL_NAME = "original";

    public static final String MODIFIED_NAME = "modified";

    private final ECOAnalyzerConfig config;

    private CodePerfTracker t = CodePerfTracker.SILENT;

    public ECOAnalyzer() {
        this(new ECOAnalyzerConfig());
    }

    public ECOAnalyzer(@NotNull ECOAnalyzerConfig config) {
        this.config = config;
    }

    public ECOAnalyzerConfig getConfig() {
        return config;
    }

    /**
     * Sets the tracker receiving the runtime of each analysis phase.
     */
    public void setPerfTracker(@NotNull CodePerfTracker t) {
        this.t = t;
    }

    @NotNull
    public ECOChangelist analyze(@NotNull DEFDesign original, @NotNull DEFDesign modified) {
        List<ECODiagnostic> diagnostics = new ArrayList<>();
        diagnostics.addAll(original.getDiagnostics());
        diagnostics.addAll(modified.getDiagnostics());

        t.start("Classify Cells");
        DEFDiffResult diff = new DEFDiffClassifier(config).classify(original, modified);
        diagnostics.addAll(diff.getDiagnostics());

        t.stop().start("Reconstruct Buffers");
        List<InsertBufferCommand> inserts = new BufferTopologyReconstructor(config)
                .reconstruct(modified, diff.getBufferCandidates(), diagnostics);

        t.stop().start("Order Buffers");
        BufferOrdering ordering = new BufferInsertionOrderer(config).order(inserts, diagnostics);
        t.stop();

        return new ECOChangelist(diff.getSizeCommands(), ordering, diagnostics);
    }

    @NotNull
    public ECOChangelist analyzeText(@NotNull String originalText, @NotNull String modifiedText) {
        t.start("Parse DEF");
        DEFDesign original = DEFParser.parse(ORIGINAL_NAME, originalText);
        DEFDesign modified = DEFParser.parse(MODIFIED_NAME, modifiedText);
        t.stop();
        return analyze(original, modified);
    }

    /**
     * @throws java.io.UncheckedIOException if either file cannot be read
     */
    @NotNull
    public ECOChangelist analyzeFiles(@NotNull Path original, @NotNull Path modified) {
        t.start("Read DEF Files");
        DEFDesign orig = DEFTools.readDEFFile(original);
        DEFDesign mod = DEFTools.readDEFFile(modified);
        t.stop();
        return analyze(orig, mod);
    }

    @NotNull
    public ECOChangelist analyzeFiles(@NotNull String original, @NotNull String modified) {
        return analyzeFiles(Paths.get(original), Paths.get(modified));
    }
}
