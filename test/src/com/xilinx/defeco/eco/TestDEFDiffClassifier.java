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

import java.util.Arrays;
import java.util.Collections;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import com.xilinx.defeco.def.DEFComponent;
import com.xilinx.defeco.def.DEFDesign;
import com.xilinx.defeco.def.DEFParser;
import com.xilinx.defeco.diagnostics.ECODiagnostic;
import com.xilinx.defeco.diagnostics.ECODiagnosticType;
import com.xilinx.defeco.support.DEFTestFiles;

public class TestDEFDiffClassifier {

    private static DEFDesign components(String name, String... records) {
        StringBuilder sb = new StringBuilder();
        sb.append("COMPONENTS ").append(records.length).append(" ;\n");
        for (String r : records) {
            sb.append("- ").append(r).append(" ;\n");
        }
        sb.append("END COMPONENTS\n");
        return DEFParser.parse(name, sb.toString());
    }

    private static DEFDiffClassifier createClassifier() {
        return new DEFDiffClassifier(Arrays.asList("BUF", "HB1", "HB2"));
    }

    @Test
    public void testClassifyEcoScenario() {
        DEFDesign orig = DEFTestFiles.loadDEF(DEFTestFiles.ECO_ORIG);
        DEFDesign mod = DEFTestFiles.loadDEF(DEFTestFiles.ECO_MOD);
        DEFDiffResult result = createClassifier().classify(orig, mod);

        Assertions.assertEquals(Collections.singletonList(new SizeCellCommand("u1", "INVx1", "INVx8")),
                result.getSizeCommands());
        Assertions.assertEquals(Collections.singletonList(new DEFComponent("buf1", "BUFx2")),
                result.getBufferCandidates());
        Assertions.assertTrue(result.getDiagnostics().isEmpty());
    }

    @Test
    public void testSizingOrderFollowsOriginal() {
        DEFDesign orig = components("orig", "a INVx1", "b NAND2x1", "c INVx2");
        DEFDesign mod = components("mod", "c INVxp5", "b NAND2x2", "a INVx4");
        DEFDiffResult result = createClassifier().classify(orig, mod);

        Assertions.assertEquals(Arrays.asList(
                new SizeCellCommand("a", "INVx1", "INVx4"),
                new SizeCellCommand("b", "NAND2x1", "NAND2x2"),
                new SizeCellCommand("c", "INVx2", "INVxp5")), result.getSizeCommands());
    }

    @Test
    public void testNoCrossFunctionResize() {
        DEFDesign orig = components("orig", "u1 INVx1", "u2 NAND2x1");
        DEFDesign mod = components("mod", "u1 BUFx1", "u2 NOR2x1");
        DEFDiffResult result = createClassifier().classify(orig, mod);

        Assertions.assertTrue(result.getSizeCommands().isEmpty());
        Assertions.assertTrue(result.getBufferCandidates().isEmpty());
        Assertions.assertEquals(2, result.getDiagnostics().size());
        for (ECODiagnostic d : result.getDiagnostics()) {
            Assertions.assertEquals(ECODiagnosticType.FUNCTION_CHANGE, d.getType());
            Assertions.assertEquals("mod", d.getSource());
        }
        Assertions.assertEquals("u1", result.getDiagnostics().get(0).getSubject());
    }

    @Test
    public void testNewAndRemovedCells() {
        DEFDesign orig = components("orig", "u1 INVx1", "old1 INVx2");
        DEFDesign mod = components("mod", "u1 INVx1", "rep2 HB1xp67", "u9 NAND2x1", "rep1 BUFx4");
        DEFDiffResult result = createClassifier().classify(orig, mod);

        Assertions.assertTrue(result.getSizeCommands().isEmpty());
        Assertions.assertEquals(Arrays.asList(new DEFComponent("rep2", "HB1xp67"), new DEFComponent("rep1", "BUFx4")),
                result.getBufferCandidates());
        Assertions.assertEquals(2, result.getDiagnostics().size());
        ECODiagnostic removed = result.getDiagnostics().get(0);
        Assertions.assertEquals(ECODiagnosticType.REMOVED_CELL, removed.getType());
        Assertions.assertEquals("old1", removed.getSubject());
        ECODiagnostic unclassified = result.getDiagnostics().get(1);
        Assertions.assertEquals(ECODiagnosticType.UNCLASSIFIED_NEW_CELL, unclassified.getType());
        Assertions.assertEquals("u9", unclassified.getSubject());
        Assertions.assertFalse(unclassified.isWarning());
    }

    @Test
    public void testIdenticalDesigns() {
        DEFDesign orig = DEFTestFiles.loadDEF(DEFTestFiles.ECO_ORIG);
        DEFDiffResult result = createClassifier().classify(orig, orig);
        Assertions.assertTrue(result.getSizeCommands().isEmpty());
        Assertions.assertTrue(result.getBufferCandidates().isEmpty());
        Assertions.assertTrue(result.getDiagnostics().isEmpty());
    }

    @Test
    public void testConfiguredBufferMarkers() {
        ECOAnalyzerConfig config = new ECOAnalyzerConfig();
        config.setBufferMarkers(Collections.singletonList("DLY"));
        DEFDesign orig = components("orig", "u1 INVx1");
        DEFDesign mod = components("mod", "u1 INVx1", "d1 DLY4x1", "b1 BUFx2");
        DEFDiffResult result = new DEFDiffClassifier(config).classify(orig, mod);

        Assertions.assertEquals(Collections.singletonList(new DEFComponent("d1", "DLY4x1")),
                result.getBufferCandidates());
        Assertions.assertEquals(ECODiagnosticType.UNCLASSIFIED_NEW_CELL, result.getDiagnostics().get(0).getType());
    }
}
