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

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.json.JSONArray;
import org.json.JSONObject;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import com.xilinx.defeco.def.DEFConnection;
import com.xilinx.defeco.diagnostics.ECODiagnostic;
import com.xilinx.defeco.support.DEFTestFiles;

public class TestECOChangelistReport {

    private static final List<String> EXPECTED_ECO_REPORT = Arrays.asList(
            "ECO CHANGELIST",
            "================================================================================",
            "",
            "Sizing Commands (1):",
            "----------------------------------------",
            " 1. size_cell u1 INVx8",
            "",
            "Buffering Commands (1):",
            "----------------------------------------",
            " 1. insert_buffer {u2/A} BUFx2 buf1 net_a",
            "",
            "Total ECO Changes: 2");

    private static ECOChangelist createEcoChangelist() {
        return new ECOAnalyzer().analyzeFiles(DEFTestFiles.getPath(DEFTestFiles.ECO_ORIG),
                DEFTestFiles.getPath(DEFTestFiles.ECO_MOD));
    }

    private static ECOChangelist createCycleChangelist() {
        List<InsertBufferCommand> inserts = Arrays.asList(
                new InsertBufferCommand("b2", "BUFx2", Collections.singletonList(new DEFConnection("b1", "A")),
                        "n2", null),
                new InsertBufferCommand("b1", "BUFx2", Collections.singletonList(new DEFConnection("b2", "A")),
                        "n1", "n0"));
        List<ECODiagnostic> diagnostics = new ArrayList<>();
        BufferOrdering ordering = new BufferInsertionOrderer().order(inserts, diagnostics);
        return new ECOChangelist(Collections.emptyList(), ordering, diagnostics);
    }

    @Test
    public void testReportLines() {
        ECOChangelist changelist = createEcoChangelist();
        ECOChangelistReport report = new ECOChangelistReport(changelist);
        Assertions.assertSame(changelist, report.getChangelist());
        Assertions.assertEquals(EXPECTED_ECO_REPORT, report.getReportLines());

        ByteArrayOutputStream baos = new ByteArrayOutputStream();
        report.printReport(new PrintStream(baos, true));
        String printed = new String(baos.toByteArray(), StandardCharsets.UTF_8);
        Assertions.assertEquals(String.join(System.lineSeparator(), EXPECTED_ECO_REPORT) + System.lineSeparator(),
                printed);
    }

    @Test
    public void testEmptyReport() {
        String text = DEFTestFiles.getText(DEFTestFiles.ECO_ORIG);
        List<String> lines = new ECOChangelistReport(new ECOAnalyzer().analyzeText(text, text)).getReportLines();
        Assertions.assertEquals("Sizing Commands (0):", lines.get(3));
        Assertions.assertEquals("   No sizing changes found.", lines.get(5));
        Assertions.assertEquals("Buffering Commands (0):", lines.get(7));
        Assertions.assertEquals("   No buffer insertions found.", lines.get(9));
        Assertions.assertEquals("Total ECO Changes: 0", lines.get(lines.size() - 1));
    }

    @Test
    public void testNumberingWidth() {
        List<SizeCellCommand> sizing = new ArrayList<>();
        for (int i = 0; i < 10; i++) {
            sizing.add(new SizeCellCommand("u" + i, "INVx1", "INVx2"));
        }
        ECOChangelist changelist = new ECOChangelist(sizing,
                new BufferOrdering.Ordered(Collections.emptyList(), Collections.emptyList()),
                Collections.emptyList());
        List<String> lines = new ECOChangelistReport(changelist).getReportLines();
        Assertions.assertEquals(" 9. size_cell u8 INVx2", lines.get(13));
        Assertions.assertEquals("10. size_cell u9 INVx2", lines.get(14));
    }

    @Test
    public void testToJSON() {
        JSONObject json = new ECOChangelistReport(createEcoChangelist()).toJSON();
        Assertions.assertEquals(2, json.getInt("total"));

        JSONArray sizing = json.getJSONArray("sizing");
        Assertions.assertEquals(1, sizing.length());
        JSONObject resize = sizing.getJSONObject(0);
        Assertions.assertEquals("u1", resize.getString("instance"));
        Assertions.assertEquals("INVx1", resize.getString("original_cell_type"));
        Assertions.assertEquals("INVx8", resize.getString("cell_type"));
        Assertions.assertEquals("size_cell u1 INVx8", resize.getString("command"));

        JSONObject insert = json.getJSONArray("buffering").getJSONObject(0);
        Assertions.assertEquals("buf1", insert.getString("buffer"));
        Assertions.assertEquals("net_a", insert.getString("output_net"));
        Assertions.assertEquals("net_a_buf", insert.getString("input_net"));
        Assertions.assertEquals("u2/A", insert.getJSONArray("loads").getString(0));

        Assertions.assertFalse(json.getJSONObject("fallback").getBoolean("used"));
        Assertions.assertTrue(json.getJSONObject("fallback").getJSONArray("stuck").isEmpty());
        Assertions.assertTrue(json.getJSONArray("diagnostics").isEmpty());
    }

    @Test
    public void testToJSONWithFallback() {
        JSONObject json = new ECOChangelistReport(createCycleChangelist()).toJSON();
        Assertions.assertEquals(2, json.getInt("total"));
        JSONObject fallback = json.getJSONObject("fallback");
        Assertions.assertTrue(fallback.getBoolean("used"));
        Assertions.assertEquals(Arrays.asList("b1", "b2"), Arrays.asList(
                fallback.getJSONArray("stuck").getString(0), fallback.getJSONArray("stuck").getString(1)));
        Assertions.assertTrue(json.getJSONArray("buffering").getJSONObject(1).isNull("input_net"));

        JSONObject diagnostic = json.getJSONArray("diagnostics").getJSONObject(0);
        Assertions.assertEquals("DEPENDENCY_CYCLE", diagnostic.getString("type"));
        Assertions.assertEquals("WARNING", diagnostic.getString("severity"));
        Assertions.assertTrue(diagnostic.isNull("source"));
        Assertions.assertEquals(2, diagnostic.getJSONArray("related").length());
    }

    @Test
    public void testWriteCommandScript(@TempDir Path tempDir) throws IOException {
        Path script = tempDir.resolve("eco.tcl");
        new ECOChangelistReport(createEcoChangelist()).writeCommandScript(script.toString());
        Assertions.assertEquals(Arrays.asList("size_cell u1 INVx8", "insert_buffer {u2/A} BUFx2 buf1 net_a"),
                Files.readAllLines(script));
    }

    @ParameterizedTest
    @ValueSource(strings = {"eco.txt", "eco", "eco.JSON", "eco.tcl"})
    public void testWriteOutput(String fileName, @TempDir Path tempDir) throws IOException {
        Path output = tempDir.resolve(fileName);
        new ECOChangelistReport(createEcoChangelist()).writeOutput(output.toString());
        List<String> lines = Files.readAllLines(output);
        if (fileName.toLowerCase().endsWith(".json")) {
            JSONObject json = new JSONObject(String.join("\n", lines));
            Assertions.assertEquals(2, json.getInt("total"));
        } else if (fileName.endsWith(".tcl")) {
            Assertions.assertEquals(2, lines.size());
            Assertions.assertEquals("size_cell u1 INVx8", lines.get(0));
        } else {
            Assertions.assertEquals(EXPECTED_ECO_REPORT, lines);
        }
    }
}
