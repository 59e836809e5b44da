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

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.List;

import org.json.JSONArray;
import org.json.JSONObject;

import com.xilinx.defeco.def.DEFConnection;
import com.xilinx.defeco.diagnostics.ECODiagnostic;
import com.xilinx.defeco.util.FileTools;

/**
 * Renders an {@link ECOChangelist} as a human readable report, as JSON or as a
 * plain command script.
 */
public class ECOChangelistReport {

    public static final String TITLE = "ECO CHANGELIST";

    public static final String JSON_EXTENSION = "json";

    public static final String SCRIPT_EXTENSION = "tcl";

    private static final String RULE = "================================================================================";

    private static final String SEPARATOR = "----------------------------------------";

    private static final int JSON_INDENT = 4;

    private final ECOChangelist changelist;

    public ECOChangelistReport(ECOChangelist changelist) {
        this.changelist = changelist;
    }

    public ECOChangelist getChangelist() {
        return changelist;
    }

    public List<String> getReportLines() {
        List<String> lines = new ArrayList<>();
        lines.add(TITLE);
        lines.add(RULE);
        lines.add("");
        addSection(lines, "Sizing", changelist.getSizingCommands(), "No sizing changes found.");
        lines.add("");
        addSection(lines, "Buffering", changelist.getBufferingCommands(), "No buffer insertions found.");
        lines.add("");
        lines.add("Total ECO Changes: " + changelist.getTotalChangeCount());
        return lines;
    }

    private static void addSection(List<String> lines, String title, List<? extends ECOCommand> commands,
            String emptyMessage) {
        lines.add(title + " Commands (" + commands.size() + "):");
        lines.add(SEPARATOR);
        if (commands.isEmpty()) {
            lines.add("   " + emptyMessage);
            return;
        }
        int i = 1;
        for (ECOCommand cmd : commands) {
            lines.add(String.format("%2d. %s", i++, cmd.toCommandString()));
        }
    }

    public void printReport(PrintStream ps) {
        for (String line : getReportLines()) {
            ps.println(line);
        }
    }

    public void writeReport(String fileName) {
        FileTools.writeLinesToTextFile(getReportLines(), fileName);
    }

    public JSONObject toJSON() {
        JSONObject json = new JSONObject();
        JSONArray sizing = new JSONArray();
        for (SizeCellCommand cmd : changelist.getSizingCommands()) {
            JSONObject o = new JSONObject();
            o.put("instance", cmd.getInstanceName());
            o.put("original_cell_type", cmd.getOriginalCellType());
            o.put("cell_type", cmd.getCellType());
            o.put("command", cmd.toCommandString());
            sizing.put(o);
        }
        json.put("sizing", sizing);

        JSONArray buffering = new JSONArray();
        for (InsertBufferCommand cmd : changelist.getBufferingCommands()) {
            JSONObject o = new JSONObject();
            o.put("buffer", cmd.getInstanceName());
            o.put("cell_type", cmd.getCellType());
            JSONArray loads = new JSONArray();
            for (DEFConnection load : cmd.getLoads()) {
                loads.put(load.getFullName());
            }
            o.put("loads", loads);
            o.put("output_net", cmd.getOutputNetName());
            o.put("input_net", cmd.getInputNetName() == null ? JSONObject.NULL : cmd.getInputNetName());
            o.put("command", cmd.toCommandString());
            buffering.put(o);
        }
        json.put("buffering", buffering);
        json.put("total", changelist.getTotalChangeCount());

        JSONObject fallback = new JSONObject();
        fallback.put("used", changelist.isFallback());
        fallback.put("stuck", new JSONArray(changelist.getBufferOrdering().getStuckBuffers()));
        json.put("fallback", fallback);

        JSONArray diagnostics = new JSONArray();
        for (ECODiagnostic d : changelist.getDiagnostics()) {
            JSONObject o = new JSONObject();
            o.put("type", d.getType().name());
            o.put("severity", d.getType().getSeverityLabel());
            o.put("source", d.getSource() == null ? JSONObject.NULL : d.getSource());
            o.put("subject", d.getSubject() == null ? JSONObject.NULL : d.getSubject());
            o.put("message", d.getMessage());
            o.put("related", new JSONArray(d.getRelatedNames()));
            diagnostics.put(o);
        }
        json.put("diagnostics", diagnostics);
        return json;
    }

    public void writeJSON(String fileName) {
        FileTools.writeStringToTextFile(toJSON().toString(JSON_INDENT), fileName);
    }

    /**
     * Writes one command per line, sizing commands first.
     */
    public void writeCommandScript(String fileName) {
        FileTools.writeLinesToTextFile(changelist.getCommandLines(), fileName);
    }

    /**
     * Writes the changelist in the format implied by the file extension:
     * {@code .json} as JSON, {@code .tcl} as a command script and anything
     * else as the text report.
     */
    public void writeOutput(String fileName) {
        String ext = FileTools.getFileExtension(fileName);
        if (ext.equals(JSON_EXTENSION)) {
            writeJSON(fileName);
        } else if (ext.equals(SCRIPT_EXTENSION)) {
            writeCommandScript(fileName);
        } else {
            writeReport(fileName);
        }
    }
}
