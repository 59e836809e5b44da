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
import java.io.UncheckedIOException;

import com.xilinx.defeco.diagnostics.ECODiagnostic;
import com.xilinx.defeco.tests.CodePerfTracker;
import com.xilinx.defeco.util.FileTools;
import com.xilinx.defeco.util.MessageGenerator;

import joptsimple.OptionException;

/**
 * Command line entry point: compares an original and a modified DEF file,
 * prints the ECO changelist and optionally writes it to a file.
 */
public class DEFECOAnalyzer {

    public static final int EXIT_OK = 0;

    public static final int EXIT_ERROR = 1;

    /**
     * Runs the analyzer on the given command line.
     * @param args Command line arguments
     * @param out Receives the report and progress messages
     * @param err Receives errors and diagnostics
     * @return The exit status
     */
    public static int run(String[] args, PrintStream out, PrintStream err) {
        ECOAnalyzerConfig config;
        try {
            if (ECOAnalyzerConfig.hasHelpArg(args)) {
                ECOAnalyzerConfig.printHelp(out);
                return EXIT_OK;
            }
            config = new ECOAnalyzerConfig(args);
        } catch (OptionException | IllegalArgumentException e) {
            MessageGenerator.briefError("ERROR: " + e.getMessage(), err);
            ECOAnalyzerConfig.printHelp(err);
            return EXIT_ERROR;
        }

        for (String fileName : new String[]{config.getOriginalFileName(), config.getModifiedFileName()}) {
            if (!FileTools.fileExists(fileName)) {
                MessageGenerator.briefError("ERROR: Could not find file: " + fileName, err);
                return EXIT_ERROR;
            }
        }

        try {
            CodePerfTracker t = config.isVerbose() ? new CodePerfTracker("DEF ECO Analyzer", out)
                    : CodePerfTracker.SILENT;
            out.println("Analyzing DEF files:");
            out.println("  Original: " + config.getOriginalFileName());
            out.println("  Modified: " + config.getModifiedFileName());

            ECOAnalyzer analyzer = new ECOAnalyzer(config);
            analyzer.setPerfTracker(t);
            ECOChangelist changelist = analyzer.analyzeFiles(config.getOriginalFileName(),
                    config.getModifiedFileName());
            ECOChangelistReport report = new ECOChangelistReport(changelist);
            out.println();
            report.printReport(out);

            if (!config.isQuiet()) {
                for (ECODiagnostic d : changelist.getDiagnostics()) {
                    if (d.isWarning() || config.isVerbose()) {
                        MessageGenerator.briefError(d.toString(), err);
                    }
                }
            }

            t.start("Write Output");
            if (config.getOutputFileName() != null) {
                report.writeOutput(config.getOutputFileName());
                out.println("\nResults saved to: " + config.getOutputFileName());
            }
            if (config.getJSONFileName() != null) {
                report.writeJSON(config.getJSONFileName());
                out.println("JSON saved to: " + config.getJSONFileName());
            }
            t.stop().printSummary();
        } catch (UncheckedIOException e) {
            MessageGenerator.briefError(e.getMessage(), err);
            return EXIT_ERROR;
        } catch (RuntimeException e) {
            MessageGenerator.briefError("ERROR: " + e.getMessage(), err);
            return EXIT_ERROR;
        }
        return EXIT_OK;
    }

    public static void main(String[] args) {
        int status = run(args, System.out, System.err);
        if (status != EXIT_OK) {
            System.exit(status);
        }
    }
}
