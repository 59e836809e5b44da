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

import java.io.IOException;
import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import com.xilinx.defeco.util.MessageGenerator;
import com.xilinx.defeco.util.Params;

import joptsimple.OptionParser;
import joptsimple.OptionSet;

/**
 * A collection of customizable parameters for an {@link ECOAnalyzer}. Defaults
 * come from {@link Params} (environment variables or JVM parameters) and can be
 * overridden by command line options or by calling the applicable setter.
 */
public class ECOAnalyzerConfig {

    private List<String> bufferMarkers;

    private List<String> outputPins;

    private List<String> inputPins;

    private int maxOrderIterations;

    private boolean verbose;

    private boolean quiet;

    private String originalFileName;

    private String modifiedFileName;

    private String outputFileName;

    private String jsonFileName;

    private static final List<String> OUTPUT_OPTS = Arrays.asList("o", "output");
    private static final List<String> JSON_OPTS = Arrays.asList("j", "json");
    private static final List<String> BUFFER_MARKERS_OPTS = Arrays.asList("b", "buffer-markers");
    private static final List<String> OUTPUT_PINS_OPTS = Collections.singletonList("output-pins");
    private static final List<String> INPUT_PINS_OPTS = Collections.singletonList("input-pins");
    private static final List<String> MAX_ITERATIONS_OPTS = Collections.singletonList("max-order-iterations");
    private static final List<String> VERBOSE_OPTS = Arrays.asList("v", "verbose");
    private static final List<String> QUIET_OPTS = Arrays.asList("q", "quiet");
    private static final List<String> HELP_OPTS = Arrays.asList("?", "h", "help");

    public ECOAnalyzerConfig() {
        setBufferMarkers(Params.getParamOrDefaultListSetting(Params.DEFECO_BUFFER_MARKERS_NAME,
                Params.DEFECO_DEFAULT_BUFFER_MARKERS));
        setOutputPins(Params.getParamOrDefaultListSetting(Params.DEFECO_OUTPUT_PINS_NAME,
                Params.DEFECO_DEFAULT_OUTPUT_PINS));
        setInputPins(Params.getParamOrDefaultListSetting(Params.DEFECO_INPUT_PINS_NAME,
                Params.DEFECO_DEFAULT_INPUT_PINS));
        maxOrderIterations = Params.getParamOrDefaultIntSetting(Params.DEFECO_MAX_ORDER_ITERATIONS_NAME,
                Params.DEFECO_DEFAULT_MAX_ORDER_ITERATIONS);
        if (maxOrderIterations < 1) {
            MessageGenerator.briefError("WARNING: Ignoring non-positive " + Params.DEFECO_MAX_ORDER_ITERATIONS_NAME
                    + " value " + maxOrderIterations + ", using " + Params.DEFECO_DEFAULT_MAX_ORDER_ITERATIONS);
            maxOrderIterations = Params.DEFECO_DEFAULT_MAX_ORDER_ITERATIONS;
        }
        verbose = Params.isParamSet(Params.DEFECO_VERBOSE_NAME);
        quiet = false;
    }

    /**
     * Creates a configuration from command line arguments: two positional DEF
     * file names (original, modified) and an optional positional output file,
     * plus the options of {@link #createOptionParser()}.
     * @param arguments The command line arguments
     * @throws joptsimple.OptionException if an option is unknown or malformed
     * @throws IllegalArgumentException if the positional arguments are wrong
     */
    public ECOAnalyzerConfig(String[] arguments) {
        this();
        parseArguments(arguments);
    }

    public static OptionParser createOptionParser() {
        return new OptionParser() {
            {
                acceptsAll(OUTPUT_OPTS, "Write the changelist to this file (.json: JSON, .tcl: command "
                        + "script, other: text report)").withRequiredArg();
                acceptsAll(JSON_OPTS, "Also write the changelist as JSON to this file").withRequiredArg();
                acceptsAll(BUFFER_MARKERS_OPTS, "Comma separated cell type markers identifying buffers "
                        + "(default " + String.join(",", Params.DEFECO_DEFAULT_BUFFER_MARKERS) + ")")
                        .withRequiredArg();
                acceptsAll(OUTPUT_PINS_OPTS, "Comma separated output pin names (default "
                        + String.join(",", Params.DEFECO_DEFAULT_OUTPUT_PINS) + ")").withRequiredArg();
                acceptsAll(INPUT_PINS_OPTS, "Comma separated input pin names (default "
                        + String.join(",", Params.DEFECO_DEFAULT_INPUT_PINS) + ")").withRequiredArg();
                acceptsAll(MAX_ITERATIONS_OPTS, "Upper bound on dependency ordering iterations")
                        .withRequiredArg().ofType(Integer.class);
                acceptsAll(VERBOSE_OPTS, "Print phase runtimes and informational diagnostics");
                acceptsAll(QUIET_OPTS, "Do not print diagnostics");
                acceptsAll(HELP_OPTS, "Print this help message").forHelp();
            }
        };
    }

    public static void printHelp(PrintStream ps) {
        OptionParser p = createOptionParser();
        MessageGenerator.printHeader("DEFECOAnalyzer", ps);
        ps.println("Compares an original and a modified DEF file and generates the ECO changelist");
        ps.println("(cell sizing and buffer insertion commands) transforming one into the other.\n");
        ps.println("Usage: DEFECOAnalyzer <original.def> <modified.def> [output_file] [options]\n");
        try {
            p.printHelpOn(ps);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    public static boolean hasHelpArg(String[] arguments) {
        OptionSet options = createOptionParser().parse(arguments);
        return options.has(HELP_OPTS.get(0));
    }

    private static List<String> getListOption(OptionSet options, List<String> opts) {
        List<String> entries = Params.splitList((String) options.valueOf(opts.get(0)));
        if (entries.isEmpty()) {
            throw new IllegalArgumentException("Option --" + opts.get(opts.size() - 1)
                    + " requires at least one value");
        }
        return entries;
    }

    private void parseArguments(String[] arguments) {
        OptionParser p = createOptionParser();
        OptionSet options = p.parse(arguments);

        List<String> positional = new ArrayList<>();
        for (Object o : options.nonOptionArguments()) {
            positional.add(o.toString());
        }
        if (positional.size() < 2 || positional.size() > 3) {
            throw new IllegalArgumentException("Expected <original.def> <modified.def> [output_file], found "
                    + positional.size() + " file argument(s)");
        }
        setOriginalFileName(positional.get(0));
        setModifiedFileName(positional.get(1));
        if (positional.size() == 3) {
            setOutputFileName(positional.get(2));
        }
        if (options.has(OUTPUT_OPTS.get(0))) {
            if (positional.size() == 3) {
                throw new IllegalArgumentException("Output file given both as argument and with --"
                        + OUTPUT_OPTS.get(1));
            }
            setOutputFileName((String) options.valueOf(OUTPUT_OPTS.get(0)));
        }
        if (options.has(JSON_OPTS.get(0))) {
            setJSONFileName((String) options.valueOf(JSON_OPTS.get(0)));
        }
        if (options.has(BUFFER_MARKERS_OPTS.get(0))) {
            setBufferMarkers(getListOption(options, BUFFER_MARKERS_OPTS));
        }
        if (options.has(OUTPUT_PINS_OPTS.get(0))) {
            setOutputPins(getListOption(options, OUTPUT_PINS_OPTS));
        }
        if (options.has(INPUT_PINS_OPTS.get(0))) {
            setInputPins(getListOption(options, INPUT_PINS_OPTS));
        }
        if (options.has(MAX_ITERATIONS_OPTS.get(0))) {
            setMaxOrderIterations((Integer) options.valueOf(MAX_ITERATIONS_OPTS.get(0)));
        }
        if (options.has(VERBOSE_OPTS.get(0))) {
            setVerbose(true);
        }
        setQuiet(options.has(QUIET_OPTS.get(0)));
    }

    public List<String> getBufferMarkers() {
        return bufferMarkers;
    }

    public void setBufferMarkers(List<String> bufferMarkers) {
        this.bufferMarkers = Collections.unmodifiableList(new ArrayList<>(bufferMarkers));
    }

    public List<String> getOutputPins() {
        return outputPins;
    }

    public void setOutputPins(List<String> outputPins) {
        this.outputPins = Collections.unmodifiableList(new ArrayList<>(outputPins));
    }

    public List<String> getInputPins() {
        return inputPins;
    }

    public void setInputPins(List<String> inputPins) {
        this.inputPins = Collections.unmodifiableList(new ArrayList<>(inputPins));
    }

    public int getMaxOrderIterations() {
        return maxOrderIterations;
    }

    public void setMaxOrderIterations(int maxOrderIterations) {
        if (maxOrderIterations < 1) {
            throw new IllegalArgumentException("Max order iterations must be positive, found "
                    + maxOrderIterations);
        }
        this.maxOrderIterations = maxOrderIterations;
    }

    public boolean isVerbose() {
        return verbose;
    }

    public void setVerbose(boolean verbose) {
        this.verbose = verbose;
    }

    public boolean isQuiet() {
        return quiet;
    }

    public void setQuiet(boolean quiet) {
        this.quiet = quiet;
    }

    public String getOriginalFileName() {
        return originalFileName;
    }

    public void setOriginalFileName(String originalFileName) {
        this.originalFileName = originalFileName;
    }

    public String getModifiedFileName() {
        return modifiedFileName;
    }

    public void setModifiedFileName(String modifiedFileName) {
        this.modifiedFileName = modifiedFileName;
    }

    public String getOutputFileName() {
        return outputFileName;
    }

    public void setOutputFileName(String outputFileName) {
        this.outputFileName = outputFileName;
    }

    public String getJSONFileName() {
        return jsonFileName;
    }

    public void setJSONFileName(String jsonFileName) {
        this.jsonFileName = jsonFileName;
    }
}
