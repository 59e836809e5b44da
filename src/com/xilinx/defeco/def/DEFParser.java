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
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.xilinx.defeco.diagnostics.ECODiagnostic;
import com.xilinx.defeco.diagnostics.ECODiagnosticType;

/**
 * Extracts the COMPONENTS and NETS facts of a DEF document. Only the subset of
 * the DEF grammar needed for cell types and pin-level connectivity is
 * understood; everything else is skipped. A parser instance handles a single
 * document.
 */
public class DEFParser {

    public static final String RECORD_START = "-";
    public static final String PROPERTY_START = "+";

    private final String name;

    private final List<DEFToken> tokens;

    private final Map<String, DEFComponent> components;

    private final Map<String, DEFNet> nets;

    private final Map<DEFSection, Integer> declaredCounts;

    private final List<ECODiagnostic> diagnostics;

    private DEFDesign design;

    /**
     * @param name Name of the document used in diagnostics, may be null
     * @param text Full text of the document
     */
    public DEFParser(String name, String text) {
        this.name = name;
        this.tokens = new DEFTokenizer(text).getTokens();
        this.components = new LinkedHashMap<>();
        this.nets = new LinkedHashMap<>();
        this.declaredCounts = new EnumMap<>(DEFSection.class);
        this.diagnostics = new ArrayList<>();
    }

    /**
     * Convenience method to parse DEF text in one call.
     * @param name Name of the document used in diagnostics, may be null
     * @param text Full text of the document
     * @return The extracted design
     */
    public static DEFDesign parse(String name, String text) {
        return new DEFParser(name, text).parse();
    }

    /**
     * Runs the component and net passes. Repeated calls return the same result.
     * @return The extracted design
     */
    public DEFDesign parse() {
        if (design == null) {
            parseComponents();
            parseNets();
            design = new DEFDesign(name, components, nets, declaredCounts, diagnostics);
        }
        return design;
    }

    private void addDiagnostic(ECODiagnosticType type, String subject, String message) {
        diagnostics.add(new ECODiagnostic(type, name, subject, message));
    }

    private static boolean isInteger(String s) {
        if (s.isEmpty()) return false;
        for (int i = 0; i < s.length(); i++) {
            if (!Character.isDigit(s.charAt(i))) return false;
        }
        return true;
    }

    /**
     * Locates the body of a section: the tokens between {@code <KEYWORD> <count> ;}
     * and {@code END <KEYWORD>}. Records the declared count when found.
     * @return The body tokens or null if the section is missing or unterminated
     */
    private List<DEFToken> findSection(DEFSection section) {
        String keyword = section.getKeyword();
        int start = -1;
        for (int i = 0; i + 2 < tokens.size(); i++) {
            if (tokens.get(i).is(keyword) && isInteger(tokens.get(i + 1).text)
                    && tokens.get(i + 2).is(DEFTokenizer.SEMICOLON)
                    && (i == 0 || !tokens.get(i - 1).is(DEFSection.END))) {
                start = i;
                break;
            }
        }
        if (start == -1) {
            addDiagnostic(ECODiagnosticType.MISSING_SECTION, keyword,
                    "No " + keyword + " section found");
            return null;
        }
        int bodyStart = start + 3;
        for (int i = bodyStart; i + 1 < tokens.size(); i++) {
            if (tokens.get(i).is(DEFSection.END) && tokens.get(i + 1).is(keyword)) {
                // Digits only, but may still overflow an int
                try {
                    declaredCounts.put(section, Integer.parseInt(tokens.get(start + 1).text));
                } catch (NumberFormatException e) {
                    declaredCounts.put(section, Integer.MAX_VALUE);
                }
                return tokens.subList(bodyStart, i);
            }
        }
        addDiagnostic(ECODiagnosticType.MISSING_SECTION, keyword,
                "No END " + keyword + " found for " + keyword + " section starting on line "
                        + tokens.get(start).line);
        return null;
    }

    private void checkCount(DEFSection section, int recordCount) {
        Integer declared = declaredCounts.get(section);
        if (declared != null && declared != recordCount) {
            addDiagnostic(ECODiagnosticType.COUNT_MISMATCH, section.getKeyword(),
                    section.getKeyword() + " declares " + declared + " records but "
                            + recordCount + " were found");
        }
    }

    private static boolean isPunctuation(DEFToken t) {
        return t.is(DEFTokenizer.LEFT_PAREN) || t.is(DEFTokenizer.RIGHT_PAREN)
                || t.is(DEFTokenizer.SEMICOLON) || t.is(PROPERTY_START) || t.is(RECORD_START);
    }

    //===================================================================================//
    /* COMPONENTS                                                                        */
    //===================================================================================//

    /**
     * Records have the form {@code - <instance> <cellType> [modifiers] ;} and may
     * span several lines.
     */
    private void parseComponents() {
        List<DEFToken> body = findSection(DEFSection.COMPONENTS);
        if (body == null) return;
        int recordCount = 0;
        int i = 0;
        while (i < body.size()) {
            if (!body.get(i).is(RECORD_START)) {
                i++;
                continue;
            }
            recordCount++;
            DEFToken startToken = body.get(i);
            int end = i + 1;
            while (end < body.size() && !body.get(end).is(DEFTokenizer.SEMICOLON)) {
                end++;
            }
            if (end == body.size()) {
                addDiagnostic(ECODiagnosticType.MALFORMED_RECORD, null,
                        "Unterminated component record on line " + startToken.line);
                break;
            }
            List<DEFToken> record = body.subList(i + 1, end);
            if (record.size() < 2 || isPunctuation(record.get(0)) || isPunctuation(record.get(1))) {
                addDiagnostic(ECODiagnosticType.MALFORMED_RECORD, null,
                        "Skipping malformed component record on line " + startToken.line);
            } else {
                addComponent(new DEFComponent(record.get(0).text, record.get(1).text));
            }
            i = end + 1;
        }
        checkCount(DEFSection.COMPONENTS, recordCount);
    }

    private void addComponent(DEFComponent c) {
        if (components.put(c.getName(), c) != null) {
            addDiagnostic(ECODiagnosticType.DUPLICATE_NAME, c.getName(),
                    "Component " + c.getName() + " is declared more than once, keeping the last type "
                            + c.getCellType());
        }
    }

    //===================================================================================//
    /* NETS                                                                              */
    //===================================================================================//

    /**
     * Net records are reassembled line by line: a line starting with '-' opens a
     * new record (closing any open one), a line ending with ';' closes the open
     * record and any other line continues it.
     */
    private void parseNets() {
        List<DEFToken> body = findSection(DEFSection.NETS);
        if (body == null) return;
        int recordCount = 0;
        List<DEFToken> current = null;
        for (DEFToken t : body) {
            if (t.firstOnLine && t.is(RECORD_START)) {
                if (current != null) {
                    finishNetRecord(current);
                }
                current = new ArrayList<>();
                recordCount++;
            } else if (current != null) {
                current.add(t);
            } else {
                continue;
            }
            if (t.lastOnLine && t.is(DEFTokenizer.SEMICOLON)) {
                finishNetRecord(current);
                current = null;
            }
        }
        if (current != null) {
            finishNetRecord(current);
        }
        checkCount(DEFSection.NETS, recordCount);
    }

    /**
     * @param record Tokens of one logical record, without its leading '-'
     */
    private void finishNetRecord(List<DEFToken> record) {
        int firstParen = -1;
        StringBuilder netName = new StringBuilder();
        for (int i = 0; i < record.size(); i++) {
            DEFToken t = record.get(i);
            if (t.is(DEFTokenizer.LEFT_PAREN)) {
                firstParen = i;
                break;
            }
            if (t.is(DEFTokenizer.SEMICOLON)) continue;
            if (netName.length() > 0) netName.append(' ');
            netName.append(t.text);
        }
        if (firstParen == -1) {
            // A net without connections, nothing to record
            return;
        }
        if (netName.length() == 0) {
            addDiagnostic(ECODiagnosticType.MALFORMED_RECORD, null,
                    "Skipping net record without a name on line " + record.get(0).line);
            return;
        }
        List<DEFConnection> connections = parseConnections(record.subList(firstParen, record.size()));
        if (connections.isEmpty()) {
            return;
        }
        String n = netName.toString();
        if (nets.put(n, new DEFNet(n, connections)) != null) {
            addDiagnostic(ECODiagnosticType.DUPLICATE_NAME, n,
                    "Net " + n + " is declared more than once, keeping the last connections");
        }
    }

    /**
     * Reads {@code ( instance pin )} groups left to right until the first
     * top-level '+' that starts the net's properties. Groups with fewer than two
     * entries are skipped.
     */
    private static List<DEFConnection> parseConnections(List<DEFToken> list) {
        List<DEFConnection> connections = new ArrayList<>();
        List<String> group = null;
        for (DEFToken t : list) {
            if (group == null) {
                if (t.is(PROPERTY_START)) {
                    break;
                }
                if (t.is(DEFTokenizer.LEFT_PAREN)) {
                    group = new ArrayList<>();
                }
            } else if (t.is(DEFTokenizer.RIGHT_PAREN)) {
                if (group.size() >= 2) {
                    connections.add(new DEFConnection(group.get(0), group.get(1)));
                }
                group = null;
            } else if (t.is(DEFTokenizer.LEFT_PAREN)) {
                // Nested groups are not part of the supported grammar, restart
                group = new ArrayList<>();
            } else if (!t.is(DEFTokenizer.SEMICOLON)) {
                group.add(t.text);
            }
        }
        return connections;
    }
}
