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
import java.util.List;

/**
 * Splits DEF text into {@link DEFToken}s while keeping track of physical line
 * boundaries, which the NETS section relies on to reassemble multi-line
 * records.
 *
 * Parentheses and semicolons are always tokens of their own, a quoted string
 * is a single token (quotes included) and a '#' at the start of a token
 * comments out the rest of the line. Everything else is separated by
 * whitespace.
 */
public class DEFTokenizer {

    public static final String LEFT_PAREN = "(";
    public static final String RIGHT_PAREN = ")";
    public static final String SEMICOLON = ";";

    private final String text;

    private List<DEFToken> tokens;

    private int position;

    public DEFTokenizer(String text) {
        this.text = text == null ? "" : text;
    }

    /**
     * Check if a character ends a token.
     */
    private static boolean endsToken(char c) {
        switch (c) {
            case '"':
            case '(':
            case ')':
            case ';':
                return true;
            default:
                return Character.isWhitespace(c);
        }
    }

    /**
     * Splits one physical line into token strings.
     * @param line The line, without its line terminator
     * @return The token strings in order of appearance
     */
    static List<String> splitLine(String line) {
        List<String> result = new ArrayList<>();
        int i = 0;
        int n = line.length();
        while (i < n) {
            char c = line.charAt(i);
            if (Character.isWhitespace(c)) {
                i++;
            } else if (c == '#') {
                break;
            } else if (c == '(' || c == ')' || c == ';') {
                result.add(String.valueOf(c));
                i++;
            } else if (c == '"') {
                int end = line.indexOf('"', i + 1);
                // An unterminated string runs to the end of the line
                int stop = end < 0 ? n : end + 1;
                result.add(line.substring(i, stop));
                i = stop;
            } else {
                int start = i;
                while (i < n && !endsToken(line.charAt(i))) {
                    i++;
                }
                result.add(line.substring(start, i));
            }
        }
        return result;
    }

    /**
     * Tokenizes the complete text on first use.
     * @return All tokens of the text, in order
     */
    public List<DEFToken> getTokens() {
        if (tokens == null) {
            tokens = new ArrayList<>();
            String[] lines = text.split("\r\n|\r|\n", -1);
            for (int l = 0; l < lines.length; l++) {
                List<String> lineTokens = splitLine(lines[l]);
                for (int i = 0; i < lineTokens.size(); i++) {
                    tokens.add(new DEFToken(lineTokens.get(i), l + 1, i == 0,
                            i == lineTokens.size() - 1));
                }
            }
        }
        return tokens;
    }

    /**
     * Get the next token object
     * @return token object, or null if at end of text
     */
    public DEFToken getOptionalNextToken() {
        List<DEFToken> all = getTokens();
        if (position >= all.size()) {
            return null;
        }
        return all.get(position++);
    }
}
