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
package com.xilinx.defeco.util;

import java.io.PrintStream;

/**
 * Common class for generating console messages.
 */
public class MessageGenerator {

    private static final String BAR =
            "==============================================================================";

    /**
     * Used as a general way to create an error message and send it to
     * std.err.
     * @param msg The message to print to standard error
     */
    public static void briefError(String msg) {
        briefError(msg, System.err);
    }

    /**
     * Prints an error message to the provided stream.
     * @param msg The message to print
     * @param ps Destination stream
     */
    public static void briefError(String msg, PrintStream ps) {
        ps.println(msg);
    }

    /**
     * Prints a generic header to separate operations.
     * @param s Title of the header
     * @param ps Destination stream
     */
    public static void printHeader(String s, PrintStream ps) {
        double whiteSpace = (72 - s.length())/2.0;
        String left = makeWhiteSpace((int)(whiteSpace));
        String right = makeWhiteSpace((int)(whiteSpace+0.5));
        ps.println(BAR);
        ps.println("== "+ left + s + right +" ==");
        ps.println(BAR);
    }

    /**
     * Creates a whitespace string with length number of spaces.
     * @param length Number of spaces in the string.
     * @return The newly created whitespace string.
     */
    public static String makeWhiteSpace(int length) {
        if (length < 1)
            return "";
        StringBuilder sb = new StringBuilder(length);
        for (int i=0; i<length; i++) {
            sb.append(' ');
        }
        return sb.toString();
    }
}
