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
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

public class TestDEFTokenizer {

    private List<DEFToken> readTokens(DEFTokenizer tokenizer) {
        List<DEFToken> tokens = new ArrayList<>();
        DEFToken t;
        while ((t = tokenizer.getOptionalNextToken()) != null) {
            tokens.add(t);
        }
        return tokens;
    }

    @Test
    public void testSplitNetRecord() {
        Assertions.assertEquals(
                Arrays.asList("-", "net_a", "(", "u1", "Y", ")", "(", "u2", "A", ")", ";"),
                DEFTokenizer.splitLine("- net_a ( u1 Y ) ( u2 A ) ;"));
    }

    @Test
    public void testDelimitersWithoutWhitespace() {
        Assertions.assertEquals(Arrays.asList("-", "n1", "(", "u1", "Y", ")", "(", "PIN", "out", ")", ";"),
                DEFTokenizer.splitLine("- n1 (u1 Y)(PIN out);"));
    }

    @Test
    public void testQuotedString() {
        Assertions.assertEquals(Arrays.asList("BUSBITCHARS", "\"[]\"", ";"),
                DEFTokenizer.splitLine("BUSBITCHARS \"[]\" ;"));
        Assertions.assertEquals(Arrays.asList("DIVIDERCHAR", "\"/ ;"),
                DEFTokenizer.splitLine("DIVIDERCHAR \"/ ;"));
    }

    @ParameterizedTest
    @ValueSource(strings = {"# a comment ( u1 Y ) ;", "   #", ""})
    public void testCommentOrEmptyLine(String line) {
        Assertions.assertEquals(Collections.emptyList(), DEFTokenizer.splitLine(line));
    }

    @Test
    public void testTrailingComment() {
        Assertions.assertEquals(Arrays.asList("-", "u1", "INVx1", ";"),
                DEFTokenizer.splitLine("- u1 INVx1 ; # resized later"));
        // Only a '#' starting a token opens a comment
        Assertions.assertEquals(Arrays.asList("net#1", "(", "u1", "Y", ")"),
                DEFTokenizer.splitLine("net#1 ( u1 Y )"));
    }

    @Test
    public void testLineBoundaries() {
        DEFTokenizer tokenizer = new DEFTokenizer("- n1\r\n\n  ( u1 Y ) ;\r- n2");
        List<DEFToken> tokens = readTokens(tokenizer);
        Assertions.assertEquals(Arrays.asList(
                new DEFToken("-", 1, true, false),
                new DEFToken("n1", 1, false, true),
                new DEFToken("(", 3, true, false),
                new DEFToken("u1", 3, false, false),
                new DEFToken("Y", 3, false, false),
                new DEFToken(")", 3, false, false),
                new DEFToken(";", 3, false, true),
                new DEFToken("-", 4, true, false),
                new DEFToken("n2", 4, false, true)), tokens);
        Assertions.assertNull(tokenizer.getOptionalNextToken());
        Assertions.assertEquals(tokens, tokenizer.getTokens());
    }

    @Test
    public void testSingleTokenLine() {
        List<DEFToken> tokens = new DEFTokenizer("END NETS\n;").getTokens();
        Assertions.assertEquals(3, tokens.size());
        DEFToken semicolon = tokens.get(2);
        Assertions.assertTrue(semicolon.is(DEFTokenizer.SEMICOLON));
        Assertions.assertTrue(semicolon.firstOnLine);
        Assertions.assertTrue(semicolon.lastOnLine);
    }

    @Test
    public void testNullText() {
        Assertions.assertTrue(new DEFTokenizer(null).getTokens().isEmpty());
        Assertions.assertNull(new DEFTokenizer(null).getOptionalNextToken());
    }
}
