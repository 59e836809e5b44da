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

package com.xilinx.defeco.tests;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

public class TestCodePerfTracker {

    @Test
    public void testPrintProgress() {
        ByteArrayOutputStream baos = new ByteArrayOutputStream();
        CodePerfTracker t = new CodePerfTracker("Analysis", new PrintStream(baos, true));
        t.start("Parse DEF").stop().start("Order Buffers").stop();
        t.printSummary();

        String printed = new String(baos.toByteArray(), StandardCharsets.UTF_8);
        Assertions.assertTrue(printed.contains("Analysis"));
        Assertions.assertTrue(printed.contains("               Parse DEF: "));
        Assertions.assertTrue(printed.contains("           Order Buffers: "));
        Assertions.assertTrue(printed.contains("*Total*"));
        Assertions.assertNotNull(t.getRuntime("Parse DEF"));
        Assertions.assertTrue(t.getRuntime("Parse DEF") >= 0);
        Assertions.assertNull(t.getRuntime("Write Output"));
    }

    @Test
    public void testSummaryOnly() {
        ByteArrayOutputStream baos = new ByteArrayOutputStream();
        CodePerfTracker t = new CodePerfTracker("Analysis", new PrintStream(baos, true), false);
        t.setPrintProgress(false);
        t.start("Parse DEF").stop();
        Assertions.assertEquals(0, baos.size());

        t.setVerbose(true);
        t.printSummary();
        String printed = new String(baos.toByteArray(), StandardCharsets.UTF_8);
        Assertions.assertTrue(printed.contains("Parse DEF"));
        Assertions.assertTrue(printed.contains("*Total*"));
        Assertions.assertEquals("Analysis", t.getName());
    }

    @Test
    public void testSilent() {
        CodePerfTracker.SILENT.start("Parse DEF").stop().printSummary();
        Assertions.assertNull(CodePerfTracker.SILENT.getRuntime("Parse DEF"));
        Assertions.assertFalse(CodePerfTracker.SILENT.isVerbose());
    }
}
