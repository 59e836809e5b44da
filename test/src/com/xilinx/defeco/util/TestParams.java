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

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

public class TestParams {

    private static final String KEY = "DEFECO_TEST_PARAM";

    @AfterEach
    public void clearProperty() {
        System.clearProperty(KEY);
    }

    @ParameterizedTest
    @ValueSource(strings = {"1", "true", "TRUE", "yes"})
    public void testIsSet(String value) {
        Assertions.assertTrue(Params.isSet(value));
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "0", "false", "False"})
    public void testIsNotSet(String value) {
        Assertions.assertFalse(Params.isSet(value));
        Assertions.assertFalse(Params.isSet(null));
    }

    @Test
    public void testJVMParameter() {
        Assertions.assertFalse(Params.isParamSet(KEY));
        Assertions.assertNull(Params.getParamValue(KEY));
        System.setProperty(KEY, "true");
        Assertions.assertTrue(Params.isParamSet(KEY));
        Assertions.assertEquals("true", Params.getParamValue(KEY));
    }

    @Test
    public void testIntSetting() {
        Assertions.assertEquals(42, Params.getParamOrDefaultIntSetting(KEY, 42));
        System.setProperty(KEY, " 17 ");
        Assertions.assertEquals(17, Params.getParamOrDefaultIntSetting(KEY, 42));
        System.setProperty(KEY, "seventeen");
        Assertions.assertNull(Params.getParamIntValue(KEY));
        Assertions.assertEquals(42, Params.getParamOrDefaultIntSetting(KEY, 42));
    }

    @Test
    public void testListSetting() {
        List<String> defaults = Collections.singletonList("BUF");
        Assertions.assertSame(defaults, Params.getParamOrDefaultListSetting(KEY, defaults));
        System.setProperty(KEY, "Y, Z,,Q ");
        Assertions.assertEquals(Arrays.asList("Y", "Z", "Q"), Params.getParamOrDefaultListSetting(KEY, defaults));
        System.setProperty(KEY, " , ");
        Assertions.assertSame(defaults, Params.getParamOrDefaultListSetting(KEY, defaults));
    }

    @Test
    public void testSplitList() {
        Assertions.assertEquals(Arrays.asList("a", "b"), Params.splitList("a,b"));
        Assertions.assertTrue(Params.splitList("").isEmpty());
    }
}
