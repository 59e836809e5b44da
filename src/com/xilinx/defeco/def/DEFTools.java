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

import java.nio.file.Path;
import java.nio.file.Paths;

import com.xilinx.defeco.util.FileTools;

/**
 * Helper methods to load DEF documents.
 */
public class DEFTools {

    /**
     * Reads and extracts a DEF file.
     * @param fileName Name of the DEF file
     * @return The extracted design, named after the file
     * @throws java.io.UncheckedIOException if the file cannot be found or read
     */
    public static DEFDesign readDEFFile(String fileName) {
        return readDEFFile(Paths.get(fileName));
    }

    /**
     * Reads and extracts a DEF file.
     * @param path Path of the DEF file
     * @return The extracted design, named after the file
     * @throws java.io.UncheckedIOException if the file cannot be found or read
     */
    public static DEFDesign readDEFFile(Path path) {
        String text = FileTools.getTextFromFile(path);
        return DEFParser.parse(path.toString(), text);
    }
}
