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

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;

import org.apache.commons.io.FilenameUtils;

/**
 * A collection of file reading and writing helpers used throughout DefEco.
 */
public class FileTools {

    /**
     * Reads the entire contents of a text file. The caller is cautioned not to
     * open extremely large files with this method.
     * @param fileName Name of the text file to load.
     * @return The file contents.
     */
    public static String getTextFromFile(String fileName) {
        return getTextFromFile(Paths.get(fileName));
    }

    /**
     * Reads the entire contents of a UTF-8 text file.
     * @param path Path of the text file to load.
     * @return The file contents.
     */
    public static String getTextFromFile(Path path) {
        try {
            return new String(Files.readAllBytes(path), StandardCharsets.UTF_8);
        } catch (NoSuchFileException e) {
            throw new UncheckedIOException("ERROR: Could not find file: " + path, e);
        } catch (IOException e) {
            throw new UncheckedIOException("ERROR: Could not read from file: " + path, e);
        }
    }

    /**
     * This is a simple method that writes the elements of a List of Strings
     * into lines in the text file fileName.
     * @param lines The List of Strings to be written
     * @param fileName Name of the text file to save the lines to
     */
    public static void writeLinesToTextFile(List<String> lines, String fileName) {
        String nl = System.lineSeparator();
        try (BufferedWriter bw = Files.newBufferedWriter(Paths.get(fileName), StandardCharsets.UTF_8)) {
            for (String line : lines) {
                bw.write(line + nl);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("ERROR: Could not write file: " + fileName, e);
        }
    }

    /**
     * This is a simple method that writes a String to a file and adds a new line.
     * @param text the String to write to the file
     * @param fileName Name of the text file
     */
    public static void writeStringToTextFile(String text, String fileName) {
        try (BufferedWriter bw = Files.newBufferedWriter(Paths.get(fileName), StandardCharsets.UTF_8)) {
            bw.write(text + System.lineSeparator());
        } catch (IOException e) {
            throw new UncheckedIOException("ERROR: Could not write file: " + fileName, e);
        }
    }

    /**
     * Checks that the named file exists and is a regular file.
     * @param fileName Name of the file to check
     * @return True if the file exists, false otherwise.
     */
    public static boolean fileExists(String fileName) {
        return fileName != null && Files.isRegularFile(Paths.get(fileName));
    }

    /**
     * Gets the lower case extension of a file name, without the dot.
     * @param fileName The file name
     * @return The extension, or the empty string if there is none.
     */
    public static String getFileExtension(String fileName) {
        return FilenameUtils.getExtension(fileName).toLowerCase();
    }
}
