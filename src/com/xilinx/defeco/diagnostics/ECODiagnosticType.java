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

package com.xilinx.defeco.diagnostics;

/**
 * An enumeration of all the anomalies reported while extracting, classifying
 * and ordering ECO changes. None of them aborts an analysis run.
 */
public enum ECODiagnosticType {
    /** A COMPONENTS or NETS section is absent or has no END marker */
    MISSING_SECTION(true),
    /** A record did not have the expected shape and was skipped */
    MALFORMED_RECORD(true),
    /** The number of records differs from the count declared by the section */
    COUNT_MISMATCH(false),
    /** An instance or net name was declared more than once */
    DUPLICATE_NAME(true),
    /** A cell kept its name but changed to a different logic function */
    FUNCTION_CHANGE(false),
    /** A new cell that is not a buffer */
    UNCLASSIFIED_NEW_CELL(false),
    /** A cell present only in the original design */
    REMOVED_CELL(false),
    /** A new buffer has more than one output net */
    MULTIPLE_OUTPUT_NETS(true),
    /** A new buffer has no output net or drives no loads */
    UNRESOLVABLE_BUFFER(true),
    /** Buffer insertions could not be fully ordered by their dependencies */
    DEPENDENCY_CYCLE(true);

    private final boolean isWarning;

    private ECODiagnosticType(boolean isWarning) {
        this.isWarning = isWarning;
    }

    /**
     * @return True if this diagnostic type is reported as a warning, false if it
     *         is informational only.
     */
    public boolean isWarning() {
        return isWarning;
    }

    /**
     * @return The severity label used when printing diagnostics of this type.
     */
    public String getSeverityLabel() {
        return isWarning ? "WARNING" : "INFO";
    }
}
