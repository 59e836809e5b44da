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

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A structured diagnostic record. Diagnostics are collected and returned
 * alongside analysis results so that callers decide how to surface them.
 */
public class ECODiagnostic {

    private final ECODiagnosticType type;

    private final String source;

    private final String subject;

    private final String message;

    private final List<String> relatedNames;

    public ECODiagnostic(ECODiagnosticType type, String source, String subject, String message,
            Collection<String> relatedNames) {
        this.type = Objects.requireNonNull(type);
        this.source = source;
        this.subject = subject;
        this.message = Objects.requireNonNull(message);
        this.relatedNames = relatedNames == null ? Collections.emptyList()
                : Collections.unmodifiableList(new ArrayList<>(relatedNames));
    }

    public ECODiagnostic(ECODiagnosticType type, String source, String subject, String message) {
        this(type, source, subject, message, null);
    }

    public ECODiagnosticType getType() {
        return type;
    }

    public boolean isWarning() {
        return type.isWarning();
    }

    /**
     * @return Name of the document the diagnostic stems from, or null if it is
     *         not tied to a single document.
     */
    public String getSource() {
        return source;
    }

    /**
     * @return The instance, net or section name the diagnostic is about, may be
     *         null.
     */
    public String getSubject() {
        return subject;
    }

    public String getMessage() {
        return message;
    }

    /**
     * @return Additional names involved (for example the stuck buffers of a
     *         dependency cycle), never null.
     */
    public List<String> getRelatedNames() {
        return relatedNames;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append(type.getSeverityLabel()).append(": [").append(type.name()).append("] ");
        if (source != null) {
            sb.append(source).append(": ");
        }
        sb.append(message);
        return sb.toString();
    }
}
