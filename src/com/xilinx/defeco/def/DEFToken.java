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

import java.util.Objects;

class DEFToken {
    public final String text;
    /** 1-based physical line number */
    public final int line;
    public final boolean firstOnLine;
    public final boolean lastOnLine;

    public DEFToken(String text, int line, boolean firstOnLine, boolean lastOnLine) {
        this.text = Objects.requireNonNull(text);
        this.line = line;
        this.firstOnLine = firstOnLine;
        this.lastOnLine = lastOnLine;
    }

    public boolean is(String s) {
        return text.equals(s);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        DEFToken defToken = (DEFToken) o;
        return line == defToken.line && firstOnLine == defToken.firstOnLine
                && lastOnLine == defToken.lastOnLine && text.equals(defToken.text);
    }

    @Override
    public int hashCode() {
        return Objects.hash(text, line, firstOnLine, lastOnLine);
    }

    @Override
    public String toString() {
        String displayText = text;
        if (text.length()>120) {
            displayText = text.substring(0,100)+"[shortened, length is "+text.length()+"]";
        }
        return displayText + "@" + line;
    }
}
