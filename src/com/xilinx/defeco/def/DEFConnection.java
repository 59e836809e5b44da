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

/**
 * One terminal attached to a net: an (instance, pin) pair. Top-level I/O pins
 * use the instance name {@link #TOP_LEVEL_PIN}.
 */
public class DEFConnection {

    public static final String TOP_LEVEL_PIN = "PIN";

    private final String instanceName;

    private final String pinName;

    public DEFConnection(String instanceName, String pinName) {
        this.instanceName = Objects.requireNonNull(instanceName);
        this.pinName = Objects.requireNonNull(pinName);
    }

    public String getInstanceName() {
        return instanceName;
    }

    public String getPinName() {
        return pinName;
    }

    public boolean isTopLevelPin() {
        return TOP_LEVEL_PIN.equals(instanceName);
    }

    /**
     * @return The terminal rendered as {@code instance/pin}
     */
    public String getFullName() {
        return instanceName + "/" + pinName;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        DEFConnection that = (DEFConnection) o;
        return instanceName.equals(that.instanceName) && pinName.equals(that.pinName);
    }

    @Override
    public int hashCode() {
        return Objects.hash(instanceName, pinName);
    }

    @Override
    public String toString() {
        return getFullName();
    }
}
