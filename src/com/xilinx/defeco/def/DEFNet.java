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
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A net from the NETS section with its connections in document order.
 */
public class DEFNet {

    private final String name;

    private final List<DEFConnection> connections;

    public DEFNet(String name, List<DEFConnection> connections) {
        this.name = Objects.requireNonNull(name);
        this.connections = Collections.unmodifiableList(new ArrayList<>(connections));
    }

    public String getName() {
        return name;
    }

    /**
     * @return An unmodifiable view of the connections, in document order
     */
    public List<DEFConnection> getConnections() {
        return connections;
    }

    public boolean isConnectedTo(String instanceName) {
        for (DEFConnection c : connections) {
            if (c.getInstanceName().equals(instanceName)) {
                return true;
            }
        }
        return false;
    }

    @Override
    public String toString() {
        return name + " " + connections;
    }
}
