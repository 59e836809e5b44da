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

package com.xilinx.defeco.eco;

/**
 * A single change of an ECO changelist.
 */
public interface ECOCommand {

    /**
     * @return Name of the instance created or modified by this command
     */
    String getInstanceName();

    /**
     * @return The new cell type of the instance
     */
    String getCellType();

    /**
     * @return The command as consumed by downstream ECO tools
     */
    String toCommandString();
}
