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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * The buffer insertion commands in emission order. An {@link Ordered} result
 * respects every dependency; an {@link OrderedWithFallback} result could not
 * place some buffers and emitted them lexically after the ordered ones.
 */
public abstract class BufferOrdering {

    private final List<InsertBufferCommand> commands;

    private final List<List<String>> layers;

    private BufferOrdering(List<InsertBufferCommand> commands, List<List<String>> layers) {
        this.commands = Collections.unmodifiableList(new ArrayList<>(commands));
        List<List<String>> copy = new ArrayList<>();
        for (List<String> layer : layers) {
            copy.add(Collections.unmodifiableList(new ArrayList<>(layer)));
        }
        this.layers = Collections.unmodifiableList(copy);
    }

    public List<InsertBufferCommand> getCommands() {
        return commands;
    }

    /**
     * @return Buffer names of each dependency layer that was emitted in order,
     * without the fallback tail
     */
    public List<List<String>> getLayers() {
        return layers;
    }

    public abstract boolean isFallback();

    /**
     * @return Names of the buffers that could not be ordered, empty unless
     * {@link #isFallback()}
     */
    public abstract SortedSet<String> getStuckBuffers();

    public static final class Ordered extends BufferOrdering {

        public Ordered(List<InsertBufferCommand> commands, List<List<String>> layers) {
            super(commands, layers);
        }

        @Override
        public boolean isFallback() {
            return false;
        }

        @Override
        public SortedSet<String> getStuckBuffers() {
            return Collections.emptySortedSet();
        }
    }

    public static final class OrderedWithFallback extends BufferOrdering {

        private final SortedSet<String> stuck;

        public OrderedWithFallback(List<InsertBufferCommand> commands, List<List<String>> layers,
                SortedSet<String> stuck) {
            super(commands, layers);
            this.stuck = Collections.unmodifiableSortedSet(new TreeSet<>(stuck));
        }

        @Override
        public boolean isFallback() {
            return true;
        }

        @Override
        public SortedSet<String> getStuckBuffers() {
            return stuck;
        }
    }
}
