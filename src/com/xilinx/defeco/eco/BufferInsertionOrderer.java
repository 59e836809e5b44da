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
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

import org.jgrapht.Graph;
import org.jgrapht.alg.cycle.CycleDetector;
import org.jgrapht.graph.DefaultDirectedGraph;
import org.jgrapht.graph.DefaultEdge;

import com.xilinx.defeco.diagnostics.ECODiagnostic;
import com.xilinx.defeco.diagnostics.ECODiagnosticType;

/**
 * Orders buffer insertion commands so that a buffer is inserted before any
 * buffer whose loads reference it, either by instance name or through a
 * top-level pin named after its output net. Buffers are emitted in layers of
 * mutually independent buffers, each layer sorted by name. If the
 * dependencies cannot be resolved (a cycle, or the layer limit is hit) the
 * remaining buffers are appended in name order and the result is marked as a
 * fallback.
 */
public class BufferInsertionOrderer {

    private final int maxIterations;

    public BufferInsertionOrderer() {
        this(Integer.MAX_VALUE);
    }

    /**
     * @param maxIterations Upper bound on the number of dependency layers
     */
    public BufferInsertionOrderer(int maxIterations) {
        if (maxIterations < 1) {
            throw new IllegalArgumentException("Max iterations must be positive, found " + maxIterations);
        }
        this.maxIterations = maxIterations;
    }

    public BufferInsertionOrderer(ECOAnalyzerConfig config) {
        this(config.getMaxOrderIterations());
    }

    public int getMaxIterations() {
        return maxIterations;
    }

    /**
     * Builds the dependency graph between the given commands. An edge from A
     * to B means A must be emitted before B.
     * @param commands Commands with unique buffer names
     * @return The dependency graph, with one vertex per buffer name
     */
    public static Graph<String, DefaultEdge> buildDependencyGraph(Map<String, InsertBufferCommand> commands) {
        Graph<String, DefaultEdge> graph = new DefaultDirectedGraph<>(DefaultEdge.class);
        Map<String, List<String>> driversOfNet = new HashMap<>();
        for (InsertBufferCommand cmd : commands.values()) {
            graph.addVertex(cmd.getInstanceName());
            driversOfNet.computeIfAbsent(cmd.getOutputNetName(), n -> new ArrayList<>())
                    .add(cmd.getInstanceName());
        }
        for (InsertBufferCommand cmd : commands.values()) {
            String to = cmd.getInstanceName();
            for (String inst : cmd.getReferencedInstanceNames()) {
                if (!inst.equals(to) && graph.containsVertex(inst)) {
                    graph.addEdge(inst, to);
                }
            }
            for (String net : cmd.getReferencedNetNames()) {
                for (String from : driversOfNet.getOrDefault(net, Collections.emptyList())) {
                    if (!from.equals(to)) {
                        graph.addEdge(from, to);
                    }
                }
            }
        }
        return graph;
    }

    /**
     * @param commands The insertion commands, in any order
     * @param diagnostics Receives a warning when the fallback order is used
     * @return All given commands in dependency order
     * @throws IllegalArgumentException if two commands share a buffer name
     */
    public BufferOrdering order(List<InsertBufferCommand> commands, List<ECODiagnostic> diagnostics) {
        Map<String, InsertBufferCommand> byName = new LinkedHashMap<>();
        for (InsertBufferCommand cmd : commands) {
            if (byName.put(cmd.getInstanceName(), cmd) != null) {
                throw new IllegalArgumentException("Duplicate buffer name " + cmd.getInstanceName());
            }
        }
        Graph<String, DefaultEdge> graph = buildDependencyGraph(byName);

        List<InsertBufferCommand> ordered = new ArrayList<>();
        List<List<String>> layers = new ArrayList<>();
        SortedSet<String> remaining = new TreeSet<>(byName.keySet());
        Set<String> emitted = new HashSet<>();
        int maxLayers = Math.min(byName.size(), maxIterations);
        while (!remaining.isEmpty() && layers.size() < maxLayers) {
            List<String> layer = new ArrayList<>();
            for (String name : remaining) {
                if (isReady(graph, name, emitted)) {
                    layer.add(name);
                }
            }
            if (layer.isEmpty()) break;
            for (String name : layer) {
                ordered.add(byName.get(name));
            }
            emitted.addAll(layer);
            remaining.removeAll(layer);
            layers.add(layer);
        }

        if (remaining.isEmpty()) {
            return new BufferOrdering.Ordered(ordered, layers);
        }

        for (String name : remaining) {
            ordered.add(byName.get(name));
        }
        SortedSet<String> cyclic = new TreeSet<>(new CycleDetector<>(graph).findCycles());
        String message = "Could not order buffer insertions " + remaining;
        if (cyclic.isEmpty()) {
            message += " within " + maxLayers + " iteration(s)";
        } else {
            message += ", cyclic dependencies between " + cyclic;
        }
        diagnostics.add(new ECODiagnostic(ECODiagnosticType.DEPENDENCY_CYCLE, null, remaining.first(),
                message + ", emitting them in name order", new ArrayList<>(remaining)));
        return new BufferOrdering.OrderedWithFallback(ordered, layers, remaining);
    }

    private static boolean isReady(Graph<String, DefaultEdge> graph, String name, Set<String> emitted) {
        for (DefaultEdge e : graph.incomingEdgesOf(name)) {
            if (!emitted.contains(graph.getEdgeSource(e))) {
                return false;
            }
        }
        return true;
    }
}
