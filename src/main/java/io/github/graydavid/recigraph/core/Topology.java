/*
 * Copyright 2021 David Gray
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package io.github.graydavid.recigraph.core;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/** A utility class for the topological views of a Graph: generations and order. */
class Topology {
    private Topology() {}

    /**
     * Partitions the nodes into topological generations: generation 0 holds the nodes without predecessors, and each
     * later generation holds the nodes whose predecessors are all in earlier generations. The index of a node's
     * generation is the length of the longest path reaching it from a source.
     *
     * @apiNote acyclicity is not verified. Nodes on a cycle (and everything downstream of one) never reach an in-degree
     *          of zero, so they're simply absent from the result.
     */
    static List<List<String>> generations(Set<String> nodeNames, Map<String, ? extends Set<String>> predecessors,
            Map<String, ? extends Set<String>> successors) {
        Map<String, Integer> remainingInDegrees = new HashMap<>();
        List<String> current = new ArrayList<>();
        for (String name : nodeNames) {
            int inDegree = predecessors.get(name).size();
            remainingInDegrees.put(name, inDegree);
            if (inDegree == 0) {
                current.add(name);
            }
        }

        List<List<String>> generations = new ArrayList<>();
        while (!current.isEmpty()) {
            generations.add(List.copyOf(current));
            List<String> next = new ArrayList<>();
            for (String name : current) {
                for (String successor : successors.get(name)) {
                    int remaining = remainingInDegrees.merge(successor, -1, Integer::sum);
                    if (remaining == 0) {
                        next.add(successor);
                    }
                }
            }
            current = next;
        }
        return List.copyOf(generations);
    }

    /** Flattens generations into a topological order: every node appears after all of its predecessors. */
    static List<String> order(List<List<String>> generations) {
        List<String> order = new ArrayList<>();
        generations.forEach(order::addAll);
        return List.copyOf(order);
    }
}
