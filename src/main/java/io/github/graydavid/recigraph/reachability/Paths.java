/*
 * Copyright 2021 David Gray
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package io.github.graydavid.recigraph.reachability;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import io.github.graydavid.recigraph.core.Graph;
import io.github.graydavid.recigraph.core.Node;
import io.github.graydavid.recigraph.core.NodeKind;

/** Finds which nodes evaluation would have to visit to compute a target from the values already in a Graph. */
public class Paths {
    private Paths() {}

    /**
     * Returns the target plus every node on a path from the last valued nodes to it. The walk stops at nodes that have
     * a value. For a conditional with a condition already known to be true, only that condition and its paired
     * possibility are followed; otherwise all of the conditional's predecessors are.
     */
    public static Set<String> getPathToTarget(Graph graph, String target) {
        Set<String> path = new LinkedHashSet<>();
        addPathToTarget(graph, target, path);
        return path;
    }

    private static void addPathToTarget(Graph graph, String target, Set<String> path) {
        if (!path.add(target)) {
            return;
        }
        Node node = graph.getNode(target);
        if (node.hasValue()) {
            return;
        }

        if (node.getKind() == NodeKind.CONDITIONAL) {
            List<String> conditions = node.getConditions();
            for (int i = 0; i < conditions.size(); ++i) {
                String condition = conditions.get(i);
                if (graph.hasValue(condition) && Boolean.TRUE.equals(graph.getValue(condition))) {
                    addPathToTarget(graph, condition, path);
                    addPathToTarget(graph, node.getPossibilities().get(i), path);
                    return;
                }
            }
        }
        graph.getPredecessors(target).forEach(predecessor -> addPathToTarget(graph, predecessor, path));
    }
}
