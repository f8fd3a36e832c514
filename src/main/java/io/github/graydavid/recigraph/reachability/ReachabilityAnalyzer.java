/*
 * Copyright 2021 David Gray
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package io.github.graydavid.recigraph.reachability;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.stream.Collectors;

import io.github.graydavid.recigraph.core.Graph;
import io.github.graydavid.recigraph.core.Node;
import io.github.graydavid.recigraph.core.NodeKind;
import io.github.graydavid.recigraph.core.Reachability;

/**
 * Predicts whether nodes can be computed from the values currently in a Graph, without invoking any recipe. Results
 * are cached as each node's reachability tag, which is trusted by later queries until cleared: after any structural or
 * value change, call {@link #clearReachabilities(Graph)} before asking again.
 *
 * The rules:<br>
 * * A node with a value is REACHABLE.<br>
 * * A standard node with neither a value nor predecessors is UNREACHABLE.<br>
 * * Any other standard node is the worst of its predecessors.<br>
 * * A conditional node with a condition already known to be true has the reachability of the paired possibility.<br>
 * * Any other conditional node is REACHABLE if all of its conditions and possibilities are; UNREACHABLE if all of them
 * are, or if every condition that isn't UNREACHABLE is paired with an UNREACHABLE possibility; and UNCERTAIN otherwise.
 *
 * UNCERTAIN means the outcome depends on values that only evaluation will reveal.
 */
public class ReachabilityAnalyzer {
    private ReachabilityAnalyzer() {}

    /**
     * Finds (and tags) the reachability of the target and whatever it depends on.
     *
     * @throws io.github.graydavid.recigraph.core.UnknownNodeException if there's no such node.
     */
    public static Reachability findReachability(Graph graph, String target) {
        Node node = graph.getNode(target);
        if (node.hasReachability()) {
            return node.getReachability();
        }

        Reachability reachability;
        if (node.hasValue()) {
            reachability = Reachability.REACHABLE;
        } else if (node.getKind() == NodeKind.STANDARD) {
            reachability = findStandardReachability(graph, target);
        } else {
            reachability = findConditionalReachability(graph, node);
        }
        graph.setReachability(target, reachability);
        return reachability;
    }

    private static Reachability findStandardReachability(Graph graph, String target) {
        Collection<String> predecessors = graph.getPredecessors(target);
        if (predecessors.isEmpty()) {
            return Reachability.UNREACHABLE;
        }
        return findWorstReachability(graph, predecessors);
    }

    private static Reachability findConditionalReachability(Graph graph, Node node) {
        List<String> conditions = node.getConditions();
        List<String> possibilities = node.getPossibilities();
        for (int i = 0; i < conditions.size(); ++i) {
            String condition = conditions.get(i);
            if (graph.hasValue(condition) && Boolean.TRUE.equals(graph.getValue(condition))) {
                return findReachability(graph, possibilities.get(i));
            }
        }

        List<Reachability> conditionReachabilities = findAll(graph, conditions);
        List<Reachability> possibilityReachabilities = findAll(graph, possibilities);
        List<Reachability> all = new ArrayList<>(conditionReachabilities);
        all.addAll(possibilityReachabilities);
        if (Reachability.worst(all) == Reachability.REACHABLE) {
            return Reachability.REACHABLE;
        }
        if (Reachability.best(all) == Reachability.UNREACHABLE) {
            return Reachability.UNREACHABLE;
        }

        // The default possibility doesn't count: without knowing every condition, it can't be selected.
        List<Reachability> selectablePossibilities = new ArrayList<>();
        for (int i = 0; i < conditions.size(); ++i) {
            if (conditionReachabilities.get(i) != Reachability.UNREACHABLE) {
                selectablePossibilities.add(possibilityReachabilities.get(i));
            }
        }
        return Reachability.best(selectablePossibilities) == Reachability.UNREACHABLE ? Reachability.UNREACHABLE
                : Reachability.UNCERTAIN;
    }

    private static List<Reachability> findAll(Graph graph, List<String> names) {
        return names.stream().map(name -> findReachability(graph, name)).collect(Collectors.toList());
    }

    /** Finds the reachability of each target, and returns the worst of them. REACHABLE if there are no targets. */
    public static Reachability findWorstReachability(Graph graph, Collection<String> targets) {
        return Reachability.worst(targets.stream().map(target -> findReachability(graph, target))
                .collect(Collectors.toList()));
    }

    /** Removes the reachability tag of every node. */
    public static void clearReachabilities(Graph graph) {
        graph.getNodeNames().forEach(graph::clearReachability);
    }

    /** Removes the reachability tag of the named nodes. Unknown names are ignored. */
    public static void clearReachabilities(Graph graph, String... names) {
        Arrays.stream(names).filter(graph::contains).forEach(graph::clearReachability);
    }
}
