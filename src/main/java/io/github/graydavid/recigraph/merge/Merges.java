/*
 * Copyright 2021 David Gray
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package io.github.graydavid.recigraph.merge;

import java.util.Arrays;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

import io.github.graydavid.recigraph.core.Graph;
import io.github.graydavid.recigraph.core.IncompatibleGraphsException;
import io.github.graydavid.recigraph.core.Node;
import io.github.graydavid.recigraph.reachability.Paths;

/** Checks graphs for structural compatibility, merges them, and extracts subgraphs. */
public class Merges {
    private Merges() {}

    /**
     * Answers whether the same-named nodes of two graphs can be merged. They can if their kinds match and either all of
     * their attributes are equal or:<br>
     * * when both have a value, the values are equal (by {@link Object#equals(Object)}: see
     * {@link io.github.graydavid.recigraph.core.Recipes#named(String, io.github.graydavid.recigraph.core.Recipe)} for
     * making separately-created recipes equal), and<br>
     * * when both are defined, their definitions are the same, argument and possibility order included.<br>
     * An undefined node is compatible with any definition of the same kind.
     *
     * @throws io.github.graydavid.recigraph.core.UnknownNodeException if either graph lacks the node.
     */
    public static boolean areCompatible(Graph first, Graph second, String name) {
        Node firstNode = first.getNode(name);
        Node secondNode = second.getNode(name);
        if (firstNode.getKind() != secondNode.getKind()) {
            return false;
        }
        if (firstNode.hasSameAttributes(secondNode)) {
            return true;
        }
        if (firstNode.hasValue() && secondNode.hasValue()
                && !Objects.equals(firstNode.getValue(), secondNode.getValue())) {
            return false;
        }
        if (firstNode.isDefined() && secondNode.isDefined()) {
            return firstNode.hasSameDefinition(secondNode);
        }
        return first.getPredecessors(name).isEmpty() || second.getPredecessors(name).isEmpty();
    }

    /** Answers whether every node the two graphs share is compatible. Acyclicity of the union isn't verified. */
    public static boolean areCompatible(Graph first, Graph second) {
        return first.getNodeNames()
                .stream()
                .filter(second::contains)
                .allMatch(name -> areCompatible(first, second, name));
    }

    /**
     * Returns a new graph that's the union of the two graphs' nodes and edges. A shared node takes its definition from
     * whichever side has one (the first, if both) and its value from whichever side has one (the first, if both).
     * Neither input is modified.
     *
     * @throws IncompatibleGraphsException if the graphs aren't compatible.
     */
    public static Graph merge(Graph first, Graph second) {
        Set<String> conflicts = new LinkedHashSet<>();
        first.getNodeNames()
                .stream()
                .filter(second::contains)
                .filter(name -> !areCompatible(first, second, name))
                .forEach(conflicts::add);
        if (!conflicts.isEmpty()) {
            throw new IncompatibleGraphsException("Cannot merge graphs that conflict on nodes " + conflicts);
        }

        Graph merged = first.copy();
        second.getNodeNames().forEach(name -> merged.mergeNode(second.getNode(name)));
        return merged;
    }

    /**
     * Returns a deep copy of the subgraph induced by the given names: those nodes and the edges between them. Names
     * that aren't in the graph are ignored. Definitions of kept nodes still mention removed dependencies.
     */
    public static Graph getSubgraph(Graph graph, Collection<String> names) {
        Graph subgraph = graph.copy();
        Set<String> kept = Set.copyOf(names);
        graph.getNodeNames().stream().filter(name -> !kept.contains(name)).forEach(subgraph::removeStep);
        return subgraph;
    }

    /**
     * Returns the subgraph induced by the nodes that evaluation would have to visit to compute the targets from the
     * graph's current values.
     */
    public static Graph getExecutionSubgraph(Graph graph, String... targets) {
        Set<String> names = new LinkedHashSet<>();
        Arrays.stream(targets).forEach(target -> names.addAll(Paths.getPathToTarget(graph, target)));
        return getSubgraph(graph, names);
    }
}
