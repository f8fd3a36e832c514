/*
 * Copyright 2021 David Gray
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package io.github.graydavid.recigraph.reachability;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

import io.github.graydavid.recigraph.core.Graph;
import io.github.graydavid.recigraph.core.Node;
import io.github.graydavid.recigraph.core.Reachability;

/** Checks, before executing anything, whether targets can be computed from a context. */
public class Feasibility {
    private Feasibility() {}

    /**
     * Applies context to the graph (or to a copy of it), clears stale reachability tags, and analyzes the targets.
     *
     * @param context values to apply, as in {@link Graph#setContext(Map)}: non-frozen values are cleared first.
     * @param inPlace whether to work on graph itself rather than on a copy. When true, graph is left with the context
     *        applied and with fresh reachability tags.
     */
    public static FeasibilityReport check(Graph graph, Map<String, ?> context, Collection<String> targets,
            boolean inPlace) {
        Graph working = inPlace ? graph : graph.copy();
        working.setContext(context);
        ReachabilityAnalyzer.clearReachabilities(working);
        Reachability reachability = ReachabilityAnalyzer.findWorstReachability(working, targets);
        return new FeasibilityReport(reachability, findMissingInputs(working, targets));
    }

    private static Set<String> findMissingInputs(Graph graph, Collection<String> targets) {
        Set<String> candidates = new LinkedHashSet<>(targets);
        targets.forEach(target -> candidates.addAll(graph.getAncestors(target)));
        Set<String> missing = new LinkedHashSet<>();
        for (String name : candidates) {
            Node node = graph.getNode(name);
            if (graph.getPredecessors(name).isEmpty() && !node.hasValue()
                    && node.getReachability() != Reachability.REACHABLE) {
                missing.add(name);
            }
        }
        return missing;
    }
}
