/*
 * Copyright 2021 David Gray
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package io.github.graydavid.recigraph.evaluation;

import java.util.Arrays;
import java.util.Collection;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.github.graydavid.recigraph.core.Graph;
import io.github.graydavid.recigraph.core.InfeasibleException;
import io.github.graydavid.recigraph.reachability.Feasibility;
import io.github.graydavid.recigraph.reachability.FeasibilityReport;

/** The top-level way to execute a Graph: apply a context, check feasibility, then compute the targets. */
public class Executions {
    private static final Logger logger = LoggerFactory.getLogger(Executions.class);

    private Executions() {}

    /**
     * Executes the graph up to the targets, given a context.
     *
     * Before any recipe runs, the targets' reachability is checked: UNREACHABLE aborts the execution, while UNCERTAIN
     * only logs a warning, since evaluation may still succeed depending on the values conditions take.
     *
     * @param context values applied as in {@link Graph#setContext(Map)}.
     * @param inPlace whether to execute on graph itself rather than on a copy.
     * @param targets what to compute. If empty, every sink that isn't a recipe is computed.
     * @return the executed graph: graph itself if inPlace, otherwise the copy.
     * @throws InfeasibleException if the targets are UNREACHABLE. The exception names the missing inputs.
     */
    public static Graph executeGraphFromContext(Graph graph, Map<String, ?> context, boolean inPlace,
            String... targets) {
        Graph working = inPlace ? graph : graph.copy();
        Collection<String> actualTargets = targets.length == 0 ? working.getSinks(true) : Arrays.asList(targets);

        FeasibilityReport report = Feasibility.check(working, context, actualTargets, true);
        switch (report.getReachability()) {
            case UNREACHABLE:
                throw new InfeasibleException("Targets " + actualTargets + " are unreachable from the given context",
                        report.getMissingInputs());
            case UNCERTAIN:
                logger.warn("Targets {} may be unreachable from the given context, depending on conditions. "
                        + "Possibly missing inputs: {}", actualTargets, report.getMissingInputs());
                break;
            case REACHABLE:
                break;
        }

        new Evaluator(working).executeToTargets(actualTargets);
        return working;
    }
}
