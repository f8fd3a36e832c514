/*
 * Copyright 2021 David Gray
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package io.github.graydavid.recigraph.compose;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.github.graydavid.recigraph.core.Graph;
import io.github.graydavid.recigraph.core.InfeasibleException;
import io.github.graydavid.recigraph.core.Node;
import io.github.graydavid.recigraph.core.NodeKind;
import io.github.graydavid.recigraph.core.Recipe;
import io.github.graydavid.recigraph.core.Recipes;
import io.github.graydavid.recigraph.evaluation.Evaluator;

/** Compiles the part of a Graph that computes a target from designated inputs into a single {@link Recipe}. */
public class Lambdify {
    private static final Logger logger = LoggerFactory.getLogger(Lambdify.class);

    private Lambdify() {}

    /**
     * Returns a recipe that computes the target from the inputs, invoked with the inputs as keyword arguments keyed by
     * node name. For all inputs, invoking it returns what executing the target on the graph with those inputs set
     * would.
     *
     * The graph itself is untouched: the work happens on a copy. On that copy, the inputs and everything computed from
     * them are cleared (frozen or not), whatever doesn't depend on the inputs is computed, and conditionals in the way
     * whose branch is then known are collapsed. Then the target's dependencies are inlined into its recipe until only
     * inputs remain, with input-independent values captured as constants.
     *
     * @throws InfeasibleException if the target needs a value that's neither an input nor computable without inputs.
     * @throws io.github.graydavid.recigraph.core.UnresolvedConditionException if a conditional in the way depends on
     *         the inputs to pick its branch.
     * @throws io.github.graydavid.recigraph.core.UnsupportedSimplificationException if a node in the way can't be
     *         inlined.
     */
    public static Recipe lambdify(Graph graph, Collection<String> inputNames, String target) {
        Set<String> inputs = Set.copyOf(inputNames);
        Graph working = graph.copy();
        working.unfreeze();
        Set<String> inputDependent = new LinkedHashSet<>(inputs);
        for (String name : working.getNodeNames()) {
            if (working.getAncestors(name).stream().anyMatch(inputs::contains)) {
                inputDependent.add(name);
            }
        }
        working.clearValues(inputDependent);
        new Evaluator(working).progressTowardsTargets(target);

        if (working.getNode(target).getKind() == NodeKind.CONDITIONAL) {
            Simplifications.convertConditionalToTrivialStep(working, target, true);
        }
        if (working.getNode(target).getRecipe() == null) {
            throw new InfeasibleException("Cannot lambdify '" + target + "' because it has no recipe", Set.of(target));
        }
        Simplifications.convertArgumentsToKeywords(working, target);

        Map<String, Object> constants = new LinkedHashMap<>();
        Set<String> pending = findPending(working, target, inputs, constants);
        while (!pending.isEmpty()) {
            for (String dependency : pending) {
                Node node = working.getNode(dependency);
                if (node.hasValue()) {
                    constants.put(dependency, node.getValue());
                } else if (node.getKind() == NodeKind.CONDITIONAL) {
                    Simplifications.convertConditionalToTrivialStep(working, dependency, true);
                } else if (node.getRecipe() == null) {
                    throw new InfeasibleException(
                            "Cannot lambdify '" + target + "' because '" + dependency + "' is not an input and has no "
                                    + "recipe",
                            Set.of(dependency));
                } else {
                    Simplifications.simplifyDependency(working, target, dependency);
                }
            }
            pending = findPending(working, target, inputs, constants);
        }

        Recipe composed = (Recipe) working.getValue(working.getNode(target).getRecipe());
        logger.debug("Lambdified '{}' from inputs {} with constants {}", target, inputs, constants.keySet());
        return Recipes.ofKeywords(keyword -> {
            Map<String, Object> arguments = new LinkedHashMap<>(constants);
            arguments.putAll(keyword);
            return composed.applyKeywords(arguments);
        });
    }

    private static Set<String> findPending(Graph graph, String target, Set<String> inputs,
            Map<String, Object> constants) {
        Set<String> pending = new LinkedHashSet<>(graph.getNode(target).getArgumentNames());
        pending.removeAll(inputs);
        pending.removeAll(constants.keySet());
        return pending;
    }
}
