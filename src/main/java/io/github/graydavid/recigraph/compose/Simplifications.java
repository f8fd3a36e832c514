/*
 * Copyright 2021 David Gray
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package io.github.graydavid.recigraph.compose;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.github.graydavid.recigraph.core.Graph;
import io.github.graydavid.recigraph.core.Node;
import io.github.graydavid.recigraph.core.NodeKind;
import io.github.graydavid.recigraph.core.Recipe;
import io.github.graydavid.recigraph.core.Recipes;
import io.github.graydavid.recigraph.core.UnresolvedConditionException;
import io.github.graydavid.recigraph.core.UnsupportedSimplificationException;
import io.github.graydavid.recigraph.evaluation.Evaluator;

/**
 * Rewrites a Graph while preserving the values it computes: inlining a dependency's computation into its consumer's
 * recipe, and collapsing conditionals whose branch is already known.
 *
 * A simplified node's arguments are all keyword arguments named after the nodes bound to them (i.e. bound as
 * {name: name}), and its recipe is a {@link Composition} invoked with those keyword arguments. Installed recipes are
 * frozen, like recipes bound before {@link Graph#finalizeDefinition()}, so that context changes don't discard them.
 *
 * @apiNote the Graph must be quiescent: nothing may evaluate it while it's being rewritten.
 */
public class Simplifications {
    private static final Logger logger = LoggerFactory.getLogger(Simplifications.class);

    private Simplifications() {}

    /**
     * Inlines the dependency's computation into the node: the node's recipe becomes a composition that computes what
     * the dependency would have from the dependency's own arguments, and those arguments replace the dependency among
     * the node's bindings (and predecessors).
     *
     * If the node's recipe node also serves other nodes, the composition is installed under a new recipe node,
     * "simplified_recipe_for_" followed by the node's name, so that the other nodes are unaffected.
     *
     * @throws UnsupportedSimplificationException if the node or dependency isn't a standard node with a recipe holding
     *         a {@link Recipe}, or if the dependency isn't one of the node's arguments.
     */
    public static void simplifyDependency(Graph graph, String node, String dependency) {
        Node consumer = requireSimplifiableStandard(graph, node);
        if (!consumer.getArgumentNames().contains(dependency)) {
            throw new UnsupportedSimplificationException(
                    "Cannot simplify '" + dependency + "' into '" + node + "' because it's not one of its arguments");
        }
        Node inlined = requireSimplifiableStandard(graph, dependency);
        Recipe inlinedRecipe = (Recipe) graph.getValue(inlined.getRecipe());
        List<String> inlinedArguments = inlined.getArgumentNames();
        Composition.Step inlinedStep = Composition.Step.nested(inlinedRecipe, inlined.getPositionalArgs(),
                inlined.getKeywordArgs());

        List<Composition.Step> positionalSteps = new ArrayList<>();
        Set<String> newBindings = new LinkedHashSet<>();
        for (String argument : consumer.getPositionalArgs()) {
            positionalSteps.add(stepFor(argument, dependency, inlinedStep, inlinedArguments, newBindings));
        }
        Map<String, Composition.Step> keywordSteps = new LinkedHashMap<>();
        consumer.getKeywordArgs()
                .forEach((parameter, argument) -> keywordSteps.put(parameter,
                        stepFor(argument, dependency, inlinedStep, inlinedArguments, newBindings)));

        Recipe outer = (Recipe) graph.getValue(consumer.getRecipe());
        installComposition(graph, consumer, new Composition(outer, positionalSteps, keywordSteps), newBindings);
        logger.debug("Simplified '{}' into '{}'", dependency, node);
    }

    private static Composition.Step stepFor(String argument, String dependency, Composition.Step inlinedStep,
            List<String> inlinedArguments, Set<String> newBindings) {
        if (argument.equals(dependency)) {
            newBindings.addAll(inlinedArguments);
            return inlinedStep;
        }
        newBindings.add(argument);
        return Composition.Step.identity(argument);
    }

    /**
     * Rebinds the node's arguments as keyword arguments named after the nodes bound to them, without otherwise
     * changing what it computes. A node that's already simplified is left as is.
     *
     * @throws UnsupportedSimplificationException if the node isn't a standard node with a recipe holding a Recipe.
     */
    public static void convertArgumentsToKeywords(Graph graph, String node) {
        Node consumer = requireSimplifiableStandard(graph, node);
        if (isKeywordOnlyByName(consumer)) {
            return;
        }
        List<Composition.Step> positionalSteps = new ArrayList<>();
        Set<String> newBindings = new LinkedHashSet<>();
        consumer.getPositionalArgs().forEach(argument -> {
            positionalSteps.add(Composition.Step.identity(argument));
            newBindings.add(argument);
        });
        Map<String, Composition.Step> keywordSteps = new LinkedHashMap<>();
        consumer.getKeywordArgs().forEach((parameter, argument) -> {
            keywordSteps.put(parameter, Composition.Step.identity(argument));
            newBindings.add(argument);
        });
        Recipe outer = (Recipe) graph.getValue(consumer.getRecipe());
        installComposition(graph, consumer, new Composition(outer, positionalSteps, keywordSteps), newBindings);
    }

    private static boolean isKeywordOnlyByName(Node node) {
        return node.getPositionalArgs().isEmpty() && node.getKeywordArgs()
                .entrySet()
                .stream()
                .allMatch(entry -> entry.getKey().equals(entry.getValue()));
    }

    private static Node requireSimplifiableStandard(Graph graph, String name) {
        Node node = graph.getNode(name);
        if (node.getKind() != NodeKind.STANDARD) {
            throw new UnsupportedSimplificationException(
                    "Simplification only supports standard nodes, but '" + name + "' is " + node.getKind());
        }
        String recipe = node.getRecipe();
        if (recipe == null) {
            throw new UnsupportedSimplificationException("Cannot simplify '" + name + "' because it has no recipe");
        }
        Node recipeNode = graph.getNode(recipe);
        if (recipeNode.getKind() != NodeKind.STANDARD) {
            throw new UnsupportedSimplificationException("Simplification only supports standard nodes, but recipe '"
                    + recipe + "' of '" + name + "' is " + recipeNode.getKind());
        }
        if (!recipeNode.hasValue() || !(recipeNode.getValue() instanceof Recipe)) {
            throw new UnsupportedSimplificationException(
                    "Cannot simplify '" + name + "' because its recipe '" + recipe + "' doesn't hold a Recipe");
        }
        return node;
    }

    private static void installComposition(Graph graph, Node node, Composition composition,
            Set<String> newBindings) {
        String name = node.getName();
        String recipe = node.getRecipe();
        if (!graph.getSuccessors(recipe).equals(Set.of(name))) {
            recipe = "simplified_recipe_for_" + name;
        }
        Map<String, String> keywordArgs = new LinkedHashMap<>();
        newBindings.forEach(binding -> keywordArgs.put(binding, binding));
        graph.editStep(name, recipe, List.of(), keywordArgs);
        graph.setValue(recipe, composition);
        graph.freeze(recipe);
    }

    /**
     * Repeatedly simplifies every argument of the node that isn't excluded and isn't a source, reducing the node to a
     * function of the excluded names and the sources. Each call inlines one level of dependencies: arguments that
     * inlining brings in are only simplified by a later call.
     */
    public static void simplifyAllDependencies(Graph graph, String node, Collection<String> exclude) {
        Set<String> excluded = new LinkedHashSet<>(exclude);
        excluded.addAll(graph.getSources(false));
        for (String dependency : new LinkedHashSet<>(graph.getNode(node).getArgumentNames())) {
            if (!excluded.contains(dependency) && graph.getNode(node).getArgumentNames().contains(dependency)) {
                simplifyDependency(graph, node, dependency);
            }
        }
    }

    /** Same as {@link #simplifyAllDependencies(Graph, String, Collection)} excluding only the sources. */
    public static void simplifyAllDependencies(Graph graph, String node) {
        simplifyAllDependencies(graph, node, Set.of());
    }

    /**
     * Collapses a conditional whose branch is known into a standard node that returns the selected possibility through
     * the identity recipe "trivial_recipe_for_" followed by the conditional's name. The selected possibility is the one
     * paired with the first condition known to be true, or the default if no condition is true. Any value the
     * conditional had is discarded and the node is unfrozen, so that its value comes from the selected possibility.
     *
     * @param evaluateConditions whether to first evaluate the conditions (without failing) until one is true.
     * @throws UnsupportedSimplificationException if the node isn't conditional.
     * @throws UnresolvedConditionException if no condition is known to be true and there's no default.
     */
    public static void convertConditionalToTrivialStep(Graph graph, String conditional,
            boolean evaluateConditions) {
        Node node = graph.getNode(conditional);
        if (node.getKind() != NodeKind.CONDITIONAL) {
            throw new UnsupportedSimplificationException("'" + conditional + "' is not a conditional node");
        }
        if (evaluateConditions) {
            new Evaluator(graph).executeTowardsAllConditionsOf(conditional);
        }

        String selected = selectPossibility(graph, node);
        String recipe = "trivial_recipe_for_" + conditional;
        graph.editStep(conditional, recipe, List.of(selected), Map.of());
        graph.unfreeze(conditional);
        graph.unsetValue(conditional);
        graph.setValue(recipe, Recipes.identity());
        graph.freeze(recipe);
        logger.debug("Converted conditional '{}' to a trivial step returning '{}'", conditional, selected);
    }

    private static String selectPossibility(Graph graph, Node node) {
        List<String> conditions = node.getConditions();
        for (int i = 0; i < conditions.size(); ++i) {
            String condition = conditions.get(i);
            if (graph.hasValue(condition) && Boolean.TRUE.equals(graph.getValue(condition))) {
                return node.getPossibilities().get(i);
            }
        }
        if (node.hasDefaultPossibility()) {
            return node.getPossibilities().get(conditions.size());
        }
        throw new UnresolvedConditionException(node.getName(),
                "Cannot convert conditional '" + node.getName() + "' because no condition is known to be true");
    }

    /** Applies {@link #convertConditionalToTrivialStep(Graph, String, boolean)} to every conditional in the graph. */
    public static void convertAllConditionalsToTrivialSteps(Graph graph, boolean evaluateConditions) {
        for (String conditional : graph.getConditionals()) {
            convertConditionalToTrivialStep(graph, conditional, evaluateConditions);
        }
    }
}
