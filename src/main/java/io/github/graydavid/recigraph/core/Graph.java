/*
 * Copyright 2021 David Gray
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package io.github.graydavid.recigraph.core;

import java.lang.reflect.Method;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Consumer;
import java.util.function.Predicate;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.github.graydavid.naryfunctions.NAryFunction;

/**
 * The single owner of a set of named {@link Node}s and the dependency edges between them. Graph is the Graph Store, the
 * Structural Editor, and the Context Manager rolled into one: every other component (evaluation, reachability,
 * composition, merging) reads and writes nodes only through a Graph.
 *
 * An edge from u to v means that u's value is an input to computing v. For every node, the set of its predecessors is
 * exactly the set of names in its definition (see {@link Node#getDefinitionNames()}): the editing methods maintain
 * this by construction.
 *
 * Graphs are built incrementally. Nodes are created the first time they're named, either explicitly or as somebody's
 * dependency, so dependents may be declared before or after their dependencies. Once fully described, call
 * {@link #finalizeDefinition()} to derive recipe closure and generations, and to freeze whatever values were supplied
 * as constants.
 *
 * @apiNote the Graph never verifies acyclicity: the caller must guarantee a DAG. Graph is not thread safe. The one
 *          exception is that values may be set concurrently by a
 *          {@link io.github.graydavid.recigraph.evaluation.ParallelEvaluator} while no structural edits happen.
 */
public class Graph {
    private static final Logger logger = LoggerFactory.getLogger(Graph.class);

    private final Map<String, Node> nodes;
    private final Map<String, Set<String>> predecessors;
    private final Map<String, Set<String>> successors;

    public Graph() {
        this.nodes = new LinkedHashMap<>();
        this.predecessors = new LinkedHashMap<>();
        this.successors = new LinkedHashMap<>();
    }

    /**
     * Creates a deep copy of this graph: every node and edge is duplicated, so that mutating the copy never affects
     * this graph. Node values themselves are shared by reference.
     */
    public Graph copy() {
        Graph copy = new Graph();
        nodes.forEach((name, node) -> copy.nodes.put(name, node.copy()));
        predecessors.forEach((name, preds) -> copy.predecessors.put(name, new LinkedHashSet<>(preds)));
        successors.forEach((name, succs) -> copy.successors.put(name, new LinkedHashSet<>(succs)));
        return copy;
    }

    // Store queries

    public boolean contains(String name) {
        return nodes.containsKey(name);
    }

    /**
     * Returns the node with the given name, as a read-only view of its attributes.
     *
     * @throws UnknownNodeException if there's no such node.
     */
    public Node getNode(String name) {
        Node node = nodes.get(name);
        if (node == null) {
            throw new UnknownNodeException(name);
        }
        return node;
    }

    /** Returns the names of all nodes, in creation order. */
    public Set<String> getNodeNames() {
        return Collections.unmodifiableSet(new LinkedHashSet<>(nodes.keySet()));
    }

    public int size() {
        return nodes.size();
    }

    /** @throws UnknownNodeException if there's no such node. */
    public Set<String> getPredecessors(String name) {
        getNode(name);
        return Collections.unmodifiableSet(new LinkedHashSet<>(predecessors.get(name)));
    }

    /** @throws UnknownNodeException if there's no such node. */
    public Set<String> getSuccessors(String name) {
        getNode(name);
        return Collections.unmodifiableSet(new LinkedHashSet<>(successors.get(name)));
    }

    public Set<Edge> getAllEdges() {
        Set<Edge> edges = new LinkedHashSet<>();
        successors.forEach((dependency, consumers) -> consumers
                .forEach(consumer -> edges.add(new Edge(dependency, consumer))));
        return Collections.unmodifiableSet(edges);
    }

    /**
     * Returns the nodes partitioned into topological generations: generation i holds the nodes whose longest path from
     * a source has length i.
     */
    public List<List<String>> getTopologicalGenerations() {
        return Topology.generations(nodes.keySet(), predecessors, successors);
    }

    /** Returns all nodes ordered so that every node comes after all of its predecessors. */
    public List<String> getTopologicalOrder() {
        return Topology.order(getTopologicalGenerations());
    }

    /** Returns the nodes without predecessors, optionally leaving out recipe nodes. */
    public Set<String> getSources(boolean excludeRecipes) {
        return filterNames(name -> predecessors.get(name).isEmpty()
                && !(excludeRecipes && nodes.get(name).isRecipe()));
    }

    /** Returns the nodes without successors, optionally leaving out recipe nodes. */
    public Set<String> getSinks(boolean excludeRecipes) {
        return filterNames(name -> successors.get(name).isEmpty() && !(excludeRecipes && nodes.get(name).isRecipe()));
    }

    public Set<String> getConditionals() {
        return filterNames(name -> nodes.get(name).getKind() == NodeKind.CONDITIONAL);
    }

    private Set<String> filterNames(Predicate<String> filter) {
        return nodes.keySet()
                .stream()
                .filter(filter)
                .collect(Collectors.collectingAndThen(Collectors.toCollection(LinkedHashSet::new),
                        Collections::unmodifiableSet));
    }

    /**
     * Returns every node from which the given node can be reached, not including the node itself.
     *
     * @throws UnknownNodeException if there's no such node.
     */
    public Set<String> getAncestors(String name) {
        getNode(name);
        Set<String> ancestors = new LinkedHashSet<>();
        Deque<String> toVisit = new ArrayDeque<>(predecessors.get(name));
        while (!toVisit.isEmpty()) {
            String current = toVisit.pop();
            if (ancestors.add(current)) {
                toVisit.addAll(predecessors.get(current));
            }
        }
        ancestors.remove(name);
        return Collections.unmodifiableSet(ancestors);
    }

    // Structural editing

    /** Declares a bare node (if it doesn't already exist) without any definition. */
    public void addStep(String name) {
        addNodeIfAbsent(name);
    }

    /** Same as {@link #addStep(String, String, List, Map)} but with positional arguments only. */
    public void addStep(String name, String recipe, String... positionalArgs) {
        addStep(name, recipe, Arrays.asList(positionalArgs), Map.of());
    }

    /**
     * Declares a standard node computed by invoking the value of the recipe node with the values of the positional
     * arguments (in order) and the keyword arguments (by parameter name). The recipe node is marked as a recipe, and
     * any node named here that doesn't exist yet is created.
     *
     * Re-declaring a node only adds what's missing, without touching its value, frozen state, or recipe flag. Giving an
     * already-defined node the identical definition is a no-op. Giving it any other definition (another recipe, other
     * arguments, the same arguments in another order, or a standard definition for a conditional node) is rejected
     * and leaves the graph unchanged: {@link #editStep(String, String, List, Map)} is the only way to redefine a node.
     *
     * @param recipe the name of the recipe node. May be null only if there are no arguments.
     * @param keywordArgs map from recipe parameter name to the name of the node bound to it.
     * @throws InvalidDefinitionException if there are arguments but no recipe.
     * @throws InvalidDefinitionException if the node is already defined with a different definition.
     */
    public void addStep(String name, String recipe, List<String> positionalArgs, Map<String, String> keywordArgs) {
        Objects.requireNonNull(name);
        Objects.requireNonNull(positionalArgs);
        Objects.requireNonNull(keywordArgs);
        if (recipe == null) {
            if (!positionalArgs.isEmpty() || !keywordArgs.isEmpty()) {
                throw new InvalidDefinitionException(
                        "Node '" + name + "' was given dependencies " + positionalArgs + " " + keywordArgs
                                + " but no recipe to consume them");
            }
            addNodeIfAbsent(name);
            return;
        }

        Node existing = nodes.get(name);
        if (existing != null && existing.isDefined()) {
            if (existing.getKind() != NodeKind.STANDARD) {
                throw new InvalidDefinitionException(
                        "Node '" + name + "' is already defined as a conditional node; use editStep to redefine it");
            }
            if (Objects.equals(existing.getRecipe(), recipe) && existing.getPositionalArgs().equals(positionalArgs)
                    && existing.getKeywordArgs().equals(keywordArgs)) {
                return;
            }
            throw new InvalidDefinitionException("Node '" + name + "' is already defined with recipe '"
                    + existing.getRecipe() + "'; use editStep to redefine it");
        }

        Node node = addNodeIfAbsent(name);
        node.defineStandard(recipe, positionalArgs, keywordArgs);
        addNodeIfAbsent(recipe).setRecipe(true);
        connectDefinition(node);
    }

    /**
     * Declares a standard node whose recipe is the given static method: the recipe node is named after the method,
     * the method's parameter names are the names of the positional arguments, and the method is immediately bound as
     * the recipe node's value.
     *
     * @apiNote the declaring class must be compiled with parameter names retained (javac -parameters).
     * @throws UnsupportedSignatureException if the method is variadic, not static, or lacks parameter names.
     */
    public void addStepQuick(String name, Method method) {
        MethodRecipe recipe = MethodRecipe.from(method);
        addStep(name, recipe.getName(), recipe.getParameterNames(), Map.of());
        setValue(recipe.getName(), recipe);
    }

    /**
     * Declares a standard node computed by the given function applied to the values of the named nodes, in order. The
     * recipe node is named "recipe_for_" followed by the node's name, and the function is immediately bound as its
     * value.
     */
    public void addStepQuick(String name, List<String> parameterNames, NAryFunction<?, ?> function) {
        String recipeName = "recipe_for_" + name;
        addStep(name, recipeName, parameterNames, Map.of());
        setValue(recipeName, Recipes.ofNAry(function));
    }

    /**
     * Declares a conditional node: its value is that of the first possibility whose paired condition is true, or of
     * the trailing default possibility if no condition is true.
     *
     * @param possibilities either one per condition, or one per condition plus a trailing default.
     * @throws InvalidDefinitionException if the number of possibilities is wrong, or if the node is already defined
     *         differently.
     */
    public void addConditional(String name, List<String> conditions, List<String> possibilities) {
        Objects.requireNonNull(name);
        int conditionCount = conditions.size();
        int possibilityCount = possibilities.size();
        if (possibilityCount == 0 || (possibilityCount != conditionCount && possibilityCount != conditionCount + 1)) {
            throw new InvalidDefinitionException("Conditional node '" + name + "' has " + conditionCount
                    + " conditions, so it needs either " + conditionCount + " or " + (conditionCount + 1)
                    + " possibilities, but received " + possibilityCount);
        }

        Node existing = nodes.get(name);
        if (existing != null && existing.isDefined()) {
            if (existing.getKind() == NodeKind.CONDITIONAL && existing.getConditions().equals(conditions)
                    && existing.getPossibilities().equals(possibilities)) {
                return;
            }
            throw new InvalidDefinitionException(
                    "Node '" + name + "' is already defined differently; use removeStep before redeclaring it");
        }

        Node node = addNodeIfAbsent(name);
        node.defineConditional(conditions, possibilities);
        connectDefinition(node);
    }

    /** Declares a conditional node that takes valueIfTrue when condition is true, and valueIfFalse otherwise. */
    public void addSimpleConditional(String name, String condition, String valueIfTrue, String valueIfFalse) {
        addConditional(name, List.of(condition), List.of(valueIfTrue, valueIfFalse));
    }

    /**
     * Replaces a node's definition (its in-edges, recipe and arguments) with a standard definition, preserving its
     * value, frozen state, and recipe flag. A conditional node becomes a standard one. Nodes that were only referenced
     * by the old definition stay in the graph.
     *
     * @throws UnknownNodeException if there's no such node.
     * @throws InvalidDefinitionException if there are arguments but no recipe.
     */
    public void editStep(String name, String recipe, List<String> positionalArgs, Map<String, String> keywordArgs) {
        Node node = getNode(name);
        if (recipe == null && (!positionalArgs.isEmpty() || !keywordArgs.isEmpty())) {
            throw new InvalidDefinitionException(
                    "Node '" + name + "' was given dependencies but no recipe to consume them");
        }
        List.copyOf(predecessors.get(name)).forEach(predecessor -> removeEdge(predecessor, name));
        node.defineStandard(null, List.of(), Map.of());
        addStep(name, recipe, positionalArgs, keywordArgs);
    }

    /**
     * Removes the node along with its inbound and outbound edges. Other nodes whose definitions mention it keep those
     * mentions.
     *
     * @throws UnknownNodeException if there's no such node.
     */
    public void removeStep(String name) {
        getNode(name);
        List.copyOf(predecessors.get(name)).forEach(predecessor -> removeEdge(predecessor, name));
        List.copyOf(successors.get(name)).forEach(successor -> removeEdge(name, successor));
        nodes.remove(name);
        predecessors.remove(name);
        successors.remove(name);
    }

    /** Marks the node as a recipe: its value is a callable used to compute other nodes. */
    public void markAsRecipe(String name) {
        getNode(name).setRecipe(true);
    }

    /**
     * Propagates recipe-ness upwards: a node that isn't a recipe but all of whose successors are recipes becomes one
     * too. Nodes are visited in reverse topological order, so promotion flows through whole chains of recipe-building
     * nodes.
     */
    public void makeRecipeDependenciesAlsoRecipes() {
        List<String> order = new ArrayList<>(getTopologicalOrder());
        Collections.reverse(order);
        for (String name : order) {
            if (!nodes.get(name).isRecipe()) {
                continue;
            }
            for (String parent : predecessors.get(name)) {
                Node parentNode = nodes.get(parent);
                if (!parentNode.isRecipe()
                        && successors.get(parent).stream().allMatch(successor -> nodes.get(successor).isRecipe())) {
                    parentNode.setRecipe(true);
                }
            }
        }
    }

    /** Recomputes every node's generation index from the current structure. */
    public void updateGenerations() {
        List<List<String>> generations = getTopologicalGenerations();
        for (int i = 0; i < generations.size(); ++i) {
            for (String name : generations.get(i)) {
                nodes.get(name).setGeneration(i);
            }
        }
    }

    /**
     * Completes the graph's description: promotes recipe closure, recomputes generations, and freezes every node that
     * currently has a value (treating whatever was supplied at definition time as a constant). Idempotent.
     */
    public void finalizeDefinition() {
        makeRecipeDependenciesAlsoRecipes();
        updateGenerations();
        freeze();
        logger.debug("Finalized graph with {} nodes", nodes.size());
    }

    /**
     * Unions the attributes of a node from another graph into this graph's node of the same name, creating it if
     * needed. Whatever this graph's node lacks is taken from other: its definition (with the matching edges), its value
     * (along with its frozen state), its generation and its reachability tag. It's a recipe if either node is.
     *
     * @apiNote compatibility isn't checked here: see {@link io.github.graydavid.recigraph.merge.Merges}.
     */
    public void mergeNode(Node other) {
        Node node = addNodeIfAbsent(other.getName());
        if (!node.isDefined() && other.isDefined()) {
            if (other.getKind() == NodeKind.STANDARD) {
                node.defineStandard(other.getRecipe(), other.getPositionalArgs(), other.getKeywordArgs());
            } else {
                node.defineConditional(other.getConditions(), other.getPossibilities());
            }
            connectDefinition(node);
        }
        if (!node.hasValue() && other.hasValue()) {
            node.setValue(other.getValue());
            node.setFrozen(other.isFrozen());
        }
        if (other.isRecipe()) {
            node.setRecipe(true);
        }
        if (node.getGeneration() < 0) {
            node.setGeneration(other.getGeneration());
        }
        if (!node.hasReachability()) {
            node.setReachability(other.getReachability());
        }
    }

    private Node addNodeIfAbsent(String name) {
        Objects.requireNonNull(name);
        return nodes.computeIfAbsent(name, key -> {
            predecessors.put(key, new LinkedHashSet<>());
            successors.put(key, new LinkedHashSet<>());
            return new Node(key);
        });
    }

    private void connectDefinition(Node node) {
        for (String dependency : node.getDefinitionNames()) {
            addNodeIfAbsent(dependency);
            predecessors.get(node.getName()).add(dependency);
            successors.get(dependency).add(node.getName());
        }
    }

    private void removeEdge(String dependency, String consumer) {
        predecessors.get(consumer).remove(dependency);
        successors.get(dependency).remove(consumer);
    }

    // Context

    /** @throws UnknownNodeException if there's no such node. */
    public boolean hasValue(String name) {
        return getNode(name).hasValue();
    }

    /**
     * @throws UnknownNodeException if there's no such node.
     * @throws MissingValueException if the node has no value.
     */
    public Object getValue(String name) {
        return getNode(name).getValue();
    }

    /**
     * Sets the node's value, regardless of whether it's frozen.
     *
     * @throws UnknownNodeException if there's no such node.
     */
    public void setValue(String name, Object value) {
        getNode(name).setValue(value);
    }

    /**
     * Logically erases the node's value, regardless of whether it's frozen.
     *
     * @throws UnknownNodeException if there's no such node.
     */
    public void unsetValue(String name) {
        getNode(name).unsetValue();
    }

    /** Sets the value of every node named in the context. Keys that don't name a node are ignored. */
    public void updateContext(Map<String, ?> context) {
        context.forEach((name, value) -> {
            Node node = nodes.get(name);
            if (node != null) {
                node.setValue(value);
            }
        });
    }

    /** Clears every non-frozen value, then applies the context as in {@link #updateContext(Map)}. */
    public void setContext(Map<String, ?> context) {
        clearValues();
        updateContext(context);
    }

    /** Returns the values of all valued nodes, optionally leaving out recipe nodes. */
    public Map<String, Object> getContext(boolean excludeRecipes) {
        Map<String, Object> context = new LinkedHashMap<>();
        nodes.values()
                .stream()
                .filter(Node::hasValue)
                .filter(node -> !(excludeRecipes && node.isRecipe()))
                .forEach(node -> context.put(node.getName(), node.getValue()));
        return context;
    }

    /** Returns the values of the named nodes, in order. Names may repeat. */
    public List<Object> getListOfValues(List<String> names) {
        List<Object> values = new ArrayList<>(names.size());
        names.forEach(name -> values.add(getValue(name)));
        return values;
    }

    /** Returns a map from each named node to its value. */
    public Map<String, Object> getMapOfValues(Collection<String> names) {
        Map<String, Object> values = new LinkedHashMap<>();
        names.forEach(name -> values.put(name, getValue(name)));
        return values;
    }

    /** Resolves keyword bindings: returns a map from each parameter name to the value of the node bound to it. */
    public Map<String, Object> getKeywordValues(Map<String, String> keywordArgs) {
        Map<String, Object> values = new LinkedHashMap<>();
        keywordArgs.forEach((parameter, name) -> values.put(parameter, getValue(name)));
        return values;
    }

    /** Freezes every node that currently has a value. */
    public void freeze() {
        nodes.values().forEach(Graph::freezeIfValued);
    }

    /** Freezes the named nodes that currently have a value. Unknown names are ignored. */
    public void freeze(String... names) {
        freeze(Arrays.asList(names));
    }

    /** Freezes the named nodes that currently have a value. Unknown names are ignored. */
    public void freeze(Collection<String> names) {
        forEachKnown(names, Graph::freezeIfValued);
    }

    private static void freezeIfValued(Node node) {
        if (node.hasValue()) {
            node.setFrozen(true);
        }
    }

    public void unfreeze() {
        nodes.values().forEach(node -> node.setFrozen(false));
    }

    /** Unfreezes the named nodes. Unknown names are ignored. */
    public void unfreeze(String... names) {
        unfreeze(Arrays.asList(names));
    }

    /** Unfreezes the named nodes. Unknown names are ignored. */
    public void unfreeze(Collection<String> names) {
        forEachKnown(names, node -> node.setFrozen(false));
    }

    /** Clears the value of every non-frozen node. */
    public void clearValues() {
        nodes.values().forEach(Graph::clearIfNotFrozen);
    }

    /** Clears the value of the named non-frozen nodes. Unknown names are ignored. */
    public void clearValues(String... names) {
        clearValues(Arrays.asList(names));
    }

    /** Clears the value of the named non-frozen nodes. Unknown names are ignored. */
    public void clearValues(Collection<String> names) {
        forEachKnown(names, Graph::clearIfNotFrozen);
    }

    private static void clearIfNotFrozen(Node node) {
        if (!node.isFrozen()) {
            node.unsetValue();
        }
    }

    private void forEachKnown(Collection<String> names, Consumer<Node> action) {
        names.stream().map(nodes::get).filter(Objects::nonNull).forEach(action);
    }

    // Reachability tags

    /** @throws UnknownNodeException if there's no such node. */
    public void setReachability(String name, Reachability reachability) {
        getNode(name).setReachability(Objects.requireNonNull(reachability));
    }

    /** Removes the node's reachability tag, if any. */
    public void clearReachability(String name) {
        getNode(name).setReachability(null);
    }

    /**
     * Two graphs are equal if they have the same nodes, each with equal attributes (values compared by equals), and the
     * same edges.
     */
    @Override
    public boolean equals(Object object) {
        if (!(object instanceof Graph)) {
            return false;
        }

        Graph other = (Graph) object;
        if (!nodes.keySet().equals(other.nodes.keySet()) || !predecessors.equals(other.predecessors)) {
            return false;
        }
        return nodes.values().stream().allMatch(node -> node.hasSameAttributes(other.nodes.get(node.getName())));
    }

    @Override
    public int hashCode() {
        return Objects.hash(nodes.keySet(), predecessors);
    }

    @Override
    public String toString() {
        return "Graph(" + nodes.values() + ")";
    }
}
