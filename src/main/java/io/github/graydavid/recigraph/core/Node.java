/*
 * Copyright 2021 David Gray
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package io.github.graydavid.recigraph.core;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A named slot in a {@link Graph}, holding at most one cached value along with the attributes that describe how that
 * value is computed. Nodes are owned by their Graph: the Graph creates them, mutates them, and is the only way to reach
 * them. Clients get read-only access through the Graph's accessors.
 *
 * A node's attributes fall into three groups:<br>
 * 1. Definition: its {@link NodeKind} plus either recipe/positional arguments/keyword arguments (STANDARD) or
 * conditions/possibilities (CONDITIONAL). These names are exactly the node's predecessors in the Graph.<br>
 * 2. Context: the value, whether it's present, and whether it's frozen (i.e. survives bulk clearing).<br>
 * 3. Derived: whether the node is a recipe, its topological generation, and its reachability tag.
 *
 * @apiNote value and hasValue are volatile so that nodes computed by one thread of a
 *          {@link io.github.graydavid.recigraph.evaluation.ParallelEvaluator} are visible to the threads computing
 *          their consumers. The other attributes are only mutated while the Graph is quiescent.
 */
public final class Node {
    private final String name;
    private NodeKind kind = NodeKind.STANDARD;
    private volatile Object value;
    private volatile boolean hasValue;
    private boolean frozen;
    private boolean recipe;
    private int generation = -1;
    private Reachability reachability;
    private String recipeName;
    private List<String> positionalArgs = List.of();
    private Map<String, String> keywordArgs = Map.of();
    private List<String> conditions = List.of();
    private List<String> possibilities = List.of();

    Node(String name) {
        this.name = Objects.requireNonNull(name);
    }

    /** Creates an attribute-for-attribute copy of this node. Values are shared by reference, not copied. */
    Node copy() {
        Node copy = new Node(name);
        copy.kind = kind;
        copy.value = value;
        copy.hasValue = hasValue;
        copy.frozen = frozen;
        copy.recipe = recipe;
        copy.generation = generation;
        copy.reachability = reachability;
        copy.recipeName = recipeName;
        copy.positionalArgs = positionalArgs;
        copy.keywordArgs = keywordArgs;
        copy.conditions = conditions;
        copy.possibilities = possibilities;
        return copy;
    }

    public String getName() {
        return name;
    }

    public NodeKind getKind() {
        return kind;
    }

    public boolean hasValue() {
        return hasValue;
    }

    /**
     * Returns the node's value.
     *
     * @throws MissingValueException if the node doesn't currently hold a value. A stale value left behind by clearing is
     *         never returned.
     */
    public Object getValue() {
        if (!hasValue) {
            throw new MissingValueException(name);
        }
        return value;
    }

    public boolean isFrozen() {
        return frozen;
    }

    /** Answers whether this node's value is a callable used to compute some other node. */
    public boolean isRecipe() {
        return recipe;
    }

    /**
     * Returns the node's topological generation: the length of the longest path reaching it from a source node. This is
     * -1 until first computed by {@link Graph#updateGenerations()} (which {@link Graph#finalizeDefinition()} calls), and
     * is not kept up to date by later structural edits. It's informational only: nothing in this library relies on it.
     * In particular, input nodes are found by their lack of predecessors, which is always current.
     */
    public int getGeneration() {
        return generation;
    }

    public boolean hasReachability() {
        return reachability != null;
    }

    /** Returns the reachability tag from the last analysis pass, or null if there is none. */
    public Reachability getReachability() {
        return reachability;
    }

    /** Returns the name of the recipe node for a STANDARD node, or null if it has none. */
    public String getRecipe() {
        return recipeName;
    }

    public List<String> getPositionalArgs() {
        return positionalArgs;
    }

    /** Returns the mapping from recipe parameter name to the name of the node bound to it. */
    public Map<String, String> getKeywordArgs() {
        return keywordArgs;
    }

    public List<String> getConditions() {
        return conditions;
    }

    public List<String> getPossibilities() {
        return possibilities;
    }

    /** Answers whether this CONDITIONAL node has a trailing default possibility. */
    public boolean hasDefaultPossibility() {
        return possibilities.size() == conditions.size() + 1;
    }

    /**
     * Returns the names that define this node's dependencies, in declaration order and possibly with repeats: recipe,
     * positional arguments and keyword-argument targets for STANDARD nodes; conditions then possibilities for
     * CONDITIONAL ones.
     */
    public List<String> getDefinitionNames() {
        List<String> names = new ArrayList<>();
        if (kind == NodeKind.STANDARD) {
            if (recipeName != null) {
                names.add(recipeName);
            }
            names.addAll(positionalArgs);
            names.addAll(keywordArgs.values());
        } else {
            names.addAll(conditions);
            names.addAll(possibilities);
        }
        return names;
    }

    /** Returns the names bound as arguments of this STANDARD node's recipe: positional first, then keyword targets. */
    public List<String> getArgumentNames() {
        List<String> names = new ArrayList<>(positionalArgs);
        names.addAll(keywordArgs.values());
        return names;
    }

    void setValue(Object value) {
        this.value = value;
        this.hasValue = true;
    }

    void unsetValue() {
        this.hasValue = false;
    }

    void setFrozen(boolean frozen) {
        this.frozen = frozen;
    }

    void setRecipe(boolean recipe) {
        this.recipe = recipe;
    }

    void setGeneration(int generation) {
        this.generation = generation;
    }

    void setReachability(Reachability reachability) {
        this.reachability = reachability;
    }

    void defineStandard(String recipeName, List<String> positionalArgs, Map<String, String> keywordArgs) {
        this.kind = NodeKind.STANDARD;
        this.recipeName = recipeName;
        this.positionalArgs = Collections.unmodifiableList(new ArrayList<>(positionalArgs));
        this.keywordArgs = Collections.unmodifiableMap(new LinkedHashMap<>(keywordArgs));
        this.conditions = List.of();
        this.possibilities = List.of();
    }

    void defineConditional(List<String> conditions, List<String> possibilities) {
        this.kind = NodeKind.CONDITIONAL;
        this.recipeName = null;
        this.positionalArgs = List.of();
        this.keywordArgs = Map.of();
        this.conditions = List.copyOf(conditions);
        this.possibilities = List.copyOf(possibilities);
    }

    /** Answers whether this node has been given a definition: a recipe or a conditional structure. */
    public boolean isDefined() {
        return kind == NodeKind.CONDITIONAL || recipeName != null;
    }

    /** Answers whether every attribute of this node equals the other's, with values compared by equals. */
    public boolean hasSameAttributes(Node other) {
        return name.equals(other.name) && kind == other.kind && hasValue == other.hasValue
                && (!hasValue || Objects.equals(value, other.value)) && frozen == other.frozen
                && recipe == other.recipe && generation == other.generation && reachability == other.reachability
                && hasSameDefinition(other);
    }

    /**
     * Answers whether this node's definition attributes equal the other's: kind, recipe name, positional arguments and
     * conditions/possibilities in order, and keyword arguments by key.
     */
    public boolean hasSameDefinition(Node other) {
        return kind == other.kind && Objects.equals(recipeName, other.recipeName)
                && positionalArgs.equals(other.positionalArgs) && keywordArgs.equals(other.keywordArgs)
                && conditions.equals(other.conditions) && possibilities.equals(other.possibilities);
    }

    @Override
    public String toString() {
        return "Node(" + name + ", " + kind + (hasValue ? ", value=" + value : "") + ")";
    }
}
