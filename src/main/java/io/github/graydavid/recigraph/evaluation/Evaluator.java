/*
 * Copyright 2021 David Gray
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package io.github.graydavid.recigraph.evaluation;

import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

import io.github.graydavid.recigraph.core.EvaluationException;
import io.github.graydavid.recigraph.core.Graph;
import io.github.graydavid.recigraph.core.GraphException;
import io.github.graydavid.recigraph.core.MissingValueException;
import io.github.graydavid.recigraph.core.Node;
import io.github.graydavid.recigraph.core.NodeKind;
import io.github.graydavid.recigraph.core.Recipe;
import io.github.graydavid.recigraph.core.UnresolvedConditionException;

/**
 * Computes node values on demand, memoizing them in the Graph. Evaluating a node that already has a value does nothing.
 * Otherwise:<br>
 * * A standard node first evaluates all of its predecessors, then invokes its recipe node's value with the values of its
 * positional and keyword arguments, and stores the result.<br>
 * * A conditional node selects the first possibility whose paired condition is true (short-circuiting on a condition
 * already known to be true, and otherwise evaluating conditions one at a time in order, stopping at the first true
 * one), falls back on the default possibility if none is true, then evaluates the selected possibility and takes its
 * value. Conditions after the selected one and unselected possibilities are never evaluated.
 *
 * A condition counts as true only if its value is {@link Boolean#TRUE}.
 *
 * This evaluator is sequential and recursive. {@link ParallelEvaluator} generalizes it to evaluate independent
 * predecessors concurrently.
 */
public class Evaluator {
    private final Graph graph;

    public Evaluator(Graph graph) {
        this.graph = Objects.requireNonNull(graph);
    }

    public Graph getGraph() {
        return graph;
    }

    /** Evaluates each target in turn, propagating any failure. */
    public void executeToTargets(String... targets) {
        executeToTargets(Arrays.asList(targets));
    }

    /** Evaluates each target in turn, propagating any failure. */
    public void executeToTargets(Collection<String> targets) {
        startEvaluation();
        evaluateAll(targets, FailureMode.HARD_FAIL);
    }

    /** Makes whatever progress is possible towards the targets: nodes that can't be computed are left unset. */
    public void progressTowardsTargets(String... targets) {
        progressTowardsTargets(Arrays.asList(targets));
    }

    /** Makes whatever progress is possible towards the targets: nodes that can't be computed are left unset. */
    public void progressTowardsTargets(Collection<String> targets) {
        startEvaluation();
        evaluateAll(targets, FailureMode.SOFT_FAIL);
    }

    /**
     * Evaluates the given condition nodes one at a time, without failing, stopping at the first one that's true. This
     * probes a conditional without committing to any of its possibilities.
     *
     * @return the first true condition, if any.
     */
    public Optional<String> executeTowardsConditions(List<String> conditions) {
        startEvaluation();
        for (String condition : conditions) {
            if (evaluateNode(condition, FailureMode.SOFT_FAIL) && isTrue(condition)) {
                return Optional.of(condition);
            }
        }
        return Optional.empty();
    }

    /** Same as {@link #executeTowardsConditions(List)} over all of the given conditional node's conditions. */
    public Optional<String> executeTowardsAllConditionsOf(String conditional) {
        return executeTowardsConditions(graph.getNode(conditional).getConditions());
    }

    /**
     * Evaluates a single node.
     *
     * @return whether the node has a value afterwards. Always true for HARD_FAIL, which throws instead.
     * @throws io.github.graydavid.recigraph.core.UnknownNodeException if there's no such node.
     */
    public boolean evaluate(String name, FailureMode failureMode) {
        startEvaluation();
        return evaluateNode(name, failureMode);
    }

    /**
     * Called once at the start of every public evaluation call, before any node is visited. Does nothing by default.
     */
    protected void startEvaluation() {}

    /** Evaluates a single node as part of an ongoing call. Same contract as {@link #evaluate(String, FailureMode)}. */
    protected boolean evaluateNode(String name, FailureMode failureMode) {
        Node node = graph.getNode(name);
        if (node.hasValue()) {
            return true;
        }
        return node.getKind() == NodeKind.STANDARD ? evaluateStandard(node, failureMode)
                : evaluateConditional(node, failureMode);
    }

    /**
     * Evaluates every named node. All nodes are attempted even if some of them can't be computed.
     *
     * @return whether all of the nodes have a value afterwards.
     */
    protected boolean evaluateAll(Collection<String> names, FailureMode failureMode) {
        boolean allValued = true;
        for (String name : names) {
            allValued &= evaluateNode(name, failureMode);
        }
        return allValued;
    }

    private boolean evaluateStandard(Node node, FailureMode failureMode) {
        if (!evaluateAll(graph.getPredecessors(node.getName()), failureMode)) {
            return false;
        }
        return computeStandard(node, failureMode);
    }

    /**
     * Invokes the node's recipe on the values of its (already evaluated) arguments and stores the result. A failure is
     * wrapped in an {@link EvaluationException} naming the node, then handled according to failureMode.
     *
     * @return whether the node has a value afterwards.
     */
    protected boolean computeStandard(Node node, FailureMode failureMode) {
        Object value;
        try {
            value = invokeRecipe(node);
        } catch (RuntimeException e) {
            failureMode.handleFailure(new EvaluationException(node.getName(), e));
            return false;
        }
        graph.setValue(node.getName(), value);
        return true;
    }

    private Object invokeRecipe(Node node) {
        String recipeName = node.getRecipe();
        if (recipeName == null) {
            throw new MissingValueException(node.getName());
        }
        Object recipe = graph.getValue(recipeName);
        if (!(recipe instanceof Recipe)) {
            throw new IllegalStateException("Recipe node '" + recipeName + "' holds '" + recipe + "', not a Recipe");
        }
        return ((Recipe) recipe).apply(graph.getListOfValues(node.getPositionalArgs()),
                graph.getKeywordValues(node.getKeywordArgs()));
    }

    private boolean evaluateConditional(Node node, FailureMode failureMode) {
        String name = node.getName();
        List<String> conditions = node.getConditions();
        int selected = indexOfFirstKnownTrue(conditions);
        for (int i = 0; selected < 0 && i < conditions.size(); ++i) {
            String condition = conditions.get(i);
            if (!evaluateCondition(name, condition, failureMode)) {
                return false;
            }
            if (isTrue(condition)) {
                selected = i;
            }
        }

        if (selected < 0) {
            if (!node.hasDefaultPossibility()) {
                failureMode.handleFailure(new UnresolvedConditionException(name,
                        "No condition of '" + name + "' is true and it has no default possibility"));
                return false;
            }
            selected = conditions.size();
        }

        String possibility = node.getPossibilities().get(selected);
        if (!evaluateNode(possibility, failureMode)) {
            return false;
        }
        graph.setValue(name, graph.getValue(possibility));
        return true;
    }

    private int indexOfFirstKnownTrue(List<String> conditions) {
        for (int i = 0; i < conditions.size(); ++i) {
            String condition = conditions.get(i);
            if (graph.hasValue(condition) && isTrue(condition)) {
                return i;
            }
        }
        return -1;
    }

    private boolean evaluateCondition(String conditional, String condition, FailureMode failureMode) {
        try {
            return evaluateNode(condition, failureMode);
        } catch (GraphException e) {
            throw new UnresolvedConditionException(conditional,
                    "Condition '" + condition + "' of '" + conditional + "' could not be computed", e);
        }
    }

    private boolean isTrue(String condition) {
        return Boolean.TRUE.equals(graph.getValue(condition));
    }
}
