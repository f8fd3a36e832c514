/*
 * Copyright 2021 David Gray
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package io.github.graydavid.recigraph.core;

import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.Objects;
import java.util.Set;

/**
 * An exception thrown when computing a node fails: its recipe threw, it had no recipe to invoke, or its recipe node
 * held something other than a {@link Recipe}. The message is prefixed with the name of the node being evaluated, and
 * the original failure is kept as the cause.
 *
 * Only the node whose recipe failed is named: consumers of that node propagate the exception untouched, so there's
 * exactly one "While evaluating" prefix no matter how deep the failing node sits in the graph.
 */
public class EvaluationException extends GraphException {
    private static final long serialVersionUID = 1;

    private final String failedNodeName;

    public EvaluationException(String failedNodeName, Throwable cause) {
        super(calculateMessage(failedNodeName, cause), Objects.requireNonNull(cause));
        this.failedNodeName = failedNodeName;
    }

    private static String calculateMessage(String failedNodeName, Throwable cause) {
        String causeMessage = cause.getMessage() == null ? cause.getClass().getName() : cause.getMessage();
        return "While evaluating " + failedNodeName + ": " + causeMessage;
    }

    /** Returns the name of the node whose computation failed. */
    public String getFailedNodeName() {
        return failedNodeName;
    }

    /**
     * Returns the first throwable in this exception's causal chain that isn't itself an EvaluationException: i.e. the
     * failure that the recipe (or the evaluator, for a missing recipe) actually raised.
     */
    public Throwable getRecipeFailure() {
        // Guard against malicious overrides of Throwable.equals by using a Set with identity equality semantics.
        Set<Throwable> alreadySeen = Collections.newSetFromMap(new IdentityHashMap<>());
        Throwable current = getCause();
        while (current instanceof EvaluationException && alreadySeen.add(current)) {
            current = current.getCause();
        }
        return current;
    }
}
