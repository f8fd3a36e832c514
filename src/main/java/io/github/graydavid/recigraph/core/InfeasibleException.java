/*
 * Copyright 2021 David Gray
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package io.github.graydavid.recigraph.core;

import java.util.Set;
import java.util.TreeSet;

/**
 * Thrown when the requested targets can't possibly be computed from the values available: some source node they need
 * has no value and no conditional path avoids it. The missing source nodes are reported so that the caller knows
 * exactly what to supply.
 */
public class InfeasibleException extends GraphException {
    private static final long serialVersionUID = 1;

    private final Set<String> missingInputs;

    public InfeasibleException(String message, Set<String> missingInputs) {
        super(message + ". Missing inputs: " + new TreeSet<>(missingInputs));
        this.missingInputs = Set.copyOf(missingInputs);
    }

    /** Returns the names of the source nodes that lack a value. */
    public Set<String> getMissingInputs() {
        return missingInputs;
    }
}
