/*
 * Copyright 2021 David Gray
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package io.github.graydavid.recigraph.core;

/**
 * Thrown when a node definition is malformed: dependencies declared without a recipe, a conditional whose
 * possibilities don't number exactly its conditions (or one more), or a conflicting re-declaration of an existing node.
 */
public class InvalidDefinitionException extends GraphException {
    private static final long serialVersionUID = 1;

    public InvalidDefinitionException(String message) {
        super(message);
    }
}
