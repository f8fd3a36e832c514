/*
 * Copyright 2021 David Gray
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package io.github.graydavid.recigraph.core;

/** Thrown when reading the value of a node that doesn't currently hold one. */
public class MissingValueException extends GraphException {
    private static final long serialVersionUID = 1;

    private final String nodeName;

    public MissingValueException(String nodeName) {
        super("Node '" + nodeName + "' has no value");
        this.nodeName = nodeName;
    }

    public String getNodeName() {
        return nodeName;
    }
}
