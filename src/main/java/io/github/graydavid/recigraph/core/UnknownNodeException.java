/*
 * Copyright 2021 David Gray
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package io.github.graydavid.recigraph.core;

/** Thrown when an operation names a node that is absent from the Graph. */
public class UnknownNodeException extends GraphException {
    private static final long serialVersionUID = 1;

    private final String nodeName;

    public UnknownNodeException(String nodeName) {
        super("Node '" + nodeName + "' is not part of this graph");
        this.nodeName = nodeName;
    }

    /** Returns the name that was not found. */
    public String getNodeName() {
        return nodeName;
    }
}
