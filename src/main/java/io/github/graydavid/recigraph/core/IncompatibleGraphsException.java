/*
 * Copyright 2021 David Gray
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package io.github.graydavid.recigraph.core;

/** Thrown when merging two graphs that disagree about a node they share. */
public class IncompatibleGraphsException extends GraphException {
    private static final long serialVersionUID = 1;

    public IncompatibleGraphsException(String message) {
        super(message);
    }
}
