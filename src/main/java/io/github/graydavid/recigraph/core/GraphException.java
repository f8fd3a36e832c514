/*
 * Copyright 2021 David Gray
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package io.github.graydavid.recigraph.core;

/**
 * The base of all exceptions thrown by this library. All of them are unchecked: they signal either a caller mistake in
 * describing or operating a Graph or a failure in computing a node, neither of which a caller can be expected to
 * recover from at every call site.
 */
public class GraphException extends RuntimeException {
    private static final long serialVersionUID = 1;

    public GraphException(String message) {
        super(message);
    }

    public GraphException(String message, Throwable cause) {
        super(message, cause);
    }
}
