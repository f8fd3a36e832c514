/*
 * Copyright 2021 David Gray
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package io.github.graydavid.recigraph.core;

/**
 * Thrown when a function's signature can't be turned into dependency names: e.g. it's variadic, so there would be no
 * way to name the nodes bound to its variadic parameter.
 */
public class UnsupportedSignatureException extends GraphException {
    private static final long serialVersionUID = 1;

    public UnsupportedSignatureException(String message) {
        super(message);
    }
}
