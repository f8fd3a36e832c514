/*
 * Copyright 2021 David Gray
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package io.github.graydavid.recigraph.core;

/**
 * Thrown when asked to inline a dependency that can't be expressed as a recipe call: e.g. a conditional dependency, a
 * dependency whose recipe is a conditional, or a dependency without any recipe at all.
 */
public class UnsupportedSimplificationException extends GraphException {
    private static final long serialVersionUID = 1;

    public UnsupportedSimplificationException(String message) {
        super(message);
    }
}
