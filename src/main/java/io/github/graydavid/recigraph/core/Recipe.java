/*
 * Copyright 2021 David Gray
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package io.github.graydavid.recigraph.core;

import java.util.List;
import java.util.Map;

/**
 * The callable held as the value of a recipe node. When a standard node is evaluated, the value of its recipe node is
 * invoked with the values of the node's positional arguments, in order, and the values of its keyword arguments, keyed
 * by recipe parameter name.
 *
 * Values are opaque: a Recipe receives boxed values and returns one boxed value. It's up to the Recipe to downcast what
 * it receives; a failed cast is just another recipe failure. See {@link Recipes} for adapters from ordinary Java
 * functional interfaces.
 */
@FunctionalInterface
public interface Recipe {
    /**
     * Computes a value.
     *
     * @param positional the values bound positionally, in declaration order. Never null.
     * @param keyword the values bound by parameter name. Never null.
     */
    Object apply(List<Object> positional, Map<String, Object> keyword);

    /** Convenience for invoking a recipe with keyword arguments only, as composed recipes expect. */
    default Object applyKeywords(Map<String, Object> keyword) {
        return apply(List.of(), keyword);
    }
}
