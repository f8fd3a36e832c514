/*
 * Copyright 2021 David Gray
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package io.github.graydavid.recigraph.core;

/**
 * Describes how a Node computes its value. The set of kinds is closed: every algorithm in this library (evaluation,
 * reachability, simplification) dispatches on exactly these two.
 */
public enum NodeKind {
    /**
     * The node's value is produced by invoking the value of its recipe node against the values of its positional and
     * keyword arguments.
     */
    STANDARD,
    /**
     * The node's value is copied from one of its possibilities: the one paired with the first condition that holds
     * true, or the trailing default possibility, if there is one and no condition holds true.
     */
    CONDITIONAL;
}
