/*
 * Copyright 2021 David Gray
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package io.github.graydavid.recigraph.core;

import java.util.Collection;
import java.util.Objects;

/**
 * A prediction, made without calling any recipe, of whether a node can be computed from the values currently present
 * in a Graph. The constants are declared in lattice order: UNREACHABLE < UNCERTAIN < REACHABLE.
 */
public enum Reachability {
    UNREACHABLE,
    UNCERTAIN,
    REACHABLE;

    /**
     * Returns the worst (lowest) of the given reachabilities: the join used when all inputs are required. An empty
     * collection yields REACHABLE, the identity of the operation.
     *
     * @throws NullPointerException if any of the reachabilities is null.
     */
    public static Reachability worst(Collection<Reachability> reachabilities) {
        Reachability worst = REACHABLE;
        for (Reachability reachability : reachabilities) {
            if (Objects.requireNonNull(reachability).compareTo(worst) < 0) {
                worst = reachability;
            }
        }
        return worst;
    }

    /**
     * Returns the best (highest) of the given reachabilities: the meet used when any input suffices. An empty
     * collection yields UNREACHABLE, the identity of the operation.
     *
     * @throws NullPointerException if any of the reachabilities is null.
     */
    public static Reachability best(Collection<Reachability> reachabilities) {
        Reachability best = UNREACHABLE;
        for (Reachability reachability : reachabilities) {
            if (Objects.requireNonNull(reachability).compareTo(best) > 0) {
                best = reachability;
            }
        }
        return best;
    }
}
