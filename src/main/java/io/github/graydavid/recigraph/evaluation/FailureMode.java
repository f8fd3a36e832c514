/*
 * Copyright 2021 David Gray
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package io.github.graydavid.recigraph.evaluation;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.github.graydavid.recigraph.core.GraphException;

/**
 * Controls what happens when a node can't be computed during evaluation: its recipe threw, it had nothing to compute
 * it, or (for a conditional) no branch could be selected.
 */
public enum FailureMode {
    /** Propagates the failure to the caller of the evaluation entry point. */
    HARD_FAIL {
        @Override
        void handleFailure(GraphException failure) {
            throw failure;
        }
    },
    /**
     * Leaves the node without a value and returns silently, so that evaluation can make whatever progress is possible
     * elsewhere. The graph is left partially populated.
     */
    SOFT_FAIL {
        @Override
        void handleFailure(GraphException failure) {
            logger.debug("Abandoned evaluation: {}", failure.getMessage());
        }
    };

    private static final Logger logger = LoggerFactory.getLogger(FailureMode.class);

    /** Either throws failure or absorbs it. */
    abstract void handleFailure(GraphException failure);
}
