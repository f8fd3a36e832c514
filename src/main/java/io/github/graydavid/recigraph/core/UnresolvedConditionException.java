/*
 * Copyright 2021 David Gray
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package io.github.graydavid.recigraph.core;

/**
 * Thrown when the truth of a conditional's conditions can't be determined, or none of them holds true and the
 * conditional has no default possibility to fall back on.
 */
public class UnresolvedConditionException extends GraphException {
    private static final long serialVersionUID = 1;

    private final String conditionalName;

    public UnresolvedConditionException(String conditionalName, String message) {
        super(message);
        this.conditionalName = conditionalName;
    }

    /** @param cause the failure that kept one of the conditions from being computed. */
    public UnresolvedConditionException(String conditionalName, String message, Throwable cause) {
        super(message, cause);
        this.conditionalName = conditionalName;
    }

    /** Returns the name of the conditional node whose branch couldn't be selected. */
    public String getConditionalName() {
        return conditionalName;
    }
}
