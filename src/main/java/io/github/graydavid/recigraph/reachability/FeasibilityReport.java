/*
 * Copyright 2021 David Gray
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package io.github.graydavid.recigraph.reachability;

import java.util.Objects;
import java.util.Set;

import io.github.graydavid.recigraph.core.Reachability;

/** The result of {@link Feasibility#check}: how reachable the targets are, and which inputs are missing. */
public class FeasibilityReport {
    private final Reachability reachability;
    private final Set<String> missingInputs;

    public FeasibilityReport(Reachability reachability, Set<String> missingInputs) {
        this.reachability = Objects.requireNonNull(reachability);
        this.missingInputs = Set.copyOf(missingInputs);
    }

    /** The worst reachability across all targets. */
    public Reachability getReachability() {
        return reachability;
    }

    /**
     * The source nodes, among the targets and their ancestors, that have no value and aren't REACHABLE: i.e. the
     * values a caller could supply to make progress.
     */
    public Set<String> getMissingInputs() {
        return missingInputs;
    }

    @Override
    public boolean equals(Object object) {
        if (!(object instanceof FeasibilityReport)) {
            return false;
        }

        FeasibilityReport other = (FeasibilityReport) object;
        return reachability == other.reachability && missingInputs.equals(other.missingInputs);
    }

    @Override
    public int hashCode() {
        return Objects.hash(reachability, missingInputs);
    }

    @Override
    public String toString() {
        return "FeasibilityReport(" + reachability + ", missingInputs=" + missingInputs + ")";
    }
}
