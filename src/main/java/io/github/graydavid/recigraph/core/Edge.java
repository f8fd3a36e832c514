/*
 * Copyright 2021 David Gray
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package io.github.graydavid.recigraph.core;

import java.util.Objects;

/**
 * An edge in a graph: a connection from a dependency to the consuming node whose computation takes the dependency's
 * value as an input.
 *
 * @apiNote Edges are meant to *describe* graphs (e.g. for merging or comparing them). Which role a dependency plays for
 *          its consumer (recipe, positional argument, keyword argument, condition, possibility) lives in the consumer
 *          node's definition, not on the edge, since evaluation needs it per node and looking it up there is cheap.
 */
public class Edge {
    private final String dependency;
    private final String consumer;

    public Edge(String dependency, String consumer) {
        this.dependency = Objects.requireNonNull(dependency);
        this.consumer = Objects.requireNonNull(consumer);
    }

    public String getDependency() {
        return dependency;
    }

    public String getConsumer() {
        return consumer;
    }

    @Override
    public boolean equals(Object object) {
        if (!(object instanceof Edge)) {
            return false;
        }

        Edge other = (Edge) object;
        return Objects.equals(this.dependency, other.dependency) && Objects.equals(this.consumer, other.consumer);
    }

    @Override
    public int hashCode() {
        return Objects.hash(dependency, consumer);
    }

    @Override
    public String toString() {
        return "{" + dependency + "}->{" + consumer + "}";
    }
}
