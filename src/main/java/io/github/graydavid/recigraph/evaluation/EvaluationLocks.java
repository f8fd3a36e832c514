/*
 * Copyright 2021 David Gray
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package io.github.graydavid.recigraph.evaluation;

import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.BooleanSupplier;

/**
 * Guards the "check, compute, store" sequence of each node with a per-node exclusive lock, so that concurrent
 * evaluators compute a node at most once per clear cycle. Locks are created lazily, the first time a node is computed.
 *
 * A failed computation is remembered: later attempts through the same object, including those of threads that were
 * waiting on the lock, answer false without computing again. Use a fresh object to allow retries.
 */
class EvaluationLocks {
    /** The per-node state of computation, as last seen through this object. */
    enum State {
        EMPTY,
        IN_PROGRESS,
        DONE,
        FAILED
    }

    private final ConcurrentHashMap<String, Slot> slots;

    EvaluationLocks() {
        this.slots = new ConcurrentHashMap<>();
    }

    /**
     * Runs computation for the node unless hasValue says the node already has a value. hasValue is checked once before
     * acquiring the node's lock and again after, so that threads racing to compute the same node wait for the winner
     * and then reuse its result. If the node's computation already failed, nothing is run.
     *
     * @param hasValue answers whether the node currently has a value.
     * @param computation computes and stores the node's value, answering whether it succeeded. Must not try to compute
     *        the same node again.
     * @return whether the node has a value afterwards.
     * @throws RuntimeException whatever computation throws, after marking the node as failed.
     */
    boolean computeOnce(String name, BooleanSupplier hasValue, BooleanSupplier computation) {
        if (hasValue.getAsBoolean()) {
            return true;
        }

        Slot slot = slots.computeIfAbsent(name, key -> new Slot());
        slot.lock.lock();
        try {
            if (hasValue.getAsBoolean()) {
                slot.state = State.DONE;
                return true;
            }
            if (slot.state == State.FAILED) {
                return false;
            }
            slot.state = State.IN_PROGRESS;
            boolean computed = false;
            try {
                computed = computation.getAsBoolean();
            } finally {
                slot.state = computed ? State.DONE : State.FAILED;
            }
            return computed;
        } finally {
            slot.lock.unlock();
        }
    }

    State getState(String name) {
        Slot slot = slots.get(Objects.requireNonNull(name));
        return slot == null ? State.EMPTY : slot.state;
    }

    private static class Slot {
        private final ReentrantLock lock = new ReentrantLock();
        private volatile State state = State.EMPTY;
    }
}
