/*
 * Copyright 2021 David Gray
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package io.github.graydavid.recigraph.evaluation;

import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.ForkJoinTask;
import java.util.concurrent.RecursiveAction;
import java.util.stream.Collectors;

import io.github.graydavid.onemoretry.Try;
import io.github.graydavid.recigraph.core.Graph;
import io.github.graydavid.recigraph.core.Node;

/**
 * An {@link Evaluator} that evaluates independent predecessors of a node concurrently on a ForkJoinPool. Semantics are
 * the same as the sequential Evaluator's: memoization, failure modes, and the lazy, in-order evaluation of a
 * conditional's conditions.
 *
 * Each standard node's recipe invocation runs under the node's own lock, with the node's value double-checked after
 * acquiring it, so that a recipe is invoked at most once per node per clear cycle no matter how many threads race to
 * compute it. The lock is held only while invoking the recipe, never while evaluating predecessors. A recipe that fails
 * isn't invoked again during the same public call: threads that were waiting for it, and later visits from other
 * consumers, see the failure instead. The next public call starts afresh and may retry it.
 *
 * @apiNote the Graph must not be structurally edited, nor have its values cleared, while an evaluation is in flight.
 *          An instance serves one public call at a time.
 */
public class ParallelEvaluator extends Evaluator {
    private final ForkJoinPool pool;
    private volatile EvaluationLocks locks;

    public ParallelEvaluator(Graph graph, ForkJoinPool pool) {
        super(graph);
        this.pool = Objects.requireNonNull(pool);
        this.locks = new EvaluationLocks();
    }

    /** Creates a ParallelEvaluator that runs on the common pool. */
    public ParallelEvaluator(Graph graph) {
        this(graph, ForkJoinPool.commonPool());
    }

    @Override
    protected void startEvaluation() {
        locks = new EvaluationLocks();
    }

    @Override
    protected boolean evaluateAll(Collection<String> names, FailureMode failureMode) {
        if (names.size() <= 1) {
            return super.evaluateAll(names, failureMode);
        }

        List<EvaluateTask> tasks = names.stream()
                .map(name -> new EvaluateTask(name, failureMode))
                .collect(Collectors.toList());
        if (ForkJoinTask.getPool() == pool) {
            ForkJoinTask.invokeAll(tasks);
        } else {
            pool.invoke(new InvokeAllAction(tasks));
        }

        tasks.forEach(EvaluateTask::rethrowFailure);
        return tasks.stream().allMatch(task -> task.valued);
    }

    @Override
    protected boolean computeStandard(Node node, FailureMode failureMode) {
        return locks.computeOnce(node.getName(), node::hasValue, () -> super.computeStandard(node, failureMode));
    }

    /** Evaluates a single node, capturing any failure so that the joining thread can rethrow it as is. */
    private class EvaluateTask extends RecursiveAction {
        private static final long serialVersionUID = 1;

        private final String name;
        private final FailureMode failureMode;
        private volatile boolean valued;
        private volatile Throwable failure;

        private EvaluateTask(String name, FailureMode failureMode) {
            this.name = name;
            this.failureMode = failureMode;
        }

        @Override
        protected void compute() {
            Try<Void> attempt = Try.runCatchRuntime(() -> valued = evaluateNode(name, failureMode));
            failure = attempt.getFailure().orElse(null);
        }

        private void rethrowFailure() {
            if (failure instanceof RuntimeException) {
                throw (RuntimeException) failure;
            }
            if (failure instanceof Error) {
                throw (Error) failure;
            }
            if (failure != null) {
                throw new IllegalStateException("Unexpected failure evaluating " + name, failure);
            }
        }
    }

    private static class InvokeAllAction extends RecursiveAction {
        private static final long serialVersionUID = 1;

        private final transient List<EvaluateTask> tasks;

        private InvokeAllAction(List<EvaluateTask> tasks) {
            this.tasks = tasks;
        }

        @Override
        protected void compute() {
            ForkJoinTask.invokeAll(tasks);
        }
    }
}
