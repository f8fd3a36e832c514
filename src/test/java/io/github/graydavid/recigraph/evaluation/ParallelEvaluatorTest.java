package io.github.graydavid.recigraph.evaluation;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.sameInstance;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import io.github.graydavid.naryfunctions.NAryFunction;
import io.github.graydavid.onemoretry.Try;
import io.github.graydavid.recigraph.core.EvaluationException;
import io.github.graydavid.recigraph.core.Graph;
import io.github.graydavid.recigraph.core.Recipes;
import io.github.graydavid.recigraph.core.TestGraphs;

public class ParallelEvaluatorTest {
    private final ForkJoinPool pool = new ForkJoinPool(4);

    @AfterEach
    public void shutdownPool() {
        pool.shutdownNow();
    }

    @Test
    public void constructorThrowsExceptionGivenNullPool() {
        assertThrows(NullPointerException.class, () -> new ParallelEvaluator(new Graph(), null));
    }

    @Test
    public void computesSameResultsAsSequentialEvaluation() {
        Graph graph = TestGraphs.arithmetic();
        graph.setContext(TestGraphs.arithmeticContext());

        new ParallelEvaluator(graph, pool).executeToTargets("g", "e");

        assertThat(graph.getValue("e"), is(3));
        assertThat(graph.getValue("f"), is(12));
        assertThat(graph.getValue("g"), is(-9));
    }

    @Test
    public void worksOnCommonPoolByDefault() {
        Graph graph = TestGraphs.arithmetic();
        graph.setContext(TestGraphs.arithmeticContext());

        new ParallelEvaluator(graph).executeToTargets("g");

        assertThat(graph.getValue("g"), is(-9));
    }

    @Test
    public void computesSharedDependencyAtMostOnce() {
        Graph graph = new Graph();
        AtomicInteger sharedCalls = new AtomicInteger();
        graph.addStep("shared", "recipe_shared");
        graph.setValue("recipe_shared", Recipes.of(() -> sharedCalls.incrementAndGet() * 10));
        List<String> consumers = new ArrayList<>();
        NAryFunction<Integer, Integer> increment = values -> values.get(0) + 1;
        for (int i = 0; i < 20; ++i) {
            String consumer = "consumer" + i;
            graph.addStepQuick(consumer, List.of("shared"), increment);
            consumers.add(consumer);
        }
        NAryFunction<Integer, Integer> sum = values -> values.stream().mapToInt(Integer::intValue).sum();
        graph.addStepQuick("top", consumers, sum);

        new ParallelEvaluator(graph, pool).executeToTargets(consumers);
        new ParallelEvaluator(graph, pool).executeToTargets("top");

        assertThat(sharedCalls.get(), is(1));
        assertThat(graph.getValue("top"), is(220));
    }

    @Test
    public void evaluatesIndependentDependenciesConcurrently() {
        Graph graph = new Graph();
        CountDownLatch bothStarted = new CountDownLatch(2);
        graph.addStep("left", "recipe_left");
        graph.addStep("right", "recipe_right");
        graph.setValue("recipe_left", Recipes.of(() -> awaitBoth(bothStarted)));
        graph.setValue("recipe_right", Recipes.of(() -> awaitBoth(bothStarted)));
        NAryFunction<Boolean, Boolean> and = values -> values.get(0) && values.get(1);
        graph.addStepQuick("both", List.of("left", "right"), and);

        new ParallelEvaluator(graph, pool).executeToTargets("both");

        assertThat(graph.getValue("both"), is(true));
    }

    private static boolean awaitBoth(CountDownLatch bothStarted) {
        bothStarted.countDown();
        return Try.callUnchecked(() -> bothStarted.await(5, TimeUnit.SECONDS));
    }

    @Test
    public void propagatesOriginalFailure() {
        Graph graph = TestGraphs.arithmetic();
        IllegalStateException failure = new IllegalStateException("recipe broke");
        graph.setValue("op_f", Recipes.of((Integer x, Integer y) -> {
            throw failure;
        }));
        graph.setContext(TestGraphs.arithmeticContext());

        EvaluationException thrown = assertThrows(EvaluationException.class,
                () -> new ParallelEvaluator(graph, pool).executeToTargets("g"));

        assertThat(thrown.getFailedNodeName(), is("f"));
        assertThat(thrown.getRecipeFailure(), sameInstance(failure));
    }

    private static Graph manyConsumersOfFailingShared(AtomicInteger sharedCalls) {
        Graph graph = new Graph();
        graph.addStep("shared", "recipe_shared");
        graph.setValue("recipe_shared", Recipes.of(() -> {
            sharedCalls.incrementAndGet();
            throw new IllegalStateException("shared broke");
        }));
        List<String> consumers = new ArrayList<>();
        NAryFunction<Integer, Integer> increment = values -> values.get(0) + 1;
        for (int i = 0; i < 20; ++i) {
            String consumer = "consumer" + i;
            graph.addStepQuick(consumer, List.of("shared"), increment);
            consumers.add(consumer);
        }
        NAryFunction<Integer, Integer> sum = values -> values.stream().mapToInt(Integer::intValue).sum();
        graph.addStepQuick("top", consumers, sum);
        return graph;
    }

    @Test
    public void softFailingSharedDependencyIsAttemptedOncePerCall() {
        AtomicInteger sharedCalls = new AtomicInteger();
        Graph graph = manyConsumersOfFailingShared(sharedCalls);

        new ParallelEvaluator(graph, pool).progressTowardsTargets("top");

        assertThat(sharedCalls.get(), is(1));
        assertThat(graph.hasValue("shared"), is(false));
        assertThat(graph.hasValue("consumer0"), is(false));
        assertThat(graph.hasValue("top"), is(false));
    }

    @Test
    public void hardFailingSharedDependencyIsAttemptedOncePerCall() {
        AtomicInteger sharedCalls = new AtomicInteger();
        Graph graph = manyConsumersOfFailingShared(sharedCalls);

        EvaluationException thrown = assertThrows(EvaluationException.class,
                () -> new ParallelEvaluator(graph, pool).executeToTargets("top"));

        assertThat(thrown.getFailedNodeName(), is("shared"));
        assertThat(sharedCalls.get(), is(1));
    }

    @Test
    public void laterCallRetriesFailedDependency() {
        AtomicInteger sharedCalls = new AtomicInteger();
        Graph graph = manyConsumersOfFailingShared(sharedCalls);
        ParallelEvaluator evaluator = new ParallelEvaluator(graph, pool);

        evaluator.progressTowardsTargets("top");
        graph.setValue("recipe_shared", Recipes.of(() -> sharedCalls.incrementAndGet() * 10));
        evaluator.progressTowardsTargets("top");

        assertThat(sharedCalls.get(), is(2));
        assertThat(graph.getValue("top"), is(420));
    }

    @Test
    public void softFailureLeavesUncomputableNodesUnset() {
        Graph graph = TestGraphs.arithmetic();
        graph.setContext(Map.of("a", 1, "b", 2, "c", 3));

        new ParallelEvaluator(graph, pool).progressTowardsTargets("g");

        assertThat(graph.getValue("e"), is(3));
        assertThat(graph.hasValue("f"), is(false));
        assertThat(graph.hasValue("g"), is(false));
    }

    @Test
    public void evaluatesConditionals() {
        Graph graph = TestGraphs.threeWayConditional(true);
        graph.updateContext(Map.of("c1", false, "c2", false, "c3", true));

        new ParallelEvaluator(graph, pool).executeToTargets("result");

        assertThat(graph.getValue("result"), is(3));
    }
}
