package io.github.graydavid.recigraph.evaluation;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.not;
import static org.hamcrest.Matchers.sameInstance;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.List;
import java.util.Map;
import java.util.Set;

import org.junit.jupiter.api.Test;

import io.github.graydavid.naryfunctions.NAryFunction;
import io.github.graydavid.recigraph.core.Graph;
import io.github.graydavid.recigraph.core.InfeasibleException;
import io.github.graydavid.recigraph.core.Recipes;
import io.github.graydavid.recigraph.core.TestGraphs;

public class ExecutionsTest {
    @Test
    public void executesCopyWithoutTouchingOriginal() {
        Graph graph = TestGraphs.arithmetic();

        Graph executed = Executions.executeGraphFromContext(graph, TestGraphs.arithmeticContext(), false, "g");

        assertThat(executed, not(sameInstance(graph)));
        assertThat(executed.getValue("g"), is(-9));
        assertThat(graph.hasValue("g"), is(false));
        assertThat(graph.hasValue("a"), is(false));
    }

    @Test
    public void executesInPlace() {
        Graph graph = TestGraphs.arithmetic();

        Graph executed = Executions.executeGraphFromContext(graph, TestGraphs.arithmeticContext(), true, "g");

        assertThat(executed, sameInstance(graph));
        assertThat(graph.getValue("g"), is(-9));
    }

    @Test
    public void executesEveryNonRecipeSinkGivenNoTargets() {
        Graph graph = TestGraphs.arithmetic();
        NAryFunction<Integer, Integer> increment = values -> values.get(0) + 1;
        graph.addStepQuick("h", List.of("e"), increment);
        graph.finalizeDefinition();

        Graph executed = Executions.executeGraphFromContext(graph, TestGraphs.arithmeticContext(), false);

        assertThat(executed.getValue("g"), is(-9));
        assertThat(executed.getValue("h"), is(4));
    }

    @Test
    public void rejectsUnreachableTargetsBeforeRunningAnyRecipe() {
        Graph graph = TestGraphs.arithmetic();

        InfeasibleException thrown = assertThrows(InfeasibleException.class,
                () -> Executions.executeGraphFromContext(graph, Map.of("a", 1, "b", 2, "c", 3), true, "g"));

        assertThat(thrown.getMissingInputs(), is(Set.of("d")));
        assertThat(graph.hasValue("e"), is(false));
    }

    @Test
    public void executesUncertainTargets() {
        Graph graph = new Graph();
        graph.addStep("condition", "is_positive", "pre_req");
        graph.setValue("is_positive", Recipes.of((Integer x) -> x > 0));
        graph.addSimpleConditional("result", "condition", "value_true", "value_false");
        graph.finalizeDefinition();

        Graph executed = Executions.executeGraphFromContext(graph, Map.of("pre_req", 1, "value_true", 1), false,
                "result");

        assertThat(executed.getValue("result"), is(1));
    }
}
