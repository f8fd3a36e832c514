package io.github.graydavid.recigraph.reachability;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.nullValue;

import java.util.List;
import java.util.Map;
import java.util.Set;

import org.junit.jupiter.api.Test;

import io.github.graydavid.recigraph.core.Graph;
import io.github.graydavid.recigraph.core.Reachability;
import io.github.graydavid.recigraph.core.Recipes;
import io.github.graydavid.recigraph.core.TestGraphs;

public class FeasibilityTest {
    @Test
    public void fullContextIsReachableWithNothingMissing() {
        Graph graph = TestGraphs.arithmetic();

        FeasibilityReport report = Feasibility.check(graph, TestGraphs.arithmeticContext(), List.of("g"), false);

        assertThat(report, is(new FeasibilityReport(Reachability.REACHABLE, Set.of())));
    }

    @Test
    public void partialContextReportsMissingInputs() {
        Graph graph = TestGraphs.arithmetic();

        FeasibilityReport report = Feasibility.check(graph, Map.of("a", 1, "c", 3), List.of("g"), false);

        assertThat(report.getReachability(), is(Reachability.UNREACHABLE));
        assertThat(report.getMissingInputs(), is(Set.of("b", "d")));
    }

    @Test
    public void emptyContextWithSingleStepIsUnreachable() {
        Graph graph = new Graph();
        graph.addStep("b", "fb", "a");
        graph.setValue("fb", Recipes.identity());
        graph.finalizeDefinition();

        FeasibilityReport report = Feasibility.check(graph, Map.of(), List.of("b"), false);

        assertThat(report.getReachability(), is(Reachability.UNREACHABLE));
        assertThat(report.getMissingInputs(), is(Set.of("a")));
    }

    @Test
    public void missingInputsIgnoreStaleGenerations() {
        Graph graph = new Graph();
        graph.addStep("b", "fb", "a");
        graph.setValue("fb", Recipes.identity());
        graph.finalizeDefinition();
        graph.editStep("a", "fa", List.of("z"), Map.of());
        graph.setValue("fa", Recipes.identity());
        graph.freeze("fa");

        FeasibilityReport report = Feasibility.check(graph, Map.of(), List.of("b"), false);

        assertThat(graph.getNode("a").getGeneration(), is(0));
        assertThat(graph.getNode("z").getGeneration(), is(-1));
        assertThat(report.getReachability(), is(Reachability.UNREACHABLE));
        assertThat(report.getMissingInputs(), is(Set.of("z")));
    }

    @Test
    public void uncertainConditionalReportsUncertain() {
        Graph graph = new Graph();
        graph.addStep("condition", "is_positive", "pre_req");
        graph.setValue("is_positive", Recipes.of((Integer x) -> x > 0));
        graph.addSimpleConditional("result", "condition", "value_true", "value_false");
        graph.finalizeDefinition();

        FeasibilityReport report = Feasibility.check(graph, Map.of("pre_req", 1, "value_true", 1), List.of("result"),
                false);

        assertThat(report.getReachability(), is(Reachability.UNCERTAIN));
        assertThat(report.getMissingInputs(), is(Set.of("value_false")));
    }

    @Test
    public void checkOnCopyLeavesGraphUntouched() {
        Graph graph = TestGraphs.arithmetic();

        Feasibility.check(graph, TestGraphs.arithmeticContext(), List.of("g"), false);

        assertThat(graph.hasValue("a"), is(false));
        assertThat(graph.getNode("g").getReachability(), nullValue());
    }

    @Test
    public void checkInPlaceAppliesContextAndLeavesTags() {
        Graph graph = TestGraphs.arithmetic();

        Feasibility.check(graph, TestGraphs.arithmeticContext(), List.of("g"), true);

        assertThat(graph.getValue("a"), is(1));
        assertThat(graph.getNode("g").getReachability(), is(Reachability.REACHABLE));
    }

    @Test
    public void checkClearsStaleTags() {
        Graph graph = TestGraphs.arithmetic();
        Feasibility.check(graph, Map.of(), List.of("g"), true);

        FeasibilityReport report = Feasibility.check(graph, TestGraphs.arithmeticContext(), List.of("g"), true);

        assertThat(report.getReachability(), is(Reachability.REACHABLE));
    }
}
