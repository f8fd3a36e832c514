package io.github.graydavid.recigraph.compose;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.List;
import java.util.Map;
import java.util.Set;

import org.junit.jupiter.api.Test;

import io.github.graydavid.recigraph.core.Graph;
import io.github.graydavid.recigraph.core.InfeasibleException;
import io.github.graydavid.recigraph.core.Recipe;
import io.github.graydavid.recigraph.core.Recipes;
import io.github.graydavid.recigraph.core.TestGraphs;
import io.github.graydavid.recigraph.core.UnresolvedConditionException;
import io.github.graydavid.recigraph.evaluation.Evaluator;

public class LambdifyTest {
    @Test
    public void compilesWholeGraphIntoRecipeOfInputs() {
        Graph graph = TestGraphs.arithmetic();

        Recipe recipe = Lambdify.lambdify(graph, List.of("a", "b", "c", "d"), "g");

        assertThat(recipe.applyKeywords(Map.of("a", 1, "b", 2, "c", 3, "d", 4)), is(-9));
        assertThat(recipe.applyKeywords(Map.of("a", 1, "b", 2, "c", 5, "d", 4)), is(-17));
    }

    @Test
    public void capturesInputIndependentValuesAsConstants() {
        Graph graph = TestGraphs.arithmetic();
        graph.setContext(TestGraphs.arithmeticContext());

        Recipe recipe = Lambdify.lambdify(graph, List.of("c"), "g");

        assertThat(recipe.applyKeywords(Map.of("c", 5)), is(-17));
    }

    @Test
    public void leavesOriginalGraphUntouched() {
        Graph graph = TestGraphs.arithmetic();
        graph.setContext(TestGraphs.arithmeticContext());
        graph.freeze("c");
        Graph before = graph.copy();

        Lambdify.lambdify(graph, List.of("c"), "g");

        assertThat(graph, is(before));
        assertThat(graph.getValue("c"), is(3));
        assertThat(graph.hasValue("e"), is(false));
    }

    @Test
    public void ignoresValuesOfInputsAndWhatDependsOnThem() {
        Graph graph = TestGraphs.arithmetic();
        graph.setContext(TestGraphs.arithmeticContext());
        new Evaluator(graph).executeToTargets("g");
        graph.freeze();

        Recipe recipe = Lambdify.lambdify(graph, List.of("a"), "g");

        assertThat(recipe.applyKeywords(Map.of("a", 10)), is(0));
    }

    @Test
    public void collapsesConditionalsWhoseConditionIsKnown() {
        Graph graph = new Graph();
        graph.addStep("doubled", "double", "x");
        graph.setValue("double", Recipes.of((Integer x) -> x * 2));
        graph.addStep("tripled", "triple", "x");
        graph.setValue("triple", Recipes.of((Integer x) -> x * 3));
        graph.addSimpleConditional("chosen", "flag", "doubled", "tripled");
        graph.addStep("result", "increment", "chosen");
        graph.setValue("increment", Recipes.of((Integer value) -> value + 1));
        graph.finalizeDefinition();
        graph.setValue("flag", true);

        Recipe chosen = Lambdify.lambdify(graph, List.of("x"), "chosen");
        Recipe result = Lambdify.lambdify(graph, List.of("x"), "result");

        assertThat(chosen.applyKeywords(Map.of("x", 5)), is(10));
        assertThat(result.applyKeywords(Map.of("x", 5)), is(11));
    }

    @Test
    public void rejectsConditionalDependingOnInputs() {
        Graph graph = new Graph();
        graph.addStep("flag", "is_positive", "x");
        graph.setValue("is_positive", Recipes.of((Integer x) -> x > 0));
        graph.addConditional("chosen", List.of("flag"), List.of("x"));
        graph.finalizeDefinition();

        assertThrows(UnresolvedConditionException.class, () -> Lambdify.lambdify(graph, List.of("x"), "chosen"));
    }

    @Test
    public void rejectsTargetNeedingValueThatIsNeitherInputNorComputable() {
        Graph graph = TestGraphs.arithmetic();

        InfeasibleException thrown = assertThrows(InfeasibleException.class,
                () -> Lambdify.lambdify(graph, List.of("a", "b", "c"), "g"));

        assertThat(thrown.getMissingInputs(), is(Set.of("d")));
    }

    @Test
    public void rejectsTargetWithoutRecipe() {
        Graph graph = TestGraphs.arithmetic();

        InfeasibleException thrown = assertThrows(InfeasibleException.class,
                () -> Lambdify.lambdify(graph, List.of("b"), "a"));

        assertThat(thrown.getMissingInputs(), is(Set.of("a")));
    }
}
