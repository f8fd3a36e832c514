package io.github.graydavid.recigraph.core;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.not;
import static org.hamcrest.Matchers.sameInstance;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

import io.github.graydavid.naryfunctions.FourAryFunction;
import io.github.graydavid.naryfunctions.ThreeAryFunction;

public class RecipesTest {
    @Test
    public void identityReturnsItsArgument() {
        Object argument = new Object();

        assertThat(Recipes.identity().apply(List.of(argument), Map.of()), sameInstance(argument));
    }

    @Test
    public void constantIgnoresArguments() {
        Recipe constant = Recipes.constant(5);

        assertThat(constant.apply(List.of(1, 2), Map.of("x", 3)), is(5));
    }

    @Test
    public void fixedArityFactoriesPassPositionalArgumentsInOrder() {
        ThreeAryFunction<Integer, Integer, Integer, Integer> three = (x, y, z) -> x * 100 + y * 10 + z;
        FourAryFunction<Integer, Integer, Integer, Integer, Integer> four = (w, x, y, z) -> w * 1000 + x * 100
                + y * 10 + z;

        assertThat(Recipes.of(() -> 7).apply(List.of(), Map.of()), is(7));
        assertThat(Recipes.of((Integer x) -> x + 1).apply(List.of(1), Map.of()), is(2));
        assertThat(Recipes.of((Integer x, Integer y) -> x - y).apply(List.of(5, 3), Map.of()), is(2));
        assertThat(Recipes.of(three).apply(List.of(1, 2, 3), Map.of()), is(123));
        assertThat(Recipes.of(four).apply(List.of(1, 2, 3, 4), Map.of()), is(1234));
    }

    @Test
    public void fixedArityFactoriesRejectWrongArgumentCount() {
        Recipe recipe = Recipes.of((Integer x, Integer y) -> x - y);

        IllegalArgumentException thrown = assertThrows(IllegalArgumentException.class,
                () -> recipe.apply(List.of(1), Map.of()));

        assertThat(thrown.getMessage(), containsString("2"));
    }

    @Test
    public void positionalRecipesRejectKeywordArguments() {
        Recipe recipe = Recipes.of((Integer x) -> x);

        assertThrows(IllegalArgumentException.class, () -> recipe.apply(List.of(1), Map.of("x", 1)));
    }

    @Test
    public void nAryRecipeAcceptsAnyNumberOfPositionalArguments() {
        Recipe concatenate = Recipes.<String, String>ofNAry(values -> String.join("", values));

        assertThat(concatenate.apply(List.of("a", "b", "c"), Map.of()), is("abc"));
        assertThat(concatenate.apply(List.of(), Map.of()), is(""));
    }

    @Test
    public void keywordRecipeReceivesKeywordArguments() {
        Recipe recipe = Recipes.ofKeywords(keyword -> (Integer) keyword.get("x") - (Integer) keyword.get("y"));

        assertThat(recipe.applyKeywords(Map.of("x", 5, "y", 3)), is(2));
        assertThrows(IllegalArgumentException.class, () -> recipe.apply(List.of(1), Map.of()));
    }

    @Test
    public void wrongArgumentTypeSurfacesAsClassCastException() {
        Recipe recipe = Recipes.of((Integer x) -> x + 1);

        assertThrows(ClassCastException.class, () -> recipe.apply(List.of("not a number"), Map.of()));
    }

    @Test
    public void namedRecipesAreEqualByIdentifier() {
        Recipe first = Recipes.named("add", Recipes.of((Integer x, Integer y) -> x + y));
        Recipe second = Recipes.named("add", Recipes.of((Integer x, Integer y) -> x + y));
        Recipe different = Recipes.named("subtract", Recipes.of((Integer x, Integer y) -> x - y));

        assertThat(first, equalTo(second));
        assertThat(first.hashCode(), equalTo(second.hashCode()));
        assertThat(first, not(equalTo(different)));
        assertThat(first.apply(List.of(1, 2), Map.of()), is(3));
        assertThat(first.toString(), containsString("add"));
    }
}
