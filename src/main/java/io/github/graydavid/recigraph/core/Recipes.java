/*
 * Copyright 2021 David Gray
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package io.github.graydavid.recigraph.core;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.BiFunction;
import java.util.function.Function;
import java.util.function.Supplier;

import io.github.graydavid.naryfunctions.FourAryFunction;
import io.github.graydavid.naryfunctions.NAryFunction;
import io.github.graydavid.naryfunctions.ThreeAryFunction;

/**
 * Creates {@link Recipe}s from ordinary functions. Recipes created by the fixed-arity factories accept exactly that many
 * positional arguments and no keyword arguments; anything else fails with an IllegalArgumentException when the recipe is
 * invoked (which evaluation reports as a failure of the node being computed).
 */
public class Recipes {
    private Recipes() {}

    private static final Recipe IDENTITY = named("identity", positional(1, args -> args.get(0)));

    /** Returns a recipe that returns its single positional argument unchanged. */
    public static Recipe identity() {
        return IDENTITY;
    }

    /** Creates a recipe that always returns the given value, ignoring any arguments. */
    public static Recipe constant(Object value) {
        return (positional, keyword) -> value;
    }

    /** Creates a recipe that evaluates the given supplier, with no arguments. */
    public static <R> Recipe of(Supplier<R> supplier) {
        Objects.requireNonNull(supplier);
        return positional(0, args -> supplier.get());
    }

    /** Creates a recipe that evaluates the 1-ary function against its single positional argument. */
    public static <A, R> Recipe of(Function<A, R> function) {
        Objects.requireNonNull(function);
        return positional(1, args -> function.apply(cast(args.get(0))));
    }

    /** Creates a recipe that evaluates the 2-ary function against its two positional arguments. */
    public static <A, B, R> Recipe of(BiFunction<A, B, R> function) {
        Objects.requireNonNull(function);
        return positional(2, args -> function.apply(cast(args.get(0)), cast(args.get(1))));
    }

    /** Creates a recipe that evaluates the 3-ary function against its three positional arguments. */
    public static <A, B, C, R> Recipe of(ThreeAryFunction<A, B, C, R> function) {
        Objects.requireNonNull(function);
        return positional(3, args -> function.apply(cast(args.get(0)), cast(args.get(1)), cast(args.get(2))));
    }

    /** Creates a recipe that evaluates the 4-ary function against its four positional arguments. */
    public static <A, B, C, D, R> Recipe of(FourAryFunction<A, B, C, D, R> function) {
        Objects.requireNonNull(function);
        return positional(4, args -> function.apply(cast(args.get(0)), cast(args.get(1)), cast(args.get(2)),
                cast(args.get(3))));
    }

    /**
     * Creates a recipe that evaluates the n-ary function against all of its positional arguments, however many there
     * are. Keyword arguments are rejected.
     */
    public static <A, R> Recipe ofNAry(NAryFunction<A, R> function) {
        Objects.requireNonNull(function);
        return (positional, keyword) -> {
            requireNoKeywords(keyword);
            List<A> arguments = cast(positional);
            return function.apply(arguments);
        };
    }

    /** Creates a recipe that evaluates the function against its keyword arguments. Positional arguments are rejected. */
    public static <R> Recipe ofKeywords(Function<Map<String, Object>, R> function) {
        Objects.requireNonNull(function);
        return (positional, keyword) -> {
            if (!positional.isEmpty()) {
                throw new IllegalArgumentException(
                        "Recipe accepts only keyword arguments but received " + positional.size() + " positional");
            }
            return function.apply(Collections.unmodifiableMap(keyword));
        };
    }

    /**
     * Decorates a recipe with an identifier that defines its equality: two named recipes are equal if and only if their
     * identifiers are. This is how two separately-created recipes that do the same thing (e.g. the same lambda declared
     * in two graph-building passes) can be recognized as the same when merging graphs.
     */
    public static Recipe named(String identifier, Recipe recipe) {
        return new NamedRecipe(identifier, recipe);
    }

    private static Recipe positional(int arity, Function<List<Object>, Object> body) {
        return (positional, keyword) -> {
            requireNoKeywords(keyword);
            if (positional.size() != arity) {
                throw new IllegalArgumentException(
                        "Recipe expects " + arity + " positional arguments but received " + positional.size());
            }
            return body.apply(positional);
        };
    }

    private static void requireNoKeywords(Map<String, Object> keyword) {
        if (!keyword.isEmpty()) {
            throw new IllegalArgumentException(
                    "Recipe accepts only positional arguments but received keywords " + keyword.keySet());
        }
    }

    // Suppress justification: values are opaque; a wrong type surfaces as a ClassCastException inside the recipe call,
    // which evaluation then reports against the node being computed.
    @SuppressWarnings("unchecked")
    private static <T> T cast(Object value) {
        return (T) value;
    }

    /** A recipe whose equality is defined by an identifier rather than by instance. */
    private static class NamedRecipe implements Recipe {
        private final String identifier;
        private final Recipe recipe;

        private NamedRecipe(String identifier, Recipe recipe) {
            this.identifier = Objects.requireNonNull(identifier);
            this.recipe = Objects.requireNonNull(recipe);
        }

        @Override
        public Object apply(List<Object> positional, Map<String, Object> keyword) {
            return recipe.apply(positional, keyword);
        }

        @Override
        public boolean equals(Object object) {
            if (!(object instanceof NamedRecipe)) {
                return false;
            }

            NamedRecipe other = (NamedRecipe) object;
            return Objects.equals(identifier, other.identifier);
        }

        @Override
        public int hashCode() {
            return Objects.hash(identifier);
        }

        @Override
        public String toString() {
            return "Recipe(" + identifier + ")";
        }
    }
}
