/*
 * Copyright 2021 David Gray
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package io.github.graydavid.recigraph.compose;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import io.github.graydavid.recigraph.core.Recipe;

/**
 * A recipe built by composing an outer recipe with sub-recipes, expressed as an interpreted plan rather than as a new
 * closure. Each argument slot of the outer recipe (every positional slot, in order, and every keyword parameter) is
 * filled by a {@link Step}: either the identity step, which passes one flat argument through unchanged, or a nested
 * step, which invokes a sub-recipe on flat arguments picked by name.
 *
 * A Composition is invoked with keyword arguments only: the "flat" arguments, keyed by the names the steps refer to.
 * Since a Composition is itself a Recipe, it can serve as the outer recipe or as a sub-recipe of another Composition,
 * to any depth.
 */
public final class Composition implements Recipe {
    /** The sentinel that {@link #compose(Recipe, List, List, List)} accepts in place of a sub-recipe to mean identity. */
    public static final Object IDENTITY_MARKER = new Object() {
        @Override
        public String toString() {
            return "IDENTITY_MARKER";
        }
    };

    private final Recipe outer;
    private final List<Step> positionalSteps;
    private final Map<String, Step> keywordSteps;

    /**
     * @param positionalSteps the steps filling the outer recipe's positional arguments, in order.
     * @param keywordSteps the steps filling the outer recipe's keyword arguments, keyed by parameter name.
     */
    public Composition(Recipe outer, List<Step> positionalSteps, Map<String, Step> keywordSteps) {
        this.outer = Objects.requireNonNull(outer);
        this.positionalSteps = List.copyOf(positionalSteps);
        this.keywordSteps = Collections.unmodifiableMap(new LinkedHashMap<>(keywordSteps));
    }

    /**
     * Composes outer with sub-recipes, where outer is invoked with keyword arguments only.
     *
     * @param subRecipes for each outer parameter, either a {@link Recipe}, invoked with the flat arguments named by
     *        the corresponding entry of subArgumentNames (positionally), or {@link #IDENTITY_MARKER}, in which case the
     *        corresponding entry of subArgumentNames must hold exactly one name: the flat argument passed through.
     * @param outerParameterNames the names of outer's keyword parameters, one per sub-recipe.
     * @param subArgumentNames the flat argument names for each sub-recipe.
     * @throws IllegalArgumentException if the lists have different sizes, an identity doesn't name exactly one
     *         argument, or a sub-recipe is neither a Recipe nor the marker.
     */
    public static Composition compose(Recipe outer, List<?> subRecipes, List<String> outerParameterNames,
            List<List<String>> subArgumentNames) {
        if (subRecipes.size() != outerParameterNames.size() || subRecipes.size() != subArgumentNames.size()) {
            throw new IllegalArgumentException("Expected one outer parameter name and one list of argument names per "
                    + "sub-recipe, but received " + subRecipes.size() + " sub-recipes, " + outerParameterNames.size()
                    + " parameter names, and " + subArgumentNames.size() + " argument name lists");
        }

        Map<String, Step> keywordSteps = new LinkedHashMap<>();
        for (int i = 0; i < subRecipes.size(); ++i) {
            Object subRecipe = subRecipes.get(i);
            List<String> argumentNames = subArgumentNames.get(i);
            Step step;
            if (subRecipe == IDENTITY_MARKER) {
                if (argumentNames.size() != 1) {
                    throw new IllegalArgumentException(
                            "An identity must pass through exactly one argument but was given " + argumentNames);
                }
                step = Step.identity(argumentNames.get(0));
            } else if (subRecipe instanceof Recipe) {
                step = Step.nested((Recipe) subRecipe, argumentNames, Map.of());
            } else {
                throw new IllegalArgumentException("Expected a Recipe or the identity marker but found: " + subRecipe);
            }
            keywordSteps.put(outerParameterNames.get(i), step);
        }
        return new Composition(outer, List.of(), keywordSteps);
    }

    /** Returns the names of all flat arguments this composition reads, in first-use order. */
    public Set<String> getFlatArgumentNames() {
        Set<String> names = new LinkedHashSet<>();
        positionalSteps.forEach(step -> names.addAll(step.getFlatArgumentNames()));
        keywordSteps.values().forEach(step -> names.addAll(step.getFlatArgumentNames()));
        return Collections.unmodifiableSet(names);
    }

    /**
     * @throws IllegalArgumentException if there are positional arguments, or a flat argument a step needs is missing.
     *         Extra flat arguments are ignored.
     */
    @Override
    public Object apply(List<Object> positional, Map<String, Object> keyword) {
        if (!positional.isEmpty()) {
            throw new IllegalArgumentException(
                    "Compositions accept only keyword arguments but received " + positional.size() + " positional");
        }
        List<Object> outerPositional = new ArrayList<>(positionalSteps.size());
        positionalSteps.forEach(step -> outerPositional.add(step.resolve(keyword)));
        Map<String, Object> outerKeyword = new LinkedHashMap<>();
        keywordSteps.forEach((parameter, step) -> outerKeyword.put(parameter, step.resolve(keyword)));
        return outer.apply(outerPositional, outerKeyword);
    }

    @Override
    public String toString() {
        return "Composition(" + outer + ", positional=" + positionalSteps + ", keyword=" + keywordSteps + ")";
    }

    /** How a single argument slot of the outer recipe is filled from the flat arguments. */
    public static final class Step {
        private final Recipe recipe;
        private final String identityName;
        private final List<String> positionalNames;
        private final Map<String, String> keywordNames;

        private Step(Recipe recipe, String identityName, List<String> positionalNames,
                Map<String, String> keywordNames) {
            this.recipe = recipe;
            this.identityName = identityName;
            this.positionalNames = List.copyOf(positionalNames);
            this.keywordNames = Collections.unmodifiableMap(new LinkedHashMap<>(keywordNames));
        }

        /** Creates a step that passes the named flat argument through unchanged. */
        public static Step identity(String flatName) {
            return new Step(null, Objects.requireNonNull(flatName), List.of(), Map.of());
        }

        /**
         * Creates a step that invokes recipe with the named flat arguments.
         *
         * @param positionalNames the flat arguments to pass positionally, in order.
         * @param keywordNames map from recipe parameter name to the flat argument passed for it.
         */
        public static Step nested(Recipe recipe, List<String> positionalNames, Map<String, String> keywordNames) {
            return new Step(Objects.requireNonNull(recipe), null, positionalNames, keywordNames);
        }

        public boolean isIdentity() {
            return recipe == null;
        }

        /** Returns the names of the flat arguments this step reads. */
        public Set<String> getFlatArgumentNames() {
            if (isIdentity()) {
                return Set.of(identityName);
            }
            Set<String> names = new LinkedHashSet<>(positionalNames);
            names.addAll(keywordNames.values());
            return names;
        }

        private Object resolve(Map<String, Object> flat) {
            if (isIdentity()) {
                return require(flat, identityName);
            }
            List<Object> positional = new ArrayList<>(positionalNames.size());
            positionalNames.forEach(name -> positional.add(require(flat, name)));
            Map<String, Object> keyword = new LinkedHashMap<>();
            keywordNames.forEach((parameter, name) -> keyword.put(parameter, require(flat, name)));
            return recipe.apply(positional, keyword);
        }

        private static Object require(Map<String, Object> flat, String name) {
            if (!flat.containsKey(name)) {
                throw new IllegalArgumentException("Missing argument '" + name + "'");
            }
            return flat.get(name);
        }

        @Override
        public String toString() {
            return isIdentity() ? "identity(" + identityName + ")"
                    : "nested(" + recipe + ", " + positionalNames + ", " + keywordNames + ")";
        }
    }
}
