/*
 * Copyright 2021 David Gray
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package io.github.graydavid.recigraph.core;

import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.lang.reflect.Parameter;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * A recipe backed by a static method, whose parameter names double as the names of the nodes it depends on. This is
 * what powers {@link Graph#addStepQuick(String, Method)}.
 *
 * @apiNote parameter names are only available through reflection if the declaring class was compiled with
 *          "-parameters". Without that, javac synthesizes names like "arg0", which would silently wire the recipe to
 *          the wrong nodes, so such methods are rejected outright.
 */
class MethodRecipe implements Recipe {
    private final Method method;
    private final List<String> parameterNames;

    private MethodRecipe(Method method, List<String> parameterNames) {
        this.method = method;
        this.parameterNames = parameterNames;
    }

    /**
     * @throws UnsupportedSignatureException if method is variadic, not static, or was compiled without parameter names.
     */
    static MethodRecipe from(Method method) {
        Objects.requireNonNull(method);
        if (method.isVarArgs()) {
            throw new UnsupportedSignatureException("Variadic method '" + method.getName()
                    + "' is not supported because there would be no way to name its dependency nodes");
        }
        if (!Modifier.isStatic(method.getModifiers())) {
            throw new UnsupportedSignatureException(
                    "Method '" + method.getName() + "' must be static to be used as a recipe");
        }
        Parameter[] parameters = method.getParameters();
        if (Arrays.stream(parameters).anyMatch(parameter -> !parameter.isNamePresent())) {
            throw new UnsupportedSignatureException("Method '" + method.getName()
                    + "' was compiled without parameter names (javac -parameters), so its dependencies can't be named");
        }
        List<String> parameterNames = Arrays.stream(parameters)
                .map(Parameter::getName)
                .collect(Collectors.toUnmodifiableList());
        method.setAccessible(true);
        return new MethodRecipe(method, parameterNames);
    }

    /** Returns the names of the method's parameters, in declaration order. */
    List<String> getParameterNames() {
        return parameterNames;
    }

    String getName() {
        return method.getName();
    }

    @Override
    public Object apply(List<Object> positional, Map<String, Object> keyword) {
        if (!keyword.isEmpty()) {
            throw new IllegalArgumentException(
                    "Method recipe '" + method.getName() + "' accepts only positional arguments");
        }
        try {
            return method.invoke(null, positional.toArray());
        } catch (InvocationTargetException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            if (cause instanceof Error) {
                throw (Error) cause;
            }
            throw new IllegalStateException("Method recipe '" + method.getName() + "' threw a checked exception",
                    cause);
        } catch (IllegalAccessException e) {
            throw new IllegalStateException("Method recipe '" + method.getName() + "' is not accessible", e);
        }
    }

    @Override
    public boolean equals(Object object) {
        if (!(object instanceof MethodRecipe)) {
            return false;
        }

        MethodRecipe other = (MethodRecipe) object;
        return Objects.equals(method, other.method);
    }

    @Override
    public int hashCode() {
        return Objects.hash(method);
    }

    @Override
    public String toString() {
        return "Recipe(" + method.getDeclaringClass().getSimpleName() + "::" + method.getName() + ")";
    }
}
