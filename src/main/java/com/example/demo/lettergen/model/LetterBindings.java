package com.example.demo.lettergen.model;

import com.example.demo.lettergen.util.PlaceholderNames;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Variable values and conditional states used to fill one letter.
 * Lookups never fail: a missing variable reads as absent, a missing conditional as {@link ConditionalState#NO}.
 */
public final class LetterBindings {
    private final Map<String, String> variables;
    private final Map<String, ConditionalState> conditionals;

    private LetterBindings(Map<String, String> variables, Map<String, ConditionalState> conditionals) {
        this.variables = Collections.unmodifiableMap(variables);
        this.conditionals = Collections.unmodifiableMap(conditionals);
    }

    public static LetterBindings of(Map<String, String> variables, Map<String, ConditionalState> conditionals) {
        return new LetterBindings(
                variables == null ? new LinkedHashMap<>() : new LinkedHashMap<>(variables),
                conditionals == null ? new LinkedHashMap<>() : new LinkedHashMap<>(conditionals));
    }

    public static LetterBindings empty() {
        return of(null, null);
    }

    /**
     * Builds bindings from raw form or import values. Keys are normalized through
     * {@code names}; conditional values are parsed with {@link ConditionalState#parse(String)}.
     */
    public static LetterBindings normalized(Map<String, String> rawVariables,
                                            Map<String, String> rawConditionals,
                                            PlaceholderNames names) {
        Map<String, String> vars = new LinkedHashMap<>();
        if (rawVariables != null) {
            rawVariables.forEach((k, v) -> vars.put(names.normalize(k), v));
        }
        Map<String, ConditionalState> conds = new LinkedHashMap<>();
        if (rawConditionals != null) {
            rawConditionals.forEach((k, v) -> conds.put(names.normalize(k), ConditionalState.parse(v)));
        }
        return new LetterBindings(vars, conds);
    }

    public Map<String, String> getVariables() {
        return variables;
    }

    public Map<String, ConditionalState> getConditionals() {
        return conditionals;
    }

    public String variable(String name) {
        return variables.get(name);
    }

    public ConditionalState conditional(String name) {
        return conditionals.getOrDefault(name, ConditionalState.NO);
    }
}
