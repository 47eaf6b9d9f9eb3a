package com.example.demo.lettergen.model;

import lombok.EqualsAndHashCode;
import lombok.ToString;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.TreeSet;

/**
 * Variable and conditional names referenced by a template, each sorted and free of duplicates.
 */
@ToString
@EqualsAndHashCode
public final class PlaceholderInventory {
    private final List<String> variables;
    private final List<String> conditionals;

    private PlaceholderInventory(List<String> variables, List<String> conditionals) {
        this.variables = variables;
        this.conditionals = conditionals;
    }

    public static PlaceholderInventory of(Collection<String> variables, Collection<String> conditionals) {
        return new PlaceholderInventory(sortedCopy(variables), sortedCopy(conditionals));
    }

    private static List<String> sortedCopy(Collection<String> names) {
        return Collections.unmodifiableList(new ArrayList<>(new TreeSet<>(names)));
    }

    public List<String> getVariables() {
        return variables;
    }

    public List<String> getConditionals() {
        return conditionals;
    }
}
