package com.example.demo.lettergen.core;

import com.example.demo.lettergen.model.LetterBindings;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Carries the bindings of one generation through the processors and collects
 * non-fatal findings along the way. One instance per generation; not thread-safe.
 */
public class RenderContext {
    private final LetterBindings bindings;
    private final List<String> warnings = new ArrayList<>();

    public RenderContext(LetterBindings bindings) {
        this.bindings = bindings == null ? LetterBindings.empty() : bindings;
    }

    public LetterBindings getBindings() {
        return bindings;
    }

    public void addWarning(String warning) {
        warnings.add(warning);
    }

    public List<String> getWarnings() {
        return Collections.unmodifiableList(warnings);
    }
}
