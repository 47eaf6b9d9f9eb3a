package com.example.demo.lettergen.processor;

import java.util.LinkedHashSet;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * The placeholder mini-language used by letter templates.
 *
 * <ul>
 *   <li>{@code {{ name }}}, {@code {{ name | int }}}, {@code {{ name | int - 1 }}} scalar variables</li>
 *   <li>{@code {{lista_alto_directores: description}}} multi-line list placeholder</li>
 *   <li>{@code {% if name == 'sí' %} ... {% endif %}} conditionals, inline or as whole paragraphs,
 *       optionally wrapped as {@code [{% ... %}].mark} by the authoring tool</li>
 * </ul>
 *
 * Stateless; every member is a pure function of its arguments.
 */
public final class PlaceholderGrammar {
    private PlaceholderGrammar() {}

    public static final String LIST_PLACEHOLDER = "lista_alto_directores";

    private static final int NAME_FLAGS = Pattern.UNICODE_CHARACTER_CLASS;

    static final Pattern VARIABLE_TOKEN = Pattern.compile("\\{\\{([^}]+)\\}\\}");
    static final Pattern CONDITIONAL_REFERENCE = Pattern.compile("\\{%\\s*if\\s+(\\w+)\\s*==", NAME_FLAGS);
    static final Pattern INLINE_OPEN = Pattern.compile("\\{% if (\\w+) == 'sí' %\\}", NAME_FLAGS);

    private static final Pattern BLOCK_OPEN = Pattern.compile("^\\{% if (\\w+)\\s*==\\s*'sí' %\\}", NAME_FLAGS);
    private static final Pattern BLOCK_CLOSE = Pattern.compile("^\\{% endif %\\}");

    static final Pattern LIST_TOKEN =
            Pattern.compile("\\{\\{" + LIST_PLACEHOLDER + ":.*?\\}\\}", Pattern.DOTALL);

    static final Pattern LEFTOVER_TAG = Pattern.compile("\\{%[^%]*%\\}");
    static final Pattern LEFTOVER_VARIABLE = Pattern.compile("\\[?\\{\\{[^}]*\\}\\}\\]?");
    static final Pattern EMPTY_MARK = Pattern.compile("\\[\\]\\.mark");
    static final Pattern BRACKETED_MARK = Pattern.compile("\\[\\.mark\\]");
    static final Pattern BARE_MARK = Pattern.compile("\\.mark\\b");

    private static final Pattern EDGE_WHITESPACE = Pattern.compile("^\\s+|\\s+$", NAME_FLAGS);

    static final Pattern MAIN_POINT = Pattern.compile("^(\\d+)\\.\\s+(.+)", Pattern.DOTALL | NAME_FLAGS);
    static final Pattern SUB_POINT = Pattern.compile("^([a-z])\\.\\s+(.+)", Pattern.DOTALL | NAME_FLAGS);

    /**
     * Name recorded for the inside of a {@code {{...}}} token, or null when the token
     * is not a variable reference (a mis-captured block tag starting with '%').
     */
    public static String variableName(String tokenBody) {
        String name = tokenBody.trim();
        if (name.contains(LIST_PLACEHOLDER) && name.contains(":")) {
            return LIST_PLACEHOLDER;
        }
        if (name.contains("|")) {
            name = name.substring(0, name.indexOf('|')).trim();
        }
        return name.startsWith("%") ? null : name;
    }

    /**
     * Name of the conditional a block-level opening paragraph refers to, or null if
     * {@code paragraphText} does not start with {@code {% if NAME == 'sí' %}}.
     */
    public static String openBlockName(String paragraphText) {
        Matcher m = BLOCK_OPEN.matcher(paragraphText);
        return m.find() ? m.group(1) : null;
    }

    /**
     * Trims leading and trailing whitespace, no-break spaces included.
     */
    public static String trim(String text) {
        return EDGE_WHITESPACE.matcher(text).replaceAll("");
    }

    public static boolean isCloseBlock(String paragraphText) {
        return BLOCK_CLOSE.matcher(paragraphText).find();
    }

    /**
     * Conditional names opened inline anywhere in {@code text}.
     */
    public static Set<String> inlineConditionalNames(String text) {
        Set<String> names = new LinkedHashSet<>();
        Matcher m = INLINE_OPEN.matcher(text);
        while (m.find()) {
            names.add(m.group(1));
        }
        return names;
    }

    static Pattern markedConditional(String name) {
        return Pattern.compile("\\[\\{% if " + Pattern.quote(name) + " == 'sí' %\\}\\]\\.mark(.*?)\\[\\{% endif %\\}\\]\\.mark",
                Pattern.DOTALL);
    }

    static Pattern bareConditional(String name) {
        return Pattern.compile("\\{% if " + Pattern.quote(name) + " == 'sí' %\\}(.*?)\\{% endif %\\}", Pattern.DOTALL);
    }

    static Pattern plainVariable(String name) {
        return Pattern.compile("\\{\\{\\s*" + Pattern.quote(name) + "\\s*\\}\\}");
    }

    static Pattern intVariable(String name) {
        return Pattern.compile("\\{\\{\\s*" + Pattern.quote(name) + "\\s*\\|\\s*int\\s*\\}\\}");
    }

    static Pattern decrementedVariable(String name) {
        return Pattern.compile("\\{\\{\\s*" + Pattern.quote(name) + "\\s*\\|\\s*int\\s*-\\s*1\\s*\\}\\}");
    }
}
