package com.example.demo.lettergen.processor;

import com.example.demo.lettergen.core.RenderContext;
import com.example.demo.lettergen.model.LetterBindings;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.MatchResult;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Rewrites the text of one paragraph against the bindings of a {@link RenderContext}.
 *
 * Steps, always in this order:
 * <ol>
 *   <li>inline conditionals (marked and bare forms), then any orphaned {@code {% ... %}} tag</li>
 *   <li>the multi-line {@code lista_alto_directores} placeholder</li>
 *   <li>scalar variables, including the {@code | int} and {@code | int - 1} filters</li>
 *   <li>leftover {@code {{...}}} tokens and {@code .mark} artifacts</li>
 * </ol>
 * Text without placeholder syntax comes back unchanged.
 */
@Slf4j
@Component
public class InlineSubstitutionEngine {

    public String rewrite(String text, RenderContext context) {
        if (text == null || text.isEmpty()) {
            return text;
        }
        String result = resolveInlineConditionals(text, context.getBindings());
        result = replaceListPlaceholders(result, context.getBindings());
        result = replaceScalars(result, context);
        return cleanup(result);
    }

    String resolveInlineConditionals(String text, LetterBindings bindings) {
        Set<String> names = new LinkedHashSet<>(bindings.getConditionals().keySet());
        names.addAll(PlaceholderGrammar.inlineConditionalNames(text));

        String result = text;
        for (String name : names) {
            // group 1 is the guarded content
            String replacement = bindings.conditional(name).isYes() ? "$1" : "";
            result = PlaceholderGrammar.markedConditional(name).matcher(result).replaceAll(replacement);
            result = PlaceholderGrammar.bareConditional(name).matcher(result).replaceAll(replacement);
        }
        return PlaceholderGrammar.LEFTOVER_TAG.matcher(result).replaceAll("");
    }

    /**
     * Matches are spliced last to first so the offsets of earlier matches stay valid.
     */
    String replaceListPlaceholders(String text, LetterBindings bindings) {
        List<MatchResult> matches = new ArrayList<>();
        Matcher m = PlaceholderGrammar.LIST_TOKEN.matcher(text);
        while (m.find()) {
            matches.add(m.toMatchResult());
        }
        if (matches.isEmpty()) {
            return text;
        }
        String value = bindings.variable(PlaceholderGrammar.LIST_PLACEHOLDER);
        String replacement = value == null ? "" : value;

        StringBuilder sb = new StringBuilder(text);
        for (int i = matches.size() - 1; i >= 0; i--) {
            MatchResult match = matches.get(i);
            sb.replace(match.start(), match.end(), replacement);
        }
        return sb.toString();
    }

    String replaceScalars(String text, RenderContext context) {
        String result = text;
        for (Map.Entry<String, String> entry : context.getBindings().getVariables().entrySet()) {
            String name = entry.getKey();
            if (PlaceholderGrammar.LIST_PLACEHOLDER.equals(name) || name == null) {
                continue;
            }
            String value = entry.getValue() == null ? "" : entry.getValue();

            result = replaceAll(PlaceholderGrammar.plainVariable(name), result, value);
            result = replaceAll(PlaceholderGrammar.intVariable(name), result, asInteger(value));

            Matcher decrement = PlaceholderGrammar.decrementedVariable(name).matcher(result);
            if (decrement.find()) {
                result = decrement.replaceAll(Matcher.quoteReplacement(decremented(name, value, context)));
            }
        }
        return result;
    }

    String cleanup(String text) {
        String result = PlaceholderGrammar.LEFTOVER_VARIABLE.matcher(text).replaceAll("");
        result = PlaceholderGrammar.EMPTY_MARK.matcher(result).replaceAll("");
        result = PlaceholderGrammar.BRACKETED_MARK.matcher(result).replaceAll("");
        return PlaceholderGrammar.BARE_MARK.matcher(result).replaceAll("");
    }

    private static String replaceAll(Pattern pattern, String text, String value) {
        return pattern.matcher(text).replaceAll(Matcher.quoteReplacement(value));
    }

    private static String asInteger(String value) {
        BigInteger number = parseInteger(value);
        return number == null ? value : number.toString();
    }

    private static String decremented(String name, String value, RenderContext context) {
        BigInteger number = parseInteger(value);
        if (number != null) {
            return number.subtract(BigInteger.ONE).toString();
        }
        if (!value.isEmpty()) {
            String warning = "Value '" + value + "' of '" + name + "' is not an integer; '| int - 1' left it unchanged";
            log.debug(warning);
            context.addWarning(warning);
        }
        return value;
    }

    private static BigInteger parseInteger(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return new BigInteger(value.trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
