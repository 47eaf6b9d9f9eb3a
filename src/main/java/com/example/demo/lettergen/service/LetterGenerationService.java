package com.example.demo.lettergen.service;

import com.example.demo.lettergen.aspect.LogExecutionTime;
import com.example.demo.lettergen.config.LetterTemplateProperties;
import com.example.demo.lettergen.core.RenderContext;
import com.example.demo.lettergen.exception.DocumentGenerationException;
import com.example.demo.lettergen.exception.TemplateLoadingException;
import com.example.demo.lettergen.model.ConditionalState;
import com.example.demo.lettergen.model.GeneratedLetter;
import com.example.demo.lettergen.model.LetterBindings;
import com.example.demo.lettergen.model.LetterGenerationRequest;
import com.example.demo.lettergen.model.PlaceholderInventory;
import com.example.demo.lettergen.processor.PlaceholderExtractor;
import com.example.demo.lettergen.util.PlaceholderNames;
import com.example.demo.lettergen.util.SpanishDates;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.poi.xwpf.usermodel.XWPFDocument;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.time.Clock;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Entry point for producing a manifestation letter from form or import values.
 *
 * Applies office defaults, reformats dates, checks required fields and then hands the
 * normalized bindings to {@link LetterDocumentGenerator}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class LetterGenerationService {
    private static final DateTimeFormatter FILENAME_DATE = DateTimeFormatter.ofPattern("yyyyMMdd");
    private static final String CLIENT_NAME = "Nombre_Cliente";

    private final LetterTemplateProperties properties;
    private final TemplateLoader templateLoader;
    private final PlaceholderExtractor extractor;
    private final LetterDocumentGenerator generator;
    private final OfficeDirectory officeDirectory;
    private final PlaceholderNames placeholderNames;
    private final Clock clock;

    /**
     * Variables and conditionals referenced by the configured template.
     */
    public PlaceholderInventory extractPlaceholders() {
        String path = properties.getTemplatePath();
        try (XWPFDocument doc = templateLoader.openTemplate(path)) {
            return extractor.extract(doc);
        } catch (IOException e) {
            throw new TemplateLoadingException(
                "TEMPLATE_READ_ERROR",
                "Failed to close template after extraction: " + path,
                e
            );
        }
    }

    /**
     * {@code allVariables} minus the ones that only matter to conditionals answered "no".
     */
    public List<String> requiredVariables(Collection<String> allVariables, Map<String, String> conditionals) {
        Map<String, ConditionalState> states = new LinkedHashMap<>();
        if (conditionals != null) {
            conditionals.forEach((k, v) -> states.put(placeholderNames.normalize(k), ConditionalState.parse(v)));
        }
        Set<String> required = new LinkedHashSet<>(allVariables);
        properties.getConditionalVariables().forEach((conditional, gated) -> {
            if (!states.getOrDefault(conditional, ConditionalState.NO).isYes()) {
                required.removeAll(gated);
            }
        });
        return new ArrayList<>(required);
    }

    @LogExecutionTime("Letter Request")
    public GeneratedLetter generate(LetterGenerationRequest request) {
        Map<String, String> variables = new LinkedHashMap<>();
        request.getVariables().forEach((k, v) -> variables.put(placeholderNames.normalize(k), v));
        Map<String, String> conditionals = new LinkedHashMap<>();
        request.getConditionals().forEach((k, v) -> conditionals.put(placeholderNames.normalize(k), v));

        applyOfficeDefaults(request.getOfficeName(), variables);
        formatDates(variables);
        validateRequired(variables);

        String templatePath = properties.getTemplatePath();
        try {
            for (String name : extractPlaceholders().getVariables()) {
                variables.putIfAbsent(name, "");
            }
            // conditionals are also readable as plain variables, e.g. {{comision}}
            conditionals.forEach((name, value) -> variables.put(name, ConditionalState.parse(value).getText()));

            RenderContext context = new RenderContext(
                    LetterBindings.normalized(variables, conditionals, placeholderNames));
            byte[] content = generator.generateBytes(templatePath, context);

            String filename = filename(variables.get(CLIENT_NAME));
            log.info("Generated letter {} ({} bytes)", filename, content.length);
            return GeneratedLetter.builder()
                    .filename(filename)
                    .content(content)
                    .warnings(context.getWarnings())
                    .build();
        } catch (TemplateLoadingException tle) {
            throw new DocumentGenerationException(tle.getCode(), tle.getDescription(), tle);
        }
    }

    private void applyOfficeDefaults(String officeName, Map<String, String> variables) {
        if (officeName == null || officeName.isBlank()) {
            return;
        }
        officeDirectory.find(officeName).toVariables().forEach((name, value) -> {
            String current = variables.get(name);
            if (current == null || current.isBlank()) {
                variables.put(name, value);
            }
        });
    }

    /**
     * Blank date fields default to today; typed values are reformatted when they parse
     * and kept as typed otherwise.
     */
    private void formatDates(Map<String, String> variables) {
        for (String field : properties.getDateFields()) {
            String value = variables.get(field);
            LocalDate date = value == null || value.isBlank()
                    ? SpanishDates.parse(value, clock)
                    : SpanishDates.tryParse(value);
            if (date != null) {
                variables.put(field, SpanishDates.format(date));
            }
        }
    }

    private void validateRequired(Map<String, String> variables) {
        List<String> missing = new ArrayList<>();
        for (String field : properties.getRequiredFields()) {
            String value = variables.get(field);
            if (value == null || value.isBlank()) {
                missing.add(field);
            }
        }
        if (!missing.isEmpty()) {
            log.warn("Letter request rejected, missing fields: {}", missing);
            throw new DocumentGenerationException(
                DocumentGenerationException.MISSING_REQUIRED_FIELDS,
                "Missing required fields: " + String.join(", ", missing)
            );
        }
    }

    private String filename(String clientName) {
        String client = clientName == null ? "" : clientName.trim().replace(' ', '_');
        return properties.getFilenamePrefix() + "_" + client + "_" + LocalDate.now(clock).format(FILENAME_DATE) + ".docx";
    }
}
