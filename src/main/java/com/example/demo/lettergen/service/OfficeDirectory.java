package com.example.demo.lettergen.service;

import com.example.demo.lettergen.config.LetterTemplateProperties;
import com.example.demo.lettergen.exception.ResourceLoadingException;
import com.example.demo.lettergen.model.Office;
import com.example.demo.lettergen.util.PlaceholderNames;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.ClassPathResource;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Address book of the firm's offices, read once from a YAML resource.
 *
 * offices:
 *   - name: ALICANTE
 *     address: Pintor Cabrera 22, esc. B, planta 4 A
 *     postalCode: "03003"
 *     city: Alicante
 */
@Slf4j
@Component
public class OfficeDirectory {
    public static final String CUSTOM_OFFICE = "PERSONALIZADA";

    private final ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());
    private final Map<String, Office> offices;

    public OfficeDirectory(LetterTemplateProperties properties) {
        this.offices = load(properties.getOfficesResource());
    }

    /**
     * Office by exact name, then ignoring case and accents. Unknown or null names
     * fall back to the blank {@value #CUSTOM_OFFICE} entry.
     */
    public Office find(String name) {
        if (name != null) {
            Office exact = offices.get(name.trim());
            if (exact != null) {
                return exact;
            }
            String folded = PlaceholderNames.fold(name);
            for (Office office : offices.values()) {
                if (PlaceholderNames.fold(office.getName()).equals(folded)) {
                    return office;
                }
            }
            log.debug("Unknown office '{}', using {}", name, CUSTOM_OFFICE);
        }
        Office custom = offices.get(CUSTOM_OFFICE);
        return custom != null ? custom : new Office(CUSTOM_OFFICE, "", "", "");
    }

    private Map<String, Office> load(String resourcePath) {
        ClassPathResource resource = new ClassPathResource(resourcePath);
        try (InputStream is = resource.getInputStream()) {
            Map<String, List<Office>> root = yamlMapper.readValue(is, new TypeReference<Map<String, List<Office>>>() {});
            Map<String, Office> byName = new LinkedHashMap<>();
            List<Office> entries = root == null ? null : root.get("offices");
            if (entries != null) {
                for (Office office : entries) {
                    byName.put(office.getName(), office);
                }
            }
            log.info("Loaded {} offices from {}", byName.size(), resourcePath);
            return byName;
        } catch (IOException e) {
            log.error("Failed to load office directory: {}", resourcePath, e);
            throw new ResourceLoadingException(
                "OFFICES_LOAD_ERROR",
                "Failed to load office directory from classpath: " + resourcePath,
                e
            );
        }
    }
}
