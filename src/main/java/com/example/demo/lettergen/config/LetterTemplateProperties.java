package com.example.demo.lettergen.config;

import com.example.demo.lettergen.processor.BlockScanMode;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Letter generation settings bound from application.yml.
 *
 * Example:
 *
 * lettergen:
 *   template-path: templates/carta-manifestacion.docx
 *   filename-prefix: Carta_Manifestacion
 *   block-scan-mode: nested
 *   required-fields: [Nombre_Cliente, Direccion_Oficina, CP, Ciudad_Oficina]
 *   conditional-variables:
 *     experto: [nombre_experto, experto_valoracion]
 *   name-aliases:
 *     comision: comision
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Component
@ConfigurationProperties(prefix = "lettergen")
public class LetterTemplateProperties {

    /**
     * Classpath location (or file system path) of the .docx template
     */
    private String templatePath = "templates/carta-manifestacion.docx";

    /**
     * Prefix of generated file names: {prefix}_{client}_{yyyyMMdd}.docx
     */
    private String filenamePrefix = "Carta_Manifestacion";

    /**
     * Conditional block tracking strategy
     */
    private BlockScanMode blockScanMode = BlockScanMode.NESTED;

    /**
     * Variables that must be non-blank before a letter is generated
     */
    private List<String> requiredFields = new ArrayList<>();

    /**
     * Variables holding dates that are re-rendered as "dd de MMMM de yyyy"
     */
    private List<String> dateFields = new ArrayList<>();

    /**
     * Variables only needed when the keyed conditional is active
     */
    private Map<String, List<String>> conditionalVariables = new LinkedHashMap<>();

    /**
     * Accent-free, lower-case spellings mapped to their canonical placeholder name
     */
    private Map<String, String> nameAliases = new LinkedHashMap<>();

    /**
     * Classpath location of the office address book
     */
    private String officesResource = "offices.yaml";
}
