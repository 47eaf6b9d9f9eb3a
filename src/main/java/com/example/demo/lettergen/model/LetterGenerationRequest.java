package com.example.demo.lettergen.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.HashMap;
import java.util.Map;

/**
 * Input of one letter generation: raw values as collected by a form or an import.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LetterGenerationRequest {
    /**
     * Office whose address fills Direccion_Oficina, CP and Ciudad_Oficina when they are blank.
     * Optional.
     */
    private String officeName;

    /**
     * Variable name to value. Names are normalized before use.
     */
    @Builder.Default
    private Map<String, String> variables = new HashMap<>();

    /**
     * Conditional name to answer ("sí"/"no", "SI", "1", ...).
     */
    @Builder.Default
    private Map<String, String> conditionals = new HashMap<>();
}
