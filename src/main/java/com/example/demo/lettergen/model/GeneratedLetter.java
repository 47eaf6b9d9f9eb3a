package com.example.demo.lettergen.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Serialized .docx produced by a successful generation.
 */
@Value
@Builder
public class GeneratedLetter {
    String filename;
    byte[] content;
    /**
     * Non-fatal findings such as numeric filter fallbacks or unterminated blocks
     */
    @Singular
    List<String> warnings;
}
