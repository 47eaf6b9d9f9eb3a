package com.example.demo.lettergen.exception;

/**
 * The single failure signal of a letter generation. Whatever went wrong inside the
 * pipeline, callers only ever see this exception and never a partially filled document.
 */
public class DocumentGenerationException extends RuntimeException {
    public static final String GENERATION_FAILED = "GENERATION_FAILED";
    public static final String MISSING_REQUIRED_FIELDS = "MISSING_REQUIRED_FIELDS";
    public static final String SERIALIZATION_FAILED = "SERIALIZATION_FAILED";

    private final String code;
    private final String description;

    public DocumentGenerationException(String code, String description) {
        super(code + ": " + description);
        this.code = code;
        this.description = description;
    }

    public DocumentGenerationException(String code, String description, Throwable cause) {
        super(code + ": " + description, cause);
        this.code = code;
        this.description = description;
    }

    public String getCode() {
        return code;
    }

    public String getDescription() {
        return description;
    }
}
