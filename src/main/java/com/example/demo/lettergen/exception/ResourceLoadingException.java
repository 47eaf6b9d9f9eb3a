package com.example.demo.lettergen.exception;

/**
 * Raised when a supporting resource (office address book, ...) cannot be loaded.
 */
public class ResourceLoadingException extends RuntimeException {
    private final String code;

    public ResourceLoadingException(String code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public String getCode() {
        return code;
    }
}
