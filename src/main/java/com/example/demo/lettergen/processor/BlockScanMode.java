package com.example.demo.lettergen.processor;

/**
 * How the conditional block eliminator tracks open {@code {% if %}} paragraphs.
 */
public enum BlockScanMode {
    /** One frame per open marker; nested blocks resolve independently. */
    NESTED,
    /**
     * Single removing/not-removing flag. Any {@code {% endif %}} closes whatever is open,
     * so a nested block ends its parent early.
     */
    FLAT
}
