package com.example.demo.lettergen.service;

import com.example.demo.lettergen.DocxTestSupport;
import com.example.demo.lettergen.exception.TemplateLoadingException;
import org.apache.poi.xwpf.usermodel.XWPFDocument;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for TemplateLoader
 * Tests classpath and file system resolution and the error codes
 */
public class TemplateLoaderTest {

    private static final String CLASSPATH_TEMPLATE = "templates/carta-manifestacion.docx";

    private final TemplateLoader templateLoader = new TemplateLoader();

    @TempDir
    Path tempDir;

    @Test
    public void testLoadFromClasspath() throws IOException {
        try (XWPFDocument doc = templateLoader.openTemplate(CLASSPATH_TEMPLATE)) {
            assertFalse(doc.getParagraphs().isEmpty());
            assertTrue(DocxTestSupport.bodyText(doc).contains("{{Nombre_Cliente}}"));
        }
    }

    @Test
    public void testEachOpenReturnsFreshDocument() throws IOException {
        try (XWPFDocument first = templateLoader.openTemplate(CLASSPATH_TEMPLATE);
             XWPFDocument second = templateLoader.openTemplate(CLASSPATH_TEMPLATE)) {
            assertNotSame(first, second);
            first.removeBodyElement(0);
            assertEquals(first.getBodyElements().size() + 1, second.getBodyElements().size());
        }
    }

    @Test
    public void testLoadFromFileSystem() throws IOException {
        Path file = tempDir.resolve("letter.docx");
        Files.write(file, DocxTestSupport.toBytes(DocxTestSupport.document("Hola {{Nombre_Cliente}}")));

        try (XWPFDocument doc = templateLoader.openTemplate(file.toString())) {
            assertEquals("Hola {{Nombre_Cliente}}", doc.getParagraphs().get(0).getText());
        }
    }

    @Test
    public void testBlankPath() {
        TemplateLoadingException ex = assertThrows(TemplateLoadingException.class,
                () -> templateLoader.getTemplateBytes("  "));
        assertEquals("INVALID_PATH", ex.getCode());

        ex = assertThrows(TemplateLoadingException.class, () -> templateLoader.getTemplateBytes(null));
        assertEquals("INVALID_PATH", ex.getCode());
    }

    @Test
    public void testMissingTemplate() {
        TemplateLoadingException ex = assertThrows(TemplateLoadingException.class,
                () -> templateLoader.openTemplate("templates/does-not-exist.docx"));

        assertEquals("TEMPLATE_NOT_FOUND", ex.getCode());
        assertTrue(ex.getDescription().contains("templates/does-not-exist.docx"));
    }

    @Test
    public void testNotADocx() throws IOException {
        Path file = tempDir.resolve("broken.docx");
        Files.write(file, "not a zip archive".getBytes(StandardCharsets.UTF_8));

        TemplateLoadingException ex = assertThrows(TemplateLoadingException.class,
                () -> templateLoader.openTemplate(file.toString()));

        assertEquals("TEMPLATE_PARSE_ERROR", ex.getCode());
    }
}
