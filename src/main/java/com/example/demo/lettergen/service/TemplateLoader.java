package com.example.demo.lettergen.service;

import com.example.demo.lettergen.aspect.LogExecutionTime;
import com.example.demo.lettergen.exception.TemplateLoadingException;
import lombok.extern.slf4j.Slf4j;
import org.apache.poi.xwpf.usermodel.XWPFDocument;
import org.springframework.core.io.ClassPathResource;
import org.springframework.stereotype.Component;

import java.io.ByteArrayInputStream;
import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Loads .docx letter templates from the classpath or, failing that, the file system.
 *
 * Every call to {@link #openTemplate(String)} parses a brand new {@link XWPFDocument}, so
 * callers own the returned document exclusively and must close it.
 */
@Slf4j
@Component
public class TemplateLoader {

    /**
     * Read the raw template bytes.
     *
     * @param path classpath location (e.g. "templates/carta.docx") or file system path
     */
    @LogExecutionTime("Fetching Letter Template")
    public byte[] getTemplateBytes(String path) {
        if (path == null || path.isBlank()) {
            throw new TemplateLoadingException(
                "INVALID_PATH",
                "Template path cannot be null or empty"
            );
        }

        try (InputStream is = getInputStream(path)) {
            return is.readAllBytes();
        } catch (IOException e) {
            log.error("Failed to read template bytes from stream: {}", path, e);
            throw new TemplateLoadingException(
                "TEMPLATE_READ_ERROR",
                "Failed to read template: " + path,
                e
            );
        }
    }

    /**
     * Load and parse a private copy of the template.
     */
    @LogExecutionTime("Opening Letter Template")
    public XWPFDocument openTemplate(String path) {
        byte[] bytes = getTemplateBytes(path);
        try {
            return new XWPFDocument(new ByteArrayInputStream(bytes));
        } catch (IOException | RuntimeException e) {
            log.error("Failed to parse template as .docx: {}", path, e);
            throw new TemplateLoadingException(
                "TEMPLATE_PARSE_ERROR",
                "Template is not a readable .docx document: " + path,
                e
            );
        }
    }

    private InputStream getInputStream(String path) throws IOException {
        ClassPathResource resource = new ClassPathResource(path);
        if (resource.exists()) {
            log.info("Loaded template from classpath resource: {}", path);
            return resource.getInputStream();
        }

        try {
            Path file = Paths.get(path);
            if (Files.isRegularFile(file)) {
                log.info("Loaded template from file system: {}", file.toAbsolutePath());
                return Files.newInputStream(file);
            }
        } catch (InvalidPathException e) {
            log.debug("Template path is not a valid file system path: {}", path);
        }

        throw new TemplateLoadingException(
            "TEMPLATE_NOT_FOUND",
            buildDetailedErrorMessage(path)
        );
    }

    /**
     * Build a detailed error message indicating all locations that were checked
     */
    private String buildDetailedErrorMessage(String path) {
        StringBuilder message = new StringBuilder();
        message.append("Letter template not found: ").append(path).append("\n\n");
        message.append("Checked the following locations:\n");
        message.append("  • Classpath/Resources: src/main/resources/").append(path).append("\n");
        message.append("  • File system: ").append(new File(path).getAbsolutePath()).append("\n\n");
        message.append("Set lettergen.template-path to a classpath resource or an existing .docx file.");
        return message.toString();
    }
}
