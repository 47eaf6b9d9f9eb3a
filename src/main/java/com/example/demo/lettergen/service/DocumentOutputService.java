package com.example.demo.lettergen.service;

import com.example.demo.lettergen.exception.DocumentGenerationException;
import org.apache.poi.xwpf.usermodel.XWPFDocument;
import org.springframework.stereotype.Component;

import java.io.ByteArrayOutputStream;
import java.io.IOException;

/**
 * Helper service to serialize generated letters to .docx bytes.
 */
@Component
public class DocumentOutputService {

    public byte[] toBytes(XWPFDocument document) {
        try (ByteArrayOutputStream baos = new ByteArrayOutputStream()) {
            document.write(baos);
            return baos.toByteArray();
        } catch (IOException e) {
            throw new DocumentGenerationException(
                DocumentGenerationException.SERIALIZATION_FAILED,
                "Failed to serialize letter document",
                e
            );
        }
    }
}
