package com.example.demo.lettergen;

import org.apache.poi.xwpf.usermodel.XWPFDocument;
import org.apache.poi.xwpf.usermodel.XWPFParagraph;
import org.apache.poi.xwpf.usermodel.XWPFRun;
import org.apache.poi.xwpf.usermodel.XWPFTable;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Builds small in-memory .docx documents for tests.
 */
public final class DocxTestSupport {
    private DocxTestSupport() {}

    /**
     * One body paragraph per line, each with a single run.
     */
    public static XWPFDocument document(String... paragraphs) {
        XWPFDocument doc = new XWPFDocument();
        for (String text : paragraphs) {
            paragraph(doc, text);
        }
        return doc;
    }

    public static XWPFParagraph paragraph(XWPFDocument doc, String text) {
        XWPFParagraph paragraph = doc.createParagraph();
        XWPFRun run = paragraph.createRun();
        run.setText(text);
        return paragraph;
    }

    /**
     * A one-row table with one cell per value.
     */
    public static XWPFTable table(XWPFDocument doc, String... cells) {
        XWPFTable table = doc.createTable(1, cells.length);
        for (int i = 0; i < cells.length; i++) {
            table.getRow(0).getCell(i).setText(cells[i]);
        }
        return table;
    }

    public static List<String> paragraphTexts(XWPFDocument doc) {
        List<String> texts = new ArrayList<>();
        for (XWPFParagraph paragraph : doc.getParagraphs()) {
            texts.add(paragraph.getText());
        }
        return texts;
    }

    public static String bodyText(XWPFDocument doc) {
        return String.join("\n", paragraphTexts(doc));
    }

    public static byte[] toBytes(XWPFDocument doc) {
        try (ByteArrayOutputStream out = new ByteArrayOutputStream()) {
            doc.write(out);
            return out.toByteArray();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    public static XWPFDocument open(byte[] bytes) {
        try {
            return new XWPFDocument(new ByteArrayInputStream(bytes));
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    /**
     * Serializes and parses again, like a template read from disk.
     */
    public static XWPFDocument reopen(XWPFDocument doc) {
        return open(toBytes(doc));
    }
}
