package com.example.demo.lettergen.service;

import com.example.demo.lettergen.aspect.LogExecutionTime;
import com.example.demo.lettergen.core.RenderContext;
import com.example.demo.lettergen.exception.DocumentGenerationException;
import com.example.demo.lettergen.exception.TemplateLoadingException;
import com.example.demo.lettergen.model.FormatSnapshot;
import com.example.demo.lettergen.model.LetterBindings;
import com.example.demo.lettergen.processor.ConditionalBlockEliminator;
import com.example.demo.lettergen.processor.InlineSubstitutionEngine;
import com.example.demo.lettergen.processor.ListNumberingNormalizer;
import com.example.demo.lettergen.processor.ParagraphFormatAdapter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.poi.xwpf.usermodel.UnderlinePatterns;
import org.apache.poi.xwpf.usermodel.XWPFDocument;
import org.apache.poi.xwpf.usermodel.XWPFParagraph;
import org.apache.poi.xwpf.usermodel.XWPFRun;
import org.apache.poi.xwpf.usermodel.XWPFTable;
import org.apache.poi.xwpf.usermodel.XWPFTableCell;
import org.apache.poi.xwpf.usermodel.XWPFTableRow;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Fills a letter template: the orchestrator of the substitution pipeline.
 *
 * Steps, strictly in order, on a private copy of the template:
 * <ol>
 *   <li>remove or unwrap paragraph-level conditional blocks</li>
 *   <li>rewrite every non-blank body paragraph, preserving its formatting</li>
 *   <li>rewrite every table cell paragraph (text only, formatting is not restored)</li>
 *   <li>renumber main and sub list markers in the body</li>
 *   <li>strip underline from every run in the body and in table cells</li>
 * </ol>
 *
 * Nothing is shared between calls, so generations may run concurrently.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class LetterDocumentGenerator {
    private final TemplateLoader templateLoader;
    private final ConditionalBlockEliminator blockEliminator;
    private final InlineSubstitutionEngine substitutionEngine;
    private final ParagraphFormatAdapter formatAdapter;
    private final ListNumberingNormalizer numberingNormalizer;
    private final DocumentOutputService outputService;

    public XWPFDocument generate(String templatePath, LetterBindings bindings) {
        return generate(templatePath, new RenderContext(bindings));
    }

    /**
     * Generate a filled document. The caller owns and must close the result.
     *
     * @throws DocumentGenerationException on any failure; no partial document escapes
     */
    public XWPFDocument generate(String templatePath, RenderContext context) {
        log.info("Generating letter from template: {}", templatePath);
        XWPFDocument doc = null;
        try {
            doc = templateLoader.openTemplate(templatePath);
            fill(doc, context);
            log.info("Letter generation complete ({} warnings)", context.getWarnings().size());
            return doc;
        } catch (DocumentGenerationException e) {
            closeQuietly(doc);
            throw e;
        } catch (TemplateLoadingException tle) {
            log.error("Template resolution error", tle);
            closeQuietly(doc);
            throw new DocumentGenerationException(tle.getCode(), tle.getDescription(), tle);
        } catch (RuntimeException e) {
            log.error("Letter generation failed", e);
            closeQuietly(doc);
            throw new DocumentGenerationException(
                DocumentGenerationException.GENERATION_FAILED,
                "Failed to generate letter from " + templatePath + ": " + e.getMessage(),
                e
            );
        }
    }

    /**
     * Generate and serialize to .docx bytes.
     *
     * @throws DocumentGenerationException on any failure, serialization included
     */
    @LogExecutionTime("Letter Generation")
    public byte[] generateBytes(String templatePath, RenderContext context) {
        XWPFDocument doc = generate(templatePath, context);
        try {
            byte[] bytes = outputService.toBytes(doc);
            log.info("Letter serialized. Size: {} bytes", bytes.length);
            return bytes;
        } catch (DocumentGenerationException e) {
            throw e;
        } catch (RuntimeException e) {
            log.error("Letter serialization failed", e);
            throw new DocumentGenerationException(
                DocumentGenerationException.SERIALIZATION_FAILED,
                "Failed to serialize letter generated from " + templatePath + ": " + e.getMessage(),
                e
            );
        } finally {
            closeQuietly(doc);
        }
    }

    void fill(XWPFDocument doc, RenderContext context) {
        blockEliminator.stripBlocks(doc, context);

        for (XWPFParagraph paragraph : doc.getParagraphs()) {
            rewriteBodyParagraph(paragraph, context);
        }
        for (XWPFParagraph paragraph : cellParagraphs(doc)) {
            rewriteCellParagraph(paragraph, context);
        }

        numberingNormalizer.normalize(doc.getParagraphs());
        removeUnderlines(doc);
    }

    private void rewriteBodyParagraph(XWPFParagraph paragraph, RenderContext context) {
        String original = paragraph.getText();
        if (original.isBlank()) {
            return;
        }
        String rewritten = substitutionEngine.rewrite(original, context);
        if (!rewritten.equals(original)) {
            FormatSnapshot snapshot = formatAdapter.save(paragraph);
            formatAdapter.replaceText(paragraph, rewritten);
            formatAdapter.restore(paragraph, snapshot);
        }
    }

    private void rewriteCellParagraph(XWPFParagraph paragraph, RenderContext context) {
        String original = paragraph.getText();
        if (original.isBlank()) {
            return;
        }
        String rewritten = substitutionEngine.rewrite(original, context);
        if (!rewritten.equals(original)) {
            formatAdapter.replaceText(paragraph, rewritten);
        }
    }

    private void removeUnderlines(XWPFDocument doc) {
        List<XWPFParagraph> paragraphs = new ArrayList<>(doc.getParagraphs());
        paragraphs.addAll(cellParagraphs(doc));
        for (XWPFParagraph paragraph : paragraphs) {
            for (XWPFRun run : paragraph.getRuns()) {
                run.setUnderline(UnderlinePatterns.NONE);
            }
        }
    }

    private List<XWPFParagraph> cellParagraphs(XWPFDocument doc) {
        List<XWPFParagraph> paragraphs = new ArrayList<>();
        for (XWPFTable table : doc.getTables()) {
            for (XWPFTableRow row : table.getRows()) {
                for (XWPFTableCell cell : row.getTableCells()) {
                    paragraphs.addAll(cell.getParagraphs());
                }
            }
        }
        return paragraphs;
    }

    private void closeQuietly(XWPFDocument doc) {
        if (doc == null) {
            return;
        }
        try {
            doc.close();
        } catch (IOException e) {
            log.warn("Error closing letter document", e);
        }
    }
}
