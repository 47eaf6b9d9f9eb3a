package com.example.demo.lettergen.processor;

import com.example.demo.lettergen.DocxTestSupport;
import com.example.demo.lettergen.core.RenderContext;
import com.example.demo.lettergen.model.ConditionalState;
import com.example.demo.lettergen.model.LetterBindings;
import org.apache.poi.xwpf.usermodel.XWPFDocument;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Conditional Block Eliminator Tests")
public class ConditionalBlockEliminatorTest {

    private static final String OPEN_A = "{% if a == 'sí' %}";
    private static final String OPEN_B = "{% if b == 'sí' %}";
    private static final String CLOSE = "{% endif %}";

    private final ConditionalBlockEliminator nested = new ConditionalBlockEliminator(BlockScanMode.NESTED);
    private final ConditionalBlockEliminator flat = new ConditionalBlockEliminator(BlockScanMode.FLAT);

    private static RenderContext context(String... yesNames) {
        Map<String, ConditionalState> conditionals = new HashMap<>();
        for (String name : yesNames) {
            conditionals.put(name, ConditionalState.YES);
        }
        return new RenderContext(LetterBindings.of(Collections.emptyMap(), conditionals));
    }

    @Test
    @DisplayName("Block bound to yes keeps its content and drops the markers")
    public void testYesBlockUnwrapped() {
        XWPFDocument doc = DocxTestSupport.document("P1", OPEN_A, "P2", "P3", CLOSE, "P4");

        int removed = nested.stripBlocks(doc, context("a"));

        assertEquals(2, removed);
        assertEquals(Arrays.asList("P1", "P2", "P3", "P4"), DocxTestSupport.paragraphTexts(doc));
    }

    @Test
    @DisplayName("Block bound to no is removed with its markers")
    public void testNoBlockRemoved() {
        XWPFDocument doc = DocxTestSupport.document("P1", OPEN_A, "P2", "P3", CLOSE, "P4");

        RenderContext ctx = context();
        nested.stripBlocks(doc, ctx);

        assertEquals(Arrays.asList("P1", "P4"), DocxTestSupport.paragraphTexts(doc));
        assertTrue(ctx.getWarnings().isEmpty());
    }

    @Test
    @DisplayName("Unbound conditional counts as no")
    public void testUnboundConditionalRemoved() {
        XWPFDocument doc = DocxTestSupport.document("P1", OPEN_B, "P2", CLOSE);

        nested.stripBlocks(doc, context("a"));

        assertEquals(Collections.singletonList("P1"), DocxTestSupport.paragraphTexts(doc));
    }

    @Test
    @DisplayName("Nested mode: a removed outer block removes everything up to its own endif")
    public void testNestedOuterNoInnerYes() {
        XWPFDocument doc = DocxTestSupport.document("P1", OPEN_A, "P2", OPEN_B, "P3", CLOSE, "P4", CLOSE, "P5");

        nested.stripBlocks(doc, context("b"));

        assertEquals(Arrays.asList("P1", "P5"), DocxTestSupport.paragraphTexts(doc));
    }

    @Test
    @DisplayName("Flat mode: the first endif ends the removal")
    public void testFlatOuterNoInnerYes() {
        XWPFDocument doc = DocxTestSupport.document("P1", OPEN_A, "P2", OPEN_B, "P3", CLOSE, "P4", CLOSE, "P5");

        flat.stripBlocks(doc, context("b"));

        assertEquals(Arrays.asList("P1", "P4", "P5"), DocxTestSupport.paragraphTexts(doc));
    }

    @Test
    @DisplayName("Both modes agree when the inner block is the removed one")
    public void testOuterYesInnerNo() {
        XWPFDocument nestedDoc = DocxTestSupport.document("P1", OPEN_A, "P2", OPEN_B, "P3", CLOSE, "P4", CLOSE, "P5");
        XWPFDocument flatDoc = DocxTestSupport.document("P1", OPEN_A, "P2", OPEN_B, "P3", CLOSE, "P4", CLOSE, "P5");

        nested.stripBlocks(nestedDoc, context("a"));
        flat.stripBlocks(flatDoc, context("a"));

        assertEquals(Arrays.asList("P1", "P2", "P4", "P5"), DocxTestSupport.paragraphTexts(nestedDoc));
        assertEquals(DocxTestSupport.paragraphTexts(nestedDoc), DocxTestSupport.paragraphTexts(flatDoc));
    }

    @Test
    @DisplayName("Unterminated block removes the rest of the body and reports a warning")
    public void testUnterminatedBlock() {
        XWPFDocument doc = DocxTestSupport.document("P1", OPEN_A, "P2", "P3");

        RenderContext ctx = context();
        nested.stripBlocks(doc, ctx);

        assertEquals(Collections.singletonList("P1"), DocxTestSupport.paragraphTexts(doc));
        assertEquals(1, ctx.getWarnings().size());
        assertTrue(ctx.getWarnings().get(0).contains("'a'"));
    }

    @Test
    @DisplayName("Markers padded with no-break spaces are recognized")
    public void testNoBreakSpacePadding() {
        XWPFDocument doc = DocxTestSupport.document("P1", "\u00a0" + OPEN_A, "P2", CLOSE + "\u00a0", "P3");

        nested.stripBlocks(doc, context());

        assertEquals(Arrays.asList("P1", "P3"), DocxTestSupport.paragraphTexts(doc));
    }

    @Test
    @DisplayName("Stray endif paragraph is dropped without affecting anything else")
    public void testStrayEndif() {
        XWPFDocument doc = DocxTestSupport.document("P1", CLOSE, "P2");

        nested.stripBlocks(doc, context());

        assertEquals(Arrays.asList("P1", "P2"), DocxTestSupport.paragraphTexts(doc));
    }

    @Test
    @DisplayName("Tables inside a removed block are removed too")
    public void testTableInsideRemovedBlock() {
        XWPFDocument doc = new XWPFDocument();
        DocxTestSupport.paragraph(doc, "P1");
        DocxTestSupport.paragraph(doc, OPEN_A);
        DocxTestSupport.table(doc, "cell");
        DocxTestSupport.paragraph(doc, CLOSE);
        DocxTestSupport.paragraph(doc, "P2");

        nested.stripBlocks(doc, context());

        assertTrue(doc.getTables().isEmpty());
        assertEquals(Arrays.asList("P1", "P2"), DocxTestSupport.paragraphTexts(doc));
    }

    @Test
    @DisplayName("Markers inside table cells are left for the inline pass")
    public void testCellMarkersIgnored() {
        XWPFDocument doc = new XWPFDocument();
        DocxTestSupport.paragraph(doc, "P1");
        DocxTestSupport.table(doc, OPEN_A, CLOSE);

        int removed = nested.stripBlocks(doc, context());

        assertEquals(0, removed);
        assertEquals(1, doc.getTables().size());
    }

    @Test
    @DisplayName("Null mode defaults to nested")
    public void testDefaultMode() {
        assertEquals(BlockScanMode.NESTED, new ConditionalBlockEliminator(null).getMode());
    }
}
