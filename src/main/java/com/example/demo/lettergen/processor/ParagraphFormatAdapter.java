package com.example.demo.lettergen.processor;

import com.example.demo.lettergen.model.FormatSnapshot;
import com.example.demo.lettergen.model.RunFormat;
import org.apache.poi.xwpf.usermodel.XWPFParagraph;
import org.apache.poi.xwpf.usermodel.XWPFRun;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.CTRPr;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Captures paragraph and run formatting before a text rewrite and puts it back afterwards.
 *
 * {@link #replaceText(XWPFParagraph, String)} collapses a paragraph into a single run, so
 * {@link #restore(XWPFParagraph, FormatSnapshot)} can only reapply the first saved run's
 * character formatting. Formatting of later runs is lost.
 */
@Component
public class ParagraphFormatAdapter {

    public FormatSnapshot save(XWPFParagraph paragraph) {
        FormatSnapshot.FormatSnapshotBuilder snapshot = FormatSnapshot.builder()
                .alignment(paragraph.getAlignment())
                .styleId(paragraph.getStyle());
        for (XWPFRun run : paragraph.getRuns()) {
            snapshot.run(capture(run));
        }
        return snapshot.build();
    }

    public void restore(XWPFParagraph paragraph, FormatSnapshot snapshot) {
        if (snapshot.getAlignment() != null) {
            paragraph.setAlignment(snapshot.getAlignment());
        }
        if (snapshot.getStyleId() != null) {
            paragraph.setStyle(snapshot.getStyleId());
        }

        List<XWPFRun> runs = paragraph.getRuns();
        List<RunFormat> saved = snapshot.getRuns();
        for (int i = 0; i < runs.size() && i < saved.size(); i++) {
            apply(runs.get(i), saved.get(i));
        }
    }

    /**
     * Drops every run of {@code paragraph} and writes {@code text} into one new run.
     * Line feeds become line breaks. Paragraph properties are untouched.
     */
    public void replaceText(XWPFParagraph paragraph, String text) {
        for (int i = paragraph.getRuns().size() - 1; i >= 0; i--) {
            paragraph.removeRun(i);
        }
        XWPFRun run = paragraph.createRun();
        String normalized = text == null ? "" : text.replace("\r\n", "\n").replace('\r', '\n');
        String[] lines = normalized.split("\n", -1);
        for (int i = 0; i < lines.length; i++) {
            if (i > 0) {
                run.addBreak();
            }
            run.setText(lines[i]);
        }
    }

    private RunFormat capture(XWPFRun run) {
        // no rPr means nothing was set on the run itself
        if (run.getCTR() == null || !run.getCTR().isSetRPr()) {
            return RunFormat.builder().build();
        }
        // toggles the run does not set stay null
        CTRPr rPr = run.getCTR().getRPr();
        return RunFormat.builder()
                .bold(rPr.sizeOfBArray() > 0 ? run.isBold() : null)
                .italic(rPr.sizeOfIArray() > 0 ? run.isItalic() : null)
                .underline(rPr.sizeOfUArray() > 0 ? run.getUnderline() : null)
                .fontName(run.getFontFamily())
                .fontSize(run.getFontSizeAsDouble())
                .fontColor(run.getColor())
                .build();
    }

    private void apply(XWPFRun run, RunFormat format) {
        if (format.getBold() != null) {
            run.setBold(format.getBold());
        }
        if (format.getItalic() != null) {
            run.setItalic(format.getItalic());
        }
        if (format.getUnderline() != null) {
            run.setUnderline(format.getUnderline());
        }
        if (format.getFontName() != null) {
            run.setFontFamily(format.getFontName());
        }
        if (format.getFontSize() != null) {
            run.setFontSize(format.getFontSize());
        }
        if (format.getFontColor() != null) {
            run.setColor(format.getFontColor());
        }
    }
}
