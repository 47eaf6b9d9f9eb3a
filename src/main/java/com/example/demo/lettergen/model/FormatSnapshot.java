package com.example.demo.lettergen.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import org.apache.poi.xwpf.usermodel.ParagraphAlignment;

import java.util.List;

/**
 * Paragraph level attributes plus per-run formatting, in run order.
 */
@Value
@Builder
public class FormatSnapshot {
    ParagraphAlignment alignment;
    String styleId;
    @Singular
    List<RunFormat> runs;
}
