package com.example.demo.lettergen.model;

import lombok.Builder;
import lombok.Value;
import org.apache.poi.xwpf.usermodel.UnderlinePatterns;

/**
 * Character formatting of one run. A null attribute means the run did not set it.
 */
@Value
@Builder
public class RunFormat {
    Boolean bold;
    Boolean italic;
    UnderlinePatterns underline;
    String fontName;
    Double fontSize;
    String fontColor;
}
