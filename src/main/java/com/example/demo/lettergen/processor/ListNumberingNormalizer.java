package com.example.demo.lettergen.processor;

import com.example.demo.lettergen.model.FormatSnapshot;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.poi.xwpf.usermodel.XWPFParagraph;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.regex.Matcher;

/**
 * Renumbers hand-typed list markers top to bottom once conditional content is gone.
 *
 * "7. text" becomes the next main number; "q. text" becomes the next letter of the current
 * sub-list. A sub-list starts over at "a." only after a main point. Every other paragraph
 * leaves both counters alone. The digits and letters already in the text are ignored.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ListNumberingNormalizer {
    private final ParagraphFormatAdapter formatAdapter;

    /**
     * @return number of paragraphs rewritten
     */
    public int normalize(List<XWPFParagraph> paragraphs) {
        int mainCounter = 1;
        int subCounter = 1;
        boolean inSubList = false;
        int rewritten = 0;

        for (XWPFParagraph paragraph : paragraphs) {
            String text = PlaceholderGrammar.trim(paragraph.getText());

            Matcher main = PlaceholderGrammar.MAIN_POINT.matcher(text);
            if (main.find()) {
                rewrite(paragraph, mainCounter + ". " + main.group(2));
                mainCounter++;
                inSubList = false;
                rewritten++;
            }

            Matcher sub = PlaceholderGrammar.SUB_POINT.matcher(text);
            if (sub.find()) {
                if (!inSubList) {
                    subCounter = 1;
                    inSubList = true;
                }
                char letter = (char) ('a' + subCounter - 1);
                rewrite(paragraph, letter + ". " + sub.group(2));
                subCounter++;
                rewritten++;
            }
        }
        log.debug("Renumbered {} list paragraphs", rewritten);
        return rewritten;
    }

    private void rewrite(XWPFParagraph paragraph, String text) {
        if (text.equals(paragraph.getText())) {
            return;
        }
        FormatSnapshot snapshot = formatAdapter.save(paragraph);
        formatAdapter.replaceText(paragraph, text);
        formatAdapter.restore(paragraph, snapshot);
    }
}
