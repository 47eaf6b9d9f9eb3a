package com.example.demo.lettergen.processor;

import com.example.demo.lettergen.model.PlaceholderInventory;
import lombok.extern.slf4j.Slf4j;
import org.apache.poi.xwpf.usermodel.XWPFDocument;
import org.apache.poi.xwpf.usermodel.XWPFParagraph;
import org.apache.poi.xwpf.usermodel.XWPFTable;
import org.apache.poi.xwpf.usermodel.XWPFTableCell;
import org.apache.poi.xwpf.usermodel.XWPFTableRow;
import org.springframework.stereotype.Component;

import java.util.HashSet;
import java.util.Set;
import java.util.regex.Matcher;

/**
 * Lists the variables and conditionals a template refers to, so a form can ask for them.
 * Scans body paragraphs and the paragraphs of every top-level table cell. Read-only.
 */
@Slf4j
@Component
public class PlaceholderExtractor {

    public PlaceholderInventory extract(XWPFDocument doc) {
        Set<String> variables = new HashSet<>();
        Set<String> conditionals = new HashSet<>();

        for (XWPFParagraph paragraph : doc.getParagraphs()) {
            collect(paragraph.getText(), variables, conditionals);
        }
        for (XWPFTable table : doc.getTables()) {
            for (XWPFTableRow row : table.getRows()) {
                for (XWPFTableCell cell : row.getTableCells()) {
                    for (XWPFParagraph paragraph : cell.getParagraphs()) {
                        collect(paragraph.getText(), variables, conditionals);
                    }
                }
            }
        }

        PlaceholderInventory inventory = PlaceholderInventory.of(variables, conditionals);
        log.debug("Extracted {} variables and {} conditionals", inventory.getVariables().size(),
                inventory.getConditionals().size());
        return inventory;
    }

    private void collect(String text, Set<String> variables, Set<String> conditionals) {
        if (text == null || text.isEmpty()) {
            return;
        }
        Matcher vars = PlaceholderGrammar.VARIABLE_TOKEN.matcher(text);
        while (vars.find()) {
            String name = PlaceholderGrammar.variableName(vars.group(1));
            if (name != null) {
                variables.add(name);
            }
        }
        Matcher conds = PlaceholderGrammar.CONDITIONAL_REFERENCE.matcher(text);
        while (conds.find()) {
            conditionals.add(conds.group(1));
        }
    }
}
