package com.formulagraph.app.services;

import com.formulagraph.app.models.*;
import org.springframework.stereotype.Service;

import java.util.*;

/**
 * Topic lookups over an analysed document for report sections that want
 * "formulas relevant to X" without re-parsing anything.
 * A formula matches a keyword through its own text or through its row label,
 * the nearest text cell to its left.
 */
@Service
public class FormulaQueryService {

    /**
     * Formulas whose text or row label contains any of the keywords, ignoring case,
     * in loader order. An empty keyword set matches nothing.
     */
    public List<FormulaRecord> formulasReferencing(WorkbookAnalysis analysis, Set<String> keywords) {
        List<String> lowered = new ArrayList<>();
        for (String keyword : keywords) {
            if (keyword != null && !keyword.isBlank()) {
                lowered.add(keyword.trim().toLowerCase(Locale.ROOT));
            }
        }
        List<FormulaRecord> matches = new ArrayList<>();
        if (lowered.isEmpty()) {
            return matches;
        }
        for (FormulaRecord record : analysis.getFormulaRecords()) {
            String formula = record.getFormula().toLowerCase(Locale.ROOT);
            String label = rowLabel(analysis.getWorkbook(), record.getAddress());
            String lowerLabel = label == null ? "" : label.toLowerCase(Locale.ROOT);
            for (String keyword : lowered) {
                if (formula.contains(keyword) || lowerLabel.contains(keyword)) {
                    matches.add(record);
                    break;
                }
            }
        }
        return matches;
    }

    /**
     * Groups formulas by engineering topic. A formula may appear under several
     * categories or under none; every category is present in the result.
     */
    public Map<EngineeringCategory, List<FormulaRecord>> categorize(WorkbookAnalysis analysis) {
        Map<EngineeringCategory, List<FormulaRecord>> categories = new EnumMap<>(EngineeringCategory.class);
        for (EngineeringCategory category : EngineeringCategory.values()) {
            categories.put(category, new ArrayList<>());
        }
        for (FormulaRecord record : analysis.getFormulaRecords()) {
            String label = rowLabel(analysis.getWorkbook(), record.getAddress());
            for (EngineeringCategory category : EngineeringCategory.values()) {
                if (category.matches(record.getFormula(), label)) {
                    categories.get(category).add(record);
                }
            }
        }
        return categories;
    }

    /**
     * Nearest text cell to the left on the same row, or null.
     */
    static String rowLabel(Workbook workbook, QualifiedAddress address) {
        Sheet sheet = workbook.getSheet(address.getSheet());
        if (sheet == null) {
            return null;
        }
        for (Cell cell : sheet.cellsLeftOf(address.getCell())) {
            if (cell.isText()) {
                return (String) cell.getValue();
            }
        }
        return null;
    }
}
