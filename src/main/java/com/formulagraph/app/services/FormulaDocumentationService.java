package com.formulagraph.app.services;

import com.formulagraph.app.models.EngineeringCategory;
import com.formulagraph.app.models.FormulaRecord;
import com.formulagraph.app.models.WorkbookAnalysis;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Map;

/**
 * Writes a Markdown summary of one analysed document.
 */
@Service
public class FormulaDocumentationService {

    static final int FORMULAS_PER_CATEGORY = 5;

    private static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private final FormulaQueryService queryService;

    public FormulaDocumentationService(FormulaQueryService queryService) {
        this.queryService = queryService;
    }

    public String document(WorkbookAnalysis analysis) {
        StringBuilder doc = new StringBuilder();
        doc.append("# Formula Documentation: ").append(analysis.getDocumentId()).append("\n\n");
        doc.append("Generated on: ").append(LocalDateTime.now().format(TIMESTAMP)).append("\n\n");

        doc.append("## Summary\n");
        doc.append("- Total formulas: ").append(analysis.getValidation().getTotalFormulas()).append('\n');
        doc.append("- Valid formulas: ").append(analysis.getValidation().getValidFormulas()).append('\n');
        doc.append("- Formulas with errors: ").append(analysis.getValidation().getErrorFormulas()).append('\n');
        doc.append("- Formulas with warnings: ").append(analysis.getValidation().getWarningFormulas()).append('\n');
        doc.append("- Number of sheets: ").append(analysis.getWorkbook().getSheets().size()).append('\n');
        doc.append("- Circular references: ").append(analysis.getCycles().size()).append("\n\n");

        Map<EngineeringCategory, List<FormulaRecord>> categories = queryService.categorize(analysis);
        doc.append("## Engineering Formula Categories\n\n");
        for (Map.Entry<EngineeringCategory, List<FormulaRecord>> entry : categories.entrySet()) {
            List<FormulaRecord> formulas = entry.getValue();
            if (formulas.isEmpty()) {
                continue;
            }
            doc.append("### ").append(entry.getKey().getTitle())
                    .append(" (").append(formulas.size()).append(" formulas)\n\n");
            for (FormulaRecord record : formulas.subList(0, Math.min(FORMULAS_PER_CATEGORY, formulas.size()))) {
                doc.append("**").append(record.getAddress()).append("**\n");
                doc.append("```\n").append(record.getFormula()).append("\n```\n\n");
            }
            if (formulas.size() > FORMULAS_PER_CATEGORY) {
                doc.append("... and ").append(formulas.size() - FORMULAS_PER_CATEGORY).append(" more formulas\n\n");
            }
        }

        Map<String, List<String>> dependencies = analysis.getGraph().getSheetDependencies();
        if (!dependencies.isEmpty()) {
            doc.append("## Cross-Sheet Dependencies\n\n");
            for (Map.Entry<String, List<String>> entry : dependencies.entrySet()) {
                doc.append("- **").append(entry.getKey()).append("** depends on: ")
                        .append(String.join(", ", entry.getValue())).append('\n');
            }
            doc.append('\n');
        }

        if (!analysis.getCycles().isEmpty()) {
            doc.append("## Circular References\n\n");
            analysis.getCycles().forEach(cycle -> doc.append("- ").append(cycle.getDescription()).append('\n'));
        }
        return doc.toString();
    }
}
