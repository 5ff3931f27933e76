package com.formulagraph.app.services;

import com.formulagraph.app.models.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.*;

/**
 * Checks formula syntax and gathers every problem of a document into a ValidationResult.
 * Never throws for a bad formula; a document with errors still gets a complete report.
 */
@Service
public class FormulaValidator {

    private static final Logger logger = LoggerFactory.getLogger(FormulaValidator.class);

    private static final String ALLOWED_SYMBOLS = "+-*/^().,!:;<>=&%$'_";

    /**
     * Syntax check of one formula text: it starts with '=', its string literals are closed,
     * its parentheses balance (ignoring text inside string literals), and outside string
     * literals it holds only letters, digits, whitespace and the allowed symbols.
     *
     * @return the reason the formula is rejected, or empty when it passes
     */
    public Optional<String> checkSyntax(String formula) {
        if (!Cell.isFormulaText(formula)) {
            return Optional.of("Formula must start with " + Cell.FORMULA_MARKER);
        }
        int depth = 0;
        boolean inString = false;
        for (int i = 1; i < formula.length(); i++) {
            char c = formula.charAt(i);
            if (inString) {
                if (c == '"') {
                    inString = false;
                }
                continue;
            }
            if (c == '"') {
                inString = true;
            } else if (c == '(') {
                depth++;
            } else if (c == ')') {
                depth--;
                if (depth < 0) {
                    return Optional.of("Unbalanced ')' at position " + i);
                }
            } else if (!Character.isLetterOrDigit(c) && !Character.isWhitespace(c)
                    && ALLOWED_SYMBOLS.indexOf(c) < 0) {
                return Optional.of("Invalid character '" + c + "' at position " + i);
            }
        }
        if (inString) {
            return Optional.of("Unterminated string literal");
        }
        if (depth != 0) {
            return Optional.of("Unbalanced parentheses");
        }
        return Optional.empty();
    }

    /**
     * Builds the report of one document from its graph, cycles and evaluation results.
     */
    public ValidationResult validate(Workbook workbook, DependencyGraph graph, List<Cycle> cycles,
                                     Map<QualifiedAddress, EvaluationResult> results) {
        ValidationResult.Builder report = ValidationResult.builder().cycles(cycles);
        Set<QualifiedAddress> circular = CycleDetector.members(cycles);

        for (Cell cell : workbook.formulaCells()) {
            QualifiedAddress address = cell.getQualifiedAddress();
            Optional<String> syntaxError = checkSyntax(cell.getFormula());
            if (syntaxError.isPresent()) {
                report.syntaxError(address, cell.getFormula(), syntaxError.get());
                continue;
            }
            if (circular.contains(address)) {
                report.circular();
                continue;
            }

            EvaluationResult result = results.get(address);
            if (result != null && !result.isSuccess()) {
                report.evaluationError(address, result);
            }

            List<QualifiedAddress> missing = missingReferences(workbook, graph, address);
            if (missing.isEmpty()) {
                report.valid();
            } else {
                report.missing(address, cell.getFormula(), missing);
            }
        }

        ValidationResult validation = report.build();
        logger.info("Validated {}: {} formulas, {} valid, {} errors, {} warnings, {} cycles",
                workbook.getDocumentId(), validation.getTotalFormulas(), validation.getValidFormulas(),
                validation.getErrorFormulas(), validation.getWarningFormulas(), validation.getCycles().size());
        return validation;
    }

    /**
     * Referenced cells the document does not hold: single cells without a cell in the
     * workbook, and any target on a sheet the document does not have. Range corners on
     * existing sheets are not reported.
     */
    private List<QualifiedAddress> missingReferences(Workbook workbook, DependencyGraph graph, QualifiedAddress source) {
        List<QualifiedAddress> missing = new ArrayList<>();
        FormulaMetadata metadata = graph.getMetadata(source);
        if (metadata == null) {
            return missing;
        }
        for (CellReference reference : metadata.getReferencedCells()) {
            QualifiedAddress target = reference.resolve(source.getSheet());
            if (!workbook.contains(target)) {
                missing.add(target);
            }
        }
        for (QualifiedAddress target : graph.getDependencies(source)) {
            if (graph.getDanglingNodes().contains(target) && !missing.contains(target)) {
                missing.add(target);
            }
        }
        return missing;
    }
}
