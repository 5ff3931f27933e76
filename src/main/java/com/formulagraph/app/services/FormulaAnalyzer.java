package com.formulagraph.app.services;

import com.formulagraph.app.models.FormulaMetadata;
import com.formulagraph.app.models.FormulaTokens;
import com.formulagraph.app.models.FormulaType;
import org.springframework.stereotype.Service;

/**
 * Turns tokenizer output into FormulaMetadata: a type classification and a complexity score.
 */
@Service
public class FormulaAnalyzer {

    static final int CELL_WEIGHT = 1;
    static final int RANGE_WEIGHT = 2;
    static final int FUNCTION_WEIGHT = 3;
    static final int OPERATOR_WEIGHT = 1;

    static final int COMPLEX_REFERENCE_CELL_THRESHOLD = 5;
    static final int COMPLEX_ARITHMETIC_OPERATOR_THRESHOLD = 3;

    private final ReferenceTokenizer tokenizer;

    public FormulaAnalyzer(ReferenceTokenizer tokenizer) {
        this.tokenizer = tokenizer;
    }

    /**
     * Tokenizes and analyzes one formula text.
     */
    public FormulaMetadata analyze(String formula) {
        return analyze(tokenizer.tokenize(formula));
    }

    public FormulaMetadata analyze(FormulaTokens tokens) {
        return new FormulaMetadata(tokens, classify(tokens), complexity(tokens));
    }

    /**
     * First match wins; function usage dominates everything else.
     */
    FormulaType classify(FormulaTokens tokens) {
        if (!tokens.getFunctions().isEmpty()) {
            return FormulaType.FUNCTION;
        }
        if (tokens.getCells().size() > COMPLEX_REFERENCE_CELL_THRESHOLD || !tokens.getRanges().isEmpty()) {
            return FormulaType.COMPLEX_REFERENCE;
        }
        if (tokens.getOperators().size() > COMPLEX_ARITHMETIC_OPERATOR_THRESHOLD) {
            return FormulaType.COMPLEX_ARITHMETIC;
        }
        return FormulaType.SIMPLE;
    }

    int complexity(FormulaTokens tokens) {
        return CELL_WEIGHT * tokens.getCells().size()
                + RANGE_WEIGHT * tokens.getRanges().size()
                + FUNCTION_WEIGHT * tokens.getFunctions().size()
                + OPERATOR_WEIGHT * tokens.getOperators().size();
    }
}
