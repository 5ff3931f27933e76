package com.formulagraph.app.models;

import java.util.*;

/**
 * Everything wrong (or suspicious) with the formulas of one document, keyed by qualified address.
 * Counts:
 * - error: syntax errors and cells on a circular reference
 * - warning: otherwise sound formulas that read cells the document does not have
 * - valid: the rest
 * Evaluation errors are listed on their own and do not change the counts.
 */
public class ValidationResult {

    private int totalFormulas;
    private int validFormulas;
    private int errorFormulas;
    private int warningFormulas;
    private final List<SyntaxError> syntaxErrors = new ArrayList<>();
    private final List<MissingReference> missingReferences = new ArrayList<>();
    private final List<Cycle> cycles = new ArrayList<>();
    private final Map<String, EvaluationResult> evaluationErrors = new LinkedHashMap<>();

    public int getTotalFormulas() {
        return totalFormulas;
    }

    public int getValidFormulas() {
        return validFormulas;
    }

    public int getErrorFormulas() {
        return errorFormulas;
    }

    public int getWarningFormulas() {
        return warningFormulas;
    }

    public List<SyntaxError> getSyntaxErrors() {
        return Collections.unmodifiableList(syntaxErrors);
    }

    public List<MissingReference> getMissingReferences() {
        return Collections.unmodifiableList(missingReferences);
    }

    public List<Cycle> getCycles() {
        return Collections.unmodifiableList(cycles);
    }

    public Map<String, EvaluationResult> getEvaluationErrors() {
        return Collections.unmodifiableMap(evaluationErrors);
    }

    /**
     * True when no formula is in error. Warnings and evaluation errors do not count.
     */
    public boolean isClean() {
        return errorFormulas == 0;
    }

    void countFormula() {
        totalFormulas++;
    }

    void countValid() {
        validFormulas++;
    }

    void addSyntaxError(SyntaxError error) {
        syntaxErrors.add(error);
        errorFormulas++;
    }

    void countCircular() {
        errorFormulas++;
    }

    void addMissingReference(MissingReference missing) {
        missingReferences.add(missing);
        warningFormulas++;
    }

    void addCycles(Collection<Cycle> found) {
        cycles.addAll(found);
    }

    void addEvaluationError(QualifiedAddress address, EvaluationResult result) {
        evaluationErrors.put(address.toString(), result);
    }

    /**
     * Collects the entries of one validation pass. Each formula must be reported exactly once
     * through one of valid, syntaxError, circular or missing.
     */
    public static class Builder {
        private final ValidationResult result = new ValidationResult();

        public Builder valid() {
            result.countFormula();
            result.countValid();
            return this;
        }

        public Builder syntaxError(QualifiedAddress address, String formula, String error) {
            result.countFormula();
            result.addSyntaxError(new SyntaxError(address, formula, error));
            return this;
        }

        public Builder circular() {
            result.countFormula();
            result.countCircular();
            return this;
        }

        public Builder missing(QualifiedAddress address, String formula, List<QualifiedAddress> missing) {
            result.countFormula();
            result.addMissingReference(new MissingReference(address, formula, missing));
            return this;
        }

        public Builder cycles(Collection<Cycle> cycles) {
            result.addCycles(cycles);
            return this;
        }

        public Builder evaluationError(QualifiedAddress address, EvaluationResult evaluation) {
            result.addEvaluationError(address, evaluation);
            return this;
        }

        public ValidationResult build() {
            return result;
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * A formula rejected by the syntax check; it is never evaluated.
     */
    public static final class SyntaxError {
        private final QualifiedAddress address;
        private final String formula;
        private final String error;

        public SyntaxError(QualifiedAddress address, String formula, String error) {
            this.address = address;
            this.formula = formula;
            this.error = error;
        }

        public QualifiedAddress getAddress() {
            return address;
        }

        public String getFormula() {
            return formula;
        }

        public String getError() {
            return error;
        }
    }

    /**
     * A formula reading cells that are not in the document. It is still evaluated,
     * with the fallback value standing in for the missing cells.
     */
    public static final class MissingReference {
        private final QualifiedAddress address;
        private final String formula;
        private final List<QualifiedAddress> missing;

        public MissingReference(QualifiedAddress address, String formula, List<QualifiedAddress> missing) {
            this.address = address;
            this.formula = formula;
            this.missing = Collections.unmodifiableList(new ArrayList<>(missing));
        }

        public QualifiedAddress getAddress() {
            return address;
        }

        public String getFormula() {
            return formula;
        }

        public List<QualifiedAddress> getMissing() {
            return missing;
        }
    }
}
