package com.formulagraph.app.config;

import com.formulagraph.app.models.ConditionalMode;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Settings under the "formula-graph" prefix of application.properties.
 */
@ConfigurationProperties(prefix = "formula-graph")
public class AnalysisProperties {

    private final Evaluation evaluation = new Evaluation();
    private final Batch batch = new Batch();

    // Above this many formulas per document a warning is logged; processing continues
    private int formulaCellLimit = 10_000;

    public Evaluation getEvaluation() {
        return evaluation;
    }

    public Batch getBatch() {
        return batch;
    }

    public int getFormulaCellLimit() {
        return formulaCellLimit;
    }

    public void setFormulaCellLimit(int formulaCellLimit) {
        this.formulaCellLimit = formulaCellLimit;
    }

    public static class Evaluation {
        private ConditionalMode conditionalMode = ConditionalMode.EAGER;
        private double fallbackValue = 0;

        public ConditionalMode getConditionalMode() {
            return conditionalMode;
        }

        public void setConditionalMode(ConditionalMode conditionalMode) {
            this.conditionalMode = conditionalMode;
        }

        public double getFallbackValue() {
            return fallbackValue;
        }

        public void setFallbackValue(double fallbackValue) {
            this.fallbackValue = fallbackValue;
        }
    }

    public static class Batch {
        private int parallelism = 4;

        public int getParallelism() {
            return parallelism;
        }

        public void setParallelism(int parallelism) {
            this.parallelism = parallelism;
        }
    }
}
