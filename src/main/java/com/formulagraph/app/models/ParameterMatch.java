package com.formulagraph.app.models;

/**
 * One advisory candidate location for an integration parameter.
 * A match is a hint for a human or a downstream tool, never an authoritative binding.
 */
public final class ParameterMatch {

    /**
     * How the candidate address was chosen.
     */
    public enum Kind {
        // A numeric or formula cell found to the right of the matching label
        NEIGHBOR_VALUE,
        // Only the label itself matched; no value cell next to it
        LABEL_ONLY
    }

    private final IntegrationParameter parameter;
    private final QualifiedAddress address;
    private final QualifiedAddress label;
    private final String labelText;
    private final Kind kind;

    public ParameterMatch(IntegrationParameter parameter, QualifiedAddress address,
                          QualifiedAddress label, String labelText, Kind kind) {
        this.parameter = parameter;
        this.address = address;
        this.label = label;
        this.labelText = labelText;
        this.kind = kind;
    }

    public IntegrationParameter getParameter() {
        return parameter;
    }

    public QualifiedAddress getAddress() {
        return address;
    }

    public QualifiedAddress getLabel() {
        return label;
    }

    public String getLabelText() {
        return labelText;
    }

    public Kind getKind() {
        return kind;
    }

    public boolean isAdvisory() {
        return true;
    }

    @Override
    public String toString() {
        return parameter + "@" + address + " (" + kind + ")";
    }
}
