package com.formulagraph.app.models;

/**
 * Advisory, undirected link between two documents through a shared parameter.
 * Links never take part in cycle detection or evaluation.
 */
public final class IntegrationLink {

    private final IntegrationParameter parameter;
    private final QualifiedAddress from;
    private final QualifiedAddress to;

    public IntegrationLink(IntegrationParameter parameter, QualifiedAddress from, QualifiedAddress to) {
        this.parameter = parameter;
        this.from = from;
        this.to = to;
    }

    public IntegrationParameter getParameter() {
        return parameter;
    }

    public QualifiedAddress getFrom() {
        return from;
    }

    public QualifiedAddress getTo() {
        return to;
    }

    @Override
    public String toString() {
        return from + " ~" + parameter + "~ " + to;
    }
}
