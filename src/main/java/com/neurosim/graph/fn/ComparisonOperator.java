package com.neurosim.graph.fn;

/**
 * Operator used to compare a termination measure against its threshold.
 */
public enum ComparisonOperator {
    LESS_THAN("<"),
    LESS_THAN_OR_EQUAL("<="),
    GREATER_THAN(">"),
    GREATER_THAN_OR_EQUAL(">="),
    EQUAL("=="),
    NOT_EQUAL("!=");

    private final String symbol;

    ComparisonOperator(String symbol) {
        this.symbol = symbol;
    }

    public String symbol() {
        return symbol;
    }

    public boolean test(double status, double threshold) {
        return switch (this) {
            case LESS_THAN -> status < threshold;
            case LESS_THAN_OR_EQUAL -> status <= threshold;
            case GREATER_THAN -> status > threshold;
            case GREATER_THAN_OR_EQUAL -> status >= threshold;
            case EQUAL -> status == threshold;
            case NOT_EQUAL -> status != threshold;
        };
    }

    /**
     * Resolves an operator from its symbol ({@code "<="}) or its name
     * ({@code "LESS_THAN_OR_EQUAL"}).
     */
    public static ComparisonOperator parse(String spec) {
        for (ComparisonOperator op : values()) {
            if (op.symbol.equals(spec) || op.name().equalsIgnoreCase(spec))
                return op;
        }
        throw new IllegalArgumentException("Unknown comparison operator: " + spec);
    }
}
