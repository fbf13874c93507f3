package io.clustersearch.exceptions;

/**
 * Thrown when an earliest/latest expression matches none of the supported time grammars.
 */
public class InvalidTimeExpressionException extends SearchCommandException {

    private final String expression;

    public InvalidTimeExpressionException(String expression) {
        super("Invalid time expression: '" + expression + "'");
        this.expression = expression;
    }

    public String getExpression() {
        return expression;
    }
}
