package com.sbomcheck.core.license;

/**
 * Thrown when a license expression does not match the SPDX license expression grammar.
 */
public class LicenseExpressionException extends RuntimeException {

    private static final int MAX_QUOTED_LENGTH = 120;

    private final String expression;
    private final int position;

    /**
     * Creates an exception for a syntax error at the given character position.
     *
     * @param expression the expression that failed to parse
     * @param position zero-based character position of the offending token
     * @param message parser message
     */
    public LicenseExpressionException(String expression, int position, String message) {
        super("invalid license expression '" + abbreviate(expression) + "' at position " + position + ": " + message);
        this.expression = expression;
        this.position = position;
    }

    private static String abbreviate(String expression) {
        if (expression.length() <= MAX_QUOTED_LENGTH) {
            return expression;
        }
        return expression.substring(0, MAX_QUOTED_LENGTH) + "...";
    }

    public String getExpression() {
        return expression;
    }

    public int getPosition() {
        return position;
    }
}
