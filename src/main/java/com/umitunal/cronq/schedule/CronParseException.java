package com.umitunal.cronq.schedule;

/**
 * Thrown when an interval expression cannot be parsed.
 */
public class CronParseException extends IllegalArgumentException {

    private final String expression;

    public CronParseException(String expression, String message) {
        super(message + " in expression '" + expression + "'");
        this.expression = expression;
    }

    public CronParseException(String expression, String message, Throwable cause) {
        super(message + " in expression '" + expression + "'", cause);
        this.expression = expression;
    }

    public String getExpression() {
        return expression;
    }
}
