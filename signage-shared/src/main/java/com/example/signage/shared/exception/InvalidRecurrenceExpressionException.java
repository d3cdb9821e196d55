package com.example.signage.shared.exception;

import lombok.Getter;

@Getter
public class InvalidRecurrenceExpressionException extends RuntimeException {

    private final String expression;

    public InvalidRecurrenceExpressionException(String expression, String reason) {
        super("Invalid recurrence rule '" + expression + "': " + reason);
        this.expression = expression;
    }

    public InvalidRecurrenceExpressionException(String expression, Throwable cause) {
        super("Invalid recurrence rule '" + expression + "': " + cause.getMessage(), cause);
        this.expression = expression;
    }
}
