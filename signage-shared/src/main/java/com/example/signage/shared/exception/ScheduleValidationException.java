package com.example.signage.shared.exception;

/**
 * Rejected schedule input: target or payload shape, time window, priority range
 * or a reference to a display or group that does not exist.
 */
public class ScheduleValidationException extends RuntimeException {

    public ScheduleValidationException(String message) {
        super(message);
    }
}
