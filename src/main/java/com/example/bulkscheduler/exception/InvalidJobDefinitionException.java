package com.example.bulkscheduler.exception;

import lombok.Getter;

/**
 * Exception for a job definition that cannot be scheduled,
 * e.g. a malformed schedule time or an unknown timezone.
 */
@Getter
public class InvalidJobDefinitionException extends RuntimeException {

    private final String field;

    public InvalidJobDefinitionException(String field, String message) {
        super(String.format("%s: %s", field, message));
        this.field = field;
    }
}
