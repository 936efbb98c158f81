package com.stpa.coverage.exception;

public class InvalidConfigurationException extends IllegalArgumentException {

    private final String field;

    public InvalidConfigurationException(String field, String message) {
        super(message);
        this.field = field;
    }

    public String getField() {
        return field;
    }
}
