package com.example.navireader.morph;

/**
 * Raised when an operation receives a value it cannot treat as text.
 */
public class InvalidInputException extends MorphologyException {

    private final String operation;

    public InvalidInputException(String operation, String message) {
        super("Invalid input: " + message + " | Operation: " + operation);
        this.operation = operation;
    }

    public String getOperation() {
        return operation;
    }
}
