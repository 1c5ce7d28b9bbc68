package uk.gegc.trivia.shared.exception;

/**
 * Thrown by the question store when a record would break a domain rule
 * (blank field, difficulty out of range, unknown category).
 */
public class ValidationException extends RuntimeException {

    public ValidationException(String message) {
        super(message);
    }
}
