package uk.gegc.trivia.shared.result;

/**
 * Failure categories an engine operation can report.
 * Each failing call yields exactly one of these.
 */
public enum ErrorKind {

    /**
     * The caller supplied structurally invalid input, e.g. a missing required field.
     */
    INVALID_REQUEST("Your request is not well formatted"),

    /**
     * A domain rule was violated, e.g. a reference to a category that does not exist.
     */
    VALIDATION_ERROR("Your request violates a domain rule"),

    /**
     * A lookup or query produced zero usable results.
     */
    NOT_FOUND("We couldn't find what you are looking for"),

    /**
     * The operation could not complete for an underlying reason, typically a failed write.
     */
    UNPROCESSABLE_ENTITY("Sorry, we couldn't process your request");

    private final String defaultMessage;

    ErrorKind(String defaultMessage) {
        this.defaultMessage = defaultMessage;
    }

    public String getDefaultMessage() {
        return defaultMessage;
    }
}
