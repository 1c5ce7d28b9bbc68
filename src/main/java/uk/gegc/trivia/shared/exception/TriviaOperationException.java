package uk.gegc.trivia.shared.exception;

import uk.gegc.trivia.shared.result.ErrorKind;

/**
 * Raised at the transport boundary when an engine operation returned a failure.
 */
public class TriviaOperationException extends RuntimeException {

    private final ErrorKind kind;

    public TriviaOperationException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public ErrorKind getKind() {
        return kind;
    }
}
