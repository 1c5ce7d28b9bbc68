package uk.gegc.trivia.shared.api.problem;

import uk.gegc.trivia.shared.result.ErrorKind;

import java.net.URI;

/**
 * Centralised catalog of RFC 7807 Problem Detail type URIs.
 *
 * @see ProblemDetailBuilder
 * @see <a href="https://www.rfc-editor.org/rfc/rfc7807">RFC 7807</a>
 */
public final class ErrorTypes {

    private static final String BASE_URL = "https://trivia.gegc.uk/docs/errors";

    // ==================== Engine Errors ====================
    public static final URI INVALID_REQUEST = URI.create(BASE_URL + "/invalid-request");
    public static final URI VALIDATION_FAILED = URI.create(BASE_URL + "/validation-failed");
    public static final URI RESOURCE_NOT_FOUND = URI.create(BASE_URL + "/resource-not-found");
    public static final URI UNPROCESSABLE_ENTITY = URI.create(BASE_URL + "/unprocessable-entity");

    // ==================== Transport Errors ====================
    public static final URI TYPE_MISMATCH = URI.create(BASE_URL + "/type-mismatch");
    public static final URI MALFORMED_JSON = URI.create(BASE_URL + "/malformed-json");

    // ==================== Generic Errors ====================
    public static final URI INTERNAL_SERVER_ERROR = URI.create(BASE_URL + "/internal-server-error");

    private ErrorTypes() {
        throw new AssertionError("Utility class - do not instantiate");
    }

    public static URI forKind(ErrorKind kind) {
        return switch (kind) {
            case INVALID_REQUEST -> INVALID_REQUEST;
            case VALIDATION_ERROR -> VALIDATION_FAILED;
            case NOT_FOUND -> RESOURCE_NOT_FOUND;
            case UNPROCESSABLE_ENTITY -> UNPROCESSABLE_ENTITY;
        };
    }
}
