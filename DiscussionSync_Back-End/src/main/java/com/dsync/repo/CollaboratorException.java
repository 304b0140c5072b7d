package com.dsync.repo;

/**
 * Failure of a call to GitHub or Discord.
 * The kind lets callers tell a missing entity from a transient outage or a permission problem.
 */
public class CollaboratorException extends RuntimeException {

    public enum Kind {
        NOT_FOUND,
        TRANSIENT,
        PERMISSION_DENIED,
        INVALID_RESPONSE
    }

    private final Kind kind;

    public CollaboratorException(Kind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public CollaboratorException(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    /**
     * Maps an HTTP status returned by GitHub or Discord to a failure kind.
     */
    public static CollaboratorException fromStatus(int status, String message, Throwable cause) {
        Kind kind;
        if (status == 404) {
            kind = Kind.NOT_FOUND;
        } else if (status == 401 || status == 403) {
            kind = Kind.PERMISSION_DENIED;
        } else if (status == 429 || status >= 500) {
            kind = Kind.TRANSIENT;
        } else {
            kind = Kind.INVALID_RESPONSE;
        }
        return new CollaboratorException(kind, message + " (HTTP " + status + ")", cause);
    }

    public Kind getKind() {
        return kind;
    }

    public boolean isNotFound() {
        return kind == Kind.NOT_FOUND;
    }
}
