package com.streamfirst.migration.domain;

/**
 * Thrown by port implementations when the external collaborator they wrap cannot be
 * reached or answers with a transport-level failure. The application layer converts it
 * to {@link ErrorKind#UNAVAILABLE}.
 */
public class CollaboratorUnavailableException extends RuntimeException {

    public CollaboratorUnavailableException(String message) {
        super(message);
    }

    public CollaboratorUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
