package com.agrilink.community.exception;

/**
 * Exception thrown when an upload is rejected or cannot be written.
 * Rejected uploads are client errors; write failures are server errors.
 *
 * @author AgriLink Team
 */
public class FileStorageException extends RuntimeException {

    private final boolean clientError;

    private FileStorageException(String message, Throwable cause, boolean clientError) {
        super(message, cause);
        this.clientError = clientError;
    }

    public static FileStorageException rejected(String message) {
        return new FileStorageException(message, null, true);
    }

    public static FileStorageException writeFailed(String message, Throwable cause) {
        return new FileStorageException(message, cause, false);
    }

    public boolean isClientError() {
        return clientError;
    }
}
