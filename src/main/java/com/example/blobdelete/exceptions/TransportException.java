package com.example.blobdelete.exceptions;

/**
 * Raised when the request could not be sent or its response could not be read.
 */
public class TransportException extends BlobRequestException {

    public TransportException(String message, Throwable cause) {
        super(Stage.TRANSPORT, "Transport error: " + message, cause);
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
