package com.example.blobdelete.exceptions;

/**
 * Raised when a successful response lacks a header the result needs, or carries one that cannot be decoded.
 */
public class ResponseParseException extends BlobRequestException {

    public ResponseParseException(String message) {
        super(Stage.RESPONSE_PARSING, message);
    }

    public ResponseParseException(String message, Throwable cause) {
        super(Stage.RESPONSE_PARSING, message, cause);
    }
}
