package com.example.blobdelete.exceptions;

import java.util.Optional;

/**
 * Raised when the service answers with a status other than the one the operation expects.
 */
public class UnexpectedStatusException extends BlobRequestException {

    private final int statusCode;
    private final String body;
    private final String errorCode;
    private final String requestId;

    public UnexpectedStatusException(int statusCode, String body) {
        this(statusCode, body, null, null);
    }

    public UnexpectedStatusException(int statusCode, String body, String errorCode, String requestId) {
        super(Stage.STATUS, buildMessage(statusCode, errorCode));
        this.statusCode = statusCode;
        this.body = body == null ? "" : body;
        this.errorCode = errorCode;
        this.requestId = requestId;
    }

    public int getStatusCode() {
        return statusCode;
    }

    public String getBody() {
        return body;
    }

    /**
     * Service error code from the {@code x-ms-error-code} header, e.g. {@code BlobNotFound}.
     */
    public Optional<String> getErrorCode() {
        return Optional.ofNullable(errorCode);
    }

    public Optional<String> getRequestId() {
        return Optional.ofNullable(requestId);
    }

    @Override
    public boolean isRetryable() {
        return statusCode >= 500 || statusCode == 408 || statusCode == 429;
    }

    private static String buildMessage(int statusCode, String errorCode) {
        return errorCode == null
                ? "Unexpected HTTP status " + statusCode
                : "Unexpected HTTP status " + statusCode + " [" + errorCode + "]";
    }
}
