package com.example.blobdelete.exceptions;

/**
 * Base class for failures of a blob request. Every failure names the {@link Stage} that produced it.
 */
public abstract class BlobRequestException extends RuntimeException {

    /**
     * Pipeline stage at which a request failed.
     */
    public enum Stage {
        VALIDATION,
        TRANSPORT,
        STATUS,
        RESPONSE_PARSING
    }

    private final Stage stage;

    protected BlobRequestException(Stage stage, String message) {
        super(message);
        this.stage = stage;
    }

    protected BlobRequestException(Stage stage, String message, Throwable cause) {
        super(message, cause);
        this.stage = stage;
    }

    public Stage getStage() {
        return stage;
    }

    /**
     * Returns true if sending the same request again may succeed.
     */
    public boolean isRetryable() {
        return false;
    }
}
