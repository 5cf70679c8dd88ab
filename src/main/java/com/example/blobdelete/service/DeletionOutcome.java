package com.example.blobdelete.service;

import com.example.blobdelete.model.BlobDeleteRequest;
import com.example.blobdelete.response.DeleteBlobResponse;

import java.util.Objects;
import java.util.Optional;

/**
 * What happened to one requested blob: the service's response, or the reason no response was accepted.
 */
public final class DeletionOutcome {

    private final BlobDeleteRequest request;
    private final DeleteBlobResponse response;
    private final String failureReason;

    private DeletionOutcome(BlobDeleteRequest request, DeleteBlobResponse response, String failureReason) {
        this.request = Objects.requireNonNull(request, "request");
        this.response = response;
        this.failureReason = failureReason;
    }

    public static DeletionOutcome deleted(BlobDeleteRequest request, DeleteBlobResponse response) {
        return new DeletionOutcome(request, Objects.requireNonNull(response, "response"), null);
    }

    public static DeletionOutcome failed(BlobDeleteRequest request, String reason) {
        return new DeletionOutcome(request, null, Objects.requireNonNull(reason, "reason"));
    }

    public boolean isDeleted() {
        return response != null;
    }

    public BlobDeleteRequest getRequest() {
        return request;
    }

    public Optional<DeleteBlobResponse> getResponse() {
        return Optional.ofNullable(response);
    }

    public Optional<String> getFailureReason() {
        return Optional.ofNullable(failureReason);
    }

    @Override
    public String toString() {
        return request.describe() + ": "
                + (isDeleted() ? "deleted (request id " + response.getRequestId() + ")" : failureReason);
    }
}
