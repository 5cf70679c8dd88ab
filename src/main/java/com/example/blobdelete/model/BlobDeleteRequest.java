package com.example.blobdelete.model;

import com.example.blobdelete.request.DeleteBlobBuilder;
import com.example.blobdelete.request.LeaseId;

import java.util.Objects;
import java.util.Optional;

/**
 * A blob named by one input line, with the line it came from.
 *
 * @param leaseId lease held on the blob, {@code null} when the line names none
 */
public record BlobDeleteRequest(String accountName, String containerName, String blobName, LeaseId leaseId,
        long lineNumber, String rawLine) {

    public BlobDeleteRequest {
        Objects.requireNonNull(accountName, "accountName");
        Objects.requireNonNull(containerName, "containerName");
        Objects.requireNonNull(blobName, "blobName");
    }

    public Optional<LeaseId> lease() {
        return Optional.ofNullable(leaseId);
    }

    /**
     * Addresses {@code template} at this blob: container, blob name and, when present, the lease.
     */
    public DeleteBlobBuilder applyTo(DeleteBlobBuilder template) {
        DeleteBlobBuilder addressed = template.withContainerName(containerName).withBlobName(blobName);
        return leaseId == null ? addressed : addressed.withLeaseId(leaseId);
    }

    public String describe() {
        return accountName + "/" + containerName + "/" + blobName + " (line " + lineNumber + ")";
    }
}
