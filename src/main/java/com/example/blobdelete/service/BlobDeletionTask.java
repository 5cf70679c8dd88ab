package com.example.blobdelete.service;

import com.example.blobdelete.exceptions.BlobRequestException;
import com.example.blobdelete.exceptions.UnexpectedStatusException;
import com.example.blobdelete.model.BlobDeleteRequest;
import com.example.blobdelete.request.DeleteBlobBuilder;
import com.example.blobdelete.response.DeleteBlobResponse;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Duration;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.Callable;

/**
 * Deletes one blob by addressing a per-account request template at it and waiting for the service's answer.
 */
public class BlobDeletionTask implements Callable<DeletionOutcome> {

    private static final Logger LOGGER = LogManager.getLogger(BlobDeletionTask.class);
    private static final Duration DEFAULT_WAIT_TIMEOUT = Duration.ofMinutes(2);

    private final DeleteBlobBuilder template;
    private final BlobDeleteRequest request;
    private final Duration waitTimeout;

    /**
     * @param template builder carrying the client and the run-wide parameters (snapshot method, timeout)
     */
    public BlobDeletionTask(DeleteBlobBuilder template, BlobDeleteRequest request) {
        this(template, request, DEFAULT_WAIT_TIMEOUT);
    }

    BlobDeletionTask(DeleteBlobBuilder template, BlobDeleteRequest request, Duration waitTimeout) {
        this.template = Objects.requireNonNull(template, "template");
        this.request = Objects.requireNonNull(request, "request");
        this.waitTimeout = Objects.requireNonNull(waitTimeout, "waitTimeout");
    }

    @Override
    public DeletionOutcome call() {
        String clientRequestId = UUID.randomUUID().toString();
        DeleteBlobBuilder builder = request.applyTo(template).withClientRequestId(clientRequestId);
        try {
            DeleteBlobResponse response = builder.execute().block(waitTimeout);
            if (response == null) {
                LOGGER.error("Delete of {} completed without a response, client request id {}", request.describe(),
                        clientRequestId);
                return DeletionOutcome.failed(request, "no response");
            }
            LOGGER.info("Deleted {}, request id {}", request.describe(), response.getRequestId());
            return DeletionOutcome.deleted(request, response);
        } catch (UnexpectedStatusException ex) {
            String reason = "status " + ex.getStatusCode() + ex.getErrorCode().map(code -> " " + code).orElse("");
            if (ex.getStatusCode() == 404) {
                LOGGER.warn("Nothing to delete at {}: {}", request.describe(), reason);
            } else {
                LOGGER.error("Service refused to delete {}: {}, request id {}, retryable {}", request.describe(),
                        reason, ex.getRequestId().orElse("n/a"), ex.isRetryable());
            }
            return DeletionOutcome.failed(request, reason);
        } catch (BlobRequestException ex) {
            LOGGER.error("Delete of {} failed at the {} stage, client request id {}. Line content: {}",
                    request.describe(), ex.getStage(), clientRequestId, request.rawLine(), ex);
            return DeletionOutcome.failed(request, ex.getMessage());
        } catch (RuntimeException ex) {
            LOGGER.error("Unexpected error deleting {}. Line content: {}", request.describe(), request.rawLine(), ex);
            return DeletionOutcome.failed(request, "unexpected error: " + ex.getMessage());
        }
    }
}
