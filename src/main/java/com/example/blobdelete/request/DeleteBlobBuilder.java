package com.example.blobdelete.request;

import com.azure.core.http.HttpHeaders;
import com.azure.core.http.HttpMethod;
import com.azure.storage.blob.models.DeleteSnapshotsOptionType;
import com.example.blobdelete.client.BlobHeaders;
import com.example.blobdelete.client.BlobStorageClient;
import com.example.blobdelete.client.BlobUris;
import com.example.blobdelete.exceptions.MissingParameterException;
import com.example.blobdelete.response.DeleteBlobResponse;
import com.example.blobdelete.response.ResponseChecks;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable builder for a Delete Blob request.
 * <p>
 * Container name, blob name and delete snapshots method are mandatory and must each be supplied through their
 * {@code with} method before {@link #execute()} sends anything. The delete snapshots method starts out as
 * {@link DeleteSnapshotsOptionType#INCLUDE} but still has to be chosen explicitly. Every {@code with} call returns a
 * new builder; the receiver is never modified.
 */
public final class DeleteBlobBuilder {

    private static final Logger LOGGER = LogManager.getLogger(DeleteBlobBuilder.class);
    private static final int EXPECTED_STATUS = 202;

    private final BlobStorageClient client;
    private final String containerName;
    private final String blobName;
    private final DeleteSnapshotsOptionType deleteSnapshotsMethod;
    private final Long timeout;
    private final LeaseId leaseId;
    private final String clientRequestId;
    private final Set<RequiredParameter> supplied;

    private DeleteBlobBuilder(BlobStorageClient client, String containerName, String blobName,
            DeleteSnapshotsOptionType deleteSnapshotsMethod, Long timeout, LeaseId leaseId, String clientRequestId,
            Set<RequiredParameter> supplied) {
        this.client = client;
        this.containerName = containerName;
        this.blobName = blobName;
        this.deleteSnapshotsMethod = deleteSnapshotsMethod;
        this.timeout = timeout;
        this.leaseId = leaseId;
        this.clientRequestId = clientRequestId;
        this.supplied = supplied;
    }

    public static DeleteBlobBuilder create(BlobStorageClient client) {
        return new DeleteBlobBuilder(Objects.requireNonNull(client, "client"), null, null,
                DeleteSnapshotsOptionType.INCLUDE, null, null, null, EnumSet.noneOf(RequiredParameter.class));
    }

    public DeleteBlobBuilder withContainerName(String containerName) {
        Objects.requireNonNull(containerName, "containerName");
        return new DeleteBlobBuilder(client, containerName, blobName, deleteSnapshotsMethod, timeout, leaseId,
                clientRequestId, mark(RequiredParameter.CONTAINER_NAME));
    }

    public DeleteBlobBuilder withBlobName(String blobName) {
        Objects.requireNonNull(blobName, "blobName");
        return new DeleteBlobBuilder(client, containerName, blobName, deleteSnapshotsMethod, timeout, leaseId,
                clientRequestId, mark(RequiredParameter.BLOB_NAME));
    }

    public DeleteBlobBuilder withDeleteSnapshotsMethod(DeleteSnapshotsOptionType deleteSnapshotsMethod) {
        Objects.requireNonNull(deleteSnapshotsMethod, "deleteSnapshotsMethod");
        return new DeleteBlobBuilder(client, containerName, blobName, deleteSnapshotsMethod, timeout, leaseId,
                clientRequestId, mark(RequiredParameter.DELETE_SNAPSHOTS_METHOD));
    }

    /**
     * Sets the server side timeout in seconds.
     */
    public DeleteBlobBuilder withTimeout(long timeoutSeconds) {
        if (timeoutSeconds < 0) {
            throw new IllegalArgumentException("timeout must not be negative, but was " + timeoutSeconds);
        }
        return new DeleteBlobBuilder(client, containerName, blobName, deleteSnapshotsMethod, timeoutSeconds, leaseId,
                clientRequestId, supplied);
    }

    public DeleteBlobBuilder withLeaseId(LeaseId leaseId) {
        Objects.requireNonNull(leaseId, "leaseId");
        return new DeleteBlobBuilder(client, containerName, blobName, deleteSnapshotsMethod, timeout, leaseId,
                clientRequestId, supplied);
    }

    public DeleteBlobBuilder withClientRequestId(String clientRequestId) {
        Objects.requireNonNull(clientRequestId, "clientRequestId");
        return new DeleteBlobBuilder(client, containerName, blobName, deleteSnapshotsMethod, timeout, leaseId,
                clientRequestId, supplied);
    }

    public BlobStorageClient client() {
        return client;
    }

    public String containerName() {
        require(RequiredParameter.CONTAINER_NAME);
        return containerName;
    }

    public String blobName() {
        require(RequiredParameter.BLOB_NAME);
        return blobName;
    }

    public DeleteSnapshotsOptionType deleteSnapshotsMethod() {
        require(RequiredParameter.DELETE_SNAPSHOTS_METHOD);
        return deleteSnapshotsMethod;
    }

    public Optional<Long> timeout() {
        return Optional.ofNullable(timeout);
    }

    public Optional<LeaseId> leaseId() {
        return Optional.ofNullable(leaseId);
    }

    public Optional<String> clientRequestId() {
        return Optional.ofNullable(clientRequestId);
    }

    /**
     * Mandatory parameters not supplied yet, in declaration order of {@link RequiredParameter}.
     */
    public List<RequiredParameter> missingParameters() {
        List<RequiredParameter> missing = new ArrayList<>();
        for (RequiredParameter parameter : RequiredParameter.values()) {
            if (!supplied.contains(parameter)) {
                missing.add(parameter);
            }
        }
        return Collections.unmodifiableList(missing);
    }

    public boolean isComplete() {
        return supplied.size() == RequiredParameter.values().length;
    }

    /**
     * Request URI: the blob resource URI plus the {@code timeout} query parameter when one is set.
     *
     * @throws MissingParameterException if container name or blob name has not been supplied
     */
    public String requestUri() {
        String uri = BlobUris.blobUri(client.getEndpoint(), containerName(), blobName());
        if (timeout != null) {
            uri = uri + "?timeout=" + timeout;
        }
        return uri;
    }

    /**
     * Sends the request. The builder is checked before anything is sent: an incomplete builder yields a
     * {@link MissingParameterException} for the first missing parameter and the client is never called.
     * Transport failures, unexpected statuses and unreadable response headers arrive through the same error
     * channel.
     */
    public Mono<DeleteBlobResponse> execute() {
        List<RequiredParameter> missing = missingParameters();
        if (!missing.isEmpty()) {
            return Mono.error(new MissingParameterException(missing.get(0)));
        }

        String uri = requestUri();
        LOGGER.trace("Delete blob request uri: {}", uri);

        return client.performRequest(uri, HttpMethod.DELETE, this::addHeaders, null)
                .flatMap(response -> ResponseChecks.checkStatusAndExtract(response, EXPECTED_STATUS))
                .map(extracted -> DeleteBlobResponse.fromHeaders(extracted.headers()));
    }

    void addHeaders(HttpHeaders headers) {
        headers.set(BlobHeaders.DELETE_SNAPSHOTS, deleteSnapshotsMethod().toString());
        if (leaseId != null) {
            headers.set(BlobHeaders.LEASE_ID, leaseId.toString());
        }
        if (clientRequestId != null) {
            headers.set(BlobHeaders.CLIENT_REQUEST_ID, clientRequestId);
        }
    }

    private Set<RequiredParameter> mark(RequiredParameter parameter) {
        EnumSet<RequiredParameter> copy = supplied.isEmpty()
                ? EnumSet.noneOf(RequiredParameter.class)
                : EnumSet.copyOf(supplied);
        copy.add(parameter);
        return copy;
    }

    private void require(RequiredParameter parameter) {
        if (!supplied.contains(parameter)) {
            throw new MissingParameterException(parameter);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof DeleteBlobBuilder)) {
            return false;
        }
        DeleteBlobBuilder that = (DeleteBlobBuilder) o;
        return client == that.client
                && Objects.equals(containerName, that.containerName)
                && Objects.equals(blobName, that.blobName)
                && Objects.equals(deleteSnapshotsMethod, that.deleteSnapshotsMethod)
                && Objects.equals(timeout, that.timeout)
                && Objects.equals(leaseId, that.leaseId)
                && Objects.equals(clientRequestId, that.clientRequestId)
                && supplied.equals(that.supplied);
    }

    @Override
    public int hashCode() {
        return Objects.hash(System.identityHashCode(client), containerName, blobName, deleteSnapshotsMethod, timeout,
                leaseId, clientRequestId, supplied);
    }

    @Override
    public String toString() {
        return "DeleteBlobBuilder{" +
                "containerName='" + containerName + '\'' +
                ", blobName='" + blobName + '\'' +
                ", deleteSnapshotsMethod=" + deleteSnapshotsMethod +
                ", timeout=" + timeout +
                ", leaseId=" + leaseId +
                ", clientRequestId='" + clientRequestId + '\'' +
                ", supplied=" + supplied +
                '}';
    }
}
