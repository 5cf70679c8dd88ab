package com.example.blobdelete.service;

import com.azure.core.http.HttpHeaders;
import com.azure.core.http.HttpRequest;
import com.azure.storage.blob.models.DeleteSnapshotsOptionType;
import com.example.blobdelete.client.BlobHeaders;
import com.example.blobdelete.client.RecordingHttpClient;
import com.example.blobdelete.model.BlobDeleteRequest;
import com.example.blobdelete.request.DeleteBlobBuilder;
import com.example.blobdelete.request.LeaseId;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;

import java.io.IOException;

import static org.junit.jupiter.api.Assertions.*;

class BlobDeletionTaskTest {

    private static final String ENDPOINT = "https://acct.blob.core.windows.net";
    private static final LeaseId LEASE = LeaseId.parse("3f2504e0-4f89-11d3-9a0c-0305e82c3301");

    private static BlobDeleteRequest request(LeaseId leaseId) {
        return new BlobDeleteRequest("acct", "c", "dir/b.txt", leaseId, 2, "acct,c,dir/b.txt");
    }

    private static DeleteBlobBuilder template(RecordingHttpClient transport, DeleteSnapshotsOptionType method) {
        return transport.client(ENDPOINT).deleteBlob().withDeleteSnapshotsMethod(method);
    }

    @Test
    void call_addressesTemplateAtRequestedBlob() {
        RecordingHttpClient transport = RecordingHttpClient.accepted("abc");
        DeleteBlobBuilder template = template(transport, DeleteSnapshotsOptionType.ONLY).withTimeout(30);

        DeletionOutcome outcome = new BlobDeletionTask(template, request(LEASE)).call();

        assertTrue(outcome.isDeleted());
        assertEquals("abc", outcome.getResponse().orElseThrow().getRequestId());
        assertEquals("acct/c/dir/b.txt (line 2): deleted (request id abc)", outcome.toString());

        HttpRequest sent = transport.lastRequest();
        HttpHeaders headers = sent.getHeaders();
        assertEquals(ENDPOINT + "/c/dir/b.txt?timeout=30", sent.getUrl().toString());
        assertEquals("only", headers.getValue(BlobHeaders.DELETE_SNAPSHOTS));
        assertEquals(LEASE.toString(), headers.getValue(BlobHeaders.LEASE_ID));
        assertNotNull(headers.getValue(BlobHeaders.CLIENT_REQUEST_ID));
    }

    @Test
    void call_leavesTemplateUntouched() {
        RecordingHttpClient transport = RecordingHttpClient.accepted("abc");
        DeleteBlobBuilder template = template(transport, DeleteSnapshotsOptionType.INCLUDE);

        new BlobDeletionTask(template, request(LEASE)).call();

        assertFalse(template.isComplete());
        assertTrue(template.leaseId().isEmpty());
    }

    @Test
    void call_withoutLeaseOrTimeout_omitsThem() {
        RecordingHttpClient transport = RecordingHttpClient.accepted("abc");

        new BlobDeletionTask(template(transport, DeleteSnapshotsOptionType.INCLUDE), request(null)).call();

        HttpRequest sent = transport.lastRequest();
        assertEquals(ENDPOINT + "/c/dir/b.txt", sent.getUrl().toString());
        assertNull(sent.getHeaders().getValue(BlobHeaders.LEASE_ID));
    }

    @Test
    void call_notFound_reportsStatusAndErrorCode() {
        RecordingHttpClient transport = RecordingHttpClient.respondingWith(404,
                new HttpHeaders().set(BlobHeaders.ERROR_CODE, "BlobNotFound"), "");

        DeletionOutcome outcome = new BlobDeletionTask(template(transport, DeleteSnapshotsOptionType.INCLUDE),
                request(null)).call();

        assertFalse(outcome.isDeleted());
        assertEquals("status 404 BlobNotFound", outcome.getFailureReason().orElseThrow());
        assertTrue(outcome.getResponse().isEmpty());
    }

    @Test
    void call_transportFailure_reportsTransportError() {
        RecordingHttpClient transport = new RecordingHttpClient(r -> Mono.error(new IOException("reset")));

        DeletionOutcome outcome = new BlobDeletionTask(template(transport, DeleteSnapshotsOptionType.INCLUDE),
                request(null)).call();

        assertFalse(outcome.isDeleted());
        assertTrue(outcome.getFailureReason().orElseThrow().contains("Transport error"));
    }

    @Test
    void call_unparseableResponse_isFailure() {
        RecordingHttpClient transport = RecordingHttpClient.respondingWith(202, new HttpHeaders(), null);

        DeletionOutcome outcome = new BlobDeletionTask(template(transport, DeleteSnapshotsOptionType.INCLUDE),
                request(null)).call();

        assertFalse(outcome.isDeleted());
        assertTrue(outcome.getFailureReason().orElseThrow().contains("x-ms-request-id"));
    }

    @Test
    void call_templateWithoutSnapshotMethod_failsWithoutSending() {
        RecordingHttpClient transport = RecordingHttpClient.accepted("abc");

        DeletionOutcome outcome = new BlobDeletionTask(transport.client(ENDPOINT).deleteBlob(), request(null)).call();

        assertEquals("Missing required parameter: delete snapshots method",
                outcome.getFailureReason().orElseThrow());
        assertTrue(transport.requests().isEmpty());
    }
}
