package com.example.blobdelete.client;

import com.azure.core.http.HttpHeaderName;
import com.azure.core.http.HttpMethod;
import com.azure.core.http.HttpRequest;
import com.azure.core.http.HttpResponse;
import com.example.blobdelete.exceptions.TransportException;
import com.example.blobdelete.request.DeleteBlobBuilder;
import org.junit.jupiter.api.Test;

import java.util.concurrent.TimeoutException;

import reactor.core.publisher.Mono;

import static org.junit.jupiter.api.Assertions.*;

class BlobStorageClientTest {

    private static final String ENDPOINT = "https://acct.blob.core.windows.net";

    @Test
    void performRequest_appliesHeaderMutatorAndBody() {
        RecordingHttpClient transport = RecordingHttpClient.accepted("r-1");
        BlobStorageClient client = transport.client(ENDPOINT);

        HttpResponse response = client.performRequest(ENDPOINT + "/c/b", HttpMethod.PUT,
                headers -> headers.set(HttpHeaderName.fromString("x-test"), "1"), new byte[] {1, 2, 3}).block();

        assertNotNull(response);
        assertEquals(202, response.getStatusCode());
        HttpRequest sent = transport.lastRequest();
        assertEquals(HttpMethod.PUT, sent.getHttpMethod());
        assertEquals("1", sent.getHeaders().getValue(HttpHeaderName.fromString("x-test")));
        assertNotNull(sent.getBody());
    }

    @Test
    void performRequest_isLazy() {
        RecordingHttpClient transport = RecordingHttpClient.accepted("r-1");

        transport.client(ENDPOINT).performRequest(ENDPOINT + "/c/b", HttpMethod.DELETE, headers -> { }, null);

        assertTrue(transport.requests().isEmpty());
    }

    @Test
    void performRequest_malformedUri_isTransportError() {
        RecordingHttpClient transport = RecordingHttpClient.accepted("r-1");

        TransportException ex = assertThrows(TransportException.class, () -> transport.client(ENDPOINT)
                .performRequest("not a url", HttpMethod.DELETE, headers -> { }, null)
                .block());

        assertNotNull(ex.getCause());
        assertTrue(transport.requests().isEmpty());
    }

    @Test
    void performRequest_pipelineFailure_isTransportError() {
        TimeoutException cause = new TimeoutException("read timed out");
        RecordingHttpClient transport = new RecordingHttpClient(request -> Mono.error(cause));

        TransportException ex = assertThrows(TransportException.class, () -> transport.client(ENDPOINT)
                .performRequest(ENDPOINT + "/c/b", HttpMethod.DELETE, headers -> { }, null)
                .block());

        assertSame(cause, ex.getCause());
        assertTrue(ex.getMessage().contains("DELETE " + ENDPOINT + "/c/b"));
    }

    @Test
    void deleteBlob_startsEmptyBuilderBoundToClient() {
        BlobStorageClient client = RecordingHttpClient.accepted("r-1").client(ENDPOINT);

        DeleteBlobBuilder builder = client.deleteBlob();

        assertSame(client, builder.client());
        assertEquals(3, builder.missingParameters().size());
    }
}
