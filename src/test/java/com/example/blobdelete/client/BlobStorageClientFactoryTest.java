package com.example.blobdelete.client;

import com.azure.core.http.HttpHeaderName;
import com.azure.core.http.HttpHeaders;
import com.azure.core.http.HttpMethod;
import com.azure.core.http.HttpPipeline;
import com.azure.core.http.HttpRequest;
import com.azure.storage.blob.models.DeleteSnapshotsOptionType;
import com.example.blobdelete.config.AppConfig;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class BlobStorageClientFactoryTest {

    private static AppConfig sharedKeyConfig() {
        return AppConfig.builder()
                .inputCsvContent("acct,c,b")
                .serviceVersion("2020-10-02")
                .maxRetries(0)
                .accountKey("c2VjcmV0LWtleQ==")
                .build();
    }

    @Test
    void create_resolvesEndpointFromAccountName() {
        BlobStorageClientFactory factory = new BlobStorageClientFactory(sharedKeyConfig(),
                RecordingHttpClient.accepted("r-1"));

        BlobStorageClient client = factory.create("acct");

        assertEquals("https://acct.blob.core.windows.net", client.getEndpoint());
    }

    @Test
    void pipeline_addsVersionDateAndSharedKeyAuthorization() {
        RecordingHttpClient transport = RecordingHttpClient.accepted("r-1");
        BlobStorageClientFactory factory = new BlobStorageClientFactory(sharedKeyConfig(), transport);

        HttpPipeline pipeline = factory.buildPipeline("acct");
        pipeline.send(new HttpRequest(HttpMethod.DELETE, "https://acct.blob.core.windows.net/c/b")).block();

        HttpHeaders headers = transport.lastRequest().getHeaders();
        assertEquals(4, pipeline.getPolicyCount());
        assertEquals("2020-10-02", headers.getValue(BlobHeaders.VERSION));
        assertNotNull(headers.getValue(HttpHeaderName.DATE));
        assertTrue(headers.getValue(HttpHeaderName.AUTHORIZATION).startsWith("SharedKey acct:"));
    }

    @Test
    void clientFromFactory_sendsDeleteThroughPipeline() {
        RecordingHttpClient transport = RecordingHttpClient.accepted("r-1");
        BlobStorageClient client = new BlobStorageClientFactory(sharedKeyConfig(), transport).create("acct");

        client.deleteBlob()
                .withContainerName("c")
                .withBlobName("b")
                .withDeleteSnapshotsMethod(DeleteSnapshotsOptionType.ONLY)
                .execute()
                .block();

        HttpHeaders headers = transport.lastRequest().getHeaders();
        assertEquals("only", headers.getValue(BlobHeaders.DELETE_SNAPSHOTS));
        assertEquals("2020-10-02", headers.getValue(BlobHeaders.VERSION));
    }

    @Test
    void accountNameOf_handlesNamesHostsAndUrls() {
        assertEquals("acct", BlobStorageClientFactory.accountNameOf("acct"));
        assertEquals("acct", BlobStorageClientFactory.accountNameOf("acct.blob.core.windows.net"));
        assertEquals("acct", BlobStorageClientFactory.accountNameOf("https://acct.blob.core.windows.net/"));
        assertEquals("devstoreaccount1",
                BlobStorageClientFactory.accountNameOf("http://127.0.0.1:10000/devstoreaccount1"));
    }
}
