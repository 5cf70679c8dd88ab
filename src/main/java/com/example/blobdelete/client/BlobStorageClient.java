package com.example.blobdelete.client;

import com.azure.core.http.HttpHeaders;
import com.azure.core.http.HttpMethod;
import com.azure.core.http.HttpPipeline;
import com.azure.core.http.HttpRequest;
import com.azure.core.http.HttpResponse;
import com.example.blobdelete.exceptions.BlobRequestException;
import com.example.blobdelete.exceptions.TransportException;
import com.example.blobdelete.request.DeleteBlobBuilder;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import reactor.core.publisher.Mono;

import java.util.Objects;
import java.util.function.Consumer;

/**
 * Client for a single storage account. Sends requests through an Azure {@link HttpPipeline}, which owns
 * authentication and retries.
 */
public class BlobStorageClient {

    private static final Logger LOGGER = LogManager.getLogger(BlobStorageClient.class);

    private final String endpoint;
    private final HttpPipeline pipeline;

    public BlobStorageClient(String endpoint, HttpPipeline pipeline) {
        this.endpoint = Objects.requireNonNull(endpoint, "endpoint");
        this.pipeline = Objects.requireNonNull(pipeline, "pipeline");
    }

    public String getEndpoint() {
        return endpoint;
    }

    /**
     * Starts a delete blob request against this account.
     */
    public DeleteBlobBuilder deleteBlob() {
        return DeleteBlobBuilder.create(this);
    }

    /**
     * Sends one request. The returned {@link Mono} is cold: nothing is sent until it is subscribed.
     *
     * @param uri absolute request URI, query string included
     * @param method HTTP method
     * @param headerMutator adds the operation specific headers
     * @param body request body, or {@code null} for none
     * @return the raw response; failures to build or send the request are signalled as {@link TransportException}
     */
    public Mono<HttpResponse> performRequest(String uri, HttpMethod method, Consumer<HttpHeaders> headerMutator,
            byte[] body) {
        Objects.requireNonNull(uri, "uri");
        Objects.requireNonNull(method, "method");
        Objects.requireNonNull(headerMutator, "headerMutator");

        return Mono.fromCallable(() -> {
            HttpRequest request = new HttpRequest(method, uri);
            headerMutator.accept(request.getHeaders());
            if (body != null) {
                request.setBody(body);
            }
            return request;
        })
                .onErrorMap(e -> !(e instanceof BlobRequestException),
                        e -> new TransportException("could not build " + method + " request for " + uri, e))
                .flatMap(request -> {
                    LOGGER.debug("Sending {} {}", method, uri);
                    return pipeline.send(request);
                })
                .onErrorMap(e -> !(e instanceof BlobRequestException),
                        e -> new TransportException(method + " " + uri + " failed: " + e.getMessage(), e));
    }
}
