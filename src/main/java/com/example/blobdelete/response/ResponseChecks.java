package com.example.blobdelete.response;

import com.azure.core.http.HttpHeaders;
import com.azure.core.http.HttpResponse;
import com.example.blobdelete.client.BlobHeaders;
import com.example.blobdelete.exceptions.BlobRequestException;
import com.example.blobdelete.exceptions.TransportException;
import com.example.blobdelete.exceptions.UnexpectedStatusException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import reactor.core.publisher.Mono;

/**
 * Status validation shared by blob operations.
 */
public final class ResponseChecks {

    private static final Logger LOGGER = LogManager.getLogger(ResponseChecks.class);

    private ResponseChecks() {
    }

    /**
     * Reads the body of {@code response} and checks its status.
     *
     * @return headers and body when the status equals {@code expectedStatus}, otherwise an
     *         {@link UnexpectedStatusException} carrying the actual status and body
     */
    public static Mono<ExtractedResponse> checkStatusAndExtract(HttpResponse response, int expectedStatus) {
        int statusCode = response.getStatusCode();
        HttpHeaders headers = response.getHeaders();

        return response.getBodyAsString()
                .defaultIfEmpty("")
                .onErrorMap(e -> !(e instanceof BlobRequestException),
                        e -> new TransportException("could not read response body", e))
                .flatMap(body -> {
                    if (statusCode != expectedStatus) {
                        String errorCode = headers.getValue(BlobHeaders.ERROR_CODE);
                        String requestId = headers.getValue(BlobHeaders.REQUEST_ID);
                        LOGGER.debug("Expected status {} but got {} (error code {}, request id {})", expectedStatus,
                                statusCode, errorCode, requestId);
                        return Mono.error(new UnexpectedStatusException(statusCode, body, errorCode, requestId));
                    }
                    return Mono.just(new ExtractedResponse(headers, body));
                });
    }
}
