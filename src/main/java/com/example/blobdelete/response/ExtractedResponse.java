package com.example.blobdelete.response;

import com.azure.core.http.HttpHeaders;

import java.util.Objects;

/**
 * Headers and body text of a response whose status has been checked.
 */
public record ExtractedResponse(HttpHeaders headers, String body) {

    public ExtractedResponse {
        Objects.requireNonNull(headers, "headers");
        body = body == null ? "" : body;
    }
}
