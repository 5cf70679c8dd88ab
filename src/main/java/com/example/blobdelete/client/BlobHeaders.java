package com.example.blobdelete.client;

import com.azure.core.http.HttpHeaderName;

/**
 * Names of the Blob service headers used by this client.
 */
public final class BlobHeaders {

    public static final HttpHeaderName DELETE_SNAPSHOTS = HttpHeaderName.fromString("x-ms-delete-snapshots");
    public static final HttpHeaderName LEASE_ID = HttpHeaderName.fromString("x-ms-lease-id");
    public static final HttpHeaderName CLIENT_REQUEST_ID = HttpHeaderName.fromString("x-ms-client-request-id");
    public static final HttpHeaderName REQUEST_ID = HttpHeaderName.fromString("x-ms-request-id");
    public static final HttpHeaderName VERSION = HttpHeaderName.fromString("x-ms-version");
    public static final HttpHeaderName ERROR_CODE = HttpHeaderName.fromString("x-ms-error-code");
    public static final HttpHeaderName DELETE_TYPE_PERMANENT = HttpHeaderName.fromString("x-ms-delete-type-permanent");

    private BlobHeaders() {
    }
}
