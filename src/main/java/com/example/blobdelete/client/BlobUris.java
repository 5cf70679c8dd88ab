package com.example.blobdelete.client;

import com.azure.storage.common.Utility;

import java.util.Objects;

/**
 * Builds Blob service endpoints and resource URIs.
 */
public final class BlobUris {

    private static final String DEFAULT_BLOB_ENDPOINT_TEMPLATE = "https://%s.blob.core.windows.net";

    private BlobUris() {
    }

    /**
     * Resolves the service endpoint for a storage account. A plain account name maps to the public Azure endpoint,
     * a host name gets an https scheme and a full URL (for example an Azurite endpoint) is kept as given.
     */
    public static String resolveEndpoint(String storageAccountName) {
        Objects.requireNonNull(storageAccountName, "storageAccountName");
        String trimmed = storageAccountName.trim();
        if (trimmed.isEmpty()) {
            throw new IllegalArgumentException("storageAccountName must not be blank");
        }
        if (trimmed.contains("://")) {
            return stripTrailingSlash(trimmed);
        }
        if (trimmed.contains(".")) {
            return "https://" + stripTrailingSlash(trimmed);
        }
        return String.format(DEFAULT_BLOB_ENDPOINT_TEMPLATE, trimmed);
    }

    /**
     * Returns {@code <endpoint>/<container>/<blob>} with the container and every blob path segment percent-encoded.
     * Slashes inside the blob name are kept as virtual directory separators.
     */
    public static String blobUri(String endpoint, String containerName, String blobName) {
        Objects.requireNonNull(endpoint, "endpoint");
        Objects.requireNonNull(containerName, "containerName");
        Objects.requireNonNull(blobName, "blobName");
        return stripTrailingSlash(endpoint) + "/" + Utility.urlEncode(containerName) + "/" + encodeBlobName(blobName);
    }

    private static String encodeBlobName(String blobName) {
        String[] segments = blobName.split("/", -1);
        StringBuilder builder = new StringBuilder(blobName.length() + 16);
        for (int i = 0; i < segments.length; i++) {
            if (i > 0) {
                builder.append('/');
            }
            builder.append(Utility.urlEncode(segments[i]));
        }
        return builder.toString();
    }

    private static String stripTrailingSlash(String value) {
        String result = value;
        while (result.endsWith("/")) {
            result = result.substring(0, result.length() - 1);
        }
        return result;
    }
}
