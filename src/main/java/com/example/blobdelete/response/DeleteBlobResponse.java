package com.example.blobdelete.response;

import com.azure.core.http.HttpHeaderName;
import com.azure.core.http.HttpHeaders;
import com.example.blobdelete.client.BlobHeaders;
import com.example.blobdelete.exceptions.ResponseParseException;

import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * Result of a successful delete blob request. The service returns no body, so everything comes from headers.
 */
public final class DeleteBlobResponse {

    private final String requestId;
    private final String clientRequestId;
    private final String version;
    private final OffsetDateTime date;
    private final boolean deleteTypePermanent;

    public DeleteBlobResponse(String requestId, String clientRequestId, String version, OffsetDateTime date,
            boolean deleteTypePermanent) {
        this.requestId = Objects.requireNonNull(requestId, "requestId");
        this.clientRequestId = clientRequestId;
        this.version = version;
        this.date = date;
        this.deleteTypePermanent = deleteTypePermanent;
    }

    public static DeleteBlobResponse fromHeaders(HttpHeaders headers) {
        Objects.requireNonNull(headers, "headers");

        String requestId = headers.getValue(BlobHeaders.REQUEST_ID);
        if (requestId == null || requestId.isBlank()) {
            throw new ResponseParseException("Response is missing the " + BlobHeaders.REQUEST_ID.getCaseSensitiveName()
                    + " header");
        }

        return new DeleteBlobResponse(requestId.trim(),
                headers.getValue(BlobHeaders.CLIENT_REQUEST_ID),
                headers.getValue(BlobHeaders.VERSION),
                parseDate(headers),
                parseBoolean(headers, BlobHeaders.DELETE_TYPE_PERMANENT));
    }

    private static OffsetDateTime parseDate(HttpHeaders headers) {
        String value = headers.getValue(HttpHeaderName.DATE);
        if (value == null) {
            return null;
        }
        try {
            return OffsetDateTime.parse(value.trim(), DateTimeFormatter.RFC_1123_DATE_TIME);
        } catch (DateTimeParseException e) {
            throw new ResponseParseException("Malformed Date header: '" + value + "'", e);
        }
    }

    private static boolean parseBoolean(HttpHeaders headers, HttpHeaderName name) {
        String value = headers.getValue(name);
        if (value == null) {
            return false;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        if (normalized.equals("true") || normalized.equals("false")) {
            return Boolean.parseBoolean(normalized);
        }
        throw new ResponseParseException("Malformed " + name.getCaseSensitiveName() + " header: '" + value + "'");
    }

    public String getRequestId() {
        return requestId;
    }

    public Optional<String> getClientRequestId() {
        return Optional.ofNullable(clientRequestId);
    }

    public Optional<String> getVersion() {
        return Optional.ofNullable(version);
    }

    public Optional<OffsetDateTime> getDate() {
        return Optional.ofNullable(date);
    }

    public boolean isDeleteTypePermanent() {
        return deleteTypePermanent;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        DeleteBlobResponse that = (DeleteBlobResponse) o;
        return deleteTypePermanent == that.deleteTypePermanent && requestId.equals(that.requestId)
                && Objects.equals(clientRequestId, that.clientRequestId) && Objects.equals(version, that.version)
                && Objects.equals(date, that.date);
    }

    @Override
    public int hashCode() {
        return Objects.hash(requestId, clientRequestId, version, date, deleteTypePermanent);
    }

    @Override
    public String toString() {
        return "DeleteBlobResponse{" +
                "requestId='" + requestId + '\'' +
                ", clientRequestId='" + clientRequestId + '\'' +
                ", version='" + version + '\'' +
                ", date=" + date +
                ", deleteTypePermanent=" + deleteTypePermanent +
                '}';
    }
}
