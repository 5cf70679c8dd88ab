package com.example.blobdelete.exceptions;

import com.example.blobdelete.request.RequiredParameter;
import org.junit.jupiter.api.Test;

import java.io.IOException;

import static org.junit.jupiter.api.Assertions.*;

class BlobRequestExceptionTest {

    @Test
    void eachKindReportsItsStage() {
        assertEquals(BlobRequestException.Stage.VALIDATION,
                new MissingParameterException(RequiredParameter.BLOB_NAME).getStage());
        assertEquals(BlobRequestException.Stage.TRANSPORT,
                new TransportException("reset", new IOException("reset")).getStage());
        assertEquals(BlobRequestException.Stage.STATUS, new UnexpectedStatusException(409, "").getStage());
        assertEquals(BlobRequestException.Stage.RESPONSE_PARSING, new ResponseParseException("bad").getStage());
    }

    @Test
    void retryability() {
        assertFalse(new MissingParameterException(RequiredParameter.CONTAINER_NAME).isRetryable());
        assertTrue(new TransportException("reset", new IOException("reset")).isRetryable());
        assertTrue(new UnexpectedStatusException(503, "").isRetryable());
        assertTrue(new UnexpectedStatusException(429, "").isRetryable());
        assertTrue(new UnexpectedStatusException(408, "").isRetryable());
        assertFalse(new UnexpectedStatusException(404, "").isRetryable());
        assertFalse(new ResponseParseException("bad").isRetryable());
    }

    @Test
    void unexpectedStatus_withoutServiceIds() {
        UnexpectedStatusException ex = new UnexpectedStatusException(409, null);

        assertEquals("Unexpected HTTP status 409", ex.getMessage());
        assertEquals("", ex.getBody());
        assertTrue(ex.getErrorCode().isEmpty());
        assertTrue(ex.getRequestId().isEmpty());
    }

    @Test
    void missingParameter_namesTheField() {
        MissingParameterException ex = new MissingParameterException(RequiredParameter.DELETE_SNAPSHOTS_METHOD);

        assertEquals(RequiredParameter.DELETE_SNAPSHOTS_METHOD, ex.getParameter());
        assertEquals("Missing required parameter: delete snapshots method", ex.getMessage());
    }
}
