package com.example.blobdelete.exceptions;

import com.example.blobdelete.request.RequiredParameter;

import java.util.Objects;

/**
 * Raised when a mandatory request parameter was never supplied.
 */
public class MissingParameterException extends BlobRequestException {

    private final RequiredParameter parameter;

    public MissingParameterException(RequiredParameter parameter) {
        super(Stage.VALIDATION, "Missing required parameter: " + Objects.requireNonNull(parameter, "parameter")
                .getDisplayName());
        this.parameter = parameter;
    }

    public RequiredParameter getParameter() {
        return parameter;
    }
}
