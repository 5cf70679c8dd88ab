package com.example.blobdelete.request;

/**
 * Mandatory parameters of a delete blob request, declared in the order in which missing ones are reported.
 */
public enum RequiredParameter {
    CONTAINER_NAME("container name"),
    BLOB_NAME("blob name"),
    DELETE_SNAPSHOTS_METHOD("delete snapshots method");

    private final String displayName;

    RequiredParameter(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }
}
