package com.example.blobdelete.request;

import java.util.Objects;
import java.util.UUID;

/**
 * Identifier of an active lease on a blob. The service issues lease ids as GUIDs.
 */
public final class LeaseId {

    private final UUID value;

    private LeaseId(UUID value) {
        this.value = value;
    }

    public static LeaseId of(UUID value) {
        return new LeaseId(Objects.requireNonNull(value, "value"));
    }

    /**
     * Parses the canonical 8-4-4-4-12 hex form. Shortened groups such as {@code 1-2-3-4-5} are rejected, since they
     * would be sent as a different id than the one given.
     */
    public static LeaseId parse(String value) {
        Objects.requireNonNull(value, "value");
        String trimmed = value.trim();
        UUID uuid;
        try {
            uuid = UUID.fromString(trimmed);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid lease id: '" + value + "'", e);
        }
        if (!uuid.toString().equalsIgnoreCase(trimmed)) {
            throw new IllegalArgumentException("Invalid lease id: '" + value + "', expected canonical GUID form");
        }
        return new LeaseId(uuid);
    }

    public UUID getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof LeaseId)) {
            return false;
        }
        return value.equals(((LeaseId) o).value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return value.toString();
    }
}
