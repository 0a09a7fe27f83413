package com.example.fundraisingdashboard.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;
import java.util.Optional;

/**
 * The fixed operation vocabulary of the change pipeline.
 */
public enum OperationKind {
    CREATE,
    UPDATE,
    DELETE,
    BULK_CREATE,
    BULK_UPDATE,
    BULK_DELETE,
    ERASE_ALL,
    REVERT,
    BACKUP,
    RESTORE;

    @JsonValue
    public String getValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    public boolean isBulk() {
        return this == BULK_CREATE || this == BULK_UPDATE || this == BULK_DELETE;
    }

    /**
     * Parse an action name ("bulk_delete", "Bulk-Delete", ...). Unknown actions yield empty.
     */
    public static Optional<OperationKind> fromAction(String action) {
        if (action == null || action.isBlank()) {
            return Optional.empty();
        }
        String normalized = action.trim().toUpperCase(Locale.ROOT).replace('-', '_').replace(' ', '_');
        for (OperationKind kind : values()) {
            if (kind.name().equals(normalized)) {
                return Optional.of(kind);
            }
        }
        return Optional.empty();
    }
}
