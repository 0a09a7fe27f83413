package com.example.fundraisingdashboard.service.handler;

import com.example.fundraisingdashboard.model.TableName;
import com.example.fundraisingdashboard.store.TabularStore;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import java.util.Set;

/**
 * Dashboard accounts. New users start out pending until an admin approves them.
 */
@Component
public class UserTableHandler extends TableHandler {

    private static final Set<String> ROLES = Set.of("admin", "regional_manager", "pending");
    private static final Set<String> STATUSES = Set.of("approved", "pending", "rejected");

    public UserTableHandler(TabularStore store, Clock clock) {
        super(store, clock);
    }

    @Override
    public TableName table() {
        return TableName.USERS;
    }

    @Override
    protected String idPrefix() {
        return "user";
    }

    @Override
    protected void applyDefaults(Map<String, String> record) {
        if (isBlank(record.get("role"))) {
            record.put("role", "pending");
        }
        if (isBlank(record.get("status"))) {
            record.put("status", "pending");
        }
        if (isBlank(record.get("requestedAt"))) {
            record.put("requestedAt", Instant.now(clock).toString());
        }
    }

    @Override
    protected void validate(Map<String, String> record) {
        requirePresent(record, "email");
        if (!ROLES.contains(record.get("role"))) {
            throw new IllegalArgumentException("unknown role '" + record.get("role") + "'");
        }
        if (!STATUSES.contains(record.get("status"))) {
            throw new IllegalArgumentException("unknown status '" + record.get("status") + "'");
        }
    }
}
