package com.example.fundraisingdashboard.model;

import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The unit of work submitted to the pipeline.
 *
 * Payload conventions:
 * <ul>
 *   <li>single create/update/delete: the record fields (key fields included) directly in the payload</li>
 *   <li>bulk variants: {@code records} as a list of field maps, or {@code ids} for single-key tables</li>
 *   <li>{@code all: true} selects every live row of the table (deletes only)</li>
 *   <li>restore: {@code snapshotId}</li>
 * </ul>
 */
@Data
@NoArgsConstructor
public class Operation {

    public static final String RECORDS = "records";
    public static final String IDS = "ids";
    public static final String ALL = "all";
    public static final String SNAPSHOT_ID = "snapshotId";
    public static final String CHANGE_ID = "changeId";

    private OperationKind kind;
    private TableName table;
    private Map<String, Object> payload = new LinkedHashMap<>();
    private String description;
    private RiskTier riskTier;
    private boolean requiresConfirmation;

    /**
     * Principal that submitted the operation, if known.
     */
    private String requestedBy;

    /**
     * Set on inverse operations built by the revert engine.
     */
    private String revertOf;

    public Operation(OperationKind kind, TableName table, Map<String, Object> payload, String description) {
        this.kind = kind;
        this.table = table;
        this.payload = payload != null ? new LinkedHashMap<>(payload) : new LinkedHashMap<>();
        this.description = description != null && !description.isBlank()
            ? description
            : defaultDescription(kind, table);
    }

    public static String defaultDescription(OperationKind kind, TableName table) {
        return kind.getValue() + " operation on " + table.getValue();
    }

    /**
     * True when the payload selects every live row instead of naming records.
     */
    public boolean selectsAll() {
        Object all = payload.get(ALL);
        return Boolean.TRUE.equals(all) || "true".equalsIgnoreCase(String.valueOf(all));
    }

    /**
     * Normalize the payload into one field map per addressed record.
     */
    @SuppressWarnings("unchecked")
    public List<Map<String, Object>> records() {
        List<Map<String, Object>> result = new ArrayList<>();
        Object records = payload.get(RECORDS);
        if (records instanceof Collection) {
            for (Object item : (Collection<Object>) records) {
                if (item instanceof Map) {
                    result.add(new LinkedHashMap<>((Map<String, Object>) item));
                }
            }
            return result;
        }

        Object ids = payload.get(IDS);
        if (ids instanceof Collection && table != null && table.getKeyColumns().size() == 1) {
            String keyColumn = table.getKeyColumns().get(0);
            for (Object id : (Collection<Object>) ids) {
                Map<String, Object> selector = new LinkedHashMap<>();
                selector.put(keyColumn, id);
                result.add(selector);
            }
            return result;
        }

        Map<String, Object> single = new LinkedHashMap<>(payload);
        single.remove(ALL);
        single.remove(SNAPSHOT_ID);
        single.remove(CHANGE_ID);
        if (!single.isEmpty()) {
            result.add(single);
        }
        return result;
    }

    /**
     * Number of records the payload addresses; -1 when it selects the whole table.
     */
    public int payloadSize() {
        return selectsAll() ? -1 : records().size();
    }

    public String payloadString(String key) {
        Object value = payload.get(key);
        return value != null ? String.valueOf(value) : null;
    }
}
