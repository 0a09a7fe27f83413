package com.example.fundraisingdashboard.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Logical tables of the fundraising spreadsheet.
 * Each constant carries the sheet name, the column layout (in sheet order) and the key columns
 * used to locate a record. {@link #ALL} is the database-wide pseudo table.
 */
public enum TableName {

    CONTRIBUTIONS("Contributions",
        List.of("id", "funderId", "stateCode", "schoolId", "fiscalYear", "date", "initiative", "amount"),
        List.of("id")),
    PROSPECTS("Prospects",
        List.of("id", "stateCode", "funderName", "stage", "estimatedAmount", "probability", "nextAction",
            "dueDate", "owner", "description", "documents", "tags", "contactPerson", "contactEmail",
            "contactPhone", "lastContact", "notes"),
        List.of("id")),
    TARGETS("StateTargets",
        List.of("stateCode", "fiscalYear", "targetAmount"),
        List.of("stateCode", "fiscalYear")),
    SCHOOLS("Schools",
        List.of("id", "stateCode", "name", "program"),
        List.of("id")),
    USERS("Users",
        List.of("id", "email", "firstName", "lastName", "role", "status", "assignedStates", "requestedAt",
            "approvedAt", "approvedBy"),
        List.of("id")),
    FUNDERS("Funders",
        List.of("id", "name", "type", "priority", "owner"),
        List.of("id")),
    STATES("States",
        List.of("code", "name", "coordinator"),
        List.of("code")),
    ALL("*", List.of(), List.of());

    private final String sheetName;
    private final List<String> columns;
    private final List<String> keyColumns;

    TableName(String sheetName, List<String> columns, List<String> keyColumns) {
        this.sheetName = sheetName;
        this.columns = columns;
        this.keyColumns = keyColumns;
    }

    public String getSheetName() {
        return sheetName;
    }

    public List<String> getColumns() {
        return columns;
    }

    public List<String> getKeyColumns() {
        return keyColumns;
    }

    @JsonValue
    public String getValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Every concrete table, i.e. everything a snapshot captures.
     */
    public static List<TableName> dataTables() {
        return Arrays.stream(values())
            .filter(t -> t != ALL)
            .toList();
    }

    /**
     * Resolve a command target such as "contribution", "Prospects" or "database".
     */
    public static Optional<TableName> fromTarget(String target) {
        if (target == null || target.isBlank()) {
            return Optional.empty();
        }
        String t = target.trim().toLowerCase(Locale.ROOT).replace(' ', '_');
        switch (t) {
            case "contribution":
            case "contributions":
            case "donation":
            case "donations":
                return Optional.of(CONTRIBUTIONS);
            case "prospect":
            case "prospects":
            case "lead":
            case "leads":
            case "pipeline":
                return Optional.of(PROSPECTS);
            case "target":
            case "targets":
            case "state_target":
            case "state_targets":
            case "statetargets":
                return Optional.of(TARGETS);
            case "school":
            case "schools":
                return Optional.of(SCHOOLS);
            case "user":
            case "users":
                return Optional.of(USERS);
            case "funder":
            case "funders":
                return Optional.of(FUNDERS);
            case "state":
            case "states":
                return Optional.of(STATES);
            case "all":
            case "database":
            case "everything":
            case "all_tables":
                return Optional.of(ALL);
            default:
                return Optional.empty();
        }
    }
}
