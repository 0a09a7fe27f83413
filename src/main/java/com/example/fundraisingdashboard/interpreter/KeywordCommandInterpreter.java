package com.example.fundraisingdashboard.interpreter;

import com.example.fundraisingdashboard.model.Command;
import com.example.fundraisingdashboard.model.TableName;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Deterministic interpreter for the fixed operation vocabulary, driven by keywords.
 *
 * <pre>
 *   revert change-1712345678901-abc123def
 *   restore snapshot-1712345678901-a1b2c3
 *   create a backup before the board meeting
 *   erase everything
 *   add contribution of 50000 from F001 for karnataka FY24-25
 *   update prospect P009 stage to Negotiation
 *   delete prospects P009, P010
 *   delete all schools
 * </pre>
 */
@Slf4j
@Component
public class KeywordCommandInterpreter implements CommandInterpreter {

    private static final Pattern REVERT = Pattern.compile("\\b(revert|undo)\\b");
    private static final Pattern RESTORE = Pattern.compile("\\brestore\\b");
    private static final Pattern BACKUP = Pattern.compile("\\b(backup|back up|snapshot)\\b");
    private static final Pattern ERASE = Pattern.compile(
        "\\b(erase|wipe|clear|delete|remove)\\b.*\\b(everything|all data|all tables|entire database|whole database)\\b");
    private static final Pattern DELETE = Pattern.compile("\\b(delete|remove)\\b");
    private static final Pattern UPDATE = Pattern.compile("\\b(update|change|set|modify|edit)\\b");
    private static final Pattern CREATE = Pattern.compile("\\b(create|add|new|record|insert)\\b");
    private static final Pattern ALL = Pattern.compile("\\ball\\b");

    private static final Pattern CHANGE_ID = Pattern.compile("\\bchange-[A-Za-z0-9-]+");
    private static final Pattern SNAPSHOT_ID = Pattern.compile("\\bsnapshot-[A-Za-z0-9-]+");
    private static final Pattern RECORD_ID = Pattern.compile(
        "\\b((?:contrib|prospect|school|funder|user)-[A-Za-z0-9]+|[A-Z]{1,3}\\d{2,})\\b");
    private static final Pattern FUNDER_ID = Pattern.compile("\\b(F\\d+)\\b");
    private static final Pattern FISCAL_YEAR = Pattern.compile("\\bFY\\s?(\\d{2})-(\\d{2})\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern AMOUNT = Pattern.compile("(?<![\\w.-])₹?(\\d{1,3}(?:,\\d{3})+|\\d+)(\\.\\d+)?(?![\\w-])");
    private static final Pattern STATE_CODE = Pattern.compile("\\bstate\\s+([A-Z]{2})\\b");
    private static final Pattern ASSIGNMENT = Pattern.compile(
        "\\b([A-Za-z]+)\\s*(?:=|\\bto\\b)\\s*(\"[^\"]*\"|'[^']*'|[^\\s,]+)");

    private static final Map<String, String> STATES = new LinkedHashMap<>();

    static {
        STATES.put("karnataka", "KA");
        STATES.put("tamil nadu", "TN");
        STATES.put("tamilnadu", "TN");
        STATES.put("kerala", "KL");
        STATES.put("maharashtra", "MH");
    }

    private final Clock clock;

    public KeywordCommandInterpreter(Clock clock) {
        this.clock = clock;
    }

    @Override
    public Optional<Command> parse(String text) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        String message = text.trim();
        String lower = message.toLowerCase(Locale.ROOT);

        Optional<Command> command;
        if (REVERT.matcher(lower).find()) {
            command = parseRevert(message);
        } else if (RESTORE.matcher(lower).find()) {
            command = parseRestore(message);
        } else if (BACKUP.matcher(lower).find() && !DELETE.matcher(lower).find()) {
            command = Optional.of(new Command("backup", "database", params("description", summarize(message)),
                "Create data backup snapshot", "low", false));
        } else if (ERASE.matcher(lower).find()) {
            command = Optional.of(new Command("erase_all", "all", new LinkedHashMap<>(),
                "Erase all data in every table", "critical", true));
        } else {
            command = parseRecordCommand(message, lower);
        }

        if (command.isEmpty()) {
            log.debug("Not a data operation: '{}'", summarize(message));
        }
        return command;
    }

    // ==================== Command Shapes ====================

    private Optional<Command> parseRevert(String message) {
        Matcher m = CHANGE_ID.matcher(message);
        if (!m.find()) {
            return Optional.empty();
        }
        String changeId = m.group();
        return Optional.of(new Command("revert", "change", params("changeId", changeId),
            "Revert change: " + changeId, "medium", false));
    }

    private Optional<Command> parseRestore(String message) {
        Matcher m = SNAPSHOT_ID.matcher(message);
        if (!m.find()) {
            return Optional.empty();
        }
        String snapshotId = m.group();
        return Optional.of(new Command("restore", "database", params("snapshotId", snapshotId),
            "Restore from backup snapshot " + snapshotId, "critical", true));
    }

    private Optional<Command> parseRecordCommand(String message, String lower) {
        Optional<TableName> detected = detectTable(lower);
        if (detected.isEmpty()) {
            return Optional.empty();
        }
        TableName table = detected.get();

        if (DELETE.matcher(lower).find()) {
            return parseDelete(message, lower, table);
        }
        if (UPDATE.matcher(lower).find()) {
            return parseUpdate(message, table);
        }
        if (CREATE.matcher(lower).find()) {
            return parseCreate(message, lower, table);
        }
        return Optional.empty();
    }

    private Optional<Command> parseDelete(String message, String lower, TableName table) {
        if (ALL.matcher(lower).find()) {
            return Optional.of(new Command("bulk_delete", table.getValue(), params("all", true),
                "Delete all " + table.getValue() + " records"));
        }

        if (table == TableName.TARGETS) {
            Map<String, Object> key = targetKey(message, lower);
            if (key.size() < 2) {
                return Optional.empty();
            }
            return Optional.of(new Command("delete", table.getValue(), key,
                "Delete target " + key.get("stateCode") + " " + key.get("fiscalYear")));
        }

        List<String> ids = recordIds(message, table);
        if (ids.isEmpty()) {
            return Optional.empty();
        }
        if (ids.size() > 1) {
            return Optional.of(new Command("bulk_delete", table.getValue(), params("ids", ids),
                "Delete " + ids.size() + " " + table.getValue() + " records: " + String.join(", ", ids)));
        }
        return Optional.of(new Command("delete", table.getValue(), params("id", ids.get(0)),
            "Delete " + table.getValue() + " record " + ids.get(0)));
    }

    private Optional<Command> parseUpdate(String message, TableName table) {
        Map<String, Object> fields = assignments(message, table);
        if (fields.isEmpty()) {
            return Optional.empty();
        }

        Map<String, Object> parameters = new LinkedHashMap<>();
        String subject;
        if (table == TableName.TARGETS) {
            parameters.putAll(targetKey(message, message.toLowerCase(Locale.ROOT)));
            if (parameters.size() < 2) {
                return Optional.empty();
            }
            subject = parameters.get("stateCode") + " " + parameters.get("fiscalYear");
        } else {
            List<String> ids = recordIds(message, table);
            if (ids.size() != 1) {
                return Optional.empty();
            }
            parameters.put(table.getKeyColumns().get(0), ids.get(0));
            subject = ids.get(0);
        }
        parameters.putAll(fields);
        return Optional.of(new Command("update", table.getValue(), parameters,
            "Update " + table.getValue() + " record " + subject + ": " + fields.keySet()));
    }

    private Optional<Command> parseCreate(String message, String lower, TableName table) {
        Map<String, Object> fields = new LinkedHashMap<>();
        Optional<Double> amount = amount(message);
        String state = state(message, lower);

        switch (table) {
            case CONTRIBUTIONS:
                fields.put("amount", amount.orElse(0d));
                Matcher funder = FUNDER_ID.matcher(message);
                if (funder.find()) {
                    fields.put("funderId", funder.group(1));
                }
                if (state != null) {
                    fields.put("stateCode", state);
                }
                fields.put("fiscalYear", fiscalYear(message).orElse(currentFiscalYear()));
                fields.put("date", LocalDate.now(clock).toString());
                break;
            case PROSPECTS:
                fields.put("estimatedAmount", amount.orElse(0d));
                if (state != null) {
                    fields.put("stateCode", state);
                }
                fields.put("stage", "Lead");
                fields.put("probability", 0.5);
                break;
            case TARGETS:
                if (state == null) {
                    return Optional.empty();
                }
                fields.put("stateCode", state);
                fields.put("fiscalYear", fiscalYear(message).orElse(currentFiscalYear()));
                fields.put("targetAmount", amount.orElse(0d));
                break;
            default:
                if (state != null && table.getColumns().contains("stateCode")) {
                    fields.put("stateCode", state);
                }
                break;
        }
        fields.putAll(assignments(message, table));

        return Optional.of(new Command("create", table.getValue(), fields,
            "Create " + table.getValue() + " record" + (amount.isPresent() ? " of " + format(amount.get()) : "")));
    }

    // ==================== Extraction ====================

    private static Optional<TableName> detectTable(String lower) {
        String[][] keywords = {
            {"contribution", "contributions"},
            {"donation", "contributions"},
            {"prospect", "prospects"},
            {"lead", "prospects"},
            {"pipeline", "prospects"},
            {"target", "targets"},
            {"school", "schools"},
            {"user", "users"},
            {"funder", "funders"},
        };
        for (String[] keyword : keywords) {
            if (Pattern.compile("\\b" + keyword[0] + "s?\\b").matcher(lower).find()) {
                return TableName.fromTarget(keyword[1]);
            }
        }
        return Optional.empty();
    }

    private static List<String> recordIds(String message, TableName table) {
        Set<String> ids = new LinkedHashSet<>();
        Matcher m = RECORD_ID.matcher(message);
        while (m.find()) {
            String id = m.group(1);
            if (id.startsWith("FY")) {
                continue;
            }
            if (table != TableName.FUNDERS && FUNDER_ID.matcher(id).matches()) {
                continue;
            }
            ids.add(id);
        }
        return new ArrayList<>(ids);
    }

    private Map<String, Object> targetKey(String message, String lower) {
        Map<String, Object> key = new LinkedHashMap<>();
        String state = state(message, lower);
        if (state != null) {
            key.put("stateCode", state);
        }
        fiscalYear(message).ifPresent(fy -> key.put("fiscalYear", fy));
        return key;
    }

    /**
     * "field to value" and "field = value" pairs naming columns of the table.
     */
    private static Map<String, Object> assignments(String message, TableName table) {
        Map<String, Object> fields = new LinkedHashMap<>();
        Matcher m = ASSIGNMENT.matcher(message);
        while (m.find()) {
            String column = column(table, m.group(1));
            if (column == null || table.getKeyColumns().contains(column)) {
                continue;
            }
            String value = m.group(2);
            if (value.length() >= 2 && (value.startsWith("\"") || value.startsWith("'"))) {
                value = value.substring(1, value.length() - 1);
            }
            fields.put(column, value);
        }
        return fields;
    }

    private static String column(TableName table, String word) {
        for (String column : table.getColumns()) {
            if (column.equalsIgnoreCase(word)) {
                return column;
            }
        }
        return null;
    }

    private static Optional<Double> amount(String message) {
        String withoutFiscalYears = FISCAL_YEAR.matcher(message).replaceAll(" ");
        Matcher m = AMOUNT.matcher(withoutFiscalYears);
        if (!m.find()) {
            return Optional.empty();
        }
        String digits = m.group(1).replace(",", "") + (m.group(2) != null ? m.group(2) : "");
        return Optional.of(Double.parseDouble(digits));
    }

    private static String state(String message, String lower) {
        for (Map.Entry<String, String> entry : STATES.entrySet()) {
            if (lower.contains(entry.getKey())) {
                return entry.getValue();
            }
        }
        Matcher m = STATE_CODE.matcher(message);
        return m.find() ? m.group(1) : null;
    }

    private static Optional<String> fiscalYear(String message) {
        Matcher m = FISCAL_YEAR.matcher(message);
        return m.find() ? Optional.of("FY" + m.group(1) + "-" + m.group(2)) : Optional.empty();
    }

    /**
     * Fiscal years run April to March.
     */
    String currentFiscalYear() {
        LocalDate today = LocalDate.now(clock);
        int start = today.getMonthValue() >= 4 ? today.getYear() : today.getYear() - 1;
        return String.format("FY%02d-%02d", start % 100, (start + 1) % 100);
    }

    private static Map<String, Object> params(String key, Object value) {
        Map<String, Object> parameters = new LinkedHashMap<>();
        parameters.put(key, value);
        return parameters;
    }

    private static String summarize(String message) {
        return message.length() > 50 ? message.substring(0, 50) + "..." : message;
    }

    private static String format(double amount) {
        return amount == Math.rint(amount) ? String.valueOf((long) amount) : String.valueOf(amount);
    }
}
