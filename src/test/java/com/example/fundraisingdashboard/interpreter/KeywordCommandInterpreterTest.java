package com.example.fundraisingdashboard.interpreter;

import com.example.fundraisingdashboard.model.Command;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class KeywordCommandInterpreterTest {

    private final KeywordCommandInterpreter interpreter = new KeywordCommandInterpreter(
        Clock.fixed(Instant.parse("2024-06-01T10:00:00Z"), ZoneOffset.UTC));

    @Test
    void testCreateContribution() {
        Command command = interpreter.parse("Add a contribution of ₹50,000 from F001 for Karnataka FY24-25").orElseThrow();

        assertEquals("create", command.getAction());
        assertEquals("contributions", command.getTarget());
        Map<String, Object> params = command.getParameters();
        assertEquals(50000.0, params.get("amount"));
        assertEquals("F001", params.get("funderId"));
        assertEquals("KA", params.get("stateCode"));
        assertEquals("FY24-25", params.get("fiscalYear"));
        assertEquals("2024-06-01", params.get("date"));
    }

    @Test
    void testCreateUsesCurrentFiscalYear() {
        Command command = interpreter.parse("record a donation of 1200 in kerala").orElseThrow();

        assertEquals("FY24-25", command.getParameters().get("fiscalYear"));
        assertEquals("KL", command.getParameters().get("stateCode"));
    }

    @Test
    void testFiscalYearBeforeApril() {
        KeywordCommandInterpreter march = new KeywordCommandInterpreter(
            Clock.fixed(Instant.parse("2025-03-31T10:00:00Z"), ZoneOffset.UTC));

        assertEquals("FY24-25", march.currentFiscalYear());
    }

    @Test
    void testUpdateProspect() {
        Command command = interpreter.parse("update prospect P009 stage to Negotiation").orElseThrow();

        assertEquals("update", command.getAction());
        assertEquals("prospects", command.getTarget());
        assertEquals("P009", command.getParameters().get("id"));
        assertEquals("Negotiation", command.getParameters().get("stage"));
    }

    @Test
    void testUpdateTarget() {
        Command command = interpreter.parse("set the target for Tamil Nadu FY24-25 targetAmount = 900000").orElseThrow();

        assertEquals("targets", command.getTarget());
        assertEquals("TN", command.getParameters().get("stateCode"));
        assertEquals("FY24-25", command.getParameters().get("fiscalYear"));
        assertEquals("900000", command.getParameters().get("targetAmount"));
    }

    @Test
    void testDeleteVariants() {
        Command single = interpreter.parse("delete prospect P009").orElseThrow();
        assertEquals("delete", single.getAction());
        assertEquals("P009", single.getParameters().get("id"));

        Command several = interpreter.parse("remove prospects P009, P010 and P011").orElseThrow();
        assertEquals("bulk_delete", several.getAction());
        assertEquals(List.of("P009", "P010", "P011"), several.getParameters().get("ids"));

        Command all = interpreter.parse("delete all schools").orElseThrow();
        assertEquals("bulk_delete", all.getAction());
        assertEquals("schools", all.getTarget());
        assertEquals(true, all.getParameters().get("all"));
    }

    @Test
    void testEraseEverything() {
        Command command = interpreter.parse("please erase everything").orElseThrow();

        assertEquals("erase_all", command.getAction());
        assertEquals("all", command.getTarget());
        assertTrue(command.getRequiresConfirmation());
    }

    @Test
    void testRevertBackupRestore() {
        Command revert = interpreter.parse("undo change-1717236000000-abc123def").orElseThrow();
        assertEquals("revert", revert.getAction());
        assertEquals("change-1717236000000-abc123def", revert.getParameters().get("changeId"));

        Command backup = interpreter.parse("take a backup before the board meeting").orElseThrow();
        assertEquals("backup", backup.getAction());

        Command restore = interpreter.parse("restore snapshot-1717236000000-a1b2c3").orElseThrow();
        assertEquals("restore", restore.getAction());
        assertEquals("snapshot-1717236000000-a1b2c3", restore.getParameters().get("snapshotId"));
    }

    @Test
    void testNotDataOperations() {
        assertTrue(interpreter.parse("what is our total for FY24-25?").isEmpty());
        assertTrue(interpreter.parse("show me the pipeline").isEmpty());
        assertTrue(interpreter.parse("revert it please").isEmpty());
        assertTrue(interpreter.parse("delete prospect").isEmpty());
        assertTrue(interpreter.parse("").isEmpty());
        assertTrue(interpreter.parse(null).isEmpty());
    }
}
