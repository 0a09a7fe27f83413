package com.example.fundraisingdashboard.controller;

import com.example.fundraisingdashboard.exception.StoreAccessException;
import com.example.fundraisingdashboard.model.TableName;
import com.example.fundraisingdashboard.service.TableQueryService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Read access to the dashboard tables.
 */
@RestController
@RequestMapping("/api/tables")
@RequiredArgsConstructor
@Slf4j
public class TableController {

    private final TableQueryService tableQueryService;

    @GetMapping("/{table}")
    public ResponseEntity<?> getTable(@PathVariable String table) {
        Optional<TableName> resolved = TableName.fromTarget(table);
        if (resolved.isEmpty() || resolved.get() == TableName.ALL) {
            log.debug("Unknown table requested: {}", table);
            return ResponseEntity.notFound().build();
        }
        try {
            List<Map<String, String>> records = tableQueryService.records(resolved.get());
            return ResponseEntity.ok(records);
        } catch (StoreAccessException e) {
            log.error("Failed to read table {}", resolved.get().getValue(), e);
            return ResponseEntity.status(500).body(Map.of(
                "success", false,
                "message", "Failed to read " + resolved.get().getValue() + ": " + e.getMessage()
            ));
        }
    }
}
