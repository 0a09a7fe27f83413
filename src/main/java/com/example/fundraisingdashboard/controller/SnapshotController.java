package com.example.fundraisingdashboard.controller;

import com.example.fundraisingdashboard.model.BackupSnapshot;
import com.example.fundraisingdashboard.model.CommandResult;
import com.example.fundraisingdashboard.security.SecurityConfig;
import com.example.fundraisingdashboard.service.DataOperationsService;
import com.example.fundraisingdashboard.service.SnapshotManager;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.*;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * REST controller for backup snapshots.
 */
@RestController
@RequestMapping("/api/snapshots")
@RequiredArgsConstructor
@Slf4j
public class SnapshotController {

    private final DataOperationsService dataOperationsService;
    private final SnapshotManager snapshotManager;

    /**
     * Take a backup of every table now.
     */
    @PostMapping
    public ResponseEntity<CommandResult> createSnapshot(@RequestBody(required = false) Map<String, String> request,
                                                        Authentication authentication) {
        String description = request != null ? request.get("description") : null;
        log.info("Manual snapshot requested by {}", SecurityConfig.actorOf(authentication));
        return ResponseEntity.ok(dataOperationsService.createSnapshot(description,
            SecurityConfig.actorOf(authentication)));
    }

    /**
     * Retained snapshots, newest first, without their row data.
     */
    @GetMapping
    public ResponseEntity<List<BackupSnapshot>> listSnapshots() {
        return ResponseEntity.ok(snapshotManager.list());
    }

    /**
     * Get snapshot information.
     */
    @GetMapping("/{snapshotId}")
    public ResponseEntity<Map<String, Object>> getSnapshotInfo(@PathVariable String snapshotId) {
        return snapshotManager.get(snapshotId)
            .map(snapshot -> {
                Map<String, Object> info = new HashMap<>();
                info.put("id", snapshot.getId());
                info.put("timestamp", snapshot.getTimestamp());
                info.put("description", snapshot.getDescription());
                info.put("sizeBytes", snapshot.getSizeBytes());
                info.put("rowCounts", snapshot.getRowCounts());
                return ResponseEntity.ok(info);
            })
            .orElseGet(() -> ResponseEntity.notFound().build());
    }

    /**
     * Request a restore. The answer is a confirmation prompt; nothing is overwritten until confirmed.
     */
    @PostMapping("/{snapshotId}/restore")
    public ResponseEntity<CommandResult> restoreSnapshot(@PathVariable String snapshotId,
                                                         Authentication authentication) {
        log.info("Restore from {} requested by {}", snapshotId, SecurityConfig.actorOf(authentication));
        return ResponseEntity.ok(dataOperationsService.restoreSnapshot(snapshotId,
            SecurityConfig.actorOf(authentication)));
    }
}
