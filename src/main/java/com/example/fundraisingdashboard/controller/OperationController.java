package com.example.fundraisingdashboard.controller;

import com.example.fundraisingdashboard.model.ChangeRecord;
import com.example.fundraisingdashboard.model.Command;
import com.example.fundraisingdashboard.model.CommandResult;
import com.example.fundraisingdashboard.model.PipelineEvent;
import com.example.fundraisingdashboard.model.PipelineStatus;
import com.example.fundraisingdashboard.security.SecurityConfig;
import com.example.fundraisingdashboard.service.DataOperationsService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * REST API of the change pipeline: commands, confirmations, reverts and status.
 */
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
@Slf4j
public class OperationController {

    private static final int MAX_CHANGES_PAGE = 100;

    private final DataOperationsService dataOperationsService;

    // ==================== Operations ====================

    /**
     * Submit a structured command.
     */
    @PostMapping("/operations")
    public ResponseEntity<CommandResult> executeCommand(@RequestBody Command command,
                                                        Authentication authentication) {
        if (command.getAction() == null || command.getAction().trim().isEmpty()) {
            return ResponseEntity.badRequest().body(CommandResult.failure("Action is required"));
        }

        log.info("Command {} on {} from {}", command.getAction(), command.getTarget(),
            SecurityConfig.actorOf(authentication));
        return ResponseEntity.ok(dataOperationsService.executeCommand(command,
            SecurityConfig.actorOf(authentication), SecurityConfig.isAdmin(authentication)));
    }

    @PostMapping("/operations/{pendingId}/confirm")
    public ResponseEntity<CommandResult> confirmOperation(@PathVariable String pendingId,
                                                          Authentication authentication) {
        log.info("Confirming operation: {}", pendingId);
        return ResponseEntity.ok(dataOperationsService.confirmOperation(pendingId,
            SecurityConfig.actorOf(authentication)));
    }

    @PostMapping("/operations/{pendingId}/cancel")
    public ResponseEntity<CommandResult> cancelOperation(@PathVariable String pendingId,
                                                         Authentication authentication) {
        log.info("Cancelling operation: {}", pendingId);
        return ResponseEntity.ok(dataOperationsService.cancelOperation(pendingId,
            SecurityConfig.actorOf(authentication)));
    }

    // ==================== Changes ====================

    @PostMapping("/changes/{changeId}/revert")
    public ResponseEntity<CommandResult> revertChange(@PathVariable String changeId,
                                                      Authentication authentication) {
        log.info("Reverting change: {}", changeId);
        return ResponseEntity.ok(dataOperationsService.revertChange(changeId,
            SecurityConfig.actorOf(authentication)));
    }

    /**
     * Most recent changes, newest first.
     */
    @GetMapping("/changes")
    public ResponseEntity<List<ChangeRecord>> getRecentChanges(@RequestParam(defaultValue = "20") int limit) {
        int bounded = Math.max(1, Math.min(limit, MAX_CHANGES_PAGE));
        return ResponseEntity.ok(dataOperationsService.recentChanges(bounded));
    }

    @GetMapping("/status")
    public ResponseEntity<PipelineStatus> getStatus() {
        return ResponseEntity.ok(dataOperationsService.getStatus());
    }

    @GetMapping("/events")
    public ResponseEntity<List<PipelineEvent>> getEvents() {
        return ResponseEntity.ok(dataOperationsService.getEvents());
    }
}
