package com.example.fundraisingdashboard.controller;

import com.example.fundraisingdashboard.model.CommandResult;
import com.example.fundraisingdashboard.security.SecurityConfig;
import com.example.fundraisingdashboard.service.DataOperationsService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

/**
 * Chat entry point of the dashboard assistant.
 */
@RestController
@RequestMapping("/api/assistant")
@RequiredArgsConstructor
@Slf4j
public class AssistantController {

    private final DataOperationsService dataOperationsService;

    /**
     * Handle a chat message: a data request, or a "confirm/cancel &lt;id&gt;" reply.
     */
    @PostMapping("/message")
    public ResponseEntity<CommandResult> handleMessage(@RequestBody Map<String, String> request,
                                                       Authentication authentication) {
        String message = request.get("message");
        if (message == null || message.trim().isEmpty()) {
            return ResponseEntity.badRequest().body(CommandResult.failure("Message is required"));
        }

        log.info("Assistant message from {}: {}", SecurityConfig.actorOf(authentication), message);
        return ResponseEntity.ok(dataOperationsService.handleMessage(message,
            SecurityConfig.actorOf(authentication), SecurityConfig.isAdmin(authentication)));
    }
}
