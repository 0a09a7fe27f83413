package com.example.fundraisingdashboard.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Structured command produced by a command interpreter (or posted directly by API clients).
 * {@code riskLevel} and {@code requiresConfirmation} are the interpreter's suggestion; the
 * pipeline classifies independently and only lets a command tighten gating.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class Command {
    private String action;
    private String target;
    private Map<String, Object> parameters = new LinkedHashMap<>();
    private String description;
    private String riskLevel;
    private Boolean requiresConfirmation;

    public Command(String action, String target, Map<String, Object> parameters, String description) {
        this(action, target, parameters, description, null, null);
    }
}
