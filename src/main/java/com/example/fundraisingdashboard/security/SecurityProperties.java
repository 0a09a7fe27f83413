package com.example.fundraisingdashboard.security;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Credentials of the built-in dashboard accounts.
 */
@Configuration
@ConfigurationProperties(prefix = "dashboard.security")
@Data
public class SecurityProperties {
    private String adminUsername = "admin";
    private String adminPassword = "admin123";
    private String managerUsername = "manager";
    private String managerPassword = "manager123";
}
