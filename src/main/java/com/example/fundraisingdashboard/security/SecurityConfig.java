package com.example.fundraisingdashboard.security;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpMethod;
import org.springframework.security.config.Customizer;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.annotation.web.configuration.EnableWebSecurity;
import org.springframework.security.config.annotation.web.configurers.AbstractHttpConfigurer;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.GrantedAuthority;
import org.springframework.security.core.userdetails.User;
import org.springframework.security.core.userdetails.UserDetails;
import org.springframework.security.core.userdetails.UserDetailsService;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.security.provisioning.InMemoryUserDetailsManager;
import org.springframework.security.web.SecurityFilterChain;

/**
 * HTTP Basic security for the dashboard API.
 *
 * Roles:
 * - ADMIN: full access, including confirmations, reverts, snapshots and restores
 * - REGIONAL_MANAGER: submit commands, cancel pending operations, read status and tables
 */
@Configuration
@EnableWebSecurity
public class SecurityConfig {

    public static final String ADMIN = "ADMIN";
    public static final String REGIONAL_MANAGER = "REGIONAL_MANAGER";

    @Bean
    public SecurityFilterChain filterChain(HttpSecurity http) throws Exception {
        http
            .csrf(AbstractHttpConfigurer::disable)
            .sessionManagement(session ->
                session.sessionCreationPolicy(SessionCreationPolicy.STATELESS))
            .authorizeHttpRequests(auth -> auth
                // Command submission and cancellation - both roles
                .requestMatchers(HttpMethod.POST, "/api/assistant/message").hasAnyRole(ADMIN, REGIONAL_MANAGER)
                .requestMatchers(HttpMethod.POST, "/api/operations").hasAnyRole(ADMIN, REGIONAL_MANAGER)
                .requestMatchers(HttpMethod.POST, "/api/operations/*/cancel").hasAnyRole(ADMIN, REGIONAL_MANAGER)

                // Confirmations, reverts and snapshots - ADMIN only
                .requestMatchers(HttpMethod.POST, "/api/operations/*/confirm").hasRole(ADMIN)
                .requestMatchers(HttpMethod.POST, "/api/changes/*/revert").hasRole(ADMIN)
                .requestMatchers(HttpMethod.POST, "/api/snapshots/**").hasRole(ADMIN)

                // Read-only endpoints - both roles
                .requestMatchers(HttpMethod.GET, "/api/**").hasAnyRole(ADMIN, REGIONAL_MANAGER)

                // All other requests require authentication
                .anyRequest().authenticated()
            )
            .httpBasic(Customizer.withDefaults());

        return http.build();
    }

    @Bean
    public PasswordEncoder passwordEncoder() {
        return new BCryptPasswordEncoder();
    }

    @Bean
    public UserDetailsService userDetailsService(PasswordEncoder passwordEncoder, SecurityProperties properties) {
        UserDetails admin = User.builder()
                .username(properties.getAdminUsername())
                .password(passwordEncoder.encode(properties.getAdminPassword()))
                .roles(ADMIN)
                .build();

        UserDetails manager = User.builder()
                .username(properties.getManagerUsername())
                .password(passwordEncoder.encode(properties.getManagerPassword()))
                .roles(REGIONAL_MANAGER)
                .build();

        return new InMemoryUserDetailsManager(admin, manager);
    }

    /**
     * Whether the caller holds the ADMIN role. Unauthenticated callers are not.
     */
    public static boolean isAdmin(Authentication authentication) {
        if (authentication == null) {
            return false;
        }
        for (GrantedAuthority authority : authentication.getAuthorities()) {
            if (("ROLE_" + ADMIN).equals(authority.getAuthority())) {
                return true;
            }
        }
        return false;
    }

    public static String actorOf(Authentication authentication) {
        return authentication != null ? authentication.getName() : null;
    }
}
