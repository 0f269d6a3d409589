package com.bybot.backend.config;

import com.bybot.backend.exception.ForbiddenException;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;

/**
 * Operator actions need {@code X-Admin-Token} to match {@code bybot.admin.token}; the dev and
 * local profiles skip the check.
 */
@Component
public class AdminAccessGuard {

    public static final String HEADER = "X-Admin-Token";

    private final Environment environment;
    private final String adminToken;

    public AdminAccessGuard(Environment environment, @Value("${bybot.admin.token:}") String adminToken) {
        this.environment = environment;
        this.adminToken = adminToken;
    }

    public void requireAdmin(String token) {
        if (!isAuthorized(token)) {
            throw new ForbiddenException("Admin token required");
        }
    }

    public boolean isAuthorized(String token) {
        return isDevProfile() || (adminToken != null && !adminToken.isBlank() && adminToken.equals(token));
    }

    private boolean isDevProfile() {
        for (String profile : environment.getActiveProfiles()) {
            if ("dev".equalsIgnoreCase(profile) || "local".equalsIgnoreCase(profile)) {
                return true;
            }
        }
        return false;
    }
}
