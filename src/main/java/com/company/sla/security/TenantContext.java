package com.company.sla.security;

import lombok.extern.slf4j.Slf4j;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Tenant and user of the current request, read from the JWT only so that a
 * caller cannot pick another tenant through a header.
 */
@Component
@Slf4j
public class TenantContext {

    static final String DEFAULT_TENANT = "default";

    private static final String TENANT_CLAIM = "tenant_id";
    private static final String AZURE_TENANT_CLAIM = "extension_TenantId";

    public String getCurrentTenantId() {
        Optional<Jwt> jwt = currentJwt();

        if (jwt.isEmpty()) {
            log.warn("No JWT principal on request, using default tenant");
            return DEFAULT_TENANT;
        }

        String tenantId = jwt.get().getClaimAsString(TENANT_CLAIM);
        if (tenantId == null) {
            tenantId = jwt.get().getClaimAsString(AZURE_TENANT_CLAIM);
        }

        if (tenantId == null || tenantId.isBlank()) {
            log.warn("JWT for subject {} carries no tenant claim, using default tenant", jwt.get().getSubject());
            return DEFAULT_TENANT;
        }
        return tenantId;
    }

    public String getCurrentUserId() {
        return currentJwt().map(Jwt::getSubject).orElse("anonymous");
    }

    private Optional<Jwt> currentJwt() {
        Authentication authentication = SecurityContextHolder.getContext().getAuthentication();

        if (authentication == null || !authentication.isAuthenticated()) {
            return Optional.empty();
        }
        if (authentication.getPrincipal() instanceof Jwt jwt) {
            return Optional.of(jwt);
        }
        return Optional.empty();
    }
}
