package com.company.sla.security;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.security.oauth2.server.resource.authentication.JwtAuthenticationToken;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class TenantContextTest {

    private final TenantContext tenantContext = new TenantContext();

    @AfterEach
    void clearContext() {
        SecurityContextHolder.clearContext();
    }

    @Test
    void readsTenantClaim() {
        authenticate(Map.of("sub", "agent-7", "tenant_id", "acme"));

        assertThat(tenantContext.getCurrentTenantId()).isEqualTo("acme");
        assertThat(tenantContext.getCurrentUserId()).isEqualTo("agent-7");
    }

    @Test
    void fallsBackToAzureTenantClaim() {
        authenticate(Map.of("sub", "agent-7", "extension_TenantId", "contoso"));

        assertThat(tenantContext.getCurrentTenantId()).isEqualTo("contoso");
    }

    @Test
    void usesDefaultTenantWithoutClaim() {
        authenticate(Map.of("sub", "agent-7"));

        assertThat(tenantContext.getCurrentTenantId()).isEqualTo(TenantContext.DEFAULT_TENANT);
    }

    @Test
    void usesDefaultsWithoutAuthentication() {
        assertThat(tenantContext.getCurrentTenantId()).isEqualTo(TenantContext.DEFAULT_TENANT);
        assertThat(tenantContext.getCurrentUserId()).isEqualTo("anonymous");
    }

    private void authenticate(Map<String, Object> claims) {
        Jwt jwt = Jwt.withTokenValue("token")
                .header("alg", "none")
                .claims(c -> c.putAll(claims))
                .issuedAt(Instant.parse("2026-02-16T09:00:00Z"))
                .expiresAt(Instant.parse("2026-02-16T10:00:00Z"))
                .build();
        SecurityContextHolder.getContext().setAuthentication(new JwtAuthenticationToken(jwt, List.of()));
    }
}
