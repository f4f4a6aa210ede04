package me.golemcore.turnguard.security;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import me.golemcore.turnguard.domain.model.TurnPolicyDeniedException;

/**
 * Tenant isolation for memory scopes.
 *
 * <p>
 * A disabled context allows every entity. An enabled context for tenant
 * {@code T} allows {@code T}, {@code T:*} and {@code T/*}, and denies both the
 * shared {@code default} scope and any other tenant's scope.
 */
public record TenantPolicyContext(boolean enabled, String tenantId) {

    public static final String DEFAULT_SCOPE = "default";
    public static final String CROSS_SCOPE_DENIED = "tenant policy denied cross-tenant scope";
    public static final String DEFAULT_SCOPE_DENIED = "tenant policy denied default scope fallback";
    public static final String MISSING_TENANT_DENIED = "tenant policy enabled without tenant id";

    public static TenantPolicyContext disabled() {
        return new TenantPolicyContext(false, null);
    }

    public static TenantPolicyContext enabled(String tenantId) {
        return new TenantPolicyContext(true, tenantId);
    }

    /**
     * Throws {@link TurnPolicyDeniedException} when the entity lies outside
     * this tenant's scope.
     */
    public void enforceScope(String entityId) {
        if (!enabled) {
            return;
        }
        if (tenantId == null || tenantId.isBlank()) {
            throw new TurnPolicyDeniedException(MISSING_TENANT_DENIED);
        }
        String scope = entityId == null ? "" : entityId.trim();
        if (DEFAULT_SCOPE.equals(scope)) {
            throw new TurnPolicyDeniedException(DEFAULT_SCOPE_DENIED);
        }
        if (scope.equals(tenantId) || scope.startsWith(tenantId + ":") || scope.startsWith(tenantId + "/")) {
            return;
        }
        throw new TurnPolicyDeniedException(CROSS_SCOPE_DENIED);
    }

    public boolean allows(String entityId) {
        try {
            enforceScope(entityId);
            return true;
        } catch (TurnPolicyDeniedException e) {
            return false;
        }
    }
}
