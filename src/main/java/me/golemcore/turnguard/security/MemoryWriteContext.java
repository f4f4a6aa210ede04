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

/**
 * Entity a turn writes memory for, together with the tenant policy that
 * bounds it.
 */
public record MemoryWriteContext(String entityId, TenantPolicyContext policyContext) {

    public static MemoryWriteContext forEntity(String entityId, TenantPolicyContext policyContext) {
        return new MemoryWriteContext(entityId, policyContext);
    }

    public void enforceWriteScope() {
        policyContext.enforceScope(entityId);
    }
}
