package me.golemcore.turnguard.domain.model;

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

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Record of a verify/repair escalation. Written to memory as an audit event
 * and surfaced to the caller as the terminal turn error.
 */
public record VerifyRepairEscalation(
        EscalationReason reason,
        int attempts,
        int repairDepth,
        int maxAttempts,
        int maxRepairDepth,
        FailureClass failureClass,
        String lastError) {

    public String toContractMessage() {
        return "verify/repair escalated: reason=" + reason.getCode()
                + " attempts=" + attempts
                + " repair_depth=" + repairDepth
                + " max_attempts=" + maxAttempts
                + " max_repair_depth=" + maxRepairDepth
                + " failure_class=" + failureClass.getCode()
                + " last_error=" + lastError;
    }

    /**
     * Field map used as the audit event payload, keyed the same way as the
     * contract message.
     */
    public Map<String, Object> toAuditFields() {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("reason", reason.getCode());
        fields.put("attempts", attempts);
        fields.put("repair_depth", repairDepth);
        fields.put("max_attempts", maxAttempts);
        fields.put("max_repair_depth", maxRepairDepth);
        fields.put("failure_class", failureClass.getCode());
        fields.put("last_error", lastError);
        return fields;
    }
}
