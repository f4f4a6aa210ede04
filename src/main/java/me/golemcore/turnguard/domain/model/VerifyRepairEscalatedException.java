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

/**
 * Terminal turn failure raised once verify/repair stops retrying. The message
 * is the escalation contract message.
 */
public class VerifyRepairEscalatedException extends TurnGuardException {

    private static final long serialVersionUID = 1L;

    private final transient VerifyRepairEscalation escalation;

    public VerifyRepairEscalatedException(VerifyRepairEscalation escalation, Throwable cause) {
        super(escalation.toContractMessage(), cause);
        this.escalation = escalation;
    }

    public VerifyRepairEscalation getEscalation() {
        return escalation;
    }
}
