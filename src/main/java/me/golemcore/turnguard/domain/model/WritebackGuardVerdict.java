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
 * Outcome of validating one writeback candidate. Exactly one of
 * {@link Accepted} or {@link Rejected}; a payload is never partially accepted.
 */
public interface WritebackGuardVerdict {

    boolean isAccepted();

    static WritebackGuardVerdict accepted(WritebackPayload payload) {
        return new Accepted(payload);
    }

    static WritebackGuardVerdict rejected(String reason) {
        return new Rejected(reason);
    }

    /**
     * Candidate passed every check; carries a payload rebuilt from validated
     * values only.
     */
    record Accepted(WritebackPayload payload) implements WritebackGuardVerdict {

        @Override
        public boolean isAccepted() {
            return true;
        }
    }

    /**
     * Candidate failed validation; the reason is sanitized and never echoes
     * offending content.
     */
    record Rejected(String reason) implements WritebackGuardVerdict {

        @Override
        public boolean isAccepted() {
            return false;
        }
    }
}
