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

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Structured event appended to the durable memory store.
 *
 * <p>
 * Every event written on the turn path is first checked by
 * {@link me.golemcore.turnguard.security.MemoryWritePolicy}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MemoryEvent {

    private String entityId;
    private String slotKey;
    private MemoryEventType eventType;
    private String value;
    private MemorySource source;

    @Builder.Default
    private PrivacyLevel privacyLevel = PrivacyLevel.PRIVATE;

    private double confidence;
    private double importance;

    @Builder.Default
    private MemoryLayer layer = MemoryLayer.WORKING;

    private SourceKind sourceKind;
    private String sourceRef;
    private MemoryProvenance provenance;
    private String occurredAt;
}
