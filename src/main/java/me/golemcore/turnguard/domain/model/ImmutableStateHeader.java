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
 * Portion of the persona self-state that the reflect/writeback path may only
 * carry forward unchanged. Always taken from the persisted canonical state,
 * never from a model-produced candidate.
 */
public record ImmutableStateHeader(long schemaVersion, String identityPrinciplesHash, String safetyPosture) {

    public static final long CURRENT_SCHEMA_VERSION = 1L;

    public static ImmutableStateHeader from(PersonaStateHeader state) {
        return new ImmutableStateHeader(CURRENT_SCHEMA_VERSION, state.getIdentityPrinciplesHash(),
                state.getSafetyPosture());
    }
}
