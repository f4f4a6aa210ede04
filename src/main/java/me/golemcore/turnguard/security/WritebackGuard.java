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

import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.turnguard.domain.model.ImmutableStateHeader;
import me.golemcore.turnguard.domain.model.SelfTaskWriteback;
import me.golemcore.turnguard.domain.model.StateHeaderWriteback;
import me.golemcore.turnguard.domain.model.StyleProfileWriteback;
import me.golemcore.turnguard.domain.model.WritebackGuardVerdict;
import me.golemcore.turnguard.domain.model.WritebackPayload;
import org.springframework.stereotype.Component;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Authorizes self-state writebacks proposed by the reflect stage.
 *
 * <p>
 * Validation is allow-list based:
 * <ul>
 * <li>Top-level fields limited to {@code state_header} and
 * {@code memory_append} (plus {@code self_tasks} / {@code style_profile} when
 * the matching extension is enabled)</li>
 * <li>Immutable header fields must equal the canonical snapshot exactly</li>
 * <li>Mutable strings and list items are trimmed, non-empty, length-bounded
 * and checked against {@link #POISON_PATTERNS}</li>
 * <li>Any failure rejects the whole payload; nothing is partially accepted</li>
 * </ul>
 *
 * <p>
 * The poison-pattern list is a first line of defense against reflected prompt
 * injection, not a complete one. Rejection reasons name the field and the
 * violated limit but never echo the offending content.
 *
 * <p>
 * The component is stateless and thread-safe; {@link #validate} never throws.
 *
 * @since 1.0
 */
@Component
@Slf4j
public class WritebackGuard {

    public static final int MAX_CURRENT_OBJECTIVE_CHARS = 280;
    public static final int MAX_RECENT_CONTEXT_SUMMARY_CHARS = 1200;
    public static final int MAX_LAST_UPDATED_AT_CHARS = 64;
    public static final int MAX_LIST_ITEM_CHARS = 240;
    public static final int MAX_OPEN_LOOPS = 7;
    public static final int MAX_NEXT_ACTIONS = 3;
    public static final int MAX_COMMITMENTS = 5;
    public static final int MAX_MEMORY_APPEND_ITEMS = 8;
    public static final int MAX_MEMORY_APPEND_ITEM_CHARS = 240;

    public static final int MAX_SELF_TASKS = 5;
    public static final int MAX_SELF_TASK_TITLE_CHARS = 120;
    public static final int MAX_SELF_TASK_INSTRUCTIONS_CHARS = 240;
    public static final int MAX_SELF_TASK_EXPIRY_HOURS = 72;
    public static final int STYLE_SCORE_MIN = 0;
    public static final int STYLE_SCORE_MAX = 100;
    public static final double STYLE_TEMPERATURE_MIN = 0.0;
    public static final double STYLE_TEMPERATURE_MAX = 1.0;

    public static final List<String> POISON_PATTERNS = List.of(
            "ignore previous instructions",
            "ignore all previous instructions",
            "system prompt",
            "developer message",
            "override safety",
            "bypass safety",
            "disable guard",
            "exfiltrate",
            "reveal secrets",
            "tool jailbreak");

    private static final String PAYLOAD = "payload";
    private static final String STATE_HEADER = "payload.state_header";
    private static final String MEMORY_APPEND = "payload.memory_append";
    private static final String SELF_TASKS = "payload.self_tasks";
    private static final String STYLE_PROFILE = "payload.style_profile";

    private static final Set<String> STATE_HEADER_FIELDS = Set.of(
            "schema_version", "identity_principles_hash", "safety_posture", "current_objective", "open_loops",
            "next_actions", "commitments", "recent_context_summary", "last_updated_at");
    private static final Set<String> SELF_TASK_FIELDS = Set.of("title", "instructions", "expires_at");
    private static final Set<String> STYLE_PROFILE_FIELDS = Set.of("formality", "verbosity", "temperature");

    /**
     * Optional writeback sections beyond the core allow-list.
     */
    public record Extensions(boolean selfTasks, boolean styleProfile) {

        public static final Extensions NONE = new Extensions(false, false);
    }

    /**
     * Validate a candidate against the strict core allow-list.
     */
    public WritebackGuardVerdict validate(JsonNode payload, ImmutableStateHeader immutable) {
        return validate(payload, immutable, Extensions.NONE);
    }

    /**
     * Validate a candidate, additionally admitting the enabled extension
     * sections.
     */
    public WritebackGuardVerdict validate(JsonNode payload, ImmutableStateHeader immutable, Extensions extensions) {
        try {
            return WritebackGuardVerdict.accepted(validatePayload(payload, immutable, extensions));
        } catch (GuardViolation violation) {
            String reason = SecretScrubber.sanitizeError(violation.getMessage());
            log.debug("[Writeback] Candidate rejected: {}", reason);
            return WritebackGuardVerdict.rejected(reason);
        }
    }

    public static boolean containsPoisonPattern(String value) {
        String normalized = value.toLowerCase(Locale.ROOT);
        for (String pattern : POISON_PATTERNS) {
            if (normalized.contains(pattern)) {
                return true;
            }
        }
        return false;
    }

    private WritebackPayload validatePayload(JsonNode payload, ImmutableStateHeader immutable,
            Extensions extensions) {
        if (payload == null || !payload.isObject()) {
            throw new GuardViolation("payload must be a JSON object");
        }

        Set<String> topLevelFields = extensions.selfTasks() || extensions.styleProfile()
                ? allowedTopLevelFields(extensions)
                : Set.of("state_header", "memory_append");
        ensureNoUnknownFields(payload, topLevelFields, PAYLOAD);

        JsonNode stateHeaderNode = payload.get("state_header");
        if (stateHeaderNode == null) {
            throw new GuardViolation("payload.state_header is required");
        }
        if (!stateHeaderNode.isObject()) {
            throw new GuardViolation("payload.state_header must be an object");
        }

        StateHeaderWriteback stateHeader = validateStateHeader(stateHeaderNode, immutable);
        List<String> memoryAppend = validateMemoryAppend(payload);
        List<SelfTaskWriteback> selfTasks = extensions.selfTasks()
                ? validateSelfTasks(payload, stateHeader.lastUpdatedAt())
                : List.of();
        StyleProfileWriteback styleProfile = extensions.styleProfile() ? validateStyleProfile(payload) : null;

        return new WritebackPayload(stateHeader, memoryAppend, selfTasks, styleProfile);
    }

    private Set<String> allowedTopLevelFields(Extensions extensions) {
        List<String> fields = new ArrayList<>(List.of("state_header", "memory_append"));
        if (extensions.selfTasks()) {
            fields.add("self_tasks");
        }
        if (extensions.styleProfile()) {
            fields.add("style_profile");
        }
        return Set.copyOf(fields);
    }

    private StateHeaderWriteback validateStateHeader(JsonNode stateHeader, ImmutableStateHeader immutable) {
        ensureNoUnknownFields(stateHeader, STATE_HEADER_FIELDS, STATE_HEADER);

        JsonNode schemaVersion = stateHeader.get("schema_version");
        if (schemaVersion == null || !schemaVersion.isIntegralNumber() || !schemaVersion.canConvertToLong()
                || schemaVersion.asLong() < 0) {
            throw new GuardViolation("payload.state_header.schema_version must be an integer");
        }
        if (schemaVersion.asLong() != immutable.schemaVersion()) {
            throw new GuardViolation("immutable field mismatch: payload.state_header.schema_version");
        }

        JsonNode identityHash = stateHeader.get("identity_principles_hash");
        if (identityHash == null || !identityHash.isTextual()) {
            throw new GuardViolation("payload.state_header.identity_principles_hash must be a string");
        }
        if (!identityHash.textValue().equals(immutable.identityPrinciplesHash())) {
            throw new GuardViolation("immutable field mismatch: payload.state_header.identity_principles_hash");
        }

        JsonNode safetyPosture = stateHeader.get("safety_posture");
        if (safetyPosture == null || !safetyPosture.isTextual()) {
            throw new GuardViolation("payload.state_header.safety_posture must be a string");
        }
        if (!safetyPosture.textValue().equals(immutable.safetyPosture())) {
            throw new GuardViolation("immutable field mismatch: payload.state_header.safety_posture");
        }

        String currentObjective = validateString(stateHeader, "current_objective", MAX_CURRENT_OBJECTIVE_CHARS,
                STATE_HEADER);
        List<String> openLoops = validateStringArray(stateHeader, "open_loops", MAX_OPEN_LOOPS);
        List<String> nextActions = validateStringArray(stateHeader, "next_actions", MAX_NEXT_ACTIONS);
        List<String> commitments = validateStringArray(stateHeader, "commitments", MAX_COMMITMENTS);
        String recentContextSummary = validateString(stateHeader, "recent_context_summary",
                MAX_RECENT_CONTEXT_SUMMARY_CHARS, STATE_HEADER);
        String lastUpdatedAt = validateString(stateHeader, "last_updated_at", MAX_LAST_UPDATED_AT_CHARS,
                STATE_HEADER);
        if (!Rfc3339Timestamps.isValid(lastUpdatedAt)) {
            throw new GuardViolation("payload.state_header.last_updated_at must be RFC3339");
        }

        return new StateHeaderWriteback(currentObjective, openLoops, nextActions, commitments,
                recentContextSummary, lastUpdatedAt);
    }

    private List<String> validateStringArray(JsonNode object, String field, int maxItems) {
        JsonNode value = object.get(field);
        if (value == null) {
            throw new GuardViolation(STATE_HEADER + "." + field + " is required");
        }
        if (!value.isArray()) {
            throw new GuardViolation(STATE_HEADER + "." + field + " must be an array");
        }
        if (value.size() > maxItems) {
            throw new GuardViolation(STATE_HEADER + "." + field + " exceeds max items (" + maxItems + ")");
        }
        return validateItems(value, STATE_HEADER + "." + field, MAX_LIST_ITEM_CHARS);
    }

    private List<String> validateMemoryAppend(JsonNode payload) {
        JsonNode value = payload.get("memory_append");
        if (value == null) {
            return List.of();
        }
        if (!value.isArray()) {
            throw new GuardViolation(MEMORY_APPEND + " must be an array");
        }
        if (value.size() > MAX_MEMORY_APPEND_ITEMS) {
            throw new GuardViolation(MEMORY_APPEND + " exceeds max items (" + MAX_MEMORY_APPEND_ITEMS + ")");
        }
        return validateItems(value, MEMORY_APPEND, MAX_MEMORY_APPEND_ITEM_CHARS);
    }

    private List<String> validateItems(JsonNode array, String path, int maxChars) {
        List<String> items = new ArrayList<>(array.size());
        for (int index = 0; index < array.size(); index++) {
            JsonNode item = array.get(index);
            String itemPath = path + "[" + index + "]";
            if (!item.isTextual()) {
                throw new GuardViolation(itemPath + " must be a string");
            }
            items.add(checkText(item.textValue(), itemPath, maxChars));
        }
        return items;
    }

    private List<SelfTaskWriteback> validateSelfTasks(JsonNode payload, String lastUpdatedAt) {
        JsonNode value = payload.get("self_tasks");
        if (value == null) {
            return List.of();
        }
        if (!value.isArray()) {
            throw new GuardViolation(SELF_TASKS + " must be an array");
        }
        if (value.size() > MAX_SELF_TASKS) {
            throw new GuardViolation(SELF_TASKS + " exceeds max items (" + MAX_SELF_TASKS + ")");
        }

        OffsetDateTime baseline = Rfc3339Timestamps.parse(lastUpdatedAt)
                .orElseThrow(() -> new GuardViolation("payload.state_header.last_updated_at must be RFC3339"));
        OffsetDateTime maxExpiresAt = baseline.plusHours(MAX_SELF_TASK_EXPIRY_HOURS);

        List<SelfTaskWriteback> tasks = new ArrayList<>(value.size());
        for (int index = 0; index < value.size(); index++) {
            JsonNode task = value.get(index);
            String context = SELF_TASKS + "[" + index + "]";
            if (!task.isObject()) {
                throw new GuardViolation(context + " must be an object");
            }
            ensureNoUnknownFields(task, SELF_TASK_FIELDS, context);
            String title = validateString(task, "title", MAX_SELF_TASK_TITLE_CHARS, context);
            String instructions = validateString(task, "instructions", MAX_SELF_TASK_INSTRUCTIONS_CHARS, context);
            String expiresAt = validateString(task, "expires_at", MAX_LAST_UPDATED_AT_CHARS, context);

            OffsetDateTime parsedExpiresAt = Rfc3339Timestamps.parse(expiresAt)
                    .orElseThrow(() -> new GuardViolation(context + ".expires_at must be RFC3339"));
            if (!parsedExpiresAt.isAfter(baseline)) {
                throw new GuardViolation(
                        context + ".expires_at must be after payload.state_header.last_updated_at");
            }
            if (parsedExpiresAt.isAfter(maxExpiresAt)) {
                throw new GuardViolation(
                        context + ".expires_at exceeds max horizon (" + MAX_SELF_TASK_EXPIRY_HOURS + "h)");
            }
            tasks.add(new SelfTaskWriteback(title, instructions, expiresAt));
        }
        return tasks;
    }

    private StyleProfileWriteback validateStyleProfile(JsonNode payload) {
        JsonNode value = payload.get("style_profile");
        if (value == null) {
            return null;
        }
        if (!value.isObject()) {
            throw new GuardViolation(STYLE_PROFILE + " must be an object");
        }
        ensureNoUnknownFields(value, STYLE_PROFILE_FIELDS, STYLE_PROFILE);

        int formality = validateStyleScore(value, "formality");
        int verbosity = validateStyleScore(value, "verbosity");

        JsonNode temperature = value.get("temperature");
        if (temperature == null || !temperature.isNumber()) {
            throw new GuardViolation(STYLE_PROFILE + ".temperature must be a number");
        }
        double temperatureValue = temperature.asDouble();
        if (!(temperatureValue >= STYLE_TEMPERATURE_MIN && temperatureValue <= STYLE_TEMPERATURE_MAX)) {
            throw new GuardViolation(STYLE_PROFILE + ".temperature must be in safe range [" + STYLE_TEMPERATURE_MIN
                    + ", " + STYLE_TEMPERATURE_MAX + "]");
        }
        return new StyleProfileWriteback(formality, verbosity, temperatureValue);
    }

    private int validateStyleScore(JsonNode styleProfile, String field) {
        JsonNode score = styleProfile.get(field);
        if (score == null || !score.isIntegralNumber() || !score.canConvertToLong() || score.asLong() < 0) {
            throw new GuardViolation(STYLE_PROFILE + "." + field + " must be an integer");
        }
        long value = score.asLong();
        if (value < STYLE_SCORE_MIN || value > STYLE_SCORE_MAX) {
            throw new GuardViolation(STYLE_PROFILE + "." + field + " must be in safe range [" + STYLE_SCORE_MIN
                    + ", " + STYLE_SCORE_MAX + "]");
        }
        return (int) value;
    }

    private String validateString(JsonNode object, String field, int maxChars, String context) {
        String path = context + "." + field;
        JsonNode value = object.get(field);
        if (value == null) {
            throw new GuardViolation(path + " is required");
        }
        if (!value.isTextual()) {
            throw new GuardViolation(path + " must be a string");
        }
        return checkText(value.textValue(), path, maxChars);
    }

    private String checkText(String raw, String path, int maxChars) {
        String sanitized = raw.trim();
        if (sanitized.isEmpty()) {
            throw new GuardViolation(path + " cannot be empty");
        }
        if (sanitized.codePointCount(0, sanitized.length()) > maxChars) {
            throw new GuardViolation(path + " exceeds max length (" + maxChars + ")");
        }
        if (containsPoisonPattern(sanitized)) {
            throw new GuardViolation(path + " contains unsafe content pattern");
        }
        return sanitized;
    }

    private void ensureNoUnknownFields(JsonNode object, Set<String> allowed, String context) {
        Iterator<String> names = object.fieldNames();
        while (names.hasNext()) {
            String key = names.next();
            if (!allowed.contains(key)) {
                // Field names are model output too; do not echo a poisoned one.
                if (containsPoisonPattern(key)) {
                    throw new GuardViolation(context + " contains unknown field");
                }
                throw new GuardViolation(context + " contains unknown field: " + key);
            }
        }
    }

    private static final class GuardViolation extends RuntimeException {

        private static final long serialVersionUID = 1L;

        GuardViolation(String message) {
            super(message, null, false, false);
        }
    }
}
