package me.golemcore.turnguard.domain.service;

import me.golemcore.turnguard.domain.model.PersonaStateHeader;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PersonaStateValidatorTest {

    private static PersonaStateHeader validHeader() {
        return PersonaStateHeader.builder()
                .schemaVersion(1)
                .identityPrinciplesHash("sha256:abc")
                .safetyPosture("strict")
                .currentObjective("Ship the release notes")
                .openLoops(new ArrayList<>(List.of("confirm date")))
                .nextActions(new ArrayList<>(List.of("draft notes")))
                .commitments(new ArrayList<>())
                .recentContextSummary("User asked for release notes.")
                .lastUpdatedAt("2026-03-01T10:00:00Z")
                .build();
    }

    private static void assertInvalid(String expected, PersonaStateHeader header) {
        IllegalArgumentException error = assertThrows(IllegalArgumentException.class,
                () -> PersonaStateValidator.validate(header));
        assertEquals(expected, error.getMessage());
    }

    @Test
    void shouldAcceptValidHeader() {
        assertDoesNotThrow(() -> PersonaStateValidator.validate(validHeader()));
    }

    @Test
    void shouldRejectWrongSchemaVersion() {
        assertInvalid("invalid schema_version: expected 1, got 2", validHeader().toBuilder().schemaVersion(2).build());
    }

    @Test
    void shouldRejectEmptyImmutableFields() {
        assertInvalid("identity_principles_hash must not be empty",
                validHeader().toBuilder().identityPrinciplesHash(" ").build());
        assertInvalid("safety_posture must not be empty", validHeader().toBuilder().safetyPosture(null).build());
    }

    @Test
    void shouldRejectOverlongObjective() {
        assertInvalid("current_objective exceeds max length of 280",
                validHeader().toBuilder().currentObjective("o".repeat(281)).build());
    }

    @Test
    void shouldCountCodePointsNotChars() {
        String emoji = "😀".repeat(280);

        assertDoesNotThrow(
                () -> PersonaStateValidator.validate(validHeader().toBuilder().currentObjective(emoji).build()));
    }

    @Test
    void shouldRejectTooManyNextActions() {
        PersonaStateHeader header = validHeader().toBuilder()
                .nextActions(new ArrayList<>(List.of("a", "b", "c", "d")))
                .build();

        assertInvalid("next_actions exceeds max items of 3", header);
    }

    @Test
    void shouldRejectBlankListItem() {
        assertInvalid("open_loops contains empty item",
                validHeader().toBuilder().openLoops(new ArrayList<>(List.of("ok", " "))).build());
    }

    @Test
    void shouldRejectOverlongListItem() {
        assertInvalid("commitments item exceeds max length of 240",
                validHeader().toBuilder().commitments(new ArrayList<>(List.of("c".repeat(241)))).build());
    }

    @Test
    void shouldRejectNonRfc3339Timestamp() {
        assertInvalid("last_updated_at must be RFC3339",
                validHeader().toBuilder().lastUpdatedAt("2026-03-01 10:00").build());
        assertInvalid("last_updated_at must be RFC3339", validHeader().toBuilder().lastUpdatedAt(null).build());
        assertInvalid("last_updated_at must be RFC3339",
                validHeader().toBuilder().lastUpdatedAt("2026-03-01T10:00Z").build());
        assertInvalid("last_updated_at must be RFC3339",
                validHeader().toBuilder().lastUpdatedAt("2026-03-01T10:00:00+01:00:30").build());
    }

    @Test
    void shouldAcceptSpaceSeparatedTimestamp() {
        assertDoesNotThrow(() -> PersonaStateValidator.validate(
                validHeader().toBuilder().lastUpdatedAt("2026-03-01 10:00:00Z").build()));
    }

    @Test
    void shouldAcceptOffsetTimestamp() {
        assertDoesNotThrow(() -> PersonaStateValidator
                .validate(validHeader().toBuilder().lastUpdatedAt("2026-03-01T12:00:00+02:00").build()));
    }

    // ===== Writeback candidate =====

    @Test
    void shouldAcceptCandidateWithSameImmutables() {
        PersonaStateHeader candidate = validHeader().toBuilder().currentObjective("New objective").build();

        assertDoesNotThrow(() -> PersonaStateValidator.validateWritebackCandidate(validHeader(), candidate));
    }

    @Test
    void shouldRejectChangedIdentityHash() {
        PersonaStateHeader candidate = validHeader().toBuilder().identityPrinciplesHash("sha256:other").build();

        IllegalArgumentException error = assertThrows(IllegalArgumentException.class,
                () -> PersonaStateValidator.validateWritebackCandidate(validHeader(), candidate));

        assertEquals("immutable field changed: identity_principles_hash", error.getMessage());
    }

    @Test
    void shouldRejectChangedSafetyPosture() {
        PersonaStateHeader candidate = validHeader().toBuilder().safetyPosture("relaxed").build();

        IllegalArgumentException error = assertThrows(IllegalArgumentException.class,
                () -> PersonaStateValidator.validateWritebackCandidate(validHeader(), candidate));

        assertEquals("immutable field changed: safety_posture", error.getMessage());
    }
}
