package me.golemcore.turnguard.adapter.outbound.memory;

import me.golemcore.turnguard.domain.model.ConsolidationInput;
import me.golemcore.turnguard.domain.model.MemoryEvent;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryMemoryAdapterTest {

    private InMemoryMemoryAdapter adapter;

    @BeforeEach
    void setUp() {
        adapter = new InMemoryMemoryAdapter();
    }

    private static MemoryEvent event(String entityId, String slotKey, String value) {
        return MemoryEvent.builder().entityId(entityId).slotKey(slotKey).value(value).build();
    }

    @Test
    void shouldCountEventsPerEntity() {
        adapter.appendEvent(event("a", "k1", "v1")).join();
        adapter.appendEvent(event("a", "k2", "v2")).join();
        adapter.appendEvent(event("b", "k1", "v1")).join();

        assertEquals(2L, adapter.countEvents("a").join());
        assertEquals(1L, adapter.countEvents("b").join());
        assertEquals(0L, adapter.countEvents("c").join());
    }

    @Test
    void shouldRecallByTermOverlap() {
        adapter.appendEvent(event("a", "user.city", "Lisbon Portugal")).join();
        adapter.appendEvent(event("a", "user.pet", "a cat named Miso")).join();
        adapter.appendEvent(event("a", "user.city.previous", "Porto Portugal")).join();

        List<MemoryEvent> recalled = adapter.recall("a", "which city in Portugal?", 5).join();

        assertEquals(2, recalled.size());
        assertTrue(recalled.stream().noneMatch(event -> event.getSlotKey().equals("user.pet")));
    }

    @Test
    void shouldPreferNewestAmongEqualScores() {
        adapter.appendEvent(event("a", "note", "meeting monday")).join();
        adapter.appendEvent(event("a", "note", "meeting tuesday")).join();

        List<MemoryEvent> recalled = adapter.recall("a", "meeting", 1).join();

        assertEquals("meeting tuesday", recalled.get(0).getValue());
    }

    @Test
    void shouldIgnoreShortTermsAndEmptyQueries() {
        adapter.appendEvent(event("a", "k", "an ox")).join();

        assertTrue(adapter.recall("a", "an ox", 5).join().isEmpty());
        assertTrue(adapter.recall("a", " ", 5).join().isEmpty());
        assertTrue(adapter.recall("a", "anything", 0).join().isEmpty());
    }

    @Test
    void shouldRecordConsolidations() {
        ConsolidationInput input = new ConsolidationInput("a", 3L, "q", "r");

        adapter.consolidate(input).join();

        assertEquals(List.of(input), adapter.consolidations("a"));
    }
}
