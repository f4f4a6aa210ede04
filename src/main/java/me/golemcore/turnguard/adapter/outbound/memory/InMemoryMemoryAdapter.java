package me.golemcore.turnguard.adapter.outbound.memory;

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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.turnguard.domain.model.ConsolidationInput;
import me.golemcore.turnguard.domain.model.MemoryEvent;
import me.golemcore.turnguard.port.outbound.MemoryPort;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

/**
 * Process-local memory store. Events are kept per entity in append order.
 *
 * <p>
 * Recall ranks events by how many query terms (three characters or longer)
 * their slot key or value contains, newest first among equals. Events with no
 * matching term are not recalled.
 */
@Component
@Slf4j
public class InMemoryMemoryAdapter implements MemoryPort {

    private static final int MIN_TERM_LENGTH = 3;

    private final Map<String, List<MemoryEvent>> events = new ConcurrentHashMap<>();
    private final Map<String, List<ConsolidationInput>> consolidations = new ConcurrentHashMap<>();

    @Override
    public CompletableFuture<Void> appendEvent(MemoryEvent event) {
        events.computeIfAbsent(event.getEntityId(), key -> new CopyOnWriteArrayList<>()).add(event);
        return CompletableFuture.completedFuture(null);
    }

    @Override
    public CompletableFuture<Long> countEvents(String entityId) {
        List<MemoryEvent> stored = events.getOrDefault(entityId, List.of());
        return CompletableFuture.completedFuture((long) stored.size());
    }

    @Override
    public CompletableFuture<List<MemoryEvent>> recall(String entityId, String query, int limit) {
        Set<String> terms = terms(query);
        if (terms.isEmpty() || limit <= 0) {
            return CompletableFuture.completedFuture(List.of());
        }

        List<MemoryEvent> stored = new ArrayList<>(events.getOrDefault(entityId, List.of()));
        Collections.reverse(stored);
        List<MemoryEvent> recalled = stored.stream()
                .filter(event -> score(event, terms) > 0)
                .sorted((left, right) -> Integer.compare(score(right, terms), score(left, terms)))
                .limit(limit)
                .toList();
        return CompletableFuture.completedFuture(recalled);
    }

    @Override
    public CompletableFuture<Void> consolidate(ConsolidationInput input) {
        consolidations.computeIfAbsent(input.entityId(), key -> new CopyOnWriteArrayList<>()).add(input);
        log.debug("[Memory] Consolidation checkpoint {} recorded for entity {}", input.checkpointEventCount(),
                input.entityId());
        return CompletableFuture.completedFuture(null);
    }

    public List<MemoryEvent> events(String entityId) {
        return List.copyOf(events.getOrDefault(entityId, List.of()));
    }

    public List<ConsolidationInput> consolidations(String entityId) {
        return List.copyOf(consolidations.getOrDefault(entityId, List.of()));
    }

    private static Set<String> terms(String query) {
        if (query == null || query.isBlank()) {
            return Set.of();
        }
        return Arrays.stream(query.toLowerCase(Locale.ROOT).split("[^\\p{L}\\p{N}_]+"))
                .filter(term -> term.length() >= MIN_TERM_LENGTH)
                .collect(Collectors.toSet());
    }

    private static int score(MemoryEvent event, Set<String> terms) {
        String haystack = (nullToEmpty(event.getSlotKey()) + " " + nullToEmpty(event.getValue()))
                .toLowerCase(Locale.ROOT);
        int hits = 0;
        for (String term : terms) {
            if (haystack.contains(term)) {
                hits++;
            }
        }
        return hits;
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
