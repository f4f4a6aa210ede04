package me.golemcore.turnguard.adapter.outbound.persona;

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

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.turnguard.domain.model.PersonaStateHeader;
import me.golemcore.turnguard.domain.model.TurnGuardException;
import me.golemcore.turnguard.domain.service.PersonaStateValidator;
import me.golemcore.turnguard.infrastructure.config.TurnGuardProperties;
import me.golemcore.turnguard.port.outbound.PersonaStatePort;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Persona state store backed by a single JSON file holding one canonical
 * state header per person id.
 *
 * <p>
 * Writes go to a temp file first and are moved into place atomically where
 * the filesystem supports it. Loaded and persisted headers are validated.
 *
 * <p>
 * File location configured via {@code turnguard.persona.state-file}.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class LocalPersonaStateAdapter implements PersonaStatePort {

    private static final TypeReference<LinkedHashMap<String, PersonaStateHeader>> STATE_MAP = new TypeReference<>() {
    };

    private final TurnGuardProperties properties;
    private final ObjectMapper objectMapper;

    private Path stateFile;

    @PostConstruct
    public void init() {
        String configured = properties.getPersona().getStateFile();
        this.stateFile = Paths.get(configured.replace("${user.home}", System.getProperty("user.home")))
                .toAbsolutePath().normalize();
        log.info("[Persona] State file: {}", stateFile);
    }

    @Override
    public CompletableFuture<Optional<PersonaStateHeader>> loadCanonical(String personId) {
        return CompletableFuture.supplyAsync(() -> {
            synchronized (this) {
                PersonaStateHeader header = readAll().get(personId);
                if (header == null) {
                    return Optional.empty();
                }
                try {
                    PersonaStateValidator.validate(header);
                } catch (IllegalArgumentException e) {
                    throw new TurnGuardException("Stored persona state for " + personId + " is invalid: "
                            + e.getMessage(), e);
                }
                return Optional.of(header);
            }
        });
    }

    @Override
    public CompletableFuture<Void> persistAndSync(String personId, PersonaStateHeader state) {
        return CompletableFuture.runAsync(() -> {
            PersonaStateValidator.validate(state);
            synchronized (this) {
                Map<String, PersonaStateHeader> all = readAll();
                all.put(personId, state);
                writeAtomically(all);
            }
            log.debug("[Persona] Persisted canonical state for {}", personId);
        });
    }

    Path getStateFile() {
        return stateFile;
    }

    private Map<String, PersonaStateHeader> readAll() {
        if (!Files.exists(stateFile)) {
            return new LinkedHashMap<>();
        }
        try {
            Map<String, PersonaStateHeader> all = objectMapper.readValue(stateFile.toFile(), STATE_MAP);
            return all != null ? all : new LinkedHashMap<>();
        } catch (IOException e) {
            throw new TurnGuardException("Failed to read persona state file: " + stateFile, e);
        }
    }

    private void writeAtomically(Map<String, PersonaStateHeader> all) {
        Path tempPath = stateFile.resolveSibling(stateFile.getFileName() + ".tmp");
        try {
            Path parent = stateFile.getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            byte[] bytes = objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(all)
                    .getBytes(StandardCharsets.UTF_8);
            Files.write(tempPath, bytes, StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING,
                    StandardOpenOption.SYNC);
            try {
                Files.move(tempPath, stateFile, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                log.warn("[Persona] Atomic move not supported, using regular move");
                Files.move(tempPath, stateFile, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            throw new TurnGuardException("Failed to write persona state file: " + stateFile, e);
        }
    }
}
