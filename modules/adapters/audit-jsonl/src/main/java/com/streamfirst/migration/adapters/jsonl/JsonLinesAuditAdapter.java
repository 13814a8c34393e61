package com.streamfirst.migration.adapters.jsonl;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.streamfirst.migration.domain.AuditEvent;
import com.streamfirst.migration.domain.ErrorKind;
import com.streamfirst.migration.domain.HealthSnapshot;
import com.streamfirst.migration.domain.MigrationId;
import com.streamfirst.migration.domain.MigrationPhase;
import com.streamfirst.migration.domain.TrafficWeight;
import com.streamfirst.migration.domain.Verdict;
import com.streamfirst.migration.ports.AuditPort;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Predicate;

/**
 * AuditPort writing one JSON document per line to an append-only file. The file survives
 * restarts, so a resumed run continues the sequence where the previous process stopped.
 */
@Slf4j
public class JsonLinesAuditAdapter implements AuditPort {

    private final Path file;
    private final ObjectMapper objectMapper;

    public JsonLinesAuditAdapter(Path file) {
        this.file = file;
        this.objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .setSerializationInclusion(JsonInclude.Include.NON_NULL);
    }

    /**
     * Flat on-disk shape of one event.
     */
    public record AuditLine(long sequenceNumber,
                            String migrationId,
                            MigrationPhase phase,
                            TrafficWeight weightBefore,
                            TrafficWeight weightAfter,
                            HealthSnapshot snapshot,
                            Verdict verdict,
                            ErrorKind errorKind,
                            String detail,
                            Instant timestamp) {

        static AuditLine from(AuditEvent event) {
            return new AuditLine(event.getSequenceNumber(), event.getMigrationId().value(), event.getPhase(),
                    event.getWeightBefore(), event.getWeightAfter(), event.getTriggeringSnapshot(),
                    event.getVerdict(), event.getErrorKind(), event.getDetail(), event.getTimestamp());
        }

        AuditEvent toEvent() {
            return new AuditEvent(sequenceNumber, new MigrationId(migrationId), phase, weightBefore, weightAfter,
                    snapshot, verdict, errorKind, detail, timestamp);
        }
    }

    @Override
    public synchronized void append(AuditEvent event) {
        String line;
        try {
            line = objectMapper.writeValueAsString(AuditLine.from(event));
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot serialize audit event " + event, e);
        }
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(file, line + System.lineSeparator(), StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND, StandardOpenOption.WRITE);
        } catch (IOException e) {
            log.error("Failed to append audit event {} to {}", event.getSequenceNumber(), file, e);
            throw new UncheckedIOException("Cannot append to audit file " + file, e);
        }
        log.trace("Appended audit event {} to {}", event.getSequenceNumber(), file);
    }

    @Override
    public synchronized List<AuditEvent> getEvents(Predicate<AuditEvent> predicate) {
        if (!Files.exists(file)) {
            return List.of();
        }
        List<String> lines;
        try {
            lines = Files.readAllLines(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read audit file " + file, e);
        }
        List<AuditEvent> events = new ArrayList<>(lines.size());
        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i);
            if (line.isBlank()) {
                continue;
            }
            try {
                AuditEvent event = objectMapper.readValue(line, AuditLine.class).toEvent();
                if (predicate.test(event)) {
                    events.add(event);
                }
            } catch (JsonProcessingException e) {
                throw new IllegalStateException("Corrupt audit record at " + file + ":" + (i + 1), e);
            }
        }
        return events;
    }

    public Path getFile() {
        return file;
    }
}
