package com.labelbridge.shipmentprocessor.ledger;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Append-only JSON-Lines ledger file.
 *
 * <p>Every transition is appended as one line and forced to disk before {@link #append} returns.
 * Loading replays the file (last line per fingerprint wins), skips a torn or corrupt line and
 * rewrites the file compacted through a temp file and an atomic rename.
 */
@Slf4j
public class JsonLinesLedgerStore implements LedgerStore {

    private final Path path;
    private final ObjectMapper objectMapper;

    public JsonLinesLedgerStore(Path path, ObjectMapper objectMapper) {
        this.path = path;
        this.objectMapper = objectMapper;
    }

    @Override
    public synchronized Map<String, LedgerEntry> loadAll() {
        Map<String, LedgerEntry> entries = new LinkedHashMap<>();
        if (!Files.exists(path)) {
            log.info("Ledger '{}' does not exist yet, starting empty", path);
            return entries;
        }

        int lines = 0;
        int skipped = 0;
        try (BufferedReader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            String line;
            while ((line = reader.readLine()) != null) {
                if (line.isBlank()) {
                    continue;
                }
                lines++;
                try {
                    LedgerEntry entry = objectMapper.readValue(line, LedgerEntry.class);
                    if (entry.getFingerprint() != null && entry.getStatus() != LedgerStatus.PENDING) {
                        entries.put(entry.getFingerprint(), entry);
                    }
                } catch (JsonProcessingException e) {
                    skipped++;
                    log.warn("Skipping unreadable ledger line {} in '{}': {}", lines, path, e.getOriginalMessage());
                }
            }
        } catch (IOException e) {
            throw new LedgerPersistenceException("Cannot read ledger " + path, e);
        }

        if (lines > entries.size()) {
            compact(entries);
        }
        log.info("Ledger '{}' loaded: {} entries from {} lines ({} skipped)", path, entries.size(), lines, skipped);
        return entries;
    }

    @Override
    public synchronized void append(Collection<LedgerEntry> entries) {
        if (entries.isEmpty()) {
            return;
        }
        StringBuilder sb = new StringBuilder();
        for (LedgerEntry entry : entries) {
            sb.append(toJson(entry)).append('\n');
        }
        try {
            createParentDirectories();
            try (FileChannel channel = FileChannel.open(path,
                    StandardOpenOption.CREATE, StandardOpenOption.WRITE, StandardOpenOption.APPEND)) {
                ByteBuffer buffer = ByteBuffer.wrap(sb.toString().getBytes(StandardCharsets.UTF_8));
                while (buffer.hasRemaining()) {
                    channel.write(buffer);
                }
                channel.force(true);
            }
        } catch (IOException e) {
            throw new LedgerPersistenceException("Cannot append " + entries.size() + " entries to ledger " + path, e);
        }
    }

    private void compact(Map<String, LedgerEntry> entries) {
        Path tmp = path.resolveSibling(path.getFileName() + ".tmp");
        try {
            StringBuilder sb = new StringBuilder();
            for (LedgerEntry entry : entries.values()) {
                sb.append(toJson(entry)).append('\n');
            }
            try (FileChannel channel = FileChannel.open(tmp,
                    StandardOpenOption.CREATE, StandardOpenOption.WRITE, StandardOpenOption.TRUNCATE_EXISTING)) {
                channel.write(ByteBuffer.wrap(sb.toString().getBytes(StandardCharsets.UTF_8)));
                channel.force(true);
            }
            try {
                Files.move(tmp, path, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                log.debug("Atomic move not supported for '{}', falling back to replace", path);
                Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            throw new LedgerPersistenceException("Cannot compact ledger " + path, e);
        }
    }

    private String toJson(LedgerEntry entry) {
        try {
            return objectMapper.writeValueAsString(entry);
        } catch (JsonProcessingException e) {
            throw new LedgerPersistenceException("Cannot serialize ledger entry " + entry.getFingerprint(), e);
        }
    }

    private void createParentDirectories() throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
    }
}
