package com.tradingcore.journal;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tradingcore.exception.JournalException;
import java.io.BufferedWriter;
import java.io.Closeable;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * File journal with one JSON object per line.
 *
 * <p>Every append is flushed before it returns. A line that cannot be parsed on read, such as a
 * line truncated by a crash, is logged and skipped. Sequence numbers continue from the highest
 * one already in the file.
 */
public class JsonLinesEventJournal implements EventJournal, Closeable {

    private static final Logger log = LoggerFactory.getLogger(JsonLinesEventJournal.class);

    private final Path path;
    private final ObjectMapper objectMapper;

    private BufferedWriter writer;
    private long lastSequence = -1;

    public JsonLinesEventJournal(Path path, ObjectMapper objectMapper) {
        this.path = path;
        this.objectMapper = objectMapper;
    }

    @Override
    public synchronized void append(JournalEntry entry) {
        if (lastSequence < 0) {
            lastSequence = readAllUnlocked().stream()
                    .mapToLong(JournalEntry::getSequence)
                    .max()
                    .orElse(0);
        }
        entry.setSequence(lastSequence + 1);

        String line;
        try {
            line = objectMapper.writeValueAsString(entry);
        } catch (JsonProcessingException e) {
            throw new JournalException("Failed to serialize journal entry " + entry.getSequence(), e);
        }

        try {
            BufferedWriter out = writer();
            out.write(line);
            out.newLine();
            out.flush();
        } catch (IOException e) {
            closeQuietly();
            throw new JournalException("Failed to append to journal " + path, e);
        }
        lastSequence = entry.getSequence();
    }

    @Override
    public synchronized List<JournalEntry> readAll() {
        return readAllUnlocked();
    }

    private List<JournalEntry> readAllUnlocked() {
        if (!Files.exists(path)) {
            return List.of();
        }
        List<String> lines;
        try {
            lines = Files.readAllLines(path, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new JournalException("Failed to read journal " + path, e);
        }

        List<JournalEntry> entries = new ArrayList<>(lines.size());
        int lineNumber = 0;
        for (String line : lines) {
            lineNumber++;
            if (line.isBlank()) {
                continue;
            }
            try {
                entries.add(objectMapper.readValue(line, JournalEntry.class));
            } catch (JsonProcessingException e) {
                log.warn("Skipping unreadable journal line {} in {}: {}", lineNumber, path, e.getOriginalMessage());
            }
        }
        return entries;
    }

    private BufferedWriter writer() throws IOException {
        if (writer == null) {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            writer = Files.newBufferedWriter(
                    path, StandardCharsets.UTF_8, StandardOpenOption.CREATE, StandardOpenOption.APPEND);
            log.info("Journal opened at {}", path.toAbsolutePath());
        }
        return writer;
    }

    @Override
    public synchronized void close() {
        closeQuietly();
    }

    private void closeQuietly() {
        if (writer == null) {
            return;
        }
        try {
            writer.close();
        } catch (IOException e) {
            log.warn("Failed to close journal {}: {}", path, e.getMessage());
        } finally {
            writer = null;
        }
    }

    public Path getPath() {
        return path;
    }
}
