package com.kernos.ledger;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Appends each record as one JSON line to a file. The file and its parent directories are created on demand.
 */
public final class JsonLinesLedgerStore implements LedgerStore {

    private static final Logger log = LoggerFactory.getLogger(JsonLinesLedgerStore.class);

    private final Path file;

    public JsonLinesLedgerStore(Path file) {
        this.file = Objects.requireNonNull(file, "file");
    }

    public Path getFile() {
        return file;
    }

    @Override
    public synchronized void append(LedgerRecord record) {
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            try (BufferedWriter out = Files.newBufferedWriter(file, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND)) {
                out.write(record.toJson());
                out.newLine();
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to append ledger record to " + file, e);
        }
    }

    /** All records in file order; empty if the file does not exist yet. Blank lines are skipped. */
    public synchronized List<LedgerRecord> readAll() {
        if (!Files.exists(file)) {
            return List.of();
        }
        try {
            List<LedgerRecord> out = new ArrayList<>();
            for (String line : Files.readAllLines(file, StandardCharsets.UTF_8)) {
                if (!line.isBlank()) {
                    out.add(LedgerRecord.fromJson(line));
                }
            }
            log.debug("Read {} ledger record(s) from {}", out.size(), file);
            return out;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read ledger " + file, e);
        }
    }
}
