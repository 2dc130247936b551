package com.bastion.validation.audit;

import com.bastion.audit.ComparisonRecord;
import com.bastion.audit.ComparisonRecordSerializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.Closeable;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Durable sink writing one JSON document per line to an append-only file.
 *
 * <p>Each append is flushed before returning. Reads skip lines that do not parse (for example a
 * line torn by a crash) and log them at WARN.
 */
public class JsonLinesAuditSink implements AuditSink, Closeable {

    private static final Logger log = LoggerFactory.getLogger(JsonLinesAuditSink.class);

    private final Path file;
    private final Object writeLock = new Object();
    private BufferedWriter writer;

    public JsonLinesAuditSink(Path file) {
        if (file == null) {
            throw new IllegalArgumentException("file must not be null");
        }
        this.file = file;
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            this.writer = openWriter();
        } catch (IOException e) {
            throw new AuditSinkException("Cannot open audit file " + file, e);
        }
        log.info("Writing comparison records to {}", file.toAbsolutePath());
    }

    @Override
    public void appendComparisonRecord(ComparisonRecord record) {
        String line = ComparisonRecordSerializer.serialize(record);
        synchronized (writeLock) {
            try {
                if (writer == null) {
                    writer = openWriter();
                }
                writer.write(line);
                writer.newLine();
                writer.flush();
            } catch (IOException e) {
                closeQuietly();
                throw new AuditSinkException("Failed to append record " + record.requestId() + " to " + file, e);
            }
        }
    }

    @Override
    public List<ComparisonRecord> queryWindow(Instant start, Instant end) {
        WindowFilter.requireValidWindow(start, end);
        if (!Files.exists(file)) {
            return List.of();
        }
        List<ComparisonRecord> matches = new ArrayList<>();
        int lineNumber = 0;
        try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            String line;
            while ((line = reader.readLine()) != null) {
                lineNumber++;
                if (line.isBlank()) {
                    continue;
                }
                Optional<ComparisonRecord> parsed = ComparisonRecordSerializer.tryDeserialize(line);
                if (parsed.isEmpty()) {
                    log.warn("Skipping corrupt audit line {} in {}", lineNumber, file);
                    continue;
                }
                if (WindowFilter.inWindow(parsed.get(), start, end)) {
                    matches.add(parsed.get());
                }
            }
        } catch (IOException e) {
            throw new AuditSinkException("Failed to read audit file " + file, e);
        }
        return WindowFilter.dedupe(matches);
    }

    @Override
    public boolean healthy() {
        return Files.isWritable(file);
    }

    public Path file() {
        return file;
    }

    @Override
    public void close() throws IOException {
        synchronized (writeLock) {
            if (writer != null) {
                writer.close();
                writer = null;
            }
        }
    }

    private BufferedWriter openWriter() throws IOException {
        return Files.newBufferedWriter(file, StandardCharsets.UTF_8,
                StandardOpenOption.CREATE, StandardOpenOption.APPEND, StandardOpenOption.WRITE);
    }

    private void closeQuietly() {
        try {
            if (writer != null) {
                writer.close();
            }
        } catch (IOException suppressed) {
            log.debug("Ignoring failure while closing broken audit writer: {}", suppressed.getMessage());
        } finally {
            writer = null;
        }
    }
}
