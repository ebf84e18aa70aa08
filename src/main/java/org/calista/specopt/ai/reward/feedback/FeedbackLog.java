package org.calista.specopt.ai.reward.feedback;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.calista.specopt.io.FileIO;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * Append-only JSONL log of {@link FeedbackRecord}s.
 * Broken rows are skipped on read (logged at WARN), so a torn last line never blocks training.
 */
public final class FeedbackLog {
    private static final Logger log = LogManager.getLogger(FeedbackLog.class);

    private final FileIO io;
    private final ObjectMapper mapper;
    private final Path file;

    public FeedbackLog(FileIO io, ObjectMapper mapper, Path file) {
        this.io = Objects.requireNonNull(io, "io");
        this.mapper = Objects.requireNonNull(mapper, "mapper");
        this.file = Objects.requireNonNull(file, "file");
    }

    public Path file() {
        return file;
    }

    public FeedbackRecord append(FeedbackRecord record) throws IOException {
        Objects.requireNonNull(record, "record");
        if (record.specA == null || record.specB == null) {
            throw new IllegalArgumentException("feedback needs both specA and specB");
        }
        if (record.preference != null && !record.preference.equals("A") && !record.preference.equals("B")) {
            throw new IllegalArgumentException("preference must be A, B or null: " + record.preference);
        }
        if (record.id == null) record.id = UUID.randomUUID().toString();
        if (record.recordedAtEpochMs == 0L) record.recordedAtEpochMs = System.currentTimeMillis();
        io.appendJsonl(file, mapper.writeValueAsString(record));
        return record;
    }

    public List<FeedbackRecord> readAll() throws IOException {
        List<String> lines = io.readJsonl(file);
        ArrayList<FeedbackRecord> out = new ArrayList<>(lines.size());
        int lineNo = 0;
        for (String line : lines) {
            lineNo++;
            try {
                out.add(mapper.readValue(line, FeedbackRecord.class));
            } catch (IOException e) {
                log.warn("Skipping broken feedback row {}:{}: {}", file, lineNo, e.getMessage());
            }
        }
        return out;
    }
}
