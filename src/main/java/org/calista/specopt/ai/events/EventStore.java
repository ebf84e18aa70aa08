package org.calista.specopt.ai.events;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.calista.specopt.io.FileIO;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

public final class EventStore {
    private static final Logger log = LogManager.getLogger(EventStore.class);

    private final FileIO io;
    private final ObjectMapper mapper;
    private final Path file;

    public EventStore(FileIO io, ObjectMapper mapper, Path file) {
        this.io = io;
        this.mapper = mapper;
        this.file = file;
    }

    public Path file() {
        return file;
    }

    public void append(OptEvent e) throws IOException {
        String line = mapper.writeValueAsString(e);
        io.appendJsonl(file, line);
    }

    public List<String> readAllRawLines() throws IOException {
        return io.readJsonl(file);
    }

    /** Parsed events; unreadable rows are skipped. */
    public List<OptEvent> readAll() throws IOException {
        List<String> lines = readAllRawLines();
        ArrayList<OptEvent> out = new ArrayList<>(lines.size());
        for (String line : lines) {
            try {
                out.add(mapper.readValue(line, OptEvent.class));
            } catch (IOException e) {
                log.warn("Skipping broken event row in {}: {}", file, e.getMessage());
            }
        }
        return out;
    }
}
