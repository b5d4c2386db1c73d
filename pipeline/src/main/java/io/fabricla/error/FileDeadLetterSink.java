package io.fabricla.error;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.fabricla.core.Json;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.util.List;

/**
 * Appends one JSON line per failed batch: timestamp, stage, channel, error and the records themselves.
 */
public class FileDeadLetterSink<T> implements DeadLetterSink<T> {
    private static final Logger log = LoggerFactory.getLogger(FileDeadLetterSink.class);

    private final Path file;
    private final ObjectMapper mapper;
    private final Clock clock;

    public FileDeadLetterSink(Path file) throws IOException {
        this(file, Json.mapper(), Clock.systemUTC());
    }

    public FileDeadLetterSink(Path file, ObjectMapper mapper, Clock clock) throws IOException {
        this.file = file;
        this.mapper = mapper;
        this.clock = clock;
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) Files.createDirectories(parent);
        if (!Files.exists(file)) {
            Files.writeString(file, "", StandardCharsets.UTF_8, StandardOpenOption.CREATE);
        }
    }

    @Override
    public synchronized void acceptFailure(String stage, String channel, List<T> records, Exception e) {
        ObjectNode line = mapper.createObjectNode();
        line.put("ts", clock.instant().toString());
        line.put("stage", stage);
        line.put("channel", channel);
        line.put("error", String.valueOf(e));
        line.put("count", records == null ? 0 : records.size());
        line.set("records", mapper.valueToTree(records == null ? List.of() : records));
        try {
            Files.writeString(file, mapper.writeValueAsString(line) + System.lineSeparator(),
                    StandardCharsets.UTF_8, StandardOpenOption.APPEND);
        } catch (IOException io) {
            // batch is already counted as failed
            log.error("Could not write {} dead-letter records for channel {} to {}",
                    records == null ? 0 : records.size(), channel, file, io);
        }
    }
}
