package tollgate.adapter.out.deadletter;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jdk8.Jdk8Module;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.jboss.logging.Logger;

import tollgate.core.model.usage.DeadLetterEntry;
import tollgate.core.model.usage.UsagePersistenceException;
import tollgate.core.port.out.DeadLetterSink;

/**
 * Dead-letter sink appending one JSON document per line to a local file.
 *
 * <p>Every write is flushed before returning. Draining reads the whole file
 * and truncates it. Lines that cannot be parsed are kept in the file.
 */
public class FileDeadLetterSink implements DeadLetterSink {

    private static final Logger LOG = Logger.getLogger(FileDeadLetterSink.class);

    private final Path path;
    private final ObjectMapper objectMapper;

    public FileDeadLetterSink(Path path) {
        this.path = path;
        this.objectMapper = new ObjectMapper()
                .registerModule(new Jdk8Module())
                .registerModule(new JavaTimeModule())
                .configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false)
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        createParentDirectories();
    }

    @Override
    public synchronized void write(DeadLetterEntry entry) {
        try {
            final var line = objectMapper.writeValueAsString(entry) + "\n";
            Files.writeString(
                    path,
                    line,
                    StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE,
                    StandardOpenOption.APPEND,
                    StandardOpenOption.SYNC);
        } catch (IOException e) {
            throw new UsagePersistenceException("Failed to write dead-letter entry to " + path, e);
        }
    }

    @Override
    public synchronized List<DeadLetterEntry> drain() {
        if (!Files.exists(path)) {
            return List.of();
        }
        try {
            final var entries = new ArrayList<DeadLetterEntry>();
            final var unreadable = new ArrayList<String>();
            for (var line : Files.readAllLines(path, StandardCharsets.UTF_8)) {
                if (line.isBlank()) {
                    continue;
                }
                try {
                    entries.add(objectMapper.readValue(line, DeadLetterEntry.class));
                } catch (JsonProcessingException e) {
                    LOG.warnv("Keeping unreadable dead-letter line in {0}: {1}", path, e.getOriginalMessage());
                    unreadable.add(line);
                }
            }
            Files.write(
                    path,
                    unreadable,
                    StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE,
                    StandardOpenOption.TRUNCATE_EXISTING,
                    StandardOpenOption.WRITE);
            return entries;
        } catch (IOException e) {
            throw new UsagePersistenceException("Failed to drain dead-letter file " + path, e);
        }
    }

    @Override
    public synchronized long count() {
        if (!Files.exists(path)) {
            return 0;
        }
        try (var lines = Files.lines(path, StandardCharsets.UTF_8)) {
            return lines.filter(line -> !line.isBlank()).count();
        } catch (IOException e) {
            throw new UsagePersistenceException("Failed to read dead-letter file " + path, e);
        }
    }

    private void createParentDirectories() {
        final var parent = path.toAbsolutePath().getParent();
        if (parent == null) {
            return;
        }
        try {
            Files.createDirectories(parent);
        } catch (IOException e) {
            throw new UsagePersistenceException("Cannot create dead-letter directory " + parent, e);
        }
    }
}
