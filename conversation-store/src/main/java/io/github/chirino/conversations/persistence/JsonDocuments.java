package io.github.chirino.conversations.persistence;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import io.github.chirino.conversations.store.StorageException;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Optional;
import java.util.UUID;
import org.jboss.logging.Logger;

/**
 * Reads and writes whole JSON documents. Writes go to a sibling temp file that is then moved over
 * the target, so a concurrent reader sees either the previous or the new document in full.
 */
public class JsonDocuments {

    private static final Logger LOG = Logger.getLogger(JsonDocuments.class);
    private static final String TEMP_SUFFIX = ".tmp";

    private final ObjectMapper mapper;
    private final ObjectWriter writer;

    public JsonDocuments(ObjectMapper mapper, boolean prettyPrint) {
        this.mapper = mapper;
        this.writer = prettyPrint ? mapper.writerWithDefaultPrettyPrinter() : mapper.writer();
    }

    public ObjectMapper mapper() {
        return mapper;
    }

    /**
     * Returns the parsed document, or empty when the file is missing or does not hold valid JSON
     * of the expected shape.
     */
    public <T> Optional<T> read(Path file, Class<T> type) {
        if (!Files.isRegularFile(file)) {
            return Optional.empty();
        }
        try {
            return Optional.ofNullable(mapper.readValue(file.toFile(), type));
        } catch (JsonProcessingException e) {
            LOG.warnf(e, "Ignoring corrupt document %s", file);
            return Optional.empty();
        } catch (IOException e) {
            if (!Files.exists(file)) {
                return Optional.empty();
            }
            throw StorageException.storageError("Failed to read " + file, file.toString(), e);
        }
    }

    public void write(Path file, Object document) {
        Path temp = file.resolveSibling(file.getFileName() + "." + UUID.randomUUID() + TEMP_SUFFIX);
        try {
            Files.createDirectories(file.getParent());
            try (OutputStream out = Files.newOutputStream(temp)) {
                writer.writeValue(out, document);
            }
            moveIntoPlace(temp, file);
        } catch (IOException e) {
            deleteQuietly(temp);
            throw StorageException.storageError("Failed to write " + file, file.toString(), e);
        }
    }

    private static void moveIntoPlace(Path temp, Path target) throws IOException {
        try {
            Files.move(
                    temp,
                    target,
                    StandardCopyOption.ATOMIC_MOVE,
                    StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            LOG.debugf("Atomic move not supported for %s, falling back to replace", target);
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private static void deleteQuietly(Path temp) {
        try {
            Files.deleteIfExists(temp);
        } catch (IOException e) {
            LOG.debugf(e, "Failed to delete temp file %s", temp);
        }
    }
}
