package hle.mcp.toolkit.cache;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * {@link StorageAdapter} that keeps one JSON file per key in a directory, so
 * cached listings survive a restart. Files are replaced atomically where the
 * file system allows it.
 *
 * <p>Each file holds {@code {"expiresAt": <epoch millis or null>, "value": "..."}}.
 */
public class FileStorageAdapter implements StorageAdapter {

    private static final Logger logger = LoggerFactory.getLogger(FileStorageAdapter.class);

    private static final Pattern VALID_KEY = Pattern.compile("[A-Za-z0-9._-]+");
    private static final String SUFFIX = ".json";

    private final Path directory;
    private final ObjectMapper mapper = new ObjectMapper();

    public FileStorageAdapter(Path directory) throws IOException {
        this.directory = Objects.requireNonNull(directory, "directory cannot be null");
        Files.createDirectories(directory);
    }

    @Override
    public Optional<String> get(String key) throws IOException {
        Path file = fileFor(key);
        if (!Files.exists(file)) {
            return Optional.empty();
        }
        JsonNode envelope = mapper.readTree(Files.readString(file, StandardCharsets.UTF_8));
        JsonNode expiresAt = envelope.get("expiresAt");
        if (expiresAt != null && !expiresAt.isNull() && System.currentTimeMillis() >= expiresAt.asLong()) {
            Files.deleteIfExists(file);
            return Optional.empty();
        }
        JsonNode value = envelope.get("value");
        if (value == null || !value.isTextual()) {
            throw new IOException("Malformed cache file " + file);
        }
        return Optional.of(value.asText());
    }

    @Override
    public void set(String key, String value, Duration ttl) throws IOException {
        Objects.requireNonNull(value, "value cannot be null");
        Path file = fileFor(key);
        ObjectNode envelope = mapper.createObjectNode();
        if (ttl == null) {
            envelope.putNull("expiresAt");
        } else {
            envelope.put("expiresAt", System.currentTimeMillis() + ttl.toMillis());
        }
        envelope.put("value", value);

        Path temp = Files.createTempFile(directory, key + "-", ".tmp");
        try {
            Files.writeString(temp, mapper.writeValueAsString(envelope), StandardCharsets.UTF_8);
            try {
                Files.move(temp, file, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                logger.debug("Atomic move not supported in {}, replacing {} non-atomically", directory, file);
                Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(temp);
        }
    }

    @Override
    public void delete(String key) throws IOException {
        Files.deleteIfExists(fileFor(key));
    }

    @Override
    public void clear() throws IOException {
        try (DirectoryStream<Path> files = Files.newDirectoryStream(directory, "*" + SUFFIX)) {
            for (Path file : files) {
                Files.deleteIfExists(file);
            }
        }
    }

    public Path getDirectory() {
        return directory;
    }

    private Path fileFor(String key) {
        Objects.requireNonNull(key, "key cannot be null");
        if (!VALID_KEY.matcher(key).matches()) {
            throw new IllegalArgumentException("Invalid storage key: " + key);
        }
        return directory.resolve(key + SUFFIX);
    }
}
