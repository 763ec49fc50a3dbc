package com.openforge.recall.arbitration;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * JSON sidecar for the learned {@link ArbitrationProfile}.
 *
 * The file is optional and safe to delete: a missing or unreadable file loads
 * as the uniform profile. Writes go to a temp file in the same directory and
 * are then moved over the target.
 */
@Slf4j
@Component
public class ArbitrationProfileStore {

    private final ObjectMapper objectMapper;
    @Nullable
    private final Path         path;
    private final double       floor;

    @Autowired
    public ArbitrationProfileStore(ObjectMapper objectMapper, ArbitrationProperties props) {
        this(objectMapper, pathOf(props.learning().profilePath()), props.learning().floor());
    }

    ArbitrationProfileStore(ObjectMapper objectMapper, @Nullable Path path, double floor) {
        this.objectMapper = objectMapper;
        this.path         = path;
        this.floor        = floor;
    }

    public ArbitrationProfile load() {
        if (path == null || !Files.isRegularFile(path)) {
            return ArbitrationProfile.uniform();
        }
        try {
            ArbitrationProfile raw = objectMapper.readValue(path.toFile(), ArbitrationProfile.class);
            ArbitrationProfile profile = raw.sanitized(floor);
            log.info("[Arbitration] Loaded profile from {}: {}", path, profile);
            return profile;
        } catch (IOException e) {
            log.warn("[Arbitration] Unreadable profile {} ({}), using uniform weights", path, e.getMessage());
            return ArbitrationProfile.uniform();
        }
    }

    /** No-op when no path is configured. */
    public void save(ArbitrationProfile profile) throws IOException {
        if (path == null) return;
        Path dir = path.toAbsolutePath().getParent();
        if (dir != null) Files.createDirectories(dir);

        Path tmp = Files.createTempFile(dir, path.getFileName().toString(), ".tmp");
        try {
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(tmp.toFile(), profile);
            try {
                Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(tmp);
        }
        log.debug("[Arbitration] Saved profile to {}", path);
    }

    @Nullable
    public Path path() {
        return path;
    }

    @Nullable
    private static Path pathOf(@Nullable String raw) {
        return raw == null || raw.isBlank() ? null : Path.of(raw.strip());
    }
}
