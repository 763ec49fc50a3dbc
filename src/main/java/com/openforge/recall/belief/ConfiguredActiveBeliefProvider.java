package com.openforge.recall.belief;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Active beliefs aggregated from configured static tags plus an optional
 * JSON sidecar (an array of strings).
 *
 * The sources are re-read every {@code recall.beliefs.refresh-ms} (default one
 * minute). A changed tag set is swapped in atomically under the next version, so a
 * query that already holds a snapshot keeps a consistent view.
 */
@Slf4j
@Component
@EnableConfigurationProperties(BeliefProperties.class)
public class ConfiguredActiveBeliefProvider implements ActiveBeliefProvider {

    private static final TypeReference<List<Object>> TAG_LIST_TYPE = new TypeReference<>() {};

    private final BeliefProperties props;
    private final ObjectMapper     objectMapper;
    private final AtomicReference<ActiveBeliefSet> snapshot = new AtomicReference<>(ActiveBeliefSet.empty());

    public ConfiguredActiveBeliefProvider(BeliefProperties props, ObjectMapper objectMapper) {
        this.props        = props;
        this.objectMapper = objectMapper;
        refresh();
    }

    @Override
    public ActiveBeliefSet current() {
        return snapshot.get();
    }

    @Scheduled(initialDelayString = "${recall.beliefs.refresh-ms:60000}",
               fixedDelayString   = "${recall.beliefs.refresh-ms:60000}")
    public void reload() {
        refresh();
    }

    /** Re-reads the sources; publishes a new version only when the tag set changed. */
    public ActiveBeliefSet refresh() {
        Set<String> tags = new LinkedHashSet<>(BeliefTags.normalizeAll(props.tags()));
        tags.addAll(readSidecar());
        ActiveBeliefSet prev = snapshot.get();
        if (prev.version() > 0 && prev.tags().equals(tags)) {
            return prev;
        }
        ActiveBeliefSet next = new ActiveBeliefSet(tags, prev.version() + 1);
        snapshot.set(next);
        log.info("[Beliefs] Active belief set v{} loaded ({} tags)", next.version(), next.tags().size());
        return next;
    }

    private Set<String> readSidecar() {
        if (props.file() == null || props.file().isBlank()) return Set.of();
        Path path = Path.of(props.file());
        if (!Files.exists(path)) {
            log.debug("[Beliefs] Sidecar {} not present, using static tags only", path);
            return Set.of();
        }
        try {
            List<Object> raw = objectMapper.readValue(path.toFile(), TAG_LIST_TYPE);
            return BeliefTags.normalizeAll(raw);
        } catch (IOException e) {
            log.warn("[Beliefs] Could not read sidecar {}: {}, using static tags only", path, e.getMessage());
            return Set.of();
        }
    }
}
