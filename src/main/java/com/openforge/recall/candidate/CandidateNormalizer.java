package com.openforge.recall.candidate;

import com.openforge.recall.belief.BeliefTags;
import com.openforge.recall.store.StoreHit;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * The single boundary where loosely typed store payloads become {@link Candidate}s.
 *
 * Recognized payload fields:
 *   content | text            → text
 *   tags                      → tags (list or comma-separated string)
 *   timestamp | create_time_ms → timestamp (ISO-8601 string or epoch millis)
 *   source_trust, confidence, importance, times_used
 *   beliefs | belief_tags     → beliefTags (strings or {tag|label|key} objects)
 *   contradiction_flag, conflict_score
 *   type, memory_type         → provenance
 *   assertion_key
 *   embedding | vector        → embedding, when the hit itself carries none
 *
 * Malformed values never fail the batch: each one is replaced by its documented default.
 */
@Slf4j
@Component
public class CandidateNormalizer {

    public List<Candidate> normalizeAll(List<StoreHit> hits) {
        List<Candidate> out = new ArrayList<>(hits.size());
        for (StoreHit hit : hits) {
            if (hit == null) continue;
            out.add(normalize(hit));
        }
        return out;
    }

    public Candidate normalize(StoreHit hit) {
        Map<String, Object> p = hit.payload();
        Set<String> tags = stringSet(p.get("tags"));

        float[] embedding = finiteOrNull(hit.embedding());
        if (embedding == null) {
            embedding = vector(firstPresent(p, "embedding", "vector"));
        }

        return Candidate.builder()
                .id(hit.id())
                .embedding(embedding)
                .rawSimilarity(Vectors.clamp01(hit.similarity()))
                .text(text(p))
                .tags(tags)
                .timestamp(timestamp(p))
                .sourceTrust(unit(p.get("source_trust"), Candidate.DEFAULT_SOURCE_TRUST))
                .confidence(unit(p.get("confidence"), Candidate.DEFAULT_CONFIDENCE))
                .importance(unit(p.get("importance"), Candidate.DEFAULT_IMPORTANCE))
                .beliefTags(beliefTags(firstPresent(p, "beliefs", "belief_tags")))
                .timesUsed(nonNegativeInt(p.get("times_used")))
                .contradictionFlag(bool(p.get("contradiction_flag")))
                .conflictScore(optionalDouble(p.get("conflict_score")))
                .provenance(provenance(p, tags))
                .assertionKey(optionalString(p.get("assertion_key")))
                .build();
    }

    // ── Field coercion ───────────────────────────────────────────────────────

    private String text(Map<String, Object> p) {
        Object v = firstPresent(p, "content", "text");
        return v == null ? "" : v.toString();
    }

    @Nullable
    private Instant timestamp(Map<String, Object> p) {
        Object ts = p.get("timestamp");
        Instant parsed = instant(ts);
        if (parsed != null) return parsed;
        return instant(p.get("create_time_ms"));
    }

    @Nullable
    private Instant instant(@Nullable Object v) {
        if (v == null) return null;
        if (v instanceof Instant i) return i;
        if (v instanceof Number n) {
            long ms = n.longValue();
            return ms > 0 ? Instant.ofEpochMilli(ms) : null;
        }
        String s = v.toString().strip();
        if (s.isEmpty()) return null;
        try {
            return OffsetDateTime.parse(s).toInstant();
        } catch (DateTimeParseException e) {
            return zoneless(s);
        }
    }

    // Zone-less ISO timestamps are stored in UTC.
    @Nullable
    private Instant zoneless(String s) {
        try {
            return LocalDateTime.parse(s).toInstant(ZoneOffset.UTC);
        } catch (DateTimeParseException e) {
            log.debug("[Normalize] Unparseable timestamp '{}' treated as absent", s);
            return null;
        }
    }

    private double unit(@Nullable Object v, double dflt) {
        Double d = optionalDouble(v);
        if (d == null) return dflt;
        return Vectors.clamp01(d);
    }

    @Nullable
    private Double optionalDouble(@Nullable Object v) {
        if (v == null) return null;
        double d;
        if (v instanceof Number n) {
            d = n.doubleValue();
        } else {
            try {
                d = Double.parseDouble(v.toString().strip());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return Double.isFinite(d) ? d : null;
    }

    private int nonNegativeInt(@Nullable Object v) {
        Double d = optionalDouble(v);
        if (d == null || d < 0) return 0;
        return d >= Integer.MAX_VALUE ? Integer.MAX_VALUE : d.intValue();
    }

    private boolean bool(@Nullable Object v) {
        if (v instanceof Boolean b) return b;
        if (v instanceof Number n) return n.doubleValue() != 0;
        if (v instanceof String s) {
            String t = s.strip().toLowerCase(Locale.ROOT);
            return t.equals("true") || t.equals("1") || t.equals("yes");
        }
        return false;
    }

    @Nullable
    private String optionalString(@Nullable Object v) {
        if (v == null) return null;
        String s = v.toString().strip();
        return s.isEmpty() ? null : s;
    }

    private Set<String> stringSet(@Nullable Object v) {
        Set<String> out = new LinkedHashSet<>();
        if (v instanceof Collection<?> c) {
            for (Object o : c) {
                if (o != null && !o.toString().isBlank()) out.add(o.toString().strip());
            }
        } else if (v instanceof String s) {
            for (String part : s.split(",")) {
                if (!part.isBlank()) out.add(part.strip());
            }
        }
        return out;
    }

    private Set<String> beliefTags(@Nullable Object v) {
        if (v instanceof Collection<?> c) return BeliefTags.normalizeAll(c);
        if (v instanceof String s) return BeliefTags.normalizeAll(List.of(s.split(",")));
        return Set.of();
    }

    @Nullable
    private float[] vector(@Nullable Object v) {
        return v instanceof List<?> list ? Vectors.toArray(list) : null;
    }

    @Nullable
    private static float[] finiteOrNull(@Nullable float[] v) {
        if (v == null || v.length == 0) return null;
        for (float f : v) {
            if (!Float.isFinite(f)) return null;
        }
        return v;
    }

    private ProvenanceClass provenance(Map<String, Object> p, Set<String> tags) {
        String type       = lower(p.get("type"));
        String memoryType = lower(p.get("memory_type"));
        if ("abstraction".equals(type) || "abstraction".equals(memoryType) || tags.contains("abstraction_active")) {
            return ProvenanceClass.ABSTRACTION;
        }
        if ("procedural".equals(memoryType) || tags.contains("procedural_active")) {
            return ProvenanceClass.PROCEDURAL;
        }
        if ("episodic".equals(memoryType) || tags.contains("episodic_active")) {
            return ProvenanceClass.EPISODIC;
        }
        return ProvenanceClass.BASE;
    }

    private String lower(@Nullable Object v) {
        return v == null ? "" : v.toString().strip().toLowerCase(Locale.ROOT);
    }

    @Nullable
    private Object firstPresent(Map<String, Object> p, String... keys) {
        for (String k : keys) {
            Object v = p.get(k);
            if (v != null) return v;
        }
        return null;
    }
}
