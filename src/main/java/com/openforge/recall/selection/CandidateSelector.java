package com.openforge.recall.selection;

import com.openforge.recall.candidate.Candidate;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Decides which raw hits are considered at all.
 *
 * Stages, each optional except the first:
 * <ol>
 *   <li>threshold filter on raw similarity</li>
 *   <li>dynamic threshold {@code min(threshold, max(floor, top * 0.98))} when nothing passed</li>
 *   <li>keyword boost of up to +0.15, used for ordering only</li>
 *   <li>near-duplicate collapse: word-set Jaccard at or above the dedupe threshold
 *       drops the later of two texts</li>
 *   <li>MMR rerank, only when every survivor carries an embedding</li>
 *   <li>top-1 fallback when still empty</li>
 *   <li>minimum-results backfill when still empty</li>
 * </ol>
 * With every optional stage off this is exactly {@code rawSimilarity >= threshold}
 * in input order. The same input and config always give the same output.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@EnableConfigurationProperties(SelectionConfig.class)
public class CandidateSelector {

    static final double DYNAMIC_RATIO     = 0.98;
    static final double MAX_KEYWORD_BOOST = 0.15;

    private static final Pattern TOKEN = Pattern.compile("\\w+", Pattern.UNICODE_CHARACTER_CLASS);

    private static final Comparator<Candidate> BY_RAW_DESC =
            Comparator.comparingDouble(Candidate::rawSimilarity).reversed();

    private final MmrReranker mmr;

    public SelectionResult select(String query, List<Candidate> hits, SelectionConfig cfg) {
        if (hits == null || hits.isEmpty()) {
            return new SelectionResult(List.of(), Map.of(), cfg.threshold(), Set.of(),
                    SelectionResult.Reason.NO_CANDIDATES);
        }

        Set<SelectionStage> stages  = EnumSet.noneOf(SelectionStage.class);
        Map<String, Double> ranking = new HashMap<>();
        double thresholdUsed = cfg.threshold();

        // 1) threshold
        List<Candidate> filtered = aboveThreshold(hits, cfg.threshold());
        if (!filtered.isEmpty()) stages.add(SelectionStage.THRESHOLD);

        // 2) dynamic threshold
        if (filtered.isEmpty() && cfg.dynamicThresholdEnabled()) {
            List<Candidate> sorted = new ArrayList<>(hits);
            sorted.sort(BY_RAW_DESC);
            double top = sorted.get(0).rawSimilarity();
            thresholdUsed = Math.min(cfg.threshold(), Math.max(cfg.floorThreshold(), top * DYNAMIC_RATIO));
            filtered = aboveThreshold(sorted, thresholdUsed);
            if (!filtered.isEmpty()) {
                stages.add(SelectionStage.DYNAMIC_THRESHOLD);
                log.debug("[Select] Dynamic threshold {} (top {}) kept {}", thresholdUsed, top, filtered.size());
            }
        }

        // 3) keyword boost
        if (cfg.keywordBoostEnabled() && !filtered.isEmpty()) {
            if (keywordBoost(query, filtered, cfg, ranking)) {
                stages.add(SelectionStage.KEYWORD_BOOST);
            }
            filtered = new ArrayList<>(filtered);
            filtered.sort(Comparator.comparingDouble(
                    (Candidate c) -> ranking.getOrDefault(c.id(), c.rawSimilarity())).reversed());
        }

        // 4) near-duplicate collapse
        if (cfg.dedupeEnabled() && filtered.size() > 1) {
            List<Candidate> kept = collapseDuplicates(filtered, cfg.dedupeThreshold());
            if (kept.size() < filtered.size()) {
                stages.add(SelectionStage.DEDUPE);
                log.debug("[Select] Collapsed {} near-duplicate(s)", filtered.size() - kept.size());
            }
            filtered = kept;
        }

        // 5) MMR
        if (cfg.mmrEnabled() && !filtered.isEmpty() && filtered.stream().allMatch(Candidate::hasEmbedding)) {
            filtered = mmr.rerank(filtered, cfg.mmrK(), cfg.mmrLambda(),
                    c -> ranking.getOrDefault(c.id(), c.rawSimilarity()), Candidate::embedding);
            stages.add(SelectionStage.MMR);
        }

        // 6) top-1 fallback
        if (filtered.isEmpty() && cfg.top1FallbackEnabled()) {
            Candidate best = hits.get(0);
            for (Candidate c : hits) {
                if (c.rawSimilarity() > best.rawSimilarity()) best = c;
            }
            filtered = List.of(best);
            stages.add(SelectionStage.TOP1_FALLBACK);
        }

        // 7) minimum results
        if (filtered.isEmpty() && cfg.minResults() > 0) {
            List<Candidate> sorted = new ArrayList<>(hits);
            sorted.sort(BY_RAW_DESC);
            filtered = sorted.subList(0, Math.min(cfg.minResults(), sorted.size()));
            stages.add(SelectionStage.MIN_RESULTS);
        }

        SelectionResult result = new SelectionResult(filtered, ranking, thresholdUsed, stages,
                filtered.isEmpty() ? SelectionResult.Reason.BELOW_THRESHOLD : null);
        if (cfg.logTelemetry()) {
            emitTelemetry(query, hits, result, cfg);
        }
        return result;
    }

    private static List<Candidate> aboveThreshold(List<Candidate> hits, double threshold) {
        List<Candidate> out = new ArrayList<>();
        for (Candidate c : hits) {
            if (c.rawSimilarity() >= threshold) out.add(c);
        }
        return out;
    }

    /**
     * Keeps each candidate unless its lower-cased whitespace-separated words overlap an
     * already kept text with Jaccard {@code >= threshold}. Blank texts are always kept.
     */
    static List<Candidate> collapseDuplicates(List<Candidate> candidates, double threshold) {
        List<Set<String>> seen = new ArrayList<>();
        List<Candidate>   out  = new ArrayList<>(candidates.size());
        for (Candidate c : candidates) {
            String text = c.text() == null ? "" : c.text().strip();
            if (text.isEmpty()) {
                out.add(c);
                continue;
            }
            Set<String> words = new HashSet<>(Arrays.asList(text.toLowerCase(Locale.ROOT).split("\\s+")));
            boolean duplicate = false;
            for (Set<String> other : seen) {
                if (jaccard(words, other) >= threshold) {
                    duplicate = true;
                    break;
                }
            }
            if (!duplicate) {
                seen.add(words);
                out.add(c);
            }
        }
        return out;
    }

    static double jaccard(Set<String> a, Set<String> b) {
        if (a.isEmpty() && b.isEmpty()) return 1.0;
        int shared = 0;
        for (String s : a) {
            if (b.contains(s)) shared++;
        }
        return (double) shared / (a.size() + b.size() - shared);
    }

    /** Fills {@code ranking} for boosted hits; returns whether any hit was boosted. */
    private static boolean keywordBoost(String query, List<Candidate> hits, SelectionConfig cfg,
                                        Map<String, Double> ranking) {
        Set<String> queryTokens = tokenize(query);
        if (queryTokens.isEmpty()) return false;

        boolean any = false;
        for (Candidate c : hits) {
            StringBuilder haystack = new StringBuilder();
            for (String field : cfg.keywordFields()) {
                if (field.equals("content") || field.equals("text")) {
                    haystack.append(c.text()).append('\n');
                } else if (field.equals("tags")) {
                    haystack.append(String.join(" ", c.tags())).append('\n');
                }
            }
            Set<String> tokens = tokenize(haystack.toString());
            tokens.retainAll(queryTokens);
            double extra = Math.min(MAX_KEYWORD_BOOST, cfg.keywordBoostUnit() * tokens.size());
            if (extra > 0) {
                ranking.put(c.id(), Math.min(1.0, c.rawSimilarity() + extra));
                any = true;
            }
        }
        return any;
    }

    static Set<String> tokenize(String text) {
        Set<String> out = new HashSet<>();
        if (text == null || text.isBlank()) return out;
        Matcher m = TOKEN.matcher(text.toLowerCase(Locale.ROOT));
        while (m.find()) {
            out.add(m.group());
        }
        return out;
    }

    private static void emitTelemetry(String query, List<Candidate> hits, SelectionResult result,
                                      SelectionConfig cfg) {
        long above = hits.stream().filter(h -> h.rawSimilarity() >= cfg.threshold()).count();
        List<String> samples = result.selected().stream()
                .limit(3)
                .map(c -> String.format(Locale.ROOT, "%s(%.4f): %s", c.id(), result.similarityOf(c),
                        Previews.preview(c.text(), cfg.previewChars())))
                .toList();
        log.info("[Select] query='{}' raw={} aboveThreshold={} selected={} threshold={} stages={} top={}",
                Previews.preview(query, 200), hits.size(), above, result.selected().size(),
                result.thresholdUsed(), result.stages(), samples);
    }
}
