package com.openforge.recall.scoring;

import com.openforge.recall.candidate.Candidate;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Heuristic detector: two candidates contradict when they share at least one
 * belief tag and one says "X is ..." while the other says "X is not ...".
 *
 * The newer claim is favored; on equal timestamps the more confident one,
 * then the one the store ranked higher.
 */
@Slf4j
@Component
public class PolarityContradictionDetector implements ContradictionDetector {

    private static final Pattern NEGATIVE = Pattern.compile(
            "\\b([A-Z][\\w\\- ]{1,60})\\s+(is|are|was|were|has|have|does|do)\\s+(?:not|no|n't)\\b");
    private static final Pattern POSITIVE = Pattern.compile(
            "\\b([A-Z][\\w\\- ]{1,60})\\s+(is|are|was|were|has|have|does|do)\\b(?!\\s+(?:not|no|n't))");

    @Override
    public List<Contradiction> detect(List<Candidate> candidates) {
        if (candidates == null || candidates.size() < 2) return List.of();

        List<Map<String, Integer>> polarities = new ArrayList<>(candidates.size());
        for (Candidate c : candidates) {
            polarities.add(polarity(c.text()));
        }

        List<Contradiction> found = new ArrayList<>();
        for (int i = 0; i < candidates.size(); i++) {
            Candidate a = candidates.get(i);
            if (a.beliefTags().isEmpty() || polarities.get(i).isEmpty()) continue;
            for (int j = i + 1; j < candidates.size(); j++) {
                Candidate b = candidates.get(j);
                TreeSet<String> shared = new TreeSet<>(a.beliefTags());
                shared.retainAll(b.beliefTags());
                if (shared.isEmpty()) continue;

                String entity = opposingEntity(polarities.get(i), polarities.get(j));
                if (entity == null) continue;

                boolean aFavored = favorsFirst(a, b);
                Candidate loser  = aFavored ? b : a;
                Candidate winner = aFavored ? a : b;
                found.add(new Contradiction(loser.id(), winner.id(), entity, List.copyOf(shared)));
                log.debug("[Contradiction] {} vs {} on '{}' (tags {}), flagging {}",
                        a.id(), b.id(), entity, shared, loser.id());
            }
        }
        return found;
    }

    /** Entity to polarity (+1 / -1). An explicit negation is never overwritten by a positive match. */
    static Map<String, Integer> polarity(String text) {
        Map<String, Integer> out = new HashMap<>();
        if (text == null || text.isBlank()) return out;
        Matcher neg = NEGATIVE.matcher(text);
        while (neg.find()) {
            out.put(neg.group(1).strip(), -1);
        }
        Matcher pos = POSITIVE.matcher(text);
        while (pos.find()) {
            out.putIfAbsent(pos.group(1).strip(), 1);
        }
        return out;
    }

    private static String opposingEntity(Map<String, Integer> a, Map<String, Integer> b) {
        // sorted for a stable choice when several entities disagree
        for (String entity : new TreeSet<>(a.keySet())) {
            Integer other = b.get(entity);
            if (other != null && other * a.get(entity) == -1) return entity;
        }
        return null;
    }

    private static boolean favorsFirst(Candidate a, Candidate b) {
        Instant ta = a.timestamp();
        Instant tb = b.timestamp();
        if (ta != null && tb != null && !ta.equals(tb)) return ta.isAfter(tb);
        if (ta != null && tb == null) return false;   // missing timestamp counts as "now"
        if (ta == null && tb != null) return true;
        if (a.confidence() != b.confidence()) return a.confidence() > b.confidence();
        return a.rawSimilarity() >= b.rawSimilarity();
    }
}
