package com.openforge.recall.arbitration;

import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Lexical intent classification. Whichever cue appears first in the query
 * decides; "how come" reads as a why-question. No cue means {@link QueryIntent#FACT}.
 */
@Component
public class IntentClassifier {

    private static final Pattern WHY = Pattern.compile(
            "\\b(why|how come|what causes|what caused|reason for|reasons for|because of what)\\b");
    private static final Pattern HOW = Pattern.compile(
            "\\b(how|steps to|way to|ways to|guide to|instructions for|procedure for)\\b");

    public QueryIntent classify(String query) {
        if (query == null || query.isBlank()) return QueryIntent.FACT;
        String q = query.toLowerCase(Locale.ROOT);

        int why = firstIndex(WHY, q);
        int how = firstIndex(HOW, q);
        if (why < 0 && how < 0) return QueryIntent.FACT;
        if (how < 0) return QueryIntent.WHY;
        if (why < 0) return QueryIntent.HOW;
        return why <= how ? QueryIntent.WHY : QueryIntent.HOW;
    }

    private static int firstIndex(Pattern p, String text) {
        Matcher m = p.matcher(text);
        return m.find() ? m.start() : -1;
    }
}
