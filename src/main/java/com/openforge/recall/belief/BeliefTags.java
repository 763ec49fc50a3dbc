package com.openforge.recall.belief;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Normalization of belief tags, applied identically to active beliefs and
 * to candidate tags so that overlap is computed on the same alphabet.
 */
public final class BeliefTags {

    private BeliefTags() {}

    /**
     * Lower-cases, maps every character outside {@code [a-z0-9:_.]} to '_',
     * and trims leading/trailing underscores. Returns "" for blank input.
     */
    public static String normalize(String raw) {
        if (raw == null) return "";
        String lower = raw.strip().toLowerCase(Locale.ROOT);
        StringBuilder sb = new StringBuilder(lower.length());
        for (int i = 0; i < lower.length(); i++) {
            char ch = lower.charAt(i);
            boolean keep = Character.isLetterOrDigit(ch) || ch == ':' || ch == '_' || ch == '.';
            sb.append(keep ? ch : '_');
        }
        int start = 0, end = sb.length();
        while (start < end && sb.charAt(start) == '_') start++;
        while (end > start && sb.charAt(end - 1) == '_') end--;
        return sb.substring(start, end);
    }

    /**
     * Accepts strings, or maps carrying the tag under "tag", "label" or "key".
     * Anything else is skipped.
     */
    public static Set<String> normalizeAll(Collection<?> raw) {
        Set<String> out = new LinkedHashSet<>();
        if (raw == null) return out;
        for (Object v : raw) {
            String tag = null;
            if (v instanceof String s) {
                tag = s;
            } else if (v instanceof Map<?, ?> m) {
                Object t = firstNonNull(m.get("tag"), m.get("label"), m.get("key"));
                if (t instanceof String s) tag = s;
            }
            String norm = normalize(tag);
            if (!norm.isEmpty()) out.add(norm);
        }
        return out;
    }

    private static Object firstNonNull(Object... values) {
        for (Object v : values) if (v != null) return v;
        return null;
    }
}
