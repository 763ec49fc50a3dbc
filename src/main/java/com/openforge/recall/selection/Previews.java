package com.openforge.recall.selection;

import java.util.regex.Pattern;

/**
 * Text previews for logs, with e-mail addresses, URLs and credentials masked.
 */
public final class Previews {

    private static final Pattern EMAIL   = Pattern.compile("[A-Za-z0-9._%+-]+@[A-Za-z0-9.-]+\\.[A-Za-z]{2,}");
    private static final Pattern URL     = Pattern.compile("https?://\\S+");
    private static final Pattern API_KEY = Pattern.compile(
            "(sk-[A-Za-z0-9]{16,}|api[_-]?key[:=]\\S+|Bearer\\s+[A-Za-z0-9._-]{16,})",
            Pattern.CASE_INSENSITIVE);

    private Previews() {}

    public static String scrub(String text) {
        if (text == null || text.isEmpty()) return "";
        String s = EMAIL.matcher(text).replaceAll("[EMAIL]");
        s = URL.matcher(s).replaceAll("[URL]");
        return API_KEY.matcher(s).replaceAll("[SECRET]");
    }

    public static String preview(String text, int maxChars) {
        String s = scrub(text).replace('\n', ' ');
        return s.length() <= maxChars ? s : s.substring(0, maxChars) + "…";
    }
}
