package org.dxworks.docframe.text;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * GitHub-style heading anchors. One instance per document keeps repeated titles unique by
 * appending {@code -2}, {@code -3} and so on.
 */
public class Slugs {

    private static final String FALLBACK = "heading";

    private final Map<String, Integer> seen = new HashMap<>();

    public static String slugify(String text) {
        if (text == null) {
            return FALLBACK;
        }
        String slug = text.toLowerCase(Locale.ROOT)
                .replaceAll("[^\\p{L}\\p{N}\\s-]", "")
                .trim()
                .replaceAll("\\s", "-")
                .replaceAll("^-+|-+$", "");
        return slug.isEmpty() ? FALLBACK : slug;
    }

    public String unique(String text) {
        String base = slugify(text);
        int count = seen.merge(base, 1, Integer::sum);
        if (count == 1) {
            return base;
        }
        String candidate = base + "-" + count;
        while (seen.containsKey(candidate)) {
            count++;
            candidate = base + "-" + count;
        }
        seen.put(base, count);
        seen.put(candidate, 1);
        return candidate;
    }
}
