package org.dxworks.docframe.text;

import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/** Classifies link and image targets by scheme and checks them against the allowed schemes. */
public class UrlClassifier {

    private static final Pattern DATA_URI = Pattern.compile("^data:([^;,]+)?(;base64)?,(.*)$", Pattern.DOTALL);
    private static final Pattern MEDIA_SUBTYPE = Pattern.compile("^[^/]+/([^;]+)");
    private static final String UNKNOWN = "unknown";

    private final Set<String> allowedSchemes;

    public UrlClassifier(Set<String> allowedSchemes) {
        this.allowedSchemes = Set.copyOf(allowedSchemes);
    }

    /** Lower-cased text before the first colon, {@code null} for scheme-less targets. */
    public static String scheme(String url) {
        if (url == null) {
            return null;
        }
        int colon = url.indexOf(':');
        return colon < 0 ? null : url.substring(0, colon).toLowerCase(Locale.ROOT);
    }

    public boolean isAllowed(String url) {
        String scheme = scheme(url);
        return scheme == null || allowedSchemes.contains(scheme);
    }

    public static String linkType(String url) {
        String target = url == null ? "" : url;
        if (target.startsWith("#")) {
            return "anchor";
        }
        if (target.startsWith("http://") || target.startsWith("https://")) {
            return "external";
        }
        if (target.startsWith("mailto:")) {
            return "email";
        }
        if (target.startsWith("tel:")) {
            return "phone";
        }
        if (target.startsWith("file:")) {
            return "file";
        }
        int separator = target.indexOf("://");
        if (separator >= 0) {
            String schemePart = target.substring(0, separator);
            return !schemePart.isEmpty() && schemePart.chars().allMatch(Character::isLetter) ? "custom" : "malformed";
        }
        return "internal";
    }

    public static String imageKind(String src) {
        String target = src == null ? "" : src;
        if (target.startsWith("data:")) {
            return "data";
        }
        if (target.startsWith("http://") || target.startsWith("https://")) {
            return "external";
        }
        return "local";
    }

    public static String imageFormat(String src) {
        String target = src == null ? "" : src;
        if (target.startsWith("data:")) {
            Matcher uri = DATA_URI.matcher(target);
            if (!uri.matches()) {
                return UNKNOWN;
            }
            String mediaType = uri.group(1) == null ? "text/plain" : uri.group(1);
            Matcher subtype = MEDIA_SUBTYPE.matcher(mediaType);
            return subtype.find() ? subtype.group(1) : UNKNOWN;
        }
        String path = target.toLowerCase(Locale.ROOT);
        int cut = indexOfAny(path, '?', '#');
        if (cut >= 0) {
            path = path.substring(0, cut);
        }
        int slash = path.lastIndexOf('/');
        String name = slash >= 0 ? path.substring(slash + 1) : path;
        int dot = name.lastIndexOf('.');
        if (dot <= 0 || dot == name.length() - 1) {
            return UNKNOWN;
        }
        return name.substring(dot + 1);
    }

    private static int indexOfAny(String text, char first, char second) {
        int a = text.indexOf(first);
        int b = text.indexOf(second);
        if (a < 0) {
            return b;
        }
        return b < 0 ? a : Math.min(a, b);
    }
}
