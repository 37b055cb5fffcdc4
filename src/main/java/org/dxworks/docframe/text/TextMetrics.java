package org.dxworks.docframe.text;

public final class TextMetrics {

    private TextMetrics() {
    }

    public static int wordCount(String text) {
        if (text == null || text.isBlank()) {
            return 0;
        }
        return text.trim().split("\\s+").length;
    }
}
