package org.dxworks.docframe.text;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

public final class ImageIds {

    private static final int LENGTH = 16;

    private ImageIds() {
    }

    /** Stable id from source and line; the same image on another line gets another id. */
    public static String of(String src, Integer line) {
        String idSource = (src == null ? "" : src) + "|" + (line == null ? -1 : line);
        try {
            byte[] digest = MessageDigest.getInstance("SHA-1").digest(idSource.getBytes(StandardCharsets.UTF_8));
            StringBuilder hex = new StringBuilder();
            for (byte b : digest) {
                hex.append(String.format("%02x", b));
                if (hex.length() >= LENGTH) {
                    break;
                }
            }
            return hex.substring(0, LENGTH);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-1 not available", e);
        }
    }
}
