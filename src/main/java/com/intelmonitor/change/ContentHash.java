package com.intelmonitor.change;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Content fingerprints for change detection and alert deduplication.
 */
public final class ContentHash {

    private ContentHash() {}

    /** Trims and lower-cases text so whitespace and casing edits are not reported as changes. */
    public static String normalize(String text) {
        return text == null ? "" : text.trim().toLowerCase();
    }

    /** SHA-256 of the normalized text, first 16 hex characters. */
    public static String ofNormalized(String text) {
        return digest("SHA-256", normalize(text)).substring(0, 16);
    }

    /** Full MD5 hex digest of the raw input. */
    public static String md5(String input) {
        return digest("MD5", input);
    }

    private static String digest(String algorithm, String input) {
        try {
            MessageDigest digest = MessageDigest.getInstance(algorithm);
            byte[] hash = digest.digest(input.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(hash);
        } catch (NoSuchAlgorithmException e) {
            // SHA-256 and MD5 are mandated by the JCA specification
            throw new IllegalStateException(algorithm + " not available", e);
        }
    }
}
