/**
 * Filename generation for stored images
 *
 * @author William Callahan
 */
package com.williamcallahan.boxhunt.util;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Locale;

/**
 * Builds collision-resistant filenames of the form {@code <source>_<epochSeconds>_<urlhash>.jpg}
 */
public final class ImageFileNames {

    public static final String EXTENSION = ".jpg";
    private static final int URL_HASH_LENGTH = 12;

    private ImageFileNames() {
        // Prevent instantiation
    }

    /**
     * @param source source tag of the candidate; sanitized to lowercase letters, digits, dash and underscore
     * @param epochSeconds download time
     * @param url original image URL
     * @return filename without directory
     */
    public static String generate(String source, long epochSeconds, String url) {
        return sanitizeSource(source) + "_" + epochSeconds + "_" + urlHash(url) + EXTENSION;
    }

    /**
     * First twelve hex digits of the MD5 of the URL
     */
    static String urlHash(String url) {
        try {
            MessageDigest digest = MessageDigest.getInstance("MD5");
            byte[] hash = digest.digest((url == null ? "" : url).getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(hash).substring(0, URL_HASH_LENGTH);
        } catch (NoSuchAlgorithmException e) {
            // MD5 is mandatory on every Java platform
            throw new IllegalStateException("MD5 digest not available", e);
        }
    }

    static String sanitizeSource(String source) {
        if (ValidationUtils.isNullOrBlank(source)) {
            return "image";
        }
        String cleaned = source.trim().toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9_-]+", "_");
        return cleaned.isEmpty() ? "image" : cleaned;
    }
}
