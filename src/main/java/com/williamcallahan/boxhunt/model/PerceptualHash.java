/**
 * 64-bit perceptual fingerprint of an image
 *
 * @author William Callahan
 *
 * Features:
 * - Stored and transported as a 16 character lowercase hex string
 * - Compared by Hamming distance over the 64 bits
 */
package com.williamcallahan.boxhunt.model;

import java.util.Locale;

public record PerceptualHash(long bits) {

    public static final int HEX_LENGTH = 16;

    /**
     * Parses the hex form written to the metadata store
     *
     * @throws IllegalArgumentException if the value is blank, too long or not hexadecimal
     */
    public static PerceptualHash fromHex(String hex) {
        if (hex == null || hex.isBlank()) {
            throw new IllegalArgumentException("Perceptual hash must not be blank");
        }
        String trimmed = hex.trim();
        if (trimmed.length() > HEX_LENGTH) {
            throw new IllegalArgumentException("Perceptual hash too long: " + trimmed);
        }
        return new PerceptualHash(Long.parseUnsignedLong(trimmed, 16));
    }

    public String toHex() {
        return String.format(Locale.ROOT, "%016x", bits);
    }

    public int distanceTo(PerceptualHash other) {
        return Long.bitCount(bits ^ other.bits);
    }

    public boolean isNearDuplicateOf(PerceptualHash other, int threshold) {
        return distanceTo(other) <= threshold;
    }

    @Override
    public String toString() {
        return toHex();
    }
}
