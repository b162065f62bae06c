package com.williamcallahan.boxhunt.types;

import java.util.Locale;

/**
 * Formats the metadata store can be exported to
 */
public enum ExportFormat {
    CSV("csv"),
    JSON("json"),
    XLSX("xlsx");

    private final String extension;

    ExportFormat(String extension) {
        this.extension = extension;
    }

    public String getExtension() {
        return extension;
    }

    /**
     * Resolves a user-supplied format name
     *
     * @throws IllegalArgumentException for unsupported names
     */
    public static ExportFormat fromName(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Export format must not be blank");
        }
        String normalized = name.trim().toLowerCase(Locale.ROOT);
        for (ExportFormat format : values()) {
            if (format.extension.equals(normalized)) {
                return format;
            }
        }
        throw new IllegalArgumentException("Unsupported export format: " + name);
    }
}
