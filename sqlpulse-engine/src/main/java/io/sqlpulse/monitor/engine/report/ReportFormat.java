package io.sqlpulse.monitor.engine.report;

import java.util.Locale;

/**
 * Output formats a report can be rendered to
 */
public enum ReportFormat {
    TEXT("txt", "text/plain"),
    JSON("json", "application/json"),
    CSV("csv", "text/csv");

    private final String extension;
    private final String mediaType;

    ReportFormat(String extension, String mediaType) {
        this.extension = extension;
        this.mediaType = mediaType;
    }

    public String getExtension() { return extension; }
    public String getMediaType() { return mediaType; }

    /**
     * Accepts the format name or its file extension, case-insensitive
     */
    public static ReportFormat parse(String value) {
        if (value == null || value.trim().isEmpty()) {
            throw new IllegalArgumentException("Report format must not be empty");
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (ReportFormat format : values()) {
            if (format.name().equalsIgnoreCase(normalized) || format.extension.equals(normalized)) {
                return format;
            }
        }
        throw new IllegalArgumentException("Unknown report format: " + value + " (expected text, json or csv)");
    }
}
