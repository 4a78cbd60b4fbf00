package com.raditha.codetwin.cli;

/**
 * Report files written after a comparison.
 */
public enum ExportFormat {
    /**
     * similarity-report.json only. The default.
     */
    JSON,

    /**
     * similarity-report.csv only.
     */
    CSV,

    /**
     * Both files.
     */
    BOTH;

    /**
     * Convert a string value to ExportFormat enum.
     *
     * @param value the string value to convert (case-insensitive)
     * @return the corresponding ExportFormat
     * @throws IllegalArgumentException if the value is not a valid format
     */
    public static ExportFormat fromString(String value) {
        if (value == null) {
            throw new IllegalArgumentException("ExportFormat value cannot be null");
        }

        return switch (value.toLowerCase()) {
            case "json" -> JSON;
            case "csv" -> CSV;
            case "both" -> BOTH;
            default -> throw new IllegalArgumentException(
                    "Invalid export format: " + value + ". Must be: json, csv, or both");
        };
    }

    public boolean includesJson() {
        return this == JSON || this == BOTH;
    }

    public boolean includesCsv() {
        return this == CSV || this == BOTH;
    }
}
