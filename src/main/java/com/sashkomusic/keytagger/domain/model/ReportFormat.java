package com.sashkomusic.keytagger.domain.model;

import java.util.Locale;

public enum ReportFormat {
    CSV("csv"),
    JSON("json");

    private final String extension;

    ReportFormat(String extension) {
        this.extension = extension;
    }

    public static ReportFormat parse(String value) {
        if (value == null || value.isBlank()) {
            return CSV;
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "csv", "tabular" -> CSV;
            case "json", "structured" -> JSON;
            default -> throw new IllegalArgumentException("Unknown report format: " + value);
        };
    }

    public String getExtension() {
        return extension;
    }
}
