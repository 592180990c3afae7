package com.sashkomusic.keytagger.domain.model;

public enum ConfidenceTier {
    HIGH("High"),
    MEDIUM("Medium"),
    LOW("Low");

    private final String displayName;

    ConfidenceTier(String displayName) {
        this.displayName = displayName;
    }

    public static ConfidenceTier fromScore(double score) {
        if (score > 0.8) {
            return HIGH;
        }
        if (score > 0.5) {
            return MEDIUM;
        }
        return LOW;
    }

    public String getDisplayName() {
        return displayName;
    }
}
