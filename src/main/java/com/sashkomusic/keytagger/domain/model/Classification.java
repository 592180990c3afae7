package com.sashkomusic.keytagger.domain.model;

public record Classification(
        String keyLabel,
        double confidenceScore,
        ConfidenceTier confidenceTier
) {
}
