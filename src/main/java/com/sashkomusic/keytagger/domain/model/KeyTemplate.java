package com.sashkomusic.keytagger.domain.model;

public record KeyTemplate(
        String label,
        boolean isMinor,
        int rotation,
        FeatureVector vector
) {
}
