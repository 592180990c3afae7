package com.sashkomusic.keytagger.domain.model;

import java.nio.file.Path;
import java.time.LocalDateTime;

public record TrackResult(
        String originalFilename,
        String finalFilename,
        Path finalPath,
        Integer bpm,
        String keyLabel,
        Double confidenceScore,
        ConfidenceTier confidenceTier,
        Double durationSeconds,
        Double sizeMb,
        boolean renamed,
        boolean renameAttempted,
        LocalDateTime timestamp
) {
    public static TrackResult failed(Path file, LocalDateTime timestamp) {
        String name = file.getFileName().toString();
        return new TrackResult(name, name, file, null, null, null, null, null, null,
                false, false, timestamp);
    }
}
