package com.sashkomusic.keytagger.domain.service.report;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.sashkomusic.keytagger.domain.model.TrackResult;

import java.time.LocalDateTime;

@JsonPropertyOrder({
        "original_filename", "filename", "path", "bpm", "key", "confidence",
        "duration_seconds", "size_mb", "renamed", "timestamp"
})
public record ReportRow(
        @JsonProperty("original_filename") String originalFilename,
        @JsonProperty("filename") String filename,
        @JsonProperty("path") String path,
        @JsonProperty("bpm") Integer bpm,
        @JsonProperty("key") String key,
        @JsonProperty("confidence") Double confidence,
        @JsonProperty("duration_seconds") Double durationSeconds,
        @JsonProperty("size_mb") Double sizeMb,
        @JsonProperty("renamed") boolean renamed,
        @JsonProperty("timestamp") LocalDateTime timestamp
) {
    public static ReportRow from(TrackResult result) {
        return new ReportRow(
                result.originalFilename(),
                result.finalFilename(),
                result.finalPath().toString(),
                result.bpm(),
                result.keyLabel(),
                result.confidenceScore(),
                result.durationSeconds(),
                result.sizeMb(),
                result.renamed(),
                result.timestamp()
        );
    }
}
