package com.sashkomusic.keytagger.domain.model;

import java.nio.file.Path;
import java.util.List;

public record AnalysisRun(
        Status status,
        Path folder,
        List<TrackResult> results,
        RunStatistics statistics,
        Path reportPath
) {
    public enum Status {
        COMPLETED,
        FOLDER_NOT_FOUND,
        NO_SUPPORTED_FILES
    }

    public static AnalysisRun completed(Path folder, List<TrackResult> results, RunStatistics statistics,
                                        Path reportPath) {
        return new AnalysisRun(Status.COMPLETED, folder, List.copyOf(results), statistics, reportPath);
    }

    public static AnalysisRun aborted(Status status, Path folder) {
        return new AnalysisRun(status, folder, List.of(), new RunStatistics(), null);
    }

    public boolean isCompleted() {
        return status == Status.COMPLETED;
    }
}
