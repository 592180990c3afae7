package com.sashkomusic.keytagger.domain.service;

import com.sashkomusic.keytagger.domain.model.AnalysisRun;
import com.sashkomusic.keytagger.domain.model.RenamePolicy;
import com.sashkomusic.keytagger.domain.model.ReportFormat;
import com.sashkomusic.keytagger.domain.model.RunStatistics;
import com.sashkomusic.keytagger.domain.model.TrackResult;
import com.sashkomusic.keytagger.domain.service.report.AnalysisSummaryPresenter;
import com.sashkomusic.keytagger.domain.service.report.ReportWriter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Analyzes every supported file of a folder. Files are processed on the analysis executor;
 * the calling thread collects results in enumeration order and is the only one touching
 * the result list and the statistics.
 */
@Slf4j
@Service
public class BatchOrchestrator {

    private final AudioFileScanner fileScanner;
    private final TrackAnalyzer trackAnalyzer;
    private final ReportWriter reportWriter;
    private final AnalysisSummaryPresenter summaryPresenter;
    private final Executor analysisExecutor;

    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    public BatchOrchestrator(AudioFileScanner fileScanner,
                             TrackAnalyzer trackAnalyzer,
                             ReportWriter reportWriter,
                             AnalysisSummaryPresenter summaryPresenter,
                             @Qualifier("analysisExecutor") Executor analysisExecutor) {
        this.fileScanner = fileScanner;
        this.trackAnalyzer = trackAnalyzer;
        this.reportWriter = reportWriter;
        this.summaryPresenter = summaryPresenter;
        this.analysisExecutor = analysisExecutor;
    }

    public AnalysisRun run(Path folder, RenamePolicy policy, ReportFormat reportFormat) {
        cancelled.set(false);

        if (!fileScanner.isFolder(folder)) {
            log.error("Folder not found: {}", folder);
            return AnalysisRun.aborted(AnalysisRun.Status.FOLDER_NOT_FOUND, folder);
        }

        List<Path> audioFiles = fileScanner.scan(folder);
        if (audioFiles.isEmpty()) {
            log.warn("No audio files found in: {}", folder);
            return AnalysisRun.aborted(AnalysisRun.Status.NO_SUPPORTED_FILES, folder);
        }

        log.info("Found {} files to analyze", audioFiles.size());

        List<CompletableFuture<Optional<TrackResult>>> tasks = new ArrayList<>(audioFiles.size());
        for (int i = 0; i < audioFiles.size(); i++) {
            tasks.add(submit(audioFiles.get(i), i + 1, audioFiles.size(), policy));
        }

        List<TrackResult> results = new ArrayList<>(audioFiles.size());
        RunStatistics statistics = new RunStatistics();

        for (int i = 0; i < tasks.size(); i++) {
            Optional<TrackResult> result = await(tasks.get(i), audioFiles.get(i));
            result.ifPresent(r -> {
                results.add(r);
                statistics.record(r);
            });
        }

        if (cancelled.get()) {
            log.warn("Run cancelled: {} of {} files processed", results.size(), audioFiles.size());
        }

        Path reportPath = writeReport(folder, results, reportFormat);
        log.info("\n{}", summaryPresenter.render(results, statistics));

        return AnalysisRun.completed(folder, results, statistics, reportPath);
    }

    // files already started finish normally
    public void cancel() {
        cancelled.set(true);
    }

    private CompletableFuture<Optional<TrackResult>> submit(Path file, int index, int total, RenamePolicy policy) {
        return CompletableFuture.supplyAsync(() -> {
            if (cancelled.get()) {
                return Optional.empty();
            }
            log.info("[{}/{}] Processing: {}", index, total, file.getFileName());
            TrackResult result = trackAnalyzer.analyze(file, policy);
            log.info("-".repeat(80));
            return Optional.of(result);
        }, analysisExecutor);
    }

    private Optional<TrackResult> await(CompletableFuture<Optional<TrackResult>> task, Path file) {
        try {
            return task.join();
        } catch (CompletionException ex) {
            log.error("Task for {} failed: {}", file.getFileName(), ex.getMessage(), ex);
            return Optional.of(trackAnalyzer.failedResult(file));
        }
    }

    private Path writeReport(Path folder, List<TrackResult> results, ReportFormat reportFormat) {
        if (results.isEmpty()) {
            return null;
        }
        try {
            return reportWriter.write(folder, results, reportFormat);
        } catch (ReportWriter.ReportWriteException ex) {
            log.error("Failed to save results: {}", ex.getMessage(), ex);
            return null;
        }
    }
}
