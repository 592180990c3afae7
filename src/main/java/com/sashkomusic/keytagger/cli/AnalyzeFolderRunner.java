package com.sashkomusic.keytagger.cli;

import com.sashkomusic.keytagger.domain.model.AnalysisRun;
import com.sashkomusic.keytagger.domain.model.KeyNotation;
import com.sashkomusic.keytagger.domain.model.RenamePolicy;
import com.sashkomusic.keytagger.domain.model.RunRequest;
import com.sashkomusic.keytagger.domain.port.OperatorConsolePort;
import com.sashkomusic.keytagger.domain.service.BatchOrchestrator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.Optional;

@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "analyzer", name = "run-on-startup", havingValue = "true", matchIfMissing = true)
public class AnalyzeFolderRunner implements ApplicationRunner {

    private final OperatorConsolePort operatorConsole;
    private final BatchOrchestrator orchestrator;

    @Override
    public void run(ApplicationArguments args) {
        Optional<RunRequest> request = operatorConsole.requestRun();
        if (request.isEmpty()) {
            log.info("Operation cancelled by user");
            return;
        }

        RunRequest runRequest = request.get();
        logRunConfiguration(runRequest);

        AnalysisRun run = orchestrator.run(runRequest.folder(), runRequest.policy(), runRequest.reportFormat());
        logCompletion(run, runRequest.policy());
    }

    private void logRunConfiguration(RunRequest request) {
        RenamePolicy policy = request.policy();
        log.info("MUSIC ANALYZER - BPM, KEY & RENAMER");
        log.info("Folder: {}", request.folder());
        log.info("Rename: {}", policy.renameEnabled() ? "YES" : "NO");
        log.info("Notation: {}", policy.notation() == KeyNotation.ALPHANUMERIC ? "Alphanumeric" : "Classic");
        if (!policy.removeLiterals().isEmpty()) {
            log.info("Remove: {}", policy.removeLiterals());
        }
        if (!policy.replaceRules().isEmpty()) {
            log.info("Replace: {}", policy.replaceRules());
        }
        log.info("Report format: {}", request.reportFormat().getExtension());
    }

    private void logCompletion(AnalysisRun run, RenamePolicy policy) {
        switch (run.status()) {
            case FOLDER_NOT_FOUND -> log.error("Folder not found: {}", run.folder());
            case NO_SUPPORTED_FILES -> log.warn("No supported audio files in: {}", run.folder());
            case COMPLETED -> {
                if (policy.renameEnabled()) {
                    log.info("Analysis and renaming complete. Files processed: {}, renamed: {}, errors: {}. Results saved in: {}",
                            run.results().size(), run.statistics().getRenamedCount(),
                            run.statistics().getRenameErrors(), run.folder());
                } else {
                    log.info("Analysis complete. Files processed: {}. Results saved in: {}",
                            run.results().size(), run.folder());
                }
            }
        }
    }
}
