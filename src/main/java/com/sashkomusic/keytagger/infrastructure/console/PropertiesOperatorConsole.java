package com.sashkomusic.keytagger.infrastructure.console;

import com.sashkomusic.keytagger.config.AnalyzerConfig;
import com.sashkomusic.keytagger.domain.model.RenamePolicy;
import com.sashkomusic.keytagger.domain.model.ReportFormat;
import com.sashkomusic.keytagger.domain.model.RunRequest;
import com.sashkomusic.keytagger.domain.port.OperatorConsolePort;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.Optional;

@Slf4j
@Component
@RequiredArgsConstructor
public class PropertiesOperatorConsole implements OperatorConsolePort {

    private final AnalyzerConfig analyzerConfig;
    private final RenamePolicyParser policyParser;

    @Override
    public Optional<RunRequest> requestRun() {
        String folder = analyzerConfig.getFolder();
        if (folder == null || folder.isBlank()) {
            log.info("No folder selected, operation cancelled");
            return Optional.empty();
        }

        AnalyzerConfig.Rename rename = analyzerConfig.getRename();
        RenamePolicy policy = policyParser.parse(
                rename.isEnabled(), rename.getNotation(), rename.getRemove(), rename.getReplace());
        ReportFormat format = ReportFormat.parse(analyzerConfig.getReport().getFormat());

        return Optional.of(new RunRequest(Path.of(folder.trim()), policy, format));
    }
}
