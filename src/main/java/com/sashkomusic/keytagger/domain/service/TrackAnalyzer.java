package com.sashkomusic.keytagger.domain.service;

import com.sashkomusic.keytagger.domain.model.Classification;
import com.sashkomusic.keytagger.domain.model.RenameOutcome;
import com.sashkomusic.keytagger.domain.model.RenamePolicy;
import com.sashkomusic.keytagger.domain.model.TrackResult;
import com.sashkomusic.keytagger.domain.port.AudioPropertiesPort;
import com.sashkomusic.keytagger.domain.port.AudioSignal;
import com.sashkomusic.keytagger.domain.port.FeatureProviderPort;
import com.sashkomusic.keytagger.domain.port.FeatureProviderPort.FeatureExtractionException;
import com.sashkomusic.keytagger.domain.service.key.TonalClassifier;
import com.sashkomusic.keytagger.domain.service.rename.RenameEngine;
import com.sashkomusic.keytagger.domain.service.tempo.TempoNormalizer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.OptionalInt;

@Slf4j
@Service
@RequiredArgsConstructor
public class TrackAnalyzer {

    private static final double BYTES_PER_MB = 1024.0 * 1024.0;

    private final FeatureProviderPort featureProvider;
    private final AudioPropertiesPort audioProperties;
    private final TempoNormalizer tempoNormalizer;
    private final TonalClassifier tonalClassifier;
    private final RenameEngine renameEngine;
    private final Clock clock;

    public TrackResult analyze(Path audioFile, RenamePolicy policy) {
        try {
            return analyzeFile(audioFile, policy);
        } catch (Exception ex) {
            log.error("Error analyzing {}: {}", audioFile, ex.getMessage(), ex);
            return failedResult(audioFile);
        }
    }

    public TrackResult failedResult(Path audioFile) {
        return TrackResult.failed(audioFile, LocalDateTime.now(clock));
    }

    private TrackResult analyzeFile(Path audioFile, RenamePolicy policy) throws IOException {
        String originalFilename = audioFile.getFileName().toString();

        double sizeMb = round2(Files.size(audioFile) / BYTES_PER_MB);
        OptionalDouble duration = audioProperties.durationSeconds(audioFile);

        Integer bpm = null;
        Optional<Classification> classification = Optional.empty();

        Optional<AudioSignal> signal = loadSignal(audioFile);
        if (signal.isPresent()) {
            bpm = detectBpm(signal.get());
            classification = detectKey(signal.get());
        }

        Path finalPath = audioFile;
        boolean renamed = false;
        boolean renameAttempted = false;

        if (policy.renameEnabled() && bpm != null && classification.isPresent()) {
            renameAttempted = true;
            RenameOutcome outcome = renameEngine.rename(audioFile, classification.get().keyLabel(), bpm, policy);
            renamed = outcome.success();
            finalPath = outcome.finalPath();
        }

        return new TrackResult(
                originalFilename,
                finalPath.getFileName().toString(),
                finalPath,
                bpm,
                classification.map(Classification::keyLabel).orElse(null),
                classification.map(Classification::confidenceScore).orElse(null),
                classification.map(Classification::confidenceTier).orElse(null),
                duration.isPresent() ? round2(duration.getAsDouble()) : null,
                sizeMb,
                renamed,
                renameAttempted,
                LocalDateTime.now(clock)
        );
    }

    private Optional<AudioSignal> loadSignal(Path audioFile) {
        try {
            return Optional.of(featureProvider.loadSignal(audioFile));
        } catch (FeatureExtractionException ex) {
            log.error("Could not load signal for {}: {}", audioFile.getFileName(), ex.getMessage());
            return Optional.empty();
        }
    }

    private Integer detectBpm(AudioSignal signal) {
        try {
            log.info("Analyzing BPM: {}", signal.source().getFileName());
            OptionalInt bpm = tempoNormalizer.normalize(featureProvider.rawTempo(signal));
            if (bpm.isEmpty()) {
                log.warn("No usable tempo for {}", signal.source().getFileName());
                return null;
            }
            log.info("BPM detected: {}", bpm.getAsInt());
            return bpm.getAsInt();
        } catch (FeatureExtractionException ex) {
            log.error("Error detecting BPM in {}: {}", signal.source(), ex.getMessage());
            return null;
        }
    }

    private Optional<Classification> detectKey(AudioSignal signal) {
        try {
            log.info("Detecting key: {}", signal.source().getFileName());
            Optional<Classification> classification = tonalClassifier.classify(featureProvider.chromaVector(signal));
            classification.ifPresent(c -> log.info("Key: {} (corr: {}, {})", c.keyLabel(),
                    String.format("%.2f", c.confidenceScore()), c.confidenceTier().getDisplayName()));
            return classification;
        } catch (FeatureExtractionException ex) {
            log.error("Error detecting key in {}: {}", signal.source(), ex.getMessage());
            return Optional.empty();
        }
    }

    static double round2(double value) {
        return BigDecimal.valueOf(value).setScale(2, RoundingMode.HALF_EVEN).doubleValue();
    }
}
