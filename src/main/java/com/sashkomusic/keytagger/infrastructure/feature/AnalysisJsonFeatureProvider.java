package com.sashkomusic.keytagger.infrastructure.feature;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sashkomusic.keytagger.config.AnalyzerConfig;
import com.sashkomusic.keytagger.domain.model.FeatureVector;
import com.sashkomusic.keytagger.domain.port.AudioSignal;
import com.sashkomusic.keytagger.domain.port.FeatureProviderPort;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads the analysis document an external audio analyzer wrote for each track:
 * <pre>
 * {"success": true, "errorMessage": null,
 *  "features": {"rhythmic": {"bpm": 127.9}, "tonal": {"chroma": [12 numbers, C..B]}}}
 * </pre>
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AnalysisJsonFeatureProvider implements FeatureProviderPort {

    private final ObjectMapper objectMapper;
    private final AnalyzerConfig analyzerConfig;

    @Override
    public AudioSignal loadSignal(Path audioFile) throws FeatureExtractionException {
        Path documentPath = locateDocument(audioFile);
        if (!Files.isRegularFile(documentPath)) {
            throw new FeatureExtractionException("Analysis document not found: " + documentPath);
        }

        JsonNode root;
        try {
            root = objectMapper.readTree(documentPath.toFile());
        } catch (IOException e) {
            throw new FeatureExtractionException("Unreadable analysis document: " + documentPath, e);
        }

        boolean success = root.path("success").asBoolean(false);
        String errorMessage = root.path("errorMessage").asText(null);
        if (!success || errorMessage != null) {
            throw new FeatureExtractionException("Analysis failed for " + audioFile.getFileName() + ": "
                    + (errorMessage != null ? errorMessage : "Unknown error"));
        }

        JsonNode features = root.path("features");
        if (features.isMissingNode() || features.isNull()) {
            throw new FeatureExtractionException("Missing features in " + documentPath);
        }

        log.debug("Loaded analysis document {} for {}", documentPath.getFileName(), audioFile.getFileName());
        return new AnalysisDocument(audioFile, features);
    }

    @Override
    public double rawTempo(AudioSignal signal) throws FeatureExtractionException {
        JsonNode bpm = features(signal).path("rhythmic").path("bpm");
        if (!bpm.isNumber()) {
            throw new FeatureExtractionException("No tempo estimate for " + signal.source().getFileName());
        }
        return bpm.asDouble();
    }

    @Override
    public FeatureVector chromaVector(AudioSignal signal) throws FeatureExtractionException {
        JsonNode chroma = features(signal).path("tonal").path("chroma");
        if (!chroma.isArray() || chroma.size() != FeatureVector.DIMENSIONS) {
            throw new FeatureExtractionException("Expected " + FeatureVector.DIMENSIONS
                    + " chroma values for " + signal.source().getFileName());
        }

        double[] values = new double[FeatureVector.DIMENSIONS];
        for (int i = 0; i < values.length; i++) {
            JsonNode value = chroma.get(i);
            if (!value.isNumber()) {
                throw new FeatureExtractionException("Non-numeric chroma value at " + i
                        + " for " + signal.source().getFileName());
            }
            values[i] = value.asDouble();
        }

        try {
            return FeatureVector.normalized(values);
        } catch (IllegalArgumentException e) {
            throw new FeatureExtractionException("Unusable chroma for " + signal.source().getFileName()
                    + ": " + e.getMessage(), e);
        }
    }

    Path locateDocument(Path audioFile) {
        String directory = analyzerConfig.getFeatures().getDirectory();
        Path base = directory != null && !directory.isBlank() ? Path.of(directory) : audioFile.getParent();
        String documentName = audioFile.getFileName() + analyzerConfig.getFeatures().getSuffix();
        return base != null ? base.resolve(documentName) : Path.of(documentName);
    }

    private JsonNode features(AudioSignal signal) throws FeatureExtractionException {
        if (signal instanceof AnalysisDocument document) {
            return document.features();
        }
        throw new FeatureExtractionException("Unsupported signal type: " + signal.getClass().getName());
    }

    private record AnalysisDocument(Path source, JsonNode features) implements AudioSignal {
    }
}
