package com.sashkomusic.keytagger.infrastructure.feature;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sashkomusic.keytagger.config.AnalyzerConfig;
import com.sashkomusic.keytagger.domain.model.FeatureVector;
import com.sashkomusic.keytagger.domain.port.AudioSignal;
import com.sashkomusic.keytagger.domain.port.FeatureProviderPort.FeatureExtractionException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class AnalysisJsonFeatureProviderTest {

    private static final String C_MAJOR_CHROMA = "[6.35, 2.23, 3.48, 2.33, 4.38, 4.09, 2.52, 5.19, 2.39, 3.66, 2.29, 2.88]";

    @TempDir
    Path folder;

    private AnalyzerConfig config;
    private AnalysisJsonFeatureProvider provider;
    private Path track;

    @BeforeEach
    void setUp() throws IOException {
        config = new AnalyzerConfig();
        provider = new AnalysisJsonFeatureProvider(new ObjectMapper(), config);
        track = Files.writeString(folder.resolve("track.mp3"), "audio");
    }

    private void document(String json) throws IOException {
        Files.writeString(folder.resolve("track.mp3.analysis.json"), json);
    }

    @Test
    void readsTempoAndChromaFromDocumentNextToTrack() throws Exception {
        document("""
                {"success": true, "errorMessage": null,
                 "features": {"rhythmic": {"bpm": 127.9}, "tonal": {"chroma": %s}}}
                """.formatted(C_MAJOR_CHROMA));

        AudioSignal signal = provider.loadSignal(track);

        assertThat(signal.source()).isEqualTo(track);
        assertThat(provider.rawTempo(signal)).isEqualTo(127.9);
        FeatureVector chroma = provider.chromaVector(signal);
        assertThat(chroma.get(0)).isGreaterThan(chroma.get(1));
        double norm = Math.sqrt(chroma.dot(chroma));
        assertThat(norm).isCloseTo(1.0, within(1e-9));
    }

    @Test
    void usesConfiguredDocumentDirectory() throws IOException {
        Path documents = Files.createDirectory(folder.resolve("analysis"));
        config.getFeatures().setDirectory(documents.toString());
        config.getFeatures().setSuffix(".json");

        assertThat(provider.locateDocument(track)).isEqualTo(documents.resolve("track.mp3.json"));
    }

    @Test
    void missingDocumentFailsToLoad() {
        assertThatThrownBy(() -> provider.loadSignal(track))
                .isInstanceOf(FeatureExtractionException.class)
                .hasMessageContaining("not found");
    }

    @Test
    void failedAnalysisFailsToLoad() throws IOException {
        document("{\"success\": false, \"errorMessage\": \"decoder crashed\"}");

        assertThatThrownBy(() -> provider.loadSignal(track))
                .isInstanceOf(FeatureExtractionException.class)
                .hasMessageContaining("decoder crashed");
    }

    @Test
    void malformedDocumentFailsToLoad() throws IOException {
        document("{not json");

        assertThatThrownBy(() -> provider.loadSignal(track))
                .isInstanceOf(FeatureExtractionException.class)
                .hasMessageContaining("Unreadable");
    }

    @Test
    void missingTempoOnlyFailsTempo() throws Exception {
        document("""
                {"success": true, "features": {"tonal": {"chroma": %s}}}
                """.formatted(C_MAJOR_CHROMA));

        AudioSignal signal = provider.loadSignal(track);

        assertThatThrownBy(() -> provider.rawTempo(signal)).isInstanceOf(FeatureExtractionException.class);
        assertThat(provider.chromaVector(signal)).isNotNull();
    }

    @Test
    void silentChromaIsUnusable() throws Exception {
        document("""
                {"success": true, "features": {"rhythmic": {"bpm": 90},
                 "tonal": {"chroma": [0, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0]}}}
                """);

        AudioSignal signal = provider.loadSignal(track);

        assertThat(provider.rawTempo(signal)).isEqualTo(90.0);
        assertThatThrownBy(() -> provider.chromaVector(signal))
                .isInstanceOf(FeatureExtractionException.class)
                .hasMessageContaining("Unusable chroma");
    }

    @Test
    void wrongChromaLengthIsRejected() throws Exception {
        document("""
                {"success": true, "features": {"tonal": {"chroma": [1, 2, 3]}}}
                """);

        AudioSignal signal = provider.loadSignal(track);

        assertThatThrownBy(() -> provider.chromaVector(signal))
                .isInstanceOf(FeatureExtractionException.class)
                .hasMessageContaining("Expected 12");
    }
}
