package com.sashkomusic.keytagger.cli;

import com.sashkomusic.keytagger.KeyTaggerApplication;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.boot.SpringApplication;
import org.springframework.context.ConfigurableApplicationContext;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class AnalyzeFolderRunnerTest {

    private static final String C_MAJOR_DOCUMENT = """
            {"success": true, "errorMessage": null,
             "features": {"rhythmic": {"bpm": 65.4},
                          "tonal": {"chroma": [6.35, 2.23, 3.48, 2.33, 4.38, 4.09, 2.52, 5.19, 2.39, 3.66, 2.29, 2.88]}}}
            """;

    @TempDir
    Path folder;

    @Test
    void startupRunAnalyzesFolderWithoutPinningTheJvm() throws IOException {
        Files.writeString(folder.resolve("track.mp3"), "audio");
        Files.writeString(folder.resolve("track.mp3.analysis.json"), C_MAJOR_DOCUMENT);

        try (ConfigurableApplicationContext context = SpringApplication.run(KeyTaggerApplication.class,
                "--analyzer.run-on-startup=true",
                "--analyzer.folder=" + folder,
                "--analyzer.workers=2")) {

            assertThat(context.getBeansOfType(AnalyzeFolderRunner.class)).hasSize(1);
            assertThat(folder.resolve("C - 130 BPM - track.mp3")).exists();
            assertThat(nonDaemonAnalysisThreads()).isEmpty();
        }
    }

    @Test
    void blankFolderEndsRunWithoutTouchingFiles() throws IOException {
        Files.writeString(folder.resolve("track.mp3"), "audio");

        try (ConfigurableApplicationContext context = SpringApplication.run(KeyTaggerApplication.class,
                "--analyzer.run-on-startup=true",
                "--analyzer.folder=")) {

            assertThat(context.isActive()).isTrue();
            assertThat(folder.resolve("track.mp3")).exists();
        }
    }

    private static List<Thread> nonDaemonAnalysisThreads() {
        return Thread.getAllStackTraces().keySet().stream()
                .filter(thread -> thread.getName().startsWith("analysis-"))
                .filter(thread -> !thread.isDaemon())
                .toList();
    }
}
