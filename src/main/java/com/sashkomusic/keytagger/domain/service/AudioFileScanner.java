package com.sashkomusic.keytagger.domain.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Stream;

@Slf4j
@Service
public class AudioFileScanner {

    public static final Set<String> SUPPORTED_EXTENSIONS = Set.of(
            "mp3", "wav", "flac", "ogg", "m4a", "aac"
    );

    public boolean isFolder(Path folder) {
        return folder != null && Files.isDirectory(folder);
    }

    public List<Path> scan(Path folder) {
        try (Stream<Path> entries = Files.list(folder)) {
            List<Path> audioFiles = entries
                    .filter(Files::isRegularFile)
                    .filter(AudioFileScanner::isAudioFile)
                    .distinct()
                    .sorted(Comparator.comparing(path -> path.getFileName().toString()))
                    .toList();
            log.debug("Found {} supported audio files in {}", audioFiles.size(), folder);
            return audioFiles;
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to list folder " + folder, ex);
        }
    }

    public static boolean isAudioFile(Path file) {
        String filename = file.getFileName().toString().toLowerCase(Locale.ROOT);
        int lastDot = filename.lastIndexOf('.');
        if (lastDot == -1) {
            return false;
        }
        return SUPPORTED_EXTENSIONS.contains(filename.substring(lastDot + 1));
    }
}
