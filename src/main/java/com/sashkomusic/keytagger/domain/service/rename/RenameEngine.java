package com.sashkomusic.keytagger.domain.service.rename;

import com.sashkomusic.keytagger.domain.model.RenameOutcome;
import com.sashkomusic.keytagger.domain.model.RenamePolicy;
import com.sashkomusic.keytagger.domain.port.TagStorePort;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Renames a track to {@code "<key> - <bpm> BPM - <name>"} and pushes the new name into the
 * title tag. Existence checks and moves inside one directory run under that directory's lock.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RenameEngine {

    private final FileNameCleaner cleaner;
    private final TagStorePort tagStore;

    private final ConcurrentMap<Path, ReentrantLock> directoryLocks = new ConcurrentHashMap<>();

    public RenameOutcome rename(Path filePath, String keyLabel, int bpm, RenamePolicy policy) {
        if (keyLabel == null || keyLabel.isBlank()) {
            throw new IllegalArgumentException("Key label is required");
        }
        if (bpm <= 0) {
            throw new IllegalArgumentException("BPM must be positive: " + bpm);
        }

        try {
            if (!Files.exists(filePath)) {
                log.error("File not found to rename: {}", filePath);
                return RenameOutcome.failed(filePath);
            }

            String filename = filePath.getFileName().toString();
            String baseName = baseName(filename);
            String extension = extension(filename);

            String displayKey = cleaner.displayKey(keyLabel, policy.notation());

            if (cleaner.isAlreadyNamed(baseName, displayKey, bpm)) {
                log.info("File already correct ({}, {}): {}", displayKey, bpm, filename);
                updateTitle(filePath, baseName);
                return RenameOutcome.unchanged(filePath);
            }

            String cleanedBase = cleaner.clean(baseName, policy, keyLabel);
            String newName = cleaner.composeCandidate(displayKey, bpm, cleanedBase);

            Path target = resolveAndMove(filePath, newName, extension);
            if (target.equals(filePath)) {
                log.info("Filename already correct: {}", filename);
                updateTitle(filePath, newName);
                return RenameOutcome.unchanged(filePath);
            }

            log.info("Renamed: {} -> {}", filename, target.getFileName());
            updateTitle(target, newName);
            return RenameOutcome.moved(target);

        } catch (IOException | RuntimeException ex) {
            log.error("Error renaming file {}: {}", filePath.getFileName(), ex.getMessage());
            return RenameOutcome.failed(filePath);
        }
    }

    // returns source itself when the name is unchanged
    private Path resolveAndMove(Path source, String newName, String extension) throws IOException {
        Path directory = source.toAbsolutePath().normalize().getParent();
        ReentrantLock lock = directoryLocks.computeIfAbsent(directory, d -> new ReentrantLock());

        lock.lock();
        try {
            Path parent = source.getParent();
            Path candidate = resolveSibling(parent, newName + extension);
            int counter = 1;
            while (Files.exists(candidate) && !isSameFile(candidate, source)) {
                candidate = resolveSibling(parent, newName + "_" + counter + extension);
                counter++;
            }

            if (candidate.equals(source)) {
                return source;
            }

            Files.move(source, candidate, StandardCopyOption.ATOMIC_MOVE);
            return candidate;
        } finally {
            lock.unlock();
        }
    }

    private void updateTitle(Path audioFile, String title) {
        try {
            if (tagStore.writeTitle(audioFile, title)) {
                log.info("Metadata title updated: '{}'", title);
            } else {
                log.warn("Metadata title not updated for {}", audioFile.getFileName());
            }
        } catch (RuntimeException ex) {
            log.error("Error updating metadata for {}: {}", audioFile.getFileName(), ex.getMessage());
        }
    }

    private static Path resolveSibling(Path parent, String filename) {
        return parent != null ? parent.resolve(filename) : Path.of(filename);
    }

    private static boolean isSameFile(Path candidate, Path source) {
        try {
            return Files.isSameFile(candidate, source);
        } catch (IOException ex) {
            return false;
        }
    }

    static String baseName(String filename) {
        int lastDot = filename.lastIndexOf('.');
        return lastDot > 0 ? filename.substring(0, lastDot) : filename;
    }

    static String extension(String filename) {
        int lastDot = filename.lastIndexOf('.');
        return lastDot > 0 ? filename.substring(lastDot) : "";
    }
}
