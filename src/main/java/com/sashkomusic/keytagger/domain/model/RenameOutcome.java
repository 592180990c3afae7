package com.sashkomusic.keytagger.domain.model;

import java.nio.file.Path;

public record RenameOutcome(
        boolean success,
        Path finalPath,
        boolean moved
) {
    public static RenameOutcome moved(Path newPath) {
        return new RenameOutcome(true, newPath, true);
    }

    public static RenameOutcome unchanged(Path path) {
        return new RenameOutcome(true, path, false);
    }

    public static RenameOutcome failed(Path originalPath) {
        return new RenameOutcome(false, originalPath, false);
    }
}
