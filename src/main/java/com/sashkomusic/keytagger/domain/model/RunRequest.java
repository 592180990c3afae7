package com.sashkomusic.keytagger.domain.model;

import java.nio.file.Path;

public record RunRequest(
        Path folder,
        RenamePolicy policy,
        ReportFormat reportFormat
) {
}
