package com.sashkomusic.keytagger.domain.port;

import com.sashkomusic.keytagger.domain.model.RunRequest;

import java.util.Optional;

public interface OperatorConsolePort {

    // empty when the operator cancelled
    Optional<RunRequest> requestRun();
}
