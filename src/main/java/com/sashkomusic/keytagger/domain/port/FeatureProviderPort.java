package com.sashkomusic.keytagger.domain.port;

import com.sashkomusic.keytagger.domain.model.FeatureVector;

import java.nio.file.Path;

public interface FeatureProviderPort {

    AudioSignal loadSignal(Path audioFile) throws FeatureExtractionException;

    // before octave correction
    double rawTempo(AudioSignal signal) throws FeatureExtractionException;

    FeatureVector chromaVector(AudioSignal signal) throws FeatureExtractionException;

    class FeatureExtractionException extends Exception {
        public FeatureExtractionException(String message) {
            super(message);
        }

        public FeatureExtractionException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
