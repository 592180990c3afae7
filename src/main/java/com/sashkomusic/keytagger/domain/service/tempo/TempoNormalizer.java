package com.sashkomusic.keytagger.domain.service.tempo;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.OptionalInt;

/**
 * Folds half-time and double-time beat tracker estimates back into the 70..200 BPM band.
 * One correction at most; the corrected value is not checked again.
 */
@Slf4j
@Component
public class TempoNormalizer {

    static final int LOWER_BOUND = 70;
    static final int UPPER_BOUND = 200;

    public OptionalInt normalize(double rawTempo) {
        if (Double.isNaN(rawTempo) || Double.isInfinite(rawTempo)) {
            return OptionalInt.empty();
        }

        int tempo = (int) rawTempo;
        if (tempo <= 0) {
            return OptionalInt.empty();
        }

        if (tempo < LOWER_BOUND) {
            tempo = tempo * 2;
            log.debug("BPM too low, doubling: {}", tempo);
        } else if (tempo > UPPER_BOUND) {
            tempo = tempo / 2;
            log.debug("BPM too high, halving: {}", tempo);
        }
        return OptionalInt.of(tempo);
    }
}
