package com.sashkomusic.keytagger.domain.service.key;

import com.sashkomusic.keytagger.domain.model.Classification;
import com.sashkomusic.keytagger.domain.model.ConfidenceTier;
import com.sashkomusic.keytagger.domain.model.FeatureVector;
import com.sashkomusic.keytagger.domain.model.KeyTemplate;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Optional;

@Slf4j
@Service
@RequiredArgsConstructor
public class TonalClassifier {

    private final KeyTemplateBank templateBank;

    /**
     * Picks the template with the highest dot product. Ties keep the earlier template,
     * so the lowest rotation wins and major wins over minor at equal rotation.
     */
    public Optional<Classification> classify(FeatureVector chroma) {
        if (chroma == null) {
            return Optional.empty();
        }

        double bestScore = Double.NEGATIVE_INFINITY;
        String bestLabel = null;

        for (KeyTemplate template : templateBank.templates()) {
            double score = chroma.dot(template.vector());
            if (score > bestScore) {
                bestScore = score;
                bestLabel = template.label();
            }
        }

        if (bestLabel == null) {
            return Optional.empty();
        }

        ConfidenceTier tier = ConfidenceTier.fromScore(bestScore);
        log.debug("Best key match: {} (corr: {}, {})", bestLabel, String.format("%.2f", bestScore),
                tier.getDisplayName());
        return Optional.of(new Classification(bestLabel, bestScore, tier));
    }
}
