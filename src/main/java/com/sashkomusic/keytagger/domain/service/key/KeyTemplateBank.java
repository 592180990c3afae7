package com.sashkomusic.keytagger.domain.service.key;

import com.sashkomusic.keytagger.domain.model.FeatureVector;
import com.sashkomusic.keytagger.domain.model.KeyTemplate;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

// Krumhansl-Kessler profiles, ordered by rotation, major before minor
@Component
public class KeyTemplateBank {

    public static final List<String> PITCH_NAMES = List.of(
            "C", "C#", "D", "D#", "E", "F", "F#", "G", "G#", "A", "A#", "B"
    );

    public static final String MINOR_SUFFIX = "m";

    static final double[] MAJOR_PROFILE = {6.35, 2.23, 3.48, 2.33, 4.38, 4.09, 2.52, 5.19, 2.39, 3.66, 2.29, 2.88};
    static final double[] MINOR_PROFILE = {6.33, 2.68, 3.52, 5.38, 2.60, 3.53, 2.54, 4.75, 3.98, 2.69, 3.34, 3.17};

    private final List<KeyTemplate> templates;

    public KeyTemplateBank() {
        FeatureVector major = FeatureVector.normalized(MAJOR_PROFILE);
        FeatureVector minor = FeatureVector.normalized(MINOR_PROFILE);

        List<KeyTemplate> entries = new ArrayList<>(PITCH_NAMES.size() * 2);
        for (int i = 0; i < PITCH_NAMES.size(); i++) {
            entries.add(new KeyTemplate(PITCH_NAMES.get(i), false, i, major.rotate(i)));
            entries.add(new KeyTemplate(PITCH_NAMES.get(i) + MINOR_SUFFIX, true, i, minor.rotate(i)));
        }
        this.templates = Collections.unmodifiableList(entries);
    }

    public List<KeyTemplate> templates() {
        return templates;
    }

    public List<String> labels() {
        return templates.stream().map(KeyTemplate::label).toList();
    }
}
