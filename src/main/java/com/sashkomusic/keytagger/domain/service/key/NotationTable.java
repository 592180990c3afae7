package com.sashkomusic.keytagger.domain.service.key;

import com.sashkomusic.keytagger.domain.model.KeyNotation;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

@Component
public class NotationTable {

    private final Map<String, String> classicToWheel = new HashMap<>();
    private final Map<String, String> wheelToClassic = new HashMap<>();

    public NotationTable() {
        register("B", "1B", null);
        register("Bm", "1A", null);
        register("F#", "2B", "Gb");
        register("F#m", "2A", "Gbm");
        register("C#", "3B", "Db");
        register("C#m", "3A", "Dbm");
        register("G#", "4B", "Ab");
        register("G#m", "4A", "Abm");
        register("D#", "5B", "Eb");
        register("D#m", "5A", "Ebm");
        register("A#", "6B", "Bb");
        register("A#m", "6A", "Bbm");
        register("F", "7B", null);
        register("Fm", "7A", null);
        register("C", "8B", null);
        register("Cm", "8A", null);
        register("G", "9B", null);
        register("Gm", "9A", null);
        register("D", "10B", null);
        register("Dm", "10A", null);
        register("A", "11B", null);
        register("Am", "11A", null);
        register("E", "12B", null);
        register("Em", "12A", null);
    }

    private void register(String classic, String wheel, String flatAlias) {
        classicToWheel.put(classic, wheel);
        if (flatAlias != null) {
            classicToWheel.put(flatAlias, wheel);
        }
        wheelToClassic.put(wheel, classic);
    }

    public Optional<String> toAlphanumeric(String classicLabel) {
        return Optional.ofNullable(classicToWheel.get(classicLabel));
    }

    public Optional<String> fromAlphanumeric(String wheelCode) {
        if (wheelCode == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(wheelToClassic.get(wheelCode.trim().toUpperCase(Locale.ROOT)));
    }

    // labels without a wheel code are shown unchanged
    public String displayKey(String classicLabel, KeyNotation notation) {
        if (notation == KeyNotation.ALPHANUMERIC) {
            return toAlphanumeric(classicLabel).orElse(classicLabel);
        }
        return classicLabel;
    }
}
