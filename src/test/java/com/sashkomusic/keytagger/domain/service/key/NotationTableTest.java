package com.sashkomusic.keytagger.domain.service.key;

import com.sashkomusic.keytagger.domain.model.KeyNotation;
import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class NotationTableTest {

    private final NotationTable table = new NotationTable();
    private final KeyTemplateBank bank = new KeyTemplateBank();

    @Test
    void everyClassifierLabelHasAWheelCodeAndMapsBack() {
        Set<String> codes = new HashSet<>();
        for (String label : bank.labels()) {
            String code = table.toAlphanumeric(label).orElseThrow();
            codes.add(code);

            String back = table.fromAlphanumeric(code).orElseThrow();
            assertThat(back).isEqualTo(label);
            assertThat(table.toAlphanumeric(back)).hasValue(code);
        }
        assertThat(codes).hasSize(24);
    }

    @Test
    void mapsKnownKeys() {
        assertThat(table.toAlphanumeric("Am")).hasValue("11A");
        assertThat(table.toAlphanumeric("C")).hasValue("8B");
        assertThat(table.toAlphanumeric("B")).hasValue("1B");
        assertThat(table.toAlphanumeric("Ebm")).hasValue("5A");
    }

    @Test
    void flatSpellingsMapBackToSharps() {
        String code = table.toAlphanumeric("Gb").orElseThrow();

        assertThat(code).isEqualTo("2B");
        assertThat(table.fromAlphanumeric(code)).hasValue("F#");
        assertThat(table.fromAlphanumeric("6a")).hasValue("A#m");
    }

    @Test
    void displayKeyFallsBackToClassicLabel() {
        assertThat(table.displayKey("Am", KeyNotation.ALPHANUMERIC)).isEqualTo("11A");
        assertThat(table.displayKey("Am", KeyNotation.CLASSIC)).isEqualTo("Am");
        assertThat(table.displayKey("Cb", KeyNotation.ALPHANUMERIC)).isEqualTo("Cb");
    }

    @Test
    void unknownCodesAreAbsent() {
        assertThat(table.fromAlphanumeric("13A")).isEmpty();
        assertThat(table.fromAlphanumeric(null)).isEmpty();
        assertThat(table.toAlphanumeric("H")).isEmpty();
    }
}
