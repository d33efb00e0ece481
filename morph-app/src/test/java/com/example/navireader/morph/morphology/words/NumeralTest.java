package com.example.navireader.morph.morphology.words;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.example.navireader.morph.UnknownFeatureException;

import java.util.List;

import org.junit.jupiter.api.Test;

class NumeralTest {

    private final Numeral numeral = new Numeral();

    @Test
    void cardinalsOneToEight() {
        assertEquals("'aw", numeral.getCardinal(1));
        assertEquals("mrr", numeral.getCardinal(5));
        assertEquals("vol", numeral.getCardinal(8));
    }

    @Test
    void ordinalsUseTruncatedStems() {
        assertEquals("'awve", numeral.getOrdinal(1));
        assertEquals("muve", numeral.getOrdinal(2));
        assertEquals("pxeyve", numeral.getOrdinal(3));
        assertEquals("tsive", numeral.getOrdinal(4));
        assertEquals("puve", numeral.getOrdinal(6));
        assertEquals("kive", numeral.getOrdinal(7));
    }

    @Test
    void fractionsHaveTwoIrregulars() {
        assertEquals("mawl", numeral.getFraction(2));
        assertEquals("pan", numeral.getFraction(3));
        assertEquals("tsipxi", numeral.getFraction(4));
        assertEquals("mrrpxi", numeral.getFraction(5));
    }

    @Test
    void adverbials() {
        assertEquals("'awlo", numeral.makeAdverbial(1));
        assertEquals("melo", numeral.makeAdverbial(2));
        assertEquals("pxelo", numeral.makeAdverbial(3));
        assertEquals("alo atsing", numeral.makeAdverbial(4));
        assertEquals(List.of("alo avol"), numeral.inflect("", new NumberFeatures(NumeralForm.ADVERBIAL, 8)));
    }

    @Test
    void valuesOutsideRangeAreRejected() {
        assertThrows(UnknownFeatureException.class, () -> numeral.getCardinal(0));
        assertThrows(UnknownFeatureException.class, () -> numeral.getOrdinal(9));
        assertThrows(UnknownFeatureException.class, () -> numeral.makeAdverbial(12));
    }
}
