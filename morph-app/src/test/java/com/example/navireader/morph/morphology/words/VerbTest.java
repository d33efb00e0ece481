package com.example.navireader.morph.morphology.words;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.example.navireader.morph.UnknownFeatureException;

import java.util.List;

import org.junit.jupiter.api.Test;

class VerbTest {

    private final Verb verb = new Verb();

    @Test
    void firstInfixGoesIntoPenultimateSyllable() {
        assertEquals("tusaron", verb.addInfix("taron", null, "us", null));
        assertEquals("tawnaron", verb.makeParticiple("taron", false));
        assertEquals("tusaron", verb.makeParticiple("taron", true));
    }

    @Test
    void secondInfixGoesIntoLastSyllable() {
        assertEquals("tareion", verb.addInfix("taron", null, null, "ei"));
        assertEquals("tamareion", verb.addInfix("taron", null, "am", "ei"));
    }

    @Test
    void preFirstAndFirstInfixesStack() {
        assertEquals("keykame", verb.makeCausative("kame"));
        assertEquals("täparon", verb.makeReflexive("taron"));
        assertEquals("keykamame", verb.addInfix("kame", "eyk", "am", null));
    }

    @Test
    void monosyllablesSkipPreFirstSlot() {
        assertEquals("kä", verb.makeCausative("kä"));
        assertEquals("kamä", verb.addInfix("kä", null, "am", null));
    }

    @Test
    void degenerateInputIsReturnedUnchanged() {
        assertEquals("nrr", verb.addInfix("nrr", null, "am", null));
        assertEquals("", verb.addInfix("", null, "am", "ei"));
    }

    @Test
    void insertInfixClampsIndexes() {
        assertEquals("tamaron", Verb.insertInfix("taron", "am", -2));
        assertEquals("tamaron", Verb.insertInfix("taron", "am", 0));
        assertEquals("tareion", Verb.insertInfix("taron", "ei", -5));
        assertEquals("tamaron", Verb.insertInfix("taron", "am", 7));
    }

    @Test
    void unknownInfixesAreRejected() {
        UnknownFeatureException ex = assertThrows(UnknownFeatureException.class,
                () -> verb.addInfix("taron", null, "xyz", null));
        assertEquals("xyz", ex.getValue());
        assertThrows(UnknownFeatureException.class, () -> verb.addInfix("taron", "am", null, null));
        assertThrows(UnknownFeatureException.class, () -> verb.addInfix("taron", null, null, "us"));
    }

    @Test
    void transitivityDoesNotChangePlacement() {
        assertEquals(verb.inflect("taron", new VerbFeatures(null, "us", null, true)),
                verb.inflect("taron", new VerbFeatures(null, "us", null, false)));
    }

    @Test
    void inflectUsesFeatureSlots() {
        assertEquals(List.of("tolaron"), verb.inflect("taron", VerbFeatures.infixes(null, "ol", null)));
        assertEquals(List.of("tawnaron"), verb.inflect("taron", VerbFeatures.passiveParticiple()));
    }
}
