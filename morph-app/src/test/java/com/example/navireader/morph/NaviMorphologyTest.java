package com.example.navireader.morph;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.example.navireader.morph.morphology.ExceptionEntry;
import com.example.navireader.morph.morphology.Lemmatizer;
import com.example.navireader.morph.morphology.MorphologyTrace;
import com.example.navireader.morph.morphology.words.GrammaticalNumber;
import com.example.navireader.morph.morphology.words.NounCase;
import com.example.navireader.morph.morphology.words.NounFeatures;
import com.example.navireader.morph.morphology.words.VerbFeatures;
import com.example.navireader.morph.morphology.words.WordCategory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.junit.jupiter.api.Test;

class NaviMorphologyTest {

    private final NaviMorphology morphology = new NaviMorphology();

    @Test
    void generatesFromTypedFeatures() {
        assertEquals(List.of("aytepil"), morphology.generate(WordCategory.NOUN, "txep",
                NounFeatures.of(NounCase.AGENTIVE, GrammaticalNumber.PLURAL)));
        assertEquals(List.of("tusaron"), morphology.generate(WordCategory.VERB, "taron",
                VerbFeatures.activeParticiple()));
    }

    @Test
    void generatesFromStringFeatures() {
        assertEquals(List.of("tutel"), morphology.generate("noun", "tute", Map.of("case", "agentive")));
        assertEquals(List.of("eampin"), morphology.generate("adjective", "ean",
                Map.of("form", "color-noun", "color", "true")));
        assertEquals(List.of("pemsu", "mesupe"), morphology.generate("pronoun", "",
                Map.of("form", "question", "number", "dual")));
        assertEquals(List.of("tsive"), morphology.generate("number", "", Map.of("form", "ordinal", "value", "4")));
        assertEquals(List.of("kame ke"), morphology.generate("particle", "ke",
                Map.of("type", "negative", "context", "kame")));
        assertEquals(List.of("tsatan"), morphology.generate("prenoun", "tsa", Map.of("noun", "atan")));
    }

    @Test
    void reflexivePronounFromStringFeatures() {
        assertEquals(List.of("snoti"), morphology.generate("pronoun", "", Map.of("form", "reflexive", "case", "patientive")));
        assertEquals(List.of("fkeyä"), morphology.generate("pronoun", "", Map.of("form", "indeterminate", "case", "genitive")));
    }

    @Test
    void mismatchedFeaturesAreRejected() {
        UnknownFeatureException ex = assertThrows(UnknownFeatureException.class,
                () -> morphology.generate(WordCategory.VERB, "taron",
                        NounFeatures.of(NounCase.AGENTIVE, GrammaticalNumber.SINGULAR)));
        assertEquals("features", ex.getFeature());
    }

    @Test
    void nullLemmaIsInvalidInput() {
        assertThrows(InvalidInputException.class, () -> morphology.generate(WordCategory.NOUN, null,
                NounFeatures.of(NounCase.AGENTIVE, GrammaticalNumber.SINGULAR)));
        assertThrows(InvalidInputException.class, () -> morphology.lemmatize(null));
    }

    @Test
    void loadsExceptionsFromSource() {
        NaviMorphology loaded = NaviMorphology.load(
                () -> List.of(new ExceptionEntry("nga", Set.of("ngati"))), MorphologyTrace.NOOP);

        assertEquals("nga", loaded.lemmatize("ngati"));
        assertEquals("ngat", morphology.lemmatize("ngati"));
    }

    @Test
    void malformedExceptionSourceFallsBackToRules() {
        NaviMorphology loaded = NaviMorphology.load(() -> {
            throw new MalformedExceptionDataException("broken");
        }, MorphologyTrace.NOOP);

        assertEquals("kame", loaded.lemmatize("kameie"));
        assertEquals(0, loaded.lemmatizer().exceptions().size());
    }

    @Test
    void traceSeesEveryCall() {
        List<String> events = new ArrayList<>();
        MorphologyTrace trace = new MorphologyTrace() {
            @Override
            public void started(String operation, Object input) {
                events.add("start " + operation);
            }

            @Override
            public void finished(String operation, Object result) {
                events.add("finish " + operation + " " + result);
            }

            @Override
            public void failed(String operation, RuntimeException error) {
                events.add("fail " + operation + " " + error.getClass().getSimpleName());
            }
        };
        NaviMorphology traced = new NaviMorphology(new Lemmatizer(), trace);

        traced.lemmatize("kameie");
        assertThrows(UnknownFeatureException.class, () -> traced.generate("noun", "tute", Map.of("mood", "x")));

        assertEquals(List.of(
                "start lemmatize",
                "finish lemmatize kame",
                "start generate",
                "fail generate UnknownFeatureException"), events);
    }
}
