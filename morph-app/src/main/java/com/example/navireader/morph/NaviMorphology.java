package com.example.navireader.morph;

import com.example.navireader.morph.morphology.AffixTables;
import com.example.navireader.morph.morphology.ExceptionIndex;
import com.example.navireader.morph.morphology.ExceptionSource;
import com.example.navireader.morph.morphology.Lemmatizer;
import com.example.navireader.morph.morphology.MorphologyTrace;
import com.example.navireader.morph.morphology.words.Adjective;
import com.example.navireader.morph.morphology.words.FeatureParser;
import com.example.navireader.morph.morphology.words.Noun;
import com.example.navireader.morph.morphology.words.Numeral;
import com.example.navireader.morph.morphology.words.Particle;
import com.example.navireader.morph.morphology.words.Prenoun;
import com.example.navireader.morph.morphology.words.Pronoun;
import com.example.navireader.morph.morphology.words.Verb;
import com.example.navireader.morph.morphology.words.WordCategory;
import com.example.navireader.morph.morphology.words.WordFeatures;
import com.example.navireader.morph.morphology.words.WordForm;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * Entry point to the morphology engine: lemmatization in one direction and generation of
 * surface forms from a lemma and features in the other.
 */
public class NaviMorphology {

    private final Lemmatizer lemmatizer;
    private final MorphologyTrace trace;
    private final Map<WordCategory, WordForm<?>> generators = new EnumMap<>(WordCategory.class);

    public NaviMorphology() {
        this(new Lemmatizer(), MorphologyTrace.NOOP);
    }

    public NaviMorphology(Lemmatizer lemmatizer, MorphologyTrace trace) {
        this.lemmatizer = Objects.requireNonNull(lemmatizer, "lemmatizer");
        this.trace = Objects.requireNonNull(trace, "trace");
        register(new Noun());
        register(new Pronoun());
        register(new Verb());
        register(new Adjective());
        register(new Numeral());
        register(new Particle());
        register(new Prenoun());
    }

    /**
     * Builds the engine with the default affix tables and the exceptions of {@code source}.
     */
    public static NaviMorphology load(ExceptionSource source, MorphologyTrace trace) {
        ExceptionIndex exceptions = ExceptionIndex.load(source);
        return new NaviMorphology(new Lemmatizer(AffixTables.defaultNavi(), exceptions), trace);
    }

    public String lemmatize(String word) {
        return traced("lemmatize", word, () -> lemmatizer.lemmatize(word));
    }

    /**
     * Generates the surface forms of {@code lemma}.
     *
     * @throws UnknownFeatureException when {@code features} belong to another category
     */
    public List<String> generate(WordCategory category, String lemma, WordFeatures features) {
        Objects.requireNonNull(category, "category");
        Objects.requireNonNull(features, "features");
        return traced("generate", category + " " + lemma + " " + features,
                () -> inflect(generators.get(category), lemma, features));
    }

    /**
     * String-keyed variant of {@link #generate(WordCategory, String, WordFeatures)} for callers
     * holding untyped input, for example {@code generate("noun", "tute", Map.of("case", "agentive"))}.
     */
    public List<String> generate(String category, String lemma, Map<String, String> features) {
        return traced("generate", category + " " + lemma + " " + features, () -> {
            WordCategory parsed = WordCategory.fromName(category);
            return inflect(generators.get(parsed), lemma, FeatureParser.parse(parsed, features));
        });
    }

    public Lemmatizer lemmatizer() {
        return lemmatizer;
    }

    private static <F extends WordFeatures> List<String> inflect(WordForm<F> form, String lemma,
                                                                 WordFeatures features) {
        if (!form.featureType().isInstance(features)) {
            throw new UnknownFeatureException("features", features.category().name(),
                    "Features for " + features.category() + " cannot inflect a " + form.category());
        }
        if (lemma == null) {
            throw new InvalidInputException("generate", "lemma must be a string, got null");
        }
        return form.inflect(lemma, form.featureType().cast(features));
    }

    private <T> T traced(String operation, Object input, Supplier<T> call) {
        trace.started(operation, input);
        try {
            T result = call.get();
            trace.finished(operation, result);
            return result;
        } catch (RuntimeException ex) {
            trace.failed(operation, ex);
            throw ex;
        }
    }

    private void register(WordForm<?> form) {
        generators.put(form.category(), form);
    }
}
