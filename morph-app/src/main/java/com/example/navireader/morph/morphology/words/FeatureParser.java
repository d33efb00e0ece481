package com.example.navireader.morph.morphology.words;

import com.example.navireader.morph.UnknownFeatureException;

import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Builds feature records from string key/value pairs such as {@code case=agentive}.
 * Unknown keys and values are rejected, missing keys take the category defaults.
 */
public final class FeatureParser {

    private static final Set<String> NOUN_KEYS = Set.of("case", "number", "indefinite");
    private static final Set<String> PRONOUN_KEYS = Set.of("form", "case", "person", "number", "animacy",
            "inclusivity", "gender", "honorific", "register");
    private static final Set<String> VERB_KEYS = Set.of("pre_first", "first", "second", "transitive");
    private static final Set<String> ADJECTIVE_KEYS = Set.of("form", "position", "le_derived", "color",
            "comparison", "compared_to");
    private static final Set<String> NUMBER_KEYS = Set.of("form", "value");
    private static final Set<String> PARTICLE_KEYS = Set.of("type", "context");
    private static final Set<String> PRENOUN_KEYS = Set.of("type", "noun");

    private FeatureParser() {
    }

    public static WordFeatures parse(WordCategory category, Map<String, String> values) {
        Map<String, String> features = values == null ? Map.of() : values;
        switch (category) {
            case NOUN:
                requireKeys(category, features, NOUN_KEYS);
                return new NounFeatures(
                        NounCase.fromName(features.getOrDefault("case", "subjective")),
                        GrammaticalNumber.fromName(features.getOrDefault("number", "singular")),
                        parseBoolean("indefinite", features.get("indefinite")));
            case PRONOUN:
                requireKeys(category, features, PRONOUN_KEYS);
                return PronounFeatures.builder()
                        .form(PronounForm.fromName(features.getOrDefault("form", "inflected")))
                        .nounCase(NounCase.fromName(features.getOrDefault("case", "subjective")))
                        .person(Person.fromName(features.getOrDefault("person", "third")))
                        .number(GrammaticalNumber.fromName(features.getOrDefault("number", "singular")))
                        .animacy(Animacy.fromName(features.getOrDefault("animacy", "animate")))
                        .inclusivity(Inclusivity.fromName(features.getOrDefault("inclusivity", "exclusive")))
                        .gender(Gender.fromName(features.getOrDefault("gender", "neutral")))
                        .honorific(parseBoolean("honorific", features.get("honorific")))
                        .register(Register.fromName(features.getOrDefault("register", "full")))
                        .build();
            case VERB:
                requireKeys(category, features, VERB_KEYS);
                return new VerbFeatures(features.get("pre_first"), features.get("first"), features.get("second"),
                        !features.containsKey("transitive") || parseBoolean("transitive", features.get("transitive")));
            case ADJECTIVE:
                requireKeys(category, features, ADJECTIVE_KEYS);
                return new AdjectiveFeatures(
                        AdjectiveForm.fromName(features.getOrDefault("form", "attributive")),
                        NounPosition.fromName(features.getOrDefault("position", "before")),
                        parseBoolean("le_derived", features.get("le_derived")),
                        parseBoolean("color", features.get("color")),
                        Comparison.fromName(features.getOrDefault("comparison", "standard")),
                        features.get("compared_to"));
            case NUMBER:
                requireKeys(category, features, NUMBER_KEYS);
                return new NumberFeatures(
                        NumeralForm.fromName(features.getOrDefault("form", "cardinal")),
                        parseInt("value", features.get("value")));
            case PARTICLE:
                requireKeys(category, features, PARTICLE_KEYS);
                return new ParticleFeatures(
                        ParticleType.fromName(features.getOrDefault("type", "general")),
                        features.getOrDefault("context", ""));
            case PRENOUN:
                requireKeys(category, features, PRENOUN_KEYS);
                return new PrenounFeatures(
                        PrenounType.fromName(features.getOrDefault("type", "deictic")),
                        features.getOrDefault("noun", ""));
            default:
                throw new UnknownFeatureException("category", category.name());
        }
    }

    private static void requireKeys(WordCategory category, Map<String, String> features, Set<String> allowed) {
        for (String key : features.keySet()) {
            if (!allowed.contains(key)) {
                throw new UnknownFeatureException(category.name().toLowerCase(Locale.ROOT) + " feature", key);
            }
        }
    }

    private static boolean parseBoolean(String feature, String raw) {
        if (raw == null) {
            return false;
        }
        String value = raw.strip().toLowerCase(Locale.ROOT);
        if ("true".equals(value)) {
            return true;
        }
        if ("false".equals(value)) {
            return false;
        }
        throw new UnknownFeatureException(feature, raw);
    }

    private static int parseInt(String feature, String raw) {
        if (raw == null) {
            throw new UnknownFeatureException(feature, "null");
        }
        try {
            return Integer.parseInt(raw.strip());
        } catch (NumberFormatException ex) {
            throw new UnknownFeatureException(feature, raw);
        }
    }
}
