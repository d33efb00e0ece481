package com.example.navireader.morph.morphology.words;

import com.example.navireader.morph.UnknownFeatureException;
import com.example.navireader.morph.morphology.PhonologicalProfile;
import com.example.navireader.morph.morphology.Phonology;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Pronoun paradigms. Case endings follow the noun rules on the pronoun's own ending; the
 * genitive, honorific and gendered forms are overridden by closed tables.
 */
public final class Pronoun implements WordForm<PronounFeatures> {

    public static final String REFLEXIVE_PRONOUN = "sno";
    public static final String INDETERMINATE_PRONOUN = "fko";

    private static final Map<String, String> IRREGULAR_GENITIVES = Map.ofEntries(
            Map.entry("fko", "fkeyä"),
            Map.entry("nga", "ngeyä"),
            Map.entry("po", "peyä"),
            Map.entry("sno", "sneyä"),
            Map.entry("tsa'u", "tseyä"),
            Map.entry("ayla", "ayleyä"),
            Map.entry("fo", "feyä"),
            Map.entry("awnga", "awngeyä"),
            Map.entry("ayoeng", "ayoengeyä"),
            Map.entry("oe", "oeyä"),
            Map.entry("moe", "moeyä"),
            Map.entry("pxoe", "pxoeyä"),
            Map.entry("ayoe", "ayoeyä"),
            Map.entry("oeng", "oengeyä"),
            Map.entry("pxoeng", "pxoengeyä"));

    // frapo, 'awpo, lapo, fìpo, tsapo: "-po" becomes "-peyä" in the genitive.
    private static final List<String> DERIVED_PO_PREFIXES = List.of("fra", "'aw", "la", "fì", "tsa");

    private static final Map<String, String> HONORIFICS = Map.ofEntries(
            Map.entry("oe", "ohe"),
            Map.entry("moe", "mohe"),
            Map.entry("pxoe", "pxohe"),
            Map.entry("ayoe", "ayohe"),
            Map.entry("oeng", "oheng"),
            Map.entry("pxoeng", "pxoheng"),
            Map.entry("ayoeng", "ayoheng"),
            Map.entry("nga", "ngenga"),
            Map.entry("menga", "mengenga"),
            Map.entry("pxenga", "pxengenga"),
            Map.entry("aynga", "ayngenga"),
            Map.entry("po", "poho"));

    private static final Map<String, String> SHORT_FORMS = Map.of(
            "ayoeng", "awnga",
            "ayfo", "fo",
            "aysa'u", "sa'u");

    private static final Set<String> LENITED_SHORT_PLURALS = Set.of("po", "fo");

    // Indexed by GrammaticalNumber ordinal; null marks a cell the language does not have.
    private static final String[] FIRST_EXCLUSIVE = {"oe", "moe", "pxoe", "ayoe"};
    private static final String[] FIRST_INCLUSIVE = {null, "oeng", "pxoeng", "ayoeng"};
    private static final String[] SECOND = {"nga", "menga", "pxenga", "aynga"};
    private static final String[] THIRD_ANIMATE = {"po", "mefo", "pxefo", "ayfo"};
    private static final String[] THIRD_INANIMATE = {"tsa'u", "mesa'u", "pxesa'u", "aysa'u"};

    private static final Map<Gender, List<List<String>>> QUESTION_WORDS = new EnumMap<>(Map.of(
            Gender.NEUTRAL, List.of(
                    List.of("pesu", "tupe"),
                    List.of("pemsu", "mesupe"),
                    List.of("pepxsu", "pxesupe"),
                    List.of("paysu", "aysupe")),
            Gender.MALE, List.of(
                    List.of("pestan", "tutampe"),
                    List.of("pemstan", "mestampe"),
                    List.of("pepxstan", "pxestampe"),
                    List.of("paystan", "aystampe")),
            Gender.FEMALE, List.of(
                    List.of("peste", "tutepe"),
                    List.of("pemste", "mestepe"),
                    List.of("pepxste", "pxestepe"),
                    List.of("payste", "aystepe"))));

    private static final Map<Register, Map<NounCase, String>> LAHE = new EnumMap<>(Map.of(
            Register.FULL, new EnumMap<>(Map.of(
                    NounCase.SUBJECTIVE, "aylahe",
                    NounCase.AGENTIVE, "aylahel",
                    NounCase.PATIENTIVE, "aylaheti",
                    NounCase.DATIVE, "aylaheru",
                    NounCase.GENITIVE, "aylaheyä",
                    NounCase.TOPICAL, "aylaheri")),
            Register.SHORT, new EnumMap<>(Map.of(
                    NounCase.SUBJECTIVE, "ayla",
                    NounCase.AGENTIVE, "aylal",
                    NounCase.PATIENTIVE, "aylat",
                    NounCase.DATIVE, "aylar",
                    NounCase.GENITIVE, "ayleyä",
                    NounCase.TOPICAL, "aylari"))));

    private final Noun noun = new Noun();

    @Override
    public WordCategory category() {
        return WordCategory.PRONOUN;
    }

    @Override
    public Class<PronounFeatures> featureType() {
        return PronounFeatures.class;
    }

    @Override
    public List<String> inflect(String lemma, PronounFeatures features) {
        switch (features.form()) {
            case INFLECTED:
                String base = features.honorific()
                        ? getHonorificForm(lemma, features)
                        : getGenderedForm(lemma, features);
                return List.of(getCase(base, features.nounCase()));
            case QUESTION:
                return getQuestionForms(features.gender(), features.number());
            case SHORT_PLURAL:
                return List.of(makeShortPlural(lemma));
            case SHORT:
                return List.of(getShortForm(lemma));
            case LAHE:
                return List.of(getLaheForm(features.register(), features.nounCase()));
            case BASIC:
                return List.of(getBasicForm(features.person(), features.inclusivity(),
                        features.animacy(), features.number()));
            case REFLEXIVE:
                return List.of(getCase(REFLEXIVE_PRONOUN, features.nounCase()));
            case INDETERMINATE:
                return List.of(getCase(INDETERMINATE_PRONOUN, features.nounCase()));
            default:
                throw new UnknownFeatureException("pronoun form", features.form().name());
        }
    }

    public String getCase(String pronoun, NounCase nounCase) {
        if (nounCase == NounCase.GENITIVE) {
            return getGenitive(pronoun);
        }
        return noun.getCase(pronoun, PhonologicalProfile.of(pronoun), nounCase);
    }

    public String getGenitive(String pronoun) {
        if (pronoun.endsWith("po") && startsWithAny(pronoun, DERIVED_PO_PREFIXES)) {
            return pronoun.substring(0, pronoun.length() - 2) + "peyä";
        }
        String irregular = IRREGULAR_GENITIVES.get(pronoun);
        if (irregular != null) {
            return irregular;
        }
        return noun.getCase(pronoun, PhonologicalProfile.of(pronoun), NounCase.GENITIVE);
    }

    /**
     * Honorific variant. A gendered third-person singular animate pronoun takes
     * {@code pohan}/{@code pohe} ahead of the table.
     */
    public String getHonorificForm(String pronoun, PronounFeatures features) {
        if (features.isThirdSingularAnimate()) {
            if (features.gender() == Gender.MALE) {
                return "pohan";
            }
            if (features.gender() == Gender.FEMALE) {
                return "pohe";
            }
        }
        return HONORIFICS.getOrDefault(pronoun, pronoun);
    }

    public String getGenderedForm(String pronoun, PronounFeatures features) {
        if (features.isThirdSingularAnimate()) {
            if (features.gender() == Gender.MALE) {
                return "poan";
            }
            if (features.gender() == Gender.FEMALE) {
                return "poe";
            }
        }
        return pronoun;
    }

    /**
     * @return the long and the short question word, in that order
     */
    public List<String> getQuestionForms(Gender gender, GrammaticalNumber number) {
        return QUESTION_WORDS.get(gender).get(number.ordinal());
    }

    public String makeShortPlural(String pronoun) {
        if (LENITED_SHORT_PLURALS.contains(pronoun)) {
            return GrammaticalNumber.PLURAL.prefix() + Phonology.lenite(pronoun);
        }
        return GrammaticalNumber.PLURAL.prefix() + pronoun;
    }

    public boolean hasShortForm(String pronoun) {
        return SHORT_FORMS.containsKey(pronoun);
    }

    public String getShortForm(String pronoun) {
        return SHORT_FORMS.getOrDefault(pronoun, pronoun);
    }

    public String getLaheForm(Register register, NounCase nounCase) {
        return LAHE.get(register).get(nounCase);
    }

    public String getBasicForm(Person person, Inclusivity inclusivity, Animacy animacy, GrammaticalNumber number) {
        String[] row;
        switch (person) {
            case FIRST:
                row = inclusivity == Inclusivity.INCLUSIVE ? FIRST_INCLUSIVE : FIRST_EXCLUSIVE;
                break;
            case SECOND:
                row = SECOND;
                break;
            default:
                row = animacy == Animacy.ANIMATE ? THIRD_ANIMATE : THIRD_INANIMATE;
                break;
        }
        String form = row[number.ordinal()];
        if (form == null) {
            throw new UnknownFeatureException("pronoun", person + "/" + inclusivity + "/" + number,
                    "No " + FeatureValues.displayName(inclusivity) + " "
                            + FeatureValues.displayName(number) + " pronoun for the "
                            + FeatureValues.displayName(person) + " person");
        }
        return form;
    }

    private static boolean startsWithAny(String word, List<String> prefixes) {
        for (String prefix : prefixes) {
            if (word.startsWith(prefix)) {
                return true;
            }
        }
        return false;
    }
}
