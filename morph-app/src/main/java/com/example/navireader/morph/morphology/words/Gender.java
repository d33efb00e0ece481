package com.example.navireader.morph.morphology.words;

/**
 * Gender of third-person and question pronouns. {@link #NEUTRAL} is the unmarked
 * ("common") gender.
 */
public enum Gender {
    NEUTRAL,
    MALE,
    FEMALE;

    public static Gender fromName(String name) {
        if (name != null && "common".equalsIgnoreCase(name.strip())) {
            return NEUTRAL;
        }
        return FeatureValues.parse(values(), "gender", name);
    }
}
