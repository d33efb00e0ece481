package com.example.navireader.morph;

/**
 * Raised when a generator is asked for a category or feature value outside its closed set.
 */
public class UnknownFeatureException extends MorphologyException {

    private final String feature;
    private final String value;

    public UnknownFeatureException(String feature, String value) {
        this(feature, value, "Unknown " + feature + ": '" + value + "'");
    }

    public UnknownFeatureException(String feature, String value, String message) {
        super(message);
        this.feature = feature;
        this.value = value;
    }

    public String getFeature() {
        return feature;
    }

    public String getValue() {
        return value;
    }
}
