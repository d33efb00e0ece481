package com.example.navireader.morph.morphology.words;

import java.util.Objects;

public record PronounFeatures(PronounForm form,
                              NounCase nounCase,
                              Person person,
                              GrammaticalNumber number,
                              Animacy animacy,
                              Inclusivity inclusivity,
                              Gender gender,
                              boolean honorific,
                              Register register) implements WordFeatures {

    public PronounFeatures {
        Objects.requireNonNull(form, "form");
        Objects.requireNonNull(nounCase, "nounCase");
        Objects.requireNonNull(person, "person");
        Objects.requireNonNull(number, "number");
        Objects.requireNonNull(animacy, "animacy");
        Objects.requireNonNull(inclusivity, "inclusivity");
        Objects.requireNonNull(gender, "gender");
        Objects.requireNonNull(register, "register");
    }

    public static Builder builder() {
        return new Builder();
    }

    public static PronounFeatures inCase(NounCase nounCase) {
        return builder().nounCase(nounCase).build();
    }

    @Override
    public WordCategory category() {
        return WordCategory.PRONOUN;
    }

    public boolean isThirdSingularAnimate() {
        return person == Person.THIRD && number == GrammaticalNumber.SINGULAR && animacy == Animacy.ANIMATE;
    }

    /**
     * Defaults: inflected third-person singular animate, exclusive, neutral, subjective.
     */
    public static final class Builder {
        private PronounForm form = PronounForm.INFLECTED;
        private NounCase nounCase = NounCase.SUBJECTIVE;
        private Person person = Person.THIRD;
        private GrammaticalNumber number = GrammaticalNumber.SINGULAR;
        private Animacy animacy = Animacy.ANIMATE;
        private Inclusivity inclusivity = Inclusivity.EXCLUSIVE;
        private Gender gender = Gender.NEUTRAL;
        private boolean honorific;
        private Register register = Register.FULL;

        private Builder() {
        }

        public Builder form(PronounForm form) {
            this.form = form;
            return this;
        }

        public Builder nounCase(NounCase nounCase) {
            this.nounCase = nounCase;
            return this;
        }

        public Builder person(Person person) {
            this.person = person;
            return this;
        }

        public Builder number(GrammaticalNumber number) {
            this.number = number;
            return this;
        }

        public Builder animacy(Animacy animacy) {
            this.animacy = animacy;
            return this;
        }

        public Builder inclusivity(Inclusivity inclusivity) {
            this.inclusivity = inclusivity;
            return this;
        }

        public Builder gender(Gender gender) {
            this.gender = gender;
            return this;
        }

        public Builder honorific(boolean honorific) {
            this.honorific = honorific;
            return this;
        }

        public Builder register(Register register) {
            this.register = register;
            return this;
        }

        public PronounFeatures build() {
            return new PronounFeatures(form, nounCase, person, number, animacy, inclusivity, gender,
                    honorific, register);
        }
    }
}
