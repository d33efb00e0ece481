package com.example.navireader.morph.morphology.words;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.example.navireader.morph.UnknownFeatureException;

import java.util.List;

import org.junit.jupiter.api.Test;

class PronounTest {

    private final Pronoun pronoun = new Pronoun();

    @Test
    void casesReuseNounEndings() {
        assertEquals("oel", pronoun.getCase("oe", NounCase.AGENTIVE));
        assertEquals("ngati", pronoun.getCase("nga", NounCase.PATIENTIVE));
        assertEquals("oengur", pronoun.getCase("oeng", NounCase.DATIVE));
        assertEquals("pori", pronoun.getCase("po", NounCase.TOPICAL));
    }

    @Test
    void genitiveUsesDerivedRuleThenTableThenNounRule() {
        assertEquals("fìpeyä", pronoun.getGenitive("fìpo"));
        assertEquals("tsapeyä", pronoun.getGenitive("tsapo"));
        assertEquals("'awpeyä", pronoun.getGenitive("'awpo"));
        assertEquals("ngeyä", pronoun.getGenitive("nga"));
        assertEquals("peyä", pronoun.getGenitive("po"));
        assertEquals("oeyä", pronoun.getCase("oe", NounCase.GENITIVE));
        assertEquals("menengayä", pronoun.getGenitive("menenga"));
    }

    @Test
    void genderedThirdPersonForms() {
        PronounFeatures male = PronounFeatures.builder().gender(Gender.MALE).nounCase(NounCase.AGENTIVE).build();
        PronounFeatures female = PronounFeatures.builder().gender(Gender.FEMALE).build();

        assertEquals(List.of("poanil"), pronoun.inflect("po", male));
        assertEquals(List.of("poe"), pronoun.inflect("po", female));
        assertEquals("po", pronoun.getGenderedForm("po", PronounFeatures.inCase(NounCase.SUBJECTIVE)));
    }

    @Test
    void genderedFormsOnlyForThirdSingularAnimate() {
        PronounFeatures plural = PronounFeatures.builder()
                .gender(Gender.MALE).number(GrammaticalNumber.PLURAL).build();

        assertEquals("ayfo", pronoun.getGenderedForm("ayfo", plural));
    }

    @Test
    void honorificOverrideBeatsTable() {
        PronounFeatures male = PronounFeatures.builder().gender(Gender.MALE).honorific(true).build();
        PronounFeatures female = PronounFeatures.builder().gender(Gender.FEMALE).honorific(true)
                .nounCase(NounCase.PATIENTIVE).build();
        PronounFeatures neutral = PronounFeatures.builder().honorific(true).build();
        PronounFeatures first = PronounFeatures.builder().person(Person.FIRST).honorific(true).build();

        assertEquals(List.of("pohan"), pronoun.inflect("po", male));
        assertEquals(List.of("poheti"), pronoun.inflect("po", female));
        assertEquals(List.of("poho"), pronoun.inflect("po", neutral));
        assertEquals(List.of("ohe"), pronoun.inflect("oe", first));
    }

    @Test
    void questionWordsHaveLongAndShortForms() {
        assertEquals(List.of("pesu", "tupe"), pronoun.getQuestionForms(Gender.NEUTRAL, GrammaticalNumber.SINGULAR));
        assertEquals(List.of("pemstan", "mestampe"), pronoun.getQuestionForms(Gender.MALE, GrammaticalNumber.DUAL));
        assertEquals(List.of("payste", "aystepe"),
                pronoun.inflect("", PronounFeatures.builder().form(PronounForm.QUESTION)
                        .gender(Gender.FEMALE).number(GrammaticalNumber.PLURAL).build()));
    }

    @Test
    void shortPluralsAndShortForms() {
        assertEquals("aypo", pronoun.makeShortPlural("po"));
        assertEquals("ayfo", pronoun.makeShortPlural("fo"));
        assertEquals("aynga", pronoun.makeShortPlural("nga"));
        assertTrue(pronoun.hasShortForm("ayoeng"));
        assertFalse(pronoun.hasShortForm("oe"));
        assertEquals("awnga", pronoun.getShortForm("ayoeng"));
        assertEquals("oe", pronoun.getShortForm("oe"));
    }

    @Test
    void laheParadigmIsTabulated() {
        assertEquals("aylaheyä", pronoun.getLaheForm(Register.FULL, NounCase.GENITIVE));
        assertEquals("aylat", pronoun.getLaheForm(Register.SHORT, NounCase.PATIENTIVE));
    }

    @Test
    void reflexiveAndIndeterminateForms() {
        PronounFeatures reflexive = PronounFeatures.builder().form(PronounForm.REFLEXIVE)
                .nounCase(NounCase.GENITIVE).build();
        PronounFeatures indeterminate = PronounFeatures.builder().form(PronounForm.INDETERMINATE)
                .nounCase(NounCase.AGENTIVE).build();

        assertEquals(List.of("sneyä"), pronoun.inflect("", reflexive));
        assertEquals(List.of("fkol"), pronoun.inflect("", indeterminate));
        assertEquals(List.of("sno"), pronoun.inflect("", PronounFeatures.builder().form(PronounForm.REFLEXIVE).build()));
    }

    @Test
    void basicFormsByPersonAndNumber() {
        assertEquals("oeng", pronoun.getBasicForm(Person.FIRST, Inclusivity.INCLUSIVE, Animacy.ANIMATE,
                GrammaticalNumber.DUAL));
        assertEquals("pxenga", pronoun.getBasicForm(Person.SECOND, Inclusivity.EXCLUSIVE, Animacy.ANIMATE,
                GrammaticalNumber.TRIAL));
        assertEquals("aysa'u", pronoun.getBasicForm(Person.THIRD, Inclusivity.EXCLUSIVE, Animacy.INANIMATE,
                GrammaticalNumber.PLURAL));
        assertThrows(UnknownFeatureException.class, () -> pronoun.getBasicForm(Person.FIRST,
                Inclusivity.INCLUSIVE, Animacy.ANIMATE, GrammaticalNumber.SINGULAR));
    }
}
