package com.example.navireader.morph.parser;

import com.example.navireader.morph.NaviMorphology;
import com.example.navireader.morph.dictionary.LexicalRecord;
import com.example.navireader.morph.dictionary.LexiconLookup;
import com.example.navireader.morph.morphology.MorphologyTrace;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Looks up every word of a sentence in the dictionary through its lemma. Sentences are split
 * on whitespace only; no syntactic analysis is attempted.
 */
public class SentenceParser {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final String EDGE_PUNCTUATION = ".,!?";

    private final NaviMorphology morphology;
    private final LexiconLookup lexicon;
    private final MorphologyTrace trace;
    private List<LexicalRecord> results = Collections.emptyList();

    public SentenceParser(NaviMorphology morphology, LexiconLookup lexicon) {
        this(morphology, lexicon, MorphologyTrace.NOOP);
    }

    public SentenceParser(NaviMorphology morphology, LexiconLookup lexicon, MorphologyTrace trace) {
        this.morphology = Objects.requireNonNull(morphology, "morphology");
        this.lexicon = Objects.requireNonNull(lexicon, "lexicon");
        this.trace = Objects.requireNonNull(trace, "trace");
    }

    /**
     * Splits on whitespace and trims {@code .,!?} from both ends of each token.
     */
    public List<String> tokenize(String sentence) {
        if (sentence == null || sentence.isBlank()) {
            return Collections.emptyList();
        }
        List<String> tokens = new ArrayList<>();
        for (String raw : WHITESPACE.split(sentence.strip())) {
            String token = stripEdges(raw);
            if (!token.isEmpty()) {
                tokens.add(token);
            }
        }
        return tokens;
    }

    /**
     * @return the dictionary record of the token's lemma, or an unknown row carrying the token
     */
    public LexicalRecord wordInfo(String token) {
        String lemma = morphology.lemmatize(token.toLowerCase(Locale.ROOT));
        return lexicon.lookup(lemma).orElseGet(() -> LexicalRecord.unknown(token));
    }

    public List<LexicalRecord> parseSentence(String sentence) {
        trace.started("parse_sentence", sentence);
        try {
            List<LexicalRecord> parsed = new ArrayList<>();
            for (String token : tokenize(sentence)) {
                parsed.add(wordInfo(token));
            }
            results = Collections.unmodifiableList(parsed);
            trace.finished("parse_sentence", results);
            return results;
        } catch (RuntimeException ex) {
            trace.failed("parse_sentence", ex);
            throw ex;
        }
    }

    /**
     * @return the rows of the last {@link #parseSentence(String)} call
     */
    public List<LexicalRecord> results() {
        return results;
    }

    private static String stripEdges(String token) {
        int start = 0;
        int end = token.length();
        while (start < end && EDGE_PUNCTUATION.indexOf(token.charAt(start)) >= 0) {
            start++;
        }
        while (end > start && EDGE_PUNCTUATION.indexOf(token.charAt(end - 1)) >= 0) {
            end--;
        }
        return token.substring(start, end);
    }
}
