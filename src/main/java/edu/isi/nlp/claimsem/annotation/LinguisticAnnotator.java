package edu.isi.nlp.claimsem.annotation;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Tokenization, part-of-speech tags and entity types for arbitrary text.
 */
public interface LinguisticAnnotator {

    List<AnnotatedToken> annotate(String text);

    /**
     * Coarse entity types for the named entities in the text, keyed by entity text.
     * Types follow {@link EntityClue}; unknown types are passed through.
     */
    Map<String, String> entityClues(String text);

    default List<String> tokenize(String text) {
        return annotate(text).stream().map(t -> t.word).collect(Collectors.toList());
    }

    /**
     * Token text to universal POS tag. A token appearing twice keeps its last tag.
     */
    default Map<String, String> partsOfSpeech(String text) {
        Map<String, String> pos = new LinkedHashMap<>();
        for (AnnotatedToken token : annotate(text)) {
            pos.put(token.word, token.pos);
        }
        return pos;
    }
}
