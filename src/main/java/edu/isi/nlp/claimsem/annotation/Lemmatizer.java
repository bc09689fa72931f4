package edu.isi.nlp.claimsem.annotation;

import edu.stanford.nlp.process.Morphology;

/**
 * Noun and verb lemmas through CoreNLP's morphological analyser. Needs no models.
 */
public class Lemmatizer {

    /**
     * Tagged as a plural so that the analyser strips number; singular nouns come back unchanged.
     */
    public String asNoun(String token) {
        return Morphology.lemmaStatic(token.toLowerCase(), "NNS");
    }

    public String asVerb(String token) {
        return Morphology.lemmaStatic(token.toLowerCase(), "VB");
    }
}
