package edu.isi.nlp.claimsem.annotation;

/**
 * A token as seen by the linguistic annotation service.
 */
public class AnnotatedToken {
    public final String word;
    public final String lemma;
    /** Universal POS tag: VERB, AUX, ADJ, NOUN, PROPN, ... */
    public final String pos;
    public final String ner;
    public final int begin;
    public final int end;

    public AnnotatedToken(String word, String lemma, String pos, String ner, int begin, int end) {
        this.word = word;
        this.lemma = lemma;
        this.pos = pos;
        this.ner = ner;
        this.begin = begin;
        this.end = end;
    }

    @Override
    public String toString() {
        return word + "/" + pos + "[" + begin + "," + end + ")";
    }
}
