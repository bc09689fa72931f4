package edu.isi.nlp.claimsem.annotation;

/**
 * The entity types the untemplated x-variable rules know how to use.
 */
public final class EntityClue {
    /** Nationalities, religious and political groups. */
    public static final String NORP = "NORP";
    public static final String PERSON = "PERSON";
    public static final String ORG = "ORG";

    private EntityClue() {
    }
}
