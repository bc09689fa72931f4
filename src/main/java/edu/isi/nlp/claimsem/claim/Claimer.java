package edu.isi.nlp.claimsem.claim;

import edu.stanford.nlp.util.Pair;

/**
 * Whoever is asserting the claim.
 */
public class Claimer extends Mention {
    public Claimer(String docId, String text, Pair<Integer, Integer> span) {
        super(docId, text, span);
    }
}
