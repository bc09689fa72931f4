package edu.isi.nlp.claimsem.claim;

import edu.stanford.nlp.util.Pair;

/**
 * The filler of the X slot in the claim template.
 */
public class XVariable extends Mention {
    public XVariable(String docId, String text, Pair<Integer, Integer> span) {
        super(docId, text, span);
    }
}
