package edu.isi.nlp.claimsem.claim;

import edu.stanford.nlp.util.Pair;

/**
 * An argument of the claim event, linked to a knowledge base entry.
 */
public class ClaimArg extends Mention {
    public final String qnodeId;
    public final String description;
    /** The argument text that was sent to entity search. */
    public final String fromQuery;

    public ClaimArg(String docId, String text, Pair<Integer, Integer> span,
                    String qnodeId, String description, String fromQuery) {
        super(docId, text, span);
        this.qnodeId = qnodeId;
        this.description = description;
        this.fromQuery = fromQuery;
    }

    @Override
    public String toString() {
        return "ClaimArg{" +
                "text='" + text + '\'' +
                ", qnodeId='" + qnodeId + '\'' +
                ", fromQuery='" + fromQuery + '\'' +
                '}';
    }
}
