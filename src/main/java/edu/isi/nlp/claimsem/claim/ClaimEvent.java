package edu.isi.nlp.claimsem.claim;

/**
 * The ontology event the claim predicate was resolved to.
 */
public class ClaimEvent {
    public final String docId;
    /** Canonical ontology name. */
    public final String text;
    public final String qnodeId;
    public final String description;
    /** The PropBank label the event came from. */
    public final String fromQuery;

    public ClaimEvent(String docId, String text, String qnodeId, String description, String fromQuery) {
        this.docId = docId;
        this.text = text;
        this.qnodeId = qnodeId;
        this.description = description;
        this.fromQuery = fromQuery;
    }

    @Override
    public String toString() {
        return "ClaimEvent{" +
                "text='" + text + '\'' +
                ", qnodeId='" + qnodeId + '\'' +
                ", fromQuery='" + fromQuery + '\'' +
                '}';
    }
}
