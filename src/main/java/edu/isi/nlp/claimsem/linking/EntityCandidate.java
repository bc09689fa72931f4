package edu.isi.nlp.claimsem.linking;

/**
 * One knowledge base entry proposed for a text span.
 */
public class EntityCandidate {
    public final String qnodeId;
    public final String canonicalName;
    public final String definition;
    /** The span text the candidate was found for. */
    public final String query;

    public EntityCandidate(String qnodeId, String canonicalName, String definition, String query) {
        this.qnodeId = qnodeId;
        this.canonicalName = canonicalName;
        this.definition = definition;
        this.query = query;
    }

    @Override
    public String toString() {
        return qnodeId + " (" + canonicalName + ")";
    }
}
