package edu.isi.nlp.claimsem.claim;

import edu.stanford.nlp.util.Pair;

import java.util.UUID;

/**
 * A stretch of claim text picked out of the AMR graph, with its character span in the claim
 * sentence when we could recover one.
 */
public abstract class Mention {
    public final String mentionId;
    public final String docId;
    public final String text;
    public final Pair<Integer, Integer> span;

    protected Mention(String docId, String text, Pair<Integer, Integer> span) {
        this(createId(), docId, text, span);
    }

    protected Mention(String mentionId, String docId, String text, Pair<Integer, Integer> span) {
        this.mentionId = mentionId;
        this.docId = docId;
        this.text = text;
        this.span = span;
    }

    /**
     * The first eight characters of a random UUID.
     */
    public static String createId() {
        return UUID.randomUUID().toString().substring(0, 8);
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{" +
                "text='" + text + '\'' +
                ", span=" + span +
                ", mentionId='" + mentionId + '\'' +
                '}';
    }
}
