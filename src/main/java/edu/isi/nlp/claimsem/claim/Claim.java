package edu.isi.nlp.claimsem.claim;

import edu.isi.nlp.claimsem.annotation.LinguisticAnnotator;
import edu.stanford.nlp.util.Pair;
import edu.stanford.nlp.util.logging.Redwood;

import java.util.*;

/**
 * A claim found in a document, plus whatever the extractors attach to it.
 *
 * Derived artifacts (the AMR graph of the claim sentence and its alignments, the graph of the
 * claim text, the token offset table) ride along as named theories.
 */
public class Claim {
    private static final Redwood.RedwoodChannels log = Redwood.channels(Claim.class);

    public static final String AMR_THEORY = "amr";
    public static final String ALIGNMENTS_THEORY = "alignments";
    public static final String TOKEN_OFFSET_THEORY = "token_offset";
    /** Graph of the claim text alone, used for the x-variable. */
    public static final String CLAIM_AMR_THEORY = "claim_amr";
    public static final String CLAIM_ALIGNMENTS_THEORY = "claim_alignments";

    public final String claimId;
    public final String docId;
    public final String claimText;
    public final String claimSentence;
    public final Pair<Integer, Integer> claimSpan;
    /** Contains a literal "X" where the unknown goes, e.g. "X cures COVID-19". May be null. */
    public final String claimTemplate;

    public String topic;
    public String subtopic;
    public Claimer claimer;
    public XVariable xVariable;
    public final List<ClaimSemantics> claimSemantics = new ArrayList<>();

    private final Map<String, Object> theories = new HashMap<>();

    public Claim(String claimId, String docId, String claimText, String claimSentence,
                 Pair<Integer, Integer> claimSpan, String claimTemplate) {
        this.claimId = claimId;
        this.docId = docId;
        this.claimText = claimText;
        this.claimSentence = claimSentence;
        this.claimSpan = claimSpan;
        this.claimTemplate = claimTemplate;
    }

    public void addTheory(String name, Object theory) {
        theories.put(name, theory);
    }

    @SuppressWarnings("unchecked")
    public <T> T getTheory(String name) {
        return (T) theories.get(name);
    }

    /**
     * Finds where the text sits in the claim sentence, using the token offset theory.
     *
     * @return character offsets [begin, end), or null when the text is empty or can't be placed
     */
    public Pair<Integer, Integer> getOffsetsForText(String text, LinguisticAnnotator tokenizer) {
        if (text == null || text.trim().isEmpty()) {
            return null;
        }
        Map<String, List<Pair<Integer, Integer>>> tokensToOffsets = getTheory(TOKEN_OFFSET_THEORY);
        if (tokensToOffsets == null || tokensToOffsets.isEmpty()) {
            log.warn("No tokens -> offsets mapping for claim `" + claimSentence + "`");
            return null;
        }
        List<String> tokens = tokenizer.tokenize(text.trim());
        if (tokens.isEmpty()) {
            return null;
        }
        if (tokens.size() == 1) {
            List<Pair<Integer, Integer>> offsets = tokensToOffsets.get(tokens.get(0));
            if (offsets == null || offsets.isEmpty()) {
                log.warn("Could not find char offset info for token '" + tokens.get(0) + "' in claim sentence `" + claimSentence + "`");
                return null;
            }
            return offsets.get(0);
        }

        String firstToken = tokens.get(0);
        String lastToken = tokens.get(tokens.size() - 1);
        List<Pair<Integer, Integer>> firstOffsets = tokensToOffsets.get(firstToken);
        if (firstOffsets == null || firstOffsets.isEmpty()) {
            log.warn("Could not find char offset info for token '" + firstToken + "' in claim sentence `" + claimSentence + "`");
            return null;
        }
        List<Pair<Integer, Integer>> lastOffsets = tokensToOffsets.get(lastToken);
        if (lastOffsets == null || lastOffsets.isEmpty()) {
            log.warn("Could not find char offset info for token '" + lastToken + "' in claim sentence `" + claimSentence + "`");
            return null;
        }
        // Later occurrences of the first token first: they give the tightest span
        List<Pair<Integer, Integer>> firstReversed = new ArrayList<>(firstOffsets);
        Collections.reverse(firstReversed);
        for (Pair<Integer, Integer> first : firstReversed) {
            for (Pair<Integer, Integer> last : lastOffsets) {
                if (first.first < last.second) {
                    return new Pair<>(first.first, last.second);
                }
            }
        }
        log.warn("Could not find char offsets for string '" + text + "' in claim sentence `" + claimSentence + "`");
        return null;
    }

    @Override
    public String toString() {
        return "Claim{" +
                "claimId='" + claimId + '\'' +
                ", docId='" + docId + '\'' +
                ", claimText='" + claimText + '\'' +
                ", claimTemplate='" + claimTemplate + '\'' +
                ", claimer=" + claimer +
                ", xVariable=" + xVariable +
                ", claimSemantics=" + claimSemantics +
                '}';
    }
}
