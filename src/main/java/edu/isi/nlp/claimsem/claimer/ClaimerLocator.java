package edu.isi.nlp.claimsem.claimer;

import edu.isi.nlp.claimsem.amr.AMR;
import edu.isi.nlp.claimsem.amr.AMRAlignment;
import edu.isi.nlp.claimsem.amr.AMRConstants;
import edu.isi.nlp.claimsem.amr.TextReconstructor;
import edu.isi.nlp.claimsem.annotation.Lemmatizer;
import edu.isi.nlp.claimsem.annotation.LinguisticAnnotator;
import edu.isi.nlp.claimsem.claim.Claim;
import edu.isi.nlp.claimsem.claim.Claimer;
import edu.stanford.nlp.util.Pair;
import edu.stanford.nlp.util.logging.Redwood;

import java.util.*;

/**
 * Finds who is making a claim, by locating the saying/reasoning event that governs the claim in the
 * sentence graph and reading off its :ARG0.
 *
 * The event is found in one of two ways:
 * <ol>
 *     <li>Match a claim token (as noun or verb lemma) to a graph concept, then walk up from that
 *         concept until we hit a statement frame.</li>
 *     <li>Failing that, take the first statement frame in the graph. This happens for about half of
 *         all claims.</li>
 * </ol>
 */
public class ClaimerLocator {
    private static final Redwood.RedwoodChannels log = Redwood.channels(ClaimerLocator.class);

    private static final Set<String> SPEECH_TAGS = Collections.unmodifiableSet(new HashSet<>(Arrays.asList("VERB", "AUX")));

    private final StatementFrames statementFrames;
    private final Lemmatizer lemmatizer;
    private final LinguisticAnnotator annotator;

    public ClaimerLocator(StatementFrames statementFrames, Lemmatizer lemmatizer, LinguisticAnnotator annotator) {
        this.statementFrames = statementFrames;
        this.lemmatizer = lemmatizer;
        this.annotator = annotator;
    }

    public Optional<Claimer> findClaimer(Claim claim, List<String> claimTokens, AMR amr, List<AMRAlignment> alignments) {
        if (amr == null) {
            return Optional.empty();
        }
        AMR.Node claimNode = getClaimNode(claimTokens, amr);
        if (claimNode == null) {
            log.debug("No statement node in graph for claim " + claim.claimId);
            return Optional.empty();
        }
        TextReconstructor reconstructor = new TextReconstructor(amr, alignments);
        String claimerText = getArgumentText(reconstructor, claimNode, annotator.partsOfSpeech(claim.claimSentence));
        if (claimerText == null || claimerText.trim().isEmpty()) {
            return Optional.empty();
        }
        Pair<Integer, Integer> span = claim.getOffsetsForText(claimerText, annotator);
        return Optional.of(new Claimer(claim.docId, claimerText, span));
    }

    AMR.Node getClaimNode(List<String> claimTokens, AMR amr) {
        for (String token : claimTokens) {
            String nounLemma = lemmatizer.asNoun(token);
            String verbLemma = lemmatizer.asVerb(token);
            for (AMR.Node node : amr.getNodes()) {
                String label = AMRConstants.stripSense(node.title);
                if (label.equals(nounLemma) || label.equals(verbLemma)) {
                    AMR.Node claimNode = locatePredicate(amr, node, new HashSet<>());
                    if (claimNode != null) {
                        return claimNode;
                    }
                }
            }
        }
        return searchForClaimNode(amr);
    }

    /**
     * Depth-first search upward from a node for the nearest statement frame.
     */
    AMR.Node locatePredicate(AMR amr, AMR.Node node, Set<AMR.Node> visited) {
        for (AMR.Node parent : amr.getParents(node)) {
            if (visited.contains(parent)) continue;
            if (statementFrames.isStatementNode(parent.title)) {
                return parent;
            }
            visited.add(parent);
            AMR.Node found = locatePredicate(amr, parent, visited);
            if (found != null) {
                return found;
            }
        }
        return null;
    }

    AMR.Node searchForClaimNode(AMR amr) {
        for (AMR.Node node : amr.getNodes()) {
            if (statementFrames.isStatementNode(node.title)) {
                return node;
            }
        }
        return null;
    }

    String getArgumentText(TextReconstructor reconstructor, AMR.Node claimNode, Map<String, String> sentencePos) {
        AMR.Node claimerNode = reconstructor.getAMR().getFirstChild(claimNode, ":ARG0");
        if (claimerNode == null) {
            return null;
        }
        String fullClaimer;
        if (AMRConstants.namedEntityTypes.contains(claimerNode.title)) {
            fullClaimer = reconstructor.fullName(claimerNode);
        } else {
            fullClaimer = reconstructor.describe(claimerNode);
        }
        return removeSpeechTag(fullClaimer, sentencePos);
    }

    /**
     * Drops a trailing verb picked up with the claimer: "he wrote" becomes "he".
     */
    static String removeSpeechTag(String claimer, Map<String, String> sentencePos) {
        if (claimer == null) {
            return null;
        }
        String[] words = claimer.split("\\s+");
        if (words.length < 2 || sentencePos == null) {
            return claimer;
        }
        String lastPos = sentencePos.get(words[words.length - 1]);
        if (lastPos != null && SPEECH_TAGS.contains(lastPos)) {
            return String.join(" ", Arrays.copyOf(words, words.length - 1));
        }
        return String.join(" ", words);
    }
}
