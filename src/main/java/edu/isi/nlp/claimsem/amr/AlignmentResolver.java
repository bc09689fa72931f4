package edu.isi.nlp.claimsem.amr;

import edu.stanford.nlp.util.logging.Redwood;

import java.util.*;

/**
 * Maps AMR node refs back to the source tokens they were aligned to.
 */
public class AlignmentResolver {
    private static final Redwood.RedwoodChannels log = Redwood.channels(AlignmentResolver.class);

    private AlignmentResolver() {
    }

    /**
     * Builds ref -> surface text. Punctuation tokens are dropped, and a node aligned by several
     * alignments collects their tokens in the order the alignments are listed. Unaligned nodes are
     * absent from the result.
     */
    public static Map<String, String> nodesToText(AMR amr, List<AMRAlignment> alignments) {
        Map<String, List<String>> nodesToTokens = new LinkedHashMap<>();
        String[] tokens = amr.getSourceText();

        for (AMRAlignment alignment : alignments) {
            for (String ref : alignment.nodeRefs) {
                for (int index : alignment.tokens) {
                    if (index < 0 || index >= tokens.length) {
                        log.warn("Alignment for " + ref + " points past the sentence (token " + index + ")");
                        continue;
                    }
                    String token = tokens[index];
                    if (AMRConstants.isPunctuation(token)) continue;
                    nodesToTokens.computeIfAbsent(ref, k -> new ArrayList<>()).add(token);
                }
            }
        }

        Map<String, String> nodesToText = new LinkedHashMap<>();
        for (Map.Entry<String, List<String>> entry : nodesToTokens.entrySet()) {
            nodesToText.put(entry.getKey(), String.join(" ", entry.getValue()));
        }
        return nodesToText;
    }
}
