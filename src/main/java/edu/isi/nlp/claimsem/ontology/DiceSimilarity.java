package edu.isi.nlp.claimsem.ontology;

import edu.isi.nlp.claimsem.amr.AMRConstants;
import edu.stanford.nlp.util.logging.Redwood;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Character-bigram Dice coefficient between a PropBank stem and ontology event names.
 */
public class DiceSimilarity {
    private static final Redwood.RedwoodChannels log = Redwood.channels(DiceSimilarity.class);

    private DiceSimilarity() {
    }

    /**
     * "cure" gives {cu, ur, re}.
     */
    public static Set<String> bigrams(String s) {
        Set<String> bigrams = new HashSet<>();
        for (int i = 0; i + 1 < s.length(); i++) {
            bigrams.add(s.substring(i, i + 2));
        }
        return bigrams;
    }

    public static double score(String a, String b) {
        Set<String> aBigrams = bigrams(a);
        Set<String> bBigrams = bigrams(b);
        int total = aBigrams.size() + bBigrams.size();
        if (total == 0) return 0.0;
        Set<String> overlap = new HashSet<>(aBigrams);
        overlap.retainAll(bBigrams);
        return 2.0 * overlap.size() / total;
    }

    /**
     * The candidate whose name is closest to the label's stem. Ties go to the earlier candidate, and
     * with no overlap at all the first candidate is returned.
     *
     * @return null only if there are no candidates
     */
    public static QNode best(String pbLabel, List<QNode> candidates) {
        if (candidates.isEmpty()) return null;
        String stem = AMRConstants.frameStem(pbLabel);
        QNode best = candidates.get(0);
        double bestScore = 0.0;
        for (QNode candidate : candidates) {
            double score = score(stem, candidate.name == null ? "" : candidate.name);
            if (score > bestScore) {
                best = candidate;
                bestScore = score;
            }
        }
        if (bestScore == 0.0) {
            log.warn("No best score found for " + pbLabel + "; taking " + best);
        }
        return best;
    }
}
