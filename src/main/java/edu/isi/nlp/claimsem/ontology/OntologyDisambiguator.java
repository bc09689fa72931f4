package edu.isi.nlp.claimsem.ontology;

import edu.isi.nlp.claimsem.amr.AMR;
import edu.isi.nlp.claimsem.amr.AMRAlignment;
import edu.isi.nlp.claimsem.amr.AMRConstants;
import edu.isi.nlp.claimsem.amr.TextReconstructor;
import edu.isi.nlp.claimsem.annotation.LinguisticAnnotator;
import edu.isi.nlp.claimsem.claim.Claim;
import edu.isi.nlp.claimsem.claim.ClaimArg;
import edu.isi.nlp.claimsem.claim.ClaimEvent;
import edu.isi.nlp.claimsem.claim.ClaimSemantics;
import edu.isi.nlp.claimsem.linking.EntityCandidate;
import edu.isi.nlp.claimsem.linking.EntitySearchResult;
import edu.isi.nlp.claimsem.linking.EntitySearchService;
import edu.stanford.nlp.util.logging.Redwood;

import java.util.*;

/**
 * Resolves the predicate of a claim to an ontology event, and its arguments to knowledge base
 * entries.
 *
 * Labels are tried in graph order; the first PropBank label stands in for the root predicate. The
 * curated overlay table is consulted first. The master table is only consulted when the overlay
 * had nothing, or only had something for a non-root label, and its answer replaces the overlay's
 * when it belongs to the root label or the overlay had nothing.
 */
public class OntologyDisambiguator {
    private static final Redwood.RedwoodChannels log = Redwood.channels(OntologyDisambiguator.class);

    /**
     * An accepted table entry and the graph label it was found for.
     */
    static class Match {
        final QNode qnode;
        final String pbLabel;
        final boolean fromRoot;

        Match(QNode qnode, String pbLabel, boolean fromRoot) {
            this.qnode = qnode;
            this.pbLabel = pbLabel;
            this.fromRoot = fromRoot;
        }
    }

    private final OntologyTables tables;
    private final GeneralityNarrower narrower;
    private final EntitySearchService entitySearch;
    private final LinguisticAnnotator annotator;
    private final int searchK;

    public OntologyDisambiguator(OntologyTables tables, EntitySearchService entitySearch,
                                 LinguisticAnnotator annotator, int searchK) {
        this.tables = tables;
        this.narrower = new GeneralityNarrower(tables.hierarchy);
        this.entitySearch = entitySearch;
        this.annotator = annotator;
        this.searchK = searchK;
    }

    public Optional<ClaimSemantics> disambiguate(AMR amr, List<AMRAlignment> alignments, Claim claim) {
        if (amr == null) {
            return Optional.empty();
        }
        List<String> pbLabels = frameLabels(amr);
        if (pbLabels.isEmpty()) {
            log.warn("No PropBank labels in the graph for claim " + claim.claimId);
            return Optional.empty();
        }
        Match match = select(pbLabels);
        if (match == null) {
            log.warn("No ontology event for any of " + pbLabels);
            return Optional.empty();
        }

        Map<String, ClaimArg> args = new LinkedHashMap<>();
        if (match.qnode.hasArgs()) {
            AMR.Node predicate = amr.firstNodeWithTitle(match.pbLabel);
            if (predicate != null) {
                TextReconstructor reconstructor = new TextReconstructor(amr, alignments);
                Map<String, String> roleTexts = ArgumentRoleMapper.labeledArgs(reconstructor, predicate, match.qnode.args);
                String sentence = String.join(" ", amr.getSourceText());
                for (Map.Entry<String, String> roleText : roleTexts.entrySet()) {
                    // Hyphenated fillers are unaligned PropBank concepts, not text worth linking
                    if (roleText.getValue().contains("-")) continue;
                    ClaimArg arg = linkArgument(sentence, roleText.getValue(), claim);
                    if (arg != null) {
                        args.put(roleText.getKey(), arg);
                    }
                }
            }
        }

        ClaimEvent event = new ClaimEvent(claim.docId, match.qnode.name, match.qnode.qnode,
                match.qnode.definition, match.pbLabel);
        return Optional.of(new ClaimSemantics(event, args));
    }

    /**
     * Node titles that look like frames, in node order. Duplicates are kept.
     */
    static List<String> frameLabels(AMR amr) {
        List<String> labels = new ArrayList<>();
        for (String title : amr.getOrderedNodeTitles()) {
            if (AMRConstants.isFrameLabel(title)) labels.add(title);
        }
        return labels;
    }

    Match select(List<String> pbLabels) {
        String rootLabel = pbLabels.get(0);
        Match best = overlayMatch(pbLabels, rootLabel);
        if (best == null || !best.fromRoot) {
            log.warn("Using node other than root to get event Qnode.");
            Match master = masterMatch(pbLabels, rootLabel);
            if (master != null && (master.fromRoot || best == null)) {
                best = master;
            }
        }
        return best;
    }

    Match overlayMatch(List<String> pbLabels, String rootLabel) {
        for (String label : pbLabels) {
            List<QNode> candidates = tables.overlay.candidates(label);
            if (candidates.isEmpty()) continue;
            QNode chosen = candidates.size() == 1 ? candidates.get(0) : DiceSimilarity.best(label, candidates);
            return new Match(chosen, label, label.equals(rootLabel));
        }
        return null;
    }

    Match masterMatch(List<String> pbLabels, String rootLabel) {
        for (String label : pbLabels) {
            List<QNode> candidates = tables.master.candidates(label);
            if (candidates.isEmpty()) continue;
            QNode chosen;
            if (candidates.size() == 1) {
                chosen = candidates.get(0);
            } else {
                chosen = narrower.mostGeneral(label, candidates);
                if (chosen == null) {
                    chosen = DiceSimilarity.best(label, candidates);
                }
            }
            return new Match(chosen, label, label.equals(rootLabel));
        }
        return null;
    }

    private ClaimArg linkArgument(String sentence, String text, Claim claim) {
        EntitySearchResult result;
        try {
            result = entitySearch.search(sentence, text, searchK);
        } catch (RuntimeException e) {
            log.warn("Entity search failed for '" + text + "': " + e.getMessage());
            return null;
        }
        EntityCandidate selection = result == null ? null : result.best();
        if (selection == null) {
            return null;
        }
        return new ClaimArg(claim.docId, selection.canonicalName, claim.getOffsetsForText(text, annotator),
                selection.qnodeId, selection.definition, text);
    }
}
