package edu.isi.nlp.claimsem.pipeline;

import edu.isi.nlp.claimsem.amr.AMR;
import edu.isi.nlp.claimsem.amr.AMRAlignment;
import edu.isi.nlp.claimsem.annotation.CoreNLPAnnotator;
import edu.isi.nlp.claimsem.annotation.Lemmatizer;
import edu.isi.nlp.claimsem.annotation.LinguisticAnnotator;
import edu.isi.nlp.claimsem.claim.Claim;
import edu.isi.nlp.claimsem.claim.ClaimSemantics;
import edu.isi.nlp.claimsem.claim.Claimer;
import edu.isi.nlp.claimsem.claim.TokenOffsets;
import edu.isi.nlp.claimsem.claim.XVariable;
import edu.isi.nlp.claimsem.claimer.ClaimerLocator;
import edu.isi.nlp.claimsem.claimer.StatementFrames;
import edu.isi.nlp.claimsem.linking.EntitySearchService;
import edu.isi.nlp.claimsem.ontology.OntologyDisambiguator;
import edu.isi.nlp.claimsem.ontology.OntologyTables;
import edu.isi.nlp.claimsem.xvariable.XVariableLocator;
import edu.stanford.nlp.util.logging.Redwood;
import edu.stanford.nlp.util.logging.StanfordRedwoodConfiguration;

import java.io.IOException;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.Properties;

/**
 * Fills in the claimer, x-variable and event semantics of claims whose graphs have already been
 * parsed. Claims are updated in place; one claim never affects another, so a single pipeline can
 * be shared across threads as long as the annotator can.
 */
public class ClaimSemanticsPipeline {
    private static final Redwood.RedwoodChannels log = Redwood.channels(ClaimSemanticsPipeline.class);

    private final ClaimSemanticsOptions.Domain domain;
    private final LinguisticAnnotator annotator;
    private final ClaimerLocator claimerLocator;
    private final XVariableLocator xVariableLocator;
    private final OntologyDisambiguator disambiguator;

    public ClaimSemanticsPipeline(ClaimSemanticsOptions options, StatementFrames statementFrames,
                                  LinguisticAnnotator annotator, OntologyTables tables,
                                  EntitySearchService entitySearch) {
        this.domain = options.getDomain();
        this.annotator = annotator;
        this.claimerLocator = new ClaimerLocator(statementFrames, new Lemmatizer(), annotator);
        this.xVariableLocator = new XVariableLocator(annotator);
        this.disambiguator = new OntologyDisambiguator(tables, entitySearch, annotator, options.searchK);
    }

    /**
     * Builds everything from properties: the CoreNLP annotator, the statement verbs, and the
     * ontology tables, deriving any table that is missing.
     *
     * @throws IOException if a resource can't be read, which leaves nothing to run with
     */
    public static ClaimSemanticsPipeline fromProperties(Properties props, EntitySearchService entitySearch) throws IOException {
        StanfordRedwoodConfiguration.setup();
        ClaimSemanticsOptions options = new ClaimSemanticsOptions(props);
        log.info("Building claim semantics pipeline for domain " + options.getDomain());
        OntologyTables tables = OntologyTables.load(
                options.file(options.masterTable), options.file(options.masterSource),
                options.file(options.overlayTable), options.file(options.overlaySource));
        return new ClaimSemanticsPipeline(options, StatementFrames.load(),
                new CoreNLPAnnotator(options.annotators), tables, entitySearch);
    }

    /**
     * Attaches the graphs as theories and processes the claim.
     */
    public Claim process(Claim claim, AMR sentenceAMR, List<AMRAlignment> sentenceAlignments,
                         AMR claimAMR, List<AMRAlignment> claimAlignments) {
        claim.addTheory(Claim.AMR_THEORY, sentenceAMR);
        claim.addTheory(Claim.ALIGNMENTS_THEORY, sentenceAlignments);
        claim.addTheory(Claim.CLAIM_AMR_THEORY, claimAMR);
        claim.addTheory(Claim.CLAIM_ALIGNMENTS_THEORY, claimAlignments);
        return process(claim);
    }

    /**
     * Processes a claim whose graphs are attached as theories. Without a separate claim-text graph
     * the sentence graph is used for the x-variable as well.
     */
    public Claim process(Claim claim) {
        AMR amr = claim.getTheory(Claim.AMR_THEORY);
        List<AMRAlignment> alignments = alignmentsOrEmpty(claim.getTheory(Claim.ALIGNMENTS_THEORY));
        if (amr == null) {
            log.warn("No graph attached to claim " + claim.claimId + "; skipping");
            return claim;
        }
        AMR claimAMR = claim.getTheory(Claim.CLAIM_AMR_THEORY);
        List<AMRAlignment> claimAlignments = alignmentsOrEmpty(claim.getTheory(Claim.CLAIM_ALIGNMENTS_THEORY));
        if (claimAMR == null) {
            claimAMR = amr;
            claimAlignments = alignments;
        }
        if (claim.getTheory(Claim.TOKEN_OFFSET_THEORY) == null && claim.claimSentence != null) {
            claim.addTheory(Claim.TOKEN_OFFSET_THEORY, TokenOffsets.fromSentence(claim.claimSentence));
        }

        List<String> claimTokens = annotator.tokenize(claim.claimText);
        Optional<Claimer> claimer = claimerLocator.findClaimer(claim, claimTokens, amr, alignments);
        claimer.ifPresent(c -> claim.claimer = c);

        Optional<XVariable> xVariable;
        if (domain == ClaimSemanticsOptions.Domain.COVID) {
            xVariable = xVariableLocator.findXVariable(claimAMR, claimAlignments, claim);
        } else {
            xVariable = xVariableLocator.identifyXVariable(claimAMR, claimAlignments, claim,
                    annotator.entityClues(claim.claimText), annotator.partsOfSpeech(claim.claimText));
        }
        xVariable.ifPresent(x -> claim.xVariable = x);

        Optional<ClaimSemantics> semantics = disambiguator.disambiguate(amr, alignments, claim);
        semantics.ifPresent(claim.claimSemantics::add);

        log.debug("Processed " + claim);
        return claim;
    }

    private static List<AMRAlignment> alignmentsOrEmpty(List<AMRAlignment> alignments) {
        return alignments == null ? Collections.emptyList() : alignments;
    }
}
