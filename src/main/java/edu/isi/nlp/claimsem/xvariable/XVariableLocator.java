package edu.isi.nlp.claimsem.xvariable;

import edu.isi.nlp.claimsem.amr.AMR;
import edu.isi.nlp.claimsem.amr.AMRAlignment;
import edu.isi.nlp.claimsem.amr.AMRConstants;
import edu.isi.nlp.claimsem.amr.TextReconstructor;
import edu.isi.nlp.claimsem.annotation.EntityClue;
import edu.isi.nlp.claimsem.annotation.LinguisticAnnotator;
import edu.isi.nlp.claimsem.claim.Claim;
import edu.isi.nlp.claimsem.claim.XVariable;
import edu.stanford.nlp.util.logging.Redwood;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Finds the unknown ("X") of a claim in its AMR graph.
 *
 * Templated claims go through {@link TemplateRules}; claims without a fixed template go through
 * {@link #identifyXVariable}, which uses entity types of the claim text as clues.
 */
public class XVariableLocator {
    private static final Redwood.RedwoodChannels log = Redwood.channels(XVariableLocator.class);

    private final List<XVariableRule> rules;
    private final LinguisticAnnotator annotator;

    public XVariableLocator(LinguisticAnnotator annotator) {
        this(TemplateRules.RULES, annotator);
    }

    public XVariableLocator(List<XVariableRule> rules, LinguisticAnnotator annotator) {
        this.rules = rules;
        this.annotator = annotator;
    }

    public Optional<XVariable> findXVariable(AMR amr, List<AMRAlignment> alignments, Claim claim) {
        String template = claim.claimTemplate;
        if (template == null || template.isEmpty() || amr == null) {
            return Optional.empty();
        }
        RuleContext context = new RuleContext(amr, new TextReconstructor(amr, alignments), template);
        for (XVariableRule rule : rules) {
            if (rule.matches(template)) {
                log.debug("Template `" + template + "` handled by " + rule);
                return toXVariable(rule.extract(context), claim);
            }
        }
        log.debug("No rule for template `" + template + "`");
        return Optional.empty();
    }

    /**
     * @param entityClues entity text to clue type, see {@link EntityClue}
     * @param claimPos    token text to universal POS tag for the claim text
     */
    public Optional<XVariable> identifyXVariable(AMR amr, List<AMRAlignment> alignments, Claim claim,
                                                 Map<String, String> entityClues, Map<String, String> claimPos) {
        if (amr == null) {
            return Optional.empty();
        }
        RuleContext context = new RuleContext(amr, new TextReconstructor(amr, alignments), null);
        TextReconstructor reconstructor = context.reconstructor;

        for (String clue : entityClues.values()) {
            if (EntityClue.NORP.equals(clue)) {
                // A nationality points at a government or a place
                for (AMR.Arc arc : amr.getArcs()) {
                    if (arc.head.title.equals("government-organization")) {
                        return toXVariable(context.governmentName(false), claim);
                    }
                    if (context.isPlace(arc.head)) {
                        return toXVariable(reconstructor.describe(arc.head), claim);
                    }
                    if (context.isPlace(arc.tail)) {
                        // "Chinese scientists": the nationality only modifies the real variable
                        String placeText = reconstructor.text(arc.tail);
                        AMR.Node variable = placeText != null && "ADJ".equals(claimPos.get(placeText))
                                ? arc.head : arc.tail;
                        return toXVariable(reconstructor.describe(variable), claim);
                    }
                }
            }
            if (EntityClue.PERSON.equals(clue) || EntityClue.ORG.equals(clue)) {
                for (AMR.Arc arc : amr.getArcs()) {
                    if (AMRConstants.namedEntityTypes.contains(arc.tail.title)) {
                        String name = reconstructor.fullName(arc.tail);
                        return toXVariable(name != null ? name : arc.tail.title, claim);
                    }
                }
            }
        }

        for (AMR.Arc arc : amr.getArcs()) {
            if (arc.title.equals(":location") || arc.title.equals(":source") || context.isPlace(arc.tail)) {
                return toXVariable(reconstructor.nameOrDescription(arc.tail), claim);
            }
            if (arc.head.title.equals("date-entity")) {
                return toXVariable(reconstructor.describe(arc.head), claim);
            }
        }
        return Optional.empty();
    }

    private Optional<XVariable> toXVariable(String text, Claim claim) {
        if (text == null || text.trim().isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(new XVariable(claim.docId, text, claim.getOffsetsForText(text, annotator)));
    }
}
