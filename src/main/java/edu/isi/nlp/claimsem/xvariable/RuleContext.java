package edu.isi.nlp.claimsem.xvariable;

import edu.isi.nlp.claimsem.amr.AMR;
import edu.isi.nlp.claimsem.amr.AMRConstants;
import edu.isi.nlp.claimsem.amr.TextReconstructor;

import java.util.List;
import java.util.Map;

/**
 * The graph a rule runs over, with the helpers every rule ends up needing.
 */
public class RuleContext {
    public final AMR amr;
    public final TextReconstructor reconstructor;
    /** The claim template, null when running untemplated. */
    public final String template;

    public RuleContext(AMR amr, TextReconstructor reconstructor, String template) {
        this.amr = amr;
        this.reconstructor = reconstructor;
        this.template = template;
    }

    public AMR.Node root() {
        return amr.getHead();
    }

    public boolean isPlace(AMR.Node node) {
        return node != null && AMRConstants.placeTypes.contains(node.title);
    }

    /**
     * The first arc whose role is :location or :source, or whose child is a place concept.
     * Not every location gets the :location role.
     */
    public AMR.Arc firstLocationArc() {
        for (AMR.Arc arc : amr.getArcs()) {
            if (arc.title.equals(":location") || arc.title.equals(":source") || isPlace(arc.tail)) {
                return arc;
            }
        }
        return null;
    }

    public AMR.Arc firstArcMatching(EdgeMatcher matcher) {
        for (AMR.Arc arc : amr.getArcs()) {
            if (matcher.matches(arc)) return arc;
        }
        return null;
    }

    /**
     * Names the place behind a government-organization concept, at most two arcs down, adding
     * "government" when the sentence itself says it.
     *
     * @param acceptPlaceAgent also accept an :ARG0 place standing in for its own government
     */
    public String governmentName(boolean acceptPlaceAgent) {
        boolean addGovernmentToken = amr.containsToken("government");
        for (AMR.Arc arc : amr.getArcs()) {
            if (arc.head.title.equals("government-organization")) {
                String fullName = null;
                if (isPlace(arc.tail)) {
                    fullName = reconstructor.fullName(arc.tail);
                } else {
                    for (List<AMR.Node> values : amr.getChildrenByRole(arc.tail).values()) {
                        for (AMR.Node value : values) {
                            if (isPlace(value)) {
                                fullName = reconstructor.fullName(value);
                            }
                        }
                    }
                }
                if (fullName != null && addGovernmentToken) {
                    return fullName + " government";
                }
                return fullName;
            } else if (acceptPlaceAgent && arc.title.equals(":ARG0") && isPlace(arc.tail)) {
                return reconstructor.fullName(arc.tail);
            }
        }
        return null;
    }

    public Map<String, List<AMR.Node>> childrenOfRoot() {
        return amr.getChildrenByRole(root());
    }
}
