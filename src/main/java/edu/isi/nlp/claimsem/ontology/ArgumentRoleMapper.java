package edu.isi.nlp.claimsem.ontology;

import edu.isi.nlp.claimsem.amr.AMR;
import edu.isi.nlp.claimsem.amr.AMRConstants;
import edu.isi.nlp.claimsem.amr.TextReconstructor;

import java.util.*;

/**
 * Binds the declared arguments of an ontology event to text, by following the argument arcs of
 * the predicate node it came from.
 */
public class ArgumentRoleMapper {

    /** Trailing words that mean the aligned text ran past the argument. */
    static final Set<String> TRAILING_STOP_WORDS = new HashSet<String>() {{
        add("and");
        add("or");
        add("the");
        add("a");
        add("is");
        add("are");
        add("like");
        add("in");
    }};

    private ArgumentRoleMapper() {
    }

    public static boolean isArgumentRole(String role) {
        return role.contains("ARG") || role.contains("time") || role.contains("location") || role.contains("direction");
    }

    /**
     * The argument of the predicate on this arc, if the arc is one: the head of an inverse role
     * pointing at the predicate, or the tail of a plain role leaving it.
     */
    public static AMR.Node argumentNode(AMR.Node predicate, AMR.Arc arc) {
        if (arc.tail.equals(predicate) && arc.isInverse()) {
            return arc.head;
        } else if (arc.head.equals(predicate) && !arc.isInverse()) {
            return arc.tail;
        }
        return null;
    }

    /**
     * :ARG1 and :ARG1-of become A1, :location becomes loc, :time stays time.
     */
    public static String frameNetRole(String role) {
        String code = role.replace(":", "").replace("-of", "");
        if (code.isEmpty()) return code;
        if (code.charAt(0) == 'A') {
            return code.replace("RG", "");
        } else if (code.equals("location") || code.equals("direction")) {
            return code.substring(0, 3);
        }
        return code;
    }

    /**
     * @return ontology role name ("agent", "patient", ...) to bound text, in arc order
     */
    public static Map<String, String> labeledArgs(TextReconstructor reconstructor, AMR.Node predicate,
                                                  Map<String, QNodeArg> declaredArgs) {
        Map<String, String> labeled = new LinkedHashMap<>();
        AMR amr = reconstructor.getAMR();
        for (AMR.Arc arc : amr.getArcsForNode(predicate)) {
            if (!isArgumentRole(arc.title)) continue;
            AMR.Node argument = argumentNode(predicate, arc);
            if (argument == null) continue;
            QNodeArg declared = declaredArgs.get(frameNetRole(arc.title));
            if (declared == null) continue;
            labeled.put(declared.textRole, boundText(reconstructor, argument));
        }
        return labeled;
    }

    static String boundText(TextReconstructor reconstructor, AMR.Node argument) {
        String text = reconstructor.text(argument);
        if (text == null || text.isEmpty()) {
            return AMRConstants.frameStem(argument.title);
        }
        for (String stopWord : TRAILING_STOP_WORDS) {
            if (text.endsWith(" " + stopWord)) {
                return text.split(" ")[0];
            }
        }
        return text;
    }
}
