package edu.isi.nlp.claimsem.xvariable;

import edu.isi.nlp.claimsem.amr.AMR;

/**
 * A test on a single arc, looking only at the parent's concept and the role.
 */
@FunctionalInterface
public interface EdgeMatcher {

    boolean matches(String parentTitle, String role);

    default boolean matches(AMR.Arc arc) {
        return matches(arc.head.title, arc.title);
    }

    static EdgeMatcher of(String parentTitle, String role) {
        return (parent, r) -> parentTitle.equals(parent) && role.equals(r);
    }

    static EdgeMatcher anyOf(EdgeMatcher... matchers) {
        return (parent, role) -> {
            for (EdgeMatcher matcher : matchers) {
                if (matcher.matches(parent, role)) return true;
            }
            return false;
        };
    }
}
