package edu.isi.nlp.claimsem.xvariable;

import java.util.function.Function;
import java.util.function.Predicate;

/**
 * One entry of the template dispatch table: which templates it answers for, and how it pulls the
 * x-variable text out of the graph.
 */
public class XVariableRule {
    public final String name;
    private final Predicate<String> templateMatcher;
    private final Function<RuleContext, String> extractor;

    public XVariableRule(String name, Predicate<String> templateMatcher, Function<RuleContext, String> extractor) {
        this.name = name;
        this.templateMatcher = templateMatcher;
        this.extractor = extractor;
    }

    public boolean matches(String template) {
        return templateMatcher.test(template);
    }

    /**
     * @return the x-variable text, or null if the graph has nothing for this rule
     */
    public String extract(RuleContext context) {
        return extractor.apply(context);
    }

    @Override
    public String toString() {
        return "XVariableRule{" + name + "}";
    }
}
