package edu.isi.nlp.claimsem.xvariable;

import edu.isi.nlp.claimsem.amr.AMR;
import edu.isi.nlp.claimsem.amr.AMRConstants;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * The ordered template rules for the COVID-19 claim templates. The first rule whose template test
 * passes decides the answer, even when it finds nothing.
 */
public class TemplateRules {

    /** Template given special treatment by the agent rule: the curer of cure-01 is its :ARG3. */
    public static final String CURES_TEMPLATE = "X cures COVID-19";

    // Treatments turn up in a handful of argument slots
    static final EdgeMatcher MISLABELED_TREATMENT = EdgeMatcher.of("treat-03", ":ARG1");
    static final EdgeMatcher TREATMENT_IN_ARG3 = EdgeMatcher.of("treat-03", ":ARG3");
    static final EdgeMatcher SHORTENS_INFECTION = EdgeMatcher.of("shorten-01", ":ARG0");
    static final EdgeMatcher PREVENTS_DEATH = EdgeMatcher.of("prevent-01", ":ARG0");
    static final EdgeMatcher TREATMENT_IS_APPROVED = EdgeMatcher.of("approve-01", ":ARG1");

    static final EdgeMatcher TREATMENT = EdgeMatcher.anyOf(
            MISLABELED_TREATMENT,
            TREATMENT_IN_ARG3,
            SHORTENS_INFECTION,
            PREVENTS_DEATH,
            TREATMENT_IS_APPROVED);

    static final EdgeMatcher SAFE_MEDICATION = EdgeMatcher.of("safe-01", ":ARG1");
    static final EdgeMatcher TARGET = EdgeMatcher.of("target-01", ":ARG1");

    public static final List<XVariableRule> RULES = Collections.unmodifiableList(new ArrayList<XVariableRule>() {{

        add(new XVariableRule("place",
                template -> AMRConstants.placeVariables.stream().anyMatch(place -> template.contains(place + "-X")),
                context -> {
                    AMR.Arc arc = context.firstLocationArc();
                    return arc == null ? null : context.reconstructor.nameOrDescription(arc.tail);
                }));

        add(new XVariableRule("person",
                template -> template.contains("person-X"),
                context -> {
                    for (AMR.Arc arc : context.amr.getArcs()) {
                        if (arc.tail.title.equals("person")) {
                            String name = context.reconstructor.fullName(arc.tail);
                            return name != null ? name : arc.tail.title;
                        }
                    }
                    return null;
                }));

        // "... is X": the unknown is usually the root of the graph
        add(new XVariableRule("copula",
                template -> template.endsWith("is X"),
                context -> context.reconstructor.describe(context.root())));

        add(new XVariableRule("target",
                template -> template.startsWith("X was the target"),
                context -> {
                    AMR.Arc arc = context.firstArcMatching(TARGET);
                    if (arc == null) return null;
                    String name = context.reconstructor.fullName(arc.tail);
                    return name != null ? name : context.reconstructor.describe(arc.tail, true);
                }));

        // Negative effects of masks: the modifiers of affect-01
        add(new XVariableRule("negative-effect",
                template -> template.contains("X negative effect"),
                context -> {
                    for (AMR.Arc arc : context.amr.getArcs()) {
                        if (arc.head.title.equals("affect-01")) {
                            return context.reconstructor.describe(arc.head, true);
                        }
                    }
                    return null;
                }));

        add(new XVariableRule("government",
                template -> template.contains("Government-X"),
                context -> context.governmentName(true)));

        add(new XVariableRule("date",
                template -> template.contains("date-X"),
                context -> {
                    AMR.Node date = context.amr.firstNodeWithTitle("date-entity");
                    return date == null ? null : context.reconstructor.describe(date);
                }));

        add(new XVariableRule("treatment",
                template -> template.contains("Treatment-X") || template.contains("effective treatment"),
                context -> {
                    AMR.Arc arc = context.firstArcMatching(TREATMENT);
                    return arc == null ? null : context.reconstructor.describe(arc.tail);
                }));

        add(new XVariableRule("medication",
                template -> template.contains("medication X"),
                context -> {
                    AMR.Arc arc = context.firstArcMatching(SAFE_MEDICATION);
                    return arc == null ? null : context.reconstructor.describe(arc.tail);
                }));

        // The only animal template is about an animal being involved in the origin of COVID-19
        add(new XVariableRule("animal",
                template -> template.contains("Animal-X"),
                context -> {
                    AMR.Node arg1 = context.amr.getFirstChild(context.root(), ":ARG1");
                    return arg1 == null ? null : context.reconstructor.describe(arg1);
                }));

        // X leads the template: agent of the root
        add(new XVariableRule("agent",
                template -> template.charAt(0) == 'X',
                context -> {
                    List<String> agentRoles = CURES_TEMPLATE.equals(context.template)
                            ? Arrays.asList(":ARG3", ":ARG0")
                            : Collections.singletonList(":ARG0");
                    for (String role : agentRoles) {
                        AMR.Node agent = context.amr.getFirstChild(context.root(), role);
                        if (agent != null) {
                            return context.reconstructor.nameOrDescription(agent);
                        }
                    }
                    return null;
                }));

        // X ends the template: patient of the root
        add(new XVariableRule("patient",
                template -> template.charAt(template.length() - 1) == 'X',
                context -> {
                    AMR.Node patient = context.amr.getFirstChild(context.root(), ":ARG1");
                    return patient == null ? null : context.reconstructor.nameOrDescription(patient);
                }));
    }});

    private TemplateRules() {
    }
}
