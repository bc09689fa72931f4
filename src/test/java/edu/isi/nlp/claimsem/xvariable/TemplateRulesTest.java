package edu.isi.nlp.claimsem.xvariable;

import org.junit.Test;

import static org.junit.Assert.*;

public class TemplateRulesTest {

    private static String ruleFor(String template) {
        for (XVariableRule rule : TemplateRules.RULES) {
            if (rule.matches(template)) return rule.name;
        }
        return null;
    }

    @Test
    public void testDispatch() {
        assertEquals("place", ruleFor("COVID-19 originated in location-X"));
        assertEquals("place", ruleFor("The first case was at facility-X"));
        assertEquals("person", ruleFor("person-X created COVID-19"));
        assertEquals("copula", ruleFor("The origin of COVID-19 is X"));
        assertEquals("target", ruleFor("X was the target of the virus"));
        assertEquals("negative-effect", ruleFor("Wearing masks has X negative effect"));
        assertEquals("government", ruleFor("Government-X hid data about COVID-19"));
        assertEquals("date", ruleFor("COVID-19 appeared on date-X"));
        assertEquals("treatment", ruleFor("Treatment-X is an effective treatment for COVID-19"));
        assertEquals("medication", ruleFor("Taking medication X is safe"));
        assertEquals("animal", ruleFor("Animal-X was involved in the origin of COVID-19"));
        assertEquals("agent", ruleFor(TemplateRules.CURES_TEMPLATE));
        assertEquals("patient", ruleFor("COVID-19 spreads through X"));
        assertNull(ruleFor("COVID-19 is a hoax"));
    }

    @Test
    public void testEarlierRulesShadowLaterOnes() {
        // Both a place and a date are asked for; the place rule comes first
        assertEquals("place", ruleFor("COVID-19 appeared in location-X on date-X"));
        // Ends in "is X" as well as starting with X
        assertEquals("copula", ruleFor("X is X"));
    }
}
