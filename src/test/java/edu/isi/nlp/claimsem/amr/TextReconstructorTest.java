package edu.isi.nlp.claimsem.amr;

import com.pholser.junit.quickcheck.From;
import com.pholser.junit.quickcheck.Property;
import com.pholser.junit.quickcheck.runner.JUnitQuickcheck;
import org.junit.Test;
import org.junit.runner.RunWith;

import java.util.Arrays;
import java.util.List;

import static org.junit.Assert.*;

@RunWith(JUnitQuickcheck.class)
public class TextReconstructorTest {

    @Test
    public void testModifiersComeBeforeTheFocus() {
        AMR amr = new AMR(new String[]{"salt", "water"});
        amr.addNode("w", "water");
        amr.addNode("s", "salt");
        amr.addArc("w", ":mod", "s");
        TextReconstructor reconstructor = new TextReconstructor(amr, Arrays.asList(
                AMRAlignment.of("w", 1),
                AMRAlignment.of("s", 0)));

        assertEquals("salt water", reconstructor.describe(amr.nodeWithRef("w")));
        assertEquals("salt", reconstructor.describe(amr.nodeWithRef("w"), true));
    }

    @Test
    public void testModifiersArePrependedOneByOne() {
        AMR amr = new AMR(new String[]{"cheap", "generic", "drug"});
        amr.addNode("d", "drug");
        amr.addNode("c", "cheap");
        amr.addNode("g", "generic");
        amr.addArc("d", ":mod", "c");
        amr.addArc("d", ":mod", "g");
        TextReconstructor reconstructor = new TextReconstructor(amr, Arrays.asList(
                AMRAlignment.of("d", 2),
                AMRAlignment.of("c", 0),
                AMRAlignment.of("g", 1)));

        // Each :mod goes to the front, so the last one listed reads first
        assertEquals("generic cheap drug", reconstructor.describe(amr.nodeWithRef("d")));
    }

    @Test
    public void testOpOneOnlyWhenNothingElseWasCollected() {
        AMR amr = new AMR(new String[]{"between", "Italy"});
        amr.addNode("b", "between");
        amr.addNode("i", "country");
        amr.addArc("b", ":op1", "i");
        List<AMRAlignment> alignments = Arrays.asList(AMRAlignment.of("b", 0), AMRAlignment.of("i", 1));
        TextReconstructor reconstructor = new TextReconstructor(amr, alignments);

        assertEquals("between Italy", reconstructor.describe(amr.nodeWithRef("b")));
    }

    @Test
    public void testPropBankFrameDescribesItsPatient() {
        AMR amr = new AMR(new String[]{"treat", "patients"});
        amr.addNode("t", "treat-03");
        amr.addNode("p", "patient");
        amr.addArc("t", ":ARG1", "p");
        TextReconstructor reconstructor = new TextReconstructor(amr, Arrays.asList(
                AMRAlignment.of("t", 0),
                AMRAlignment.of("p", 1)));

        assertEquals("treat patients", reconstructor.describe(amr.nodeWithRef("t")));
    }

    @Test
    public void testPropBankFrameKeepsItsTextWhenIgnoringTheFocus() {
        AMR amr = new AMR(new String[]{"affect", "breathing"});
        amr.addNode("a", "affect-01");
        amr.addNode("b", "breathe-01");
        amr.addArc("a", ":ARG1", "b");
        TextReconstructor reconstructor = new TextReconstructor(amr, Arrays.asList(
                AMRAlignment.of("a", 0),
                AMRAlignment.of("b", 1)));

        assertEquals("affect breathing", reconstructor.describe(amr.nodeWithRef("a"), true));
        assertEquals("affect breathing", reconstructor.describe(amr.nodeWithRef("a")));
    }

    @Test
    public void testPropBankCycleTerminates() {
        AMR amr = new AMR(new String[]{"cause", "spread"});
        amr.addNode("c", "cause-01");
        amr.addNode("s", "spread-02");
        amr.addArc("c", ":ARG1", "s");
        amr.addArc("s", ":ARG1", "c");
        TextReconstructor reconstructor = new TextReconstructor(amr, Arrays.asList(
                AMRAlignment.of("c", 0),
                AMRAlignment.of("s", 1)));

        assertEquals("cause spread", reconstructor.describe(amr.nodeWithRef("c")));
    }

    @Test
    public void testFullName() {
        AMR amr = new AMR(new String[]{"Anthony", "Fauci"});
        amr.addNode("p", "person");
        amr.addNode("n", "name");
        amr.addArc("p", ":name", "n");
        TextReconstructor reconstructor = new TextReconstructor(amr, Arrays.asList(AMRAlignment.of("n", 0, 1)));

        assertEquals("Anthony Fauci", reconstructor.fullName(amr.nodeWithRef("p")));
        assertNull(reconstructor.fullName(amr.nodeWithRef("n")));
        assertEquals("Anthony Fauci", reconstructor.nameOrDescription(amr.nodeWithRef("p")));
    }

    @Property
    public void nodeWithoutModifiersDescribesAsItsOwnText(@From(AMRGen.class) AMR amr) {
        TextReconstructor reconstructor = new TextReconstructor(amr, AMRGen.identityAlignments(amr));
        for (AMR.Node node : amr.getNodes()) {
            if (amr.getChildrenByRole(node).isEmpty()) {
                assertEquals(reconstructor.text(node), reconstructor.describe(node));
            }
        }
    }

    @Property
    public void describeTerminatesOnAnyGraph(@From(AMRGen.class) AMR amr) {
        TextReconstructor reconstructor = new TextReconstructor(amr, AMRGen.identityAlignments(amr));
        for (AMR.Node node : amr.getNodes()) {
            assertNotNull(reconstructor.describe(node));
            assertNotNull(reconstructor.describe(node, true));
        }
    }
}
