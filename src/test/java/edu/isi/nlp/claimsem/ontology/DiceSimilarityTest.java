package edu.isi.nlp.claimsem.ontology;

import com.pholser.junit.quickcheck.Property;
import com.pholser.junit.quickcheck.runner.JUnitQuickcheck;
import org.junit.Test;
import org.junit.runner.RunWith;

import java.util.Arrays;
import java.util.HashSet;

import static edu.isi.nlp.claimsem.ontology.OntologyFixtures.qnode;
import static org.junit.Assert.*;

@RunWith(JUnitQuickcheck.class)
public class DiceSimilarityTest {

    @Test
    public void testBigrams() {
        assertEquals(new HashSet<>(Arrays.asList("cu", "ur", "re")), DiceSimilarity.bigrams("cure"));
        assertTrue(DiceSimilarity.bigrams("c").isEmpty());
    }

    @Test
    public void testScore() {
        assertEquals(1.0, DiceSimilarity.score("cure", "cure"), 1e-9);
        assertEquals(0.0, DiceSimilarity.score("cure", "xyz"), 1e-9);
        // {cu, ur, re} and {cu, ur, ri, in, ng}
        assertEquals(0.5, DiceSimilarity.score("cure", "curing"), 1e-9);
        assertEquals(0.0, DiceSimilarity.score("", ""), 1e-9);
    }

    @Test
    public void testBestUsesTheStemOfTheLabel() {
        QNode best = DiceSimilarity.best("cure-01", Arrays.asList(
                qnode("Q1", "heal"),
                qnode("Q2", "curing"),
                qnode("Q3", "cure")));
        assertEquals("Q3", best.qnode);
    }

    @Test
    public void testTiesGoToTheFirstCandidate() {
        QNode best = DiceSimilarity.best("cure-01", Arrays.asList(
                qnode("Q1", "cu"),
                qnode("Q2", "re")));
        assertEquals("Q1", best.qnode);
    }

    @Test
    public void testZeroScoreStillPicksOne() {
        QNode best = DiceSimilarity.best("cure-01", Arrays.asList(
                qnode("Q1", "xyz"),
                qnode("Q2", "abc")));
        assertEquals("Q1", best.qnode);
        assertNull(DiceSimilarity.best("cure-01", Arrays.asList()));
    }

    @Property
    public void scoreIsSymmetric(String a, String b) {
        assertEquals(DiceSimilarity.score(a, b), DiceSimilarity.score(b, a), 1e-12);
    }

    @Property
    public void scoreIsBounded(String a, String b) {
        double score = DiceSimilarity.score(a, b);
        assertTrue(score >= 0.0 && score <= 1.0);
    }
}
