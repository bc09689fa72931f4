package edu.isi.nlp.claimsem.claim;

import edu.isi.nlp.claimsem.annotation.WhitespaceAnnotator;
import edu.stanford.nlp.util.Pair;
import org.junit.Test;

import java.util.List;
import java.util.Map;

import static org.junit.Assert.*;

public class ClaimTest {

    private static final String SENTENCE = "the virus came from the lab in the city";

    private static Claim claim() {
        Claim claim = new Claim("c1", "doc1", SENTENCE, SENTENCE, new Pair<>(0, SENTENCE.length()), null);
        claim.addTheory(Claim.TOKEN_OFFSET_THEORY, TokenOffsets.fromSentence(SENTENCE));
        return claim;
    }

    @Test
    public void testTokenOffsets() {
        Map<String, List<Pair<Integer, Integer>>> offsets = TokenOffsets.fromSentence(SENTENCE);
        assertEquals(3, offsets.get("the").size());
        assertEquals(new Pair<>(0, 3), offsets.get("the").get(0));
        assertEquals(new Pair<>(4, 9), offsets.get("virus").get(0));
    }

    @Test
    public void testSingleToken() {
        assertEquals(new Pair<>(4, 9), claim().getOffsetsForText("virus", new WhitespaceAnnotator()));
    }

    @Test
    public void testSpanUsesTheLatestStartBeforeTheEnd() {
        // "the" occurs three times; the last one that still starts before "lab" ends is picked
        assertEquals(new Pair<>(20, 27), claim().getOffsetsForText("the lab", new WhitespaceAnnotator()));
        assertEquals(new Pair<>(31, 39), claim().getOffsetsForText("the city", new WhitespaceAnnotator()));
    }

    @Test
    public void testUnplaceableText() {
        Claim claim = claim();
        assertNull(claim.getOffsetsForText("bats", new WhitespaceAnnotator()));
        assertNull(claim.getOffsetsForText("the bats", new WhitespaceAnnotator()));
        assertNull(claim.getOffsetsForText("  ", new WhitespaceAnnotator()));
        assertNull(claim.getOffsetsForText(null, new WhitespaceAnnotator()));
    }

    @Test
    public void testNoOffsetTable() {
        Claim claim = new Claim("c1", "doc1", SENTENCE, SENTENCE, null, null);
        assertNull(claim.getOffsetsForText("virus", new WhitespaceAnnotator()));
    }

    @Test
    public void testMentionIds() {
        Claimer claimer = new Claimer("doc1", "the minister", null);
        assertEquals(8, claimer.mentionId.length());
        assertNotEquals(claimer.mentionId, new Claimer("doc1", "the minister", null).mentionId);
    }
}
