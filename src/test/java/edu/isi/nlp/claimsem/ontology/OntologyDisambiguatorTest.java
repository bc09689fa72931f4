package edu.isi.nlp.claimsem.ontology;

import com.fasterxml.jackson.databind.ObjectMapper;
import edu.isi.nlp.claimsem.amr.AMR;
import edu.isi.nlp.claimsem.amr.AMRAlignment;
import edu.isi.nlp.claimsem.annotation.WhitespaceAnnotator;
import edu.isi.nlp.claimsem.claim.Claim;
import edu.isi.nlp.claimsem.claim.ClaimArg;
import edu.isi.nlp.claimsem.claim.ClaimSemantics;
import edu.isi.nlp.claimsem.claim.TokenOffsets;
import edu.isi.nlp.claimsem.linking.EntityCandidate;
import edu.isi.nlp.claimsem.linking.EntitySearchResult;
import edu.isi.nlp.claimsem.linking.EntitySearchService;
import edu.stanford.nlp.util.Pair;
import org.junit.Test;

import java.io.File;
import java.io.IOException;
import java.util.*;

import static edu.isi.nlp.claimsem.ontology.OntologyFixtures.qnode;
import static edu.isi.nlp.claimsem.ontology.OntologyFixtures.table;
import static org.junit.Assert.*;

public class OntologyDisambiguatorTest {

    private static final String SENTENCE = "doctors say vaccines cure patients";

    private static final EntitySearchService NO_CANDIDATES = (sentence, query, k) -> EntitySearchResult.EMPTY;

    private static Claim claim() {
        Claim claim = new Claim("c1", "doc1", "vaccines cure patients", SENTENCE, new Pair<>(12, 34), null);
        claim.addTheory(Claim.TOKEN_OFFSET_THEORY, TokenOffsets.fromSentence(SENTENCE));
        return claim;
    }

    /** (s / say-01 :ARG0 (d / doctor) :ARG1 (c / cure-01 :ARG0 (v / vaccine) :ARG1 (p / patient))) */
    private static AMR graph() {
        AMR amr = new AMR(SENTENCE.split(" "));
        amr.addNode("s", "say-01");
        amr.addNode("d", "doctor");
        amr.addNode("c", "cure-01");
        amr.addNode("v", "vaccine");
        amr.addNode("p", "patient");
        amr.addArc("s", ":ARG0", "d");
        amr.addArc("s", ":ARG1", "c");
        amr.addArc("c", ":ARG0", "v");
        amr.addArc("c", ":ARG1", "p");
        return amr;
    }

    private static List<AMRAlignment> alignments() {
        return Arrays.asList(
                AMRAlignment.of("d", 0),
                AMRAlignment.of("s", 1),
                AMRAlignment.of("v", 2),
                AMRAlignment.of("c", 3),
                AMRAlignment.of("p", 4));
    }

    private static OntologyDisambiguator disambiguator(OntologyTable overlay, OntologyTable master, EntitySearchService search) {
        return new OntologyDisambiguator(new OntologyTables(overlay, master, QNodeHierarchy.EMPTY),
                search, new WhitespaceAnnotator(), 1);
    }

    private static String eventId(Optional<ClaimSemantics> semantics) {
        return semantics.map(s -> s.event.qnodeId).orElse(null);
    }

    @Test
    public void testNoPropBankNode() {
        AMR amr = new AMR(new String[]{"masks"});
        amr.addNode("m", "mask");
        OntologyDisambiguator disambiguator = disambiguator(
                table("overlay", "say-01", qnode("Q30", "say")),
                table("master", "say-01", qnode("Q31", "say")),
                NO_CANDIDATES);

        assertFalse(disambiguator.disambiguate(amr, Collections.singletonList(AMRAlignment.of("m", 0)), claim()).isPresent());
    }

    @Test
    public void testFrameLabelsKeepGraphOrder() {
        AMR amr = graph();
        amr.addNode("h", "have-name-91");
        assertEquals(Arrays.asList("say-01", "cure-01", "have-name-91"), OntologyDisambiguator.frameLabels(amr));
    }

    @Test
    public void testOverlayRootMatchWins() {
        OntologyDisambiguator disambiguator = disambiguator(
                table("overlay", "say-01", qnode("Q30", "say")),
                table("master", "say-01", qnode("Q31", "say")),
                NO_CANDIDATES);

        Optional<ClaimSemantics> semantics = disambiguator.disambiguate(graph(), alignments(), claim());
        assertEquals("Q30", eventId(semantics));
        assertEquals("say-01", semantics.get().event.fromQuery);
        assertEquals("doc1", semantics.get().event.docId);
    }

    @Test
    public void testMasterRootMatchOverridesNonRootOverlay() {
        OntologyDisambiguator disambiguator = disambiguator(
                table("overlay", "cure-01", qnode("Q10", "cure")),
                table("master", "say-01", qnode("Q31", "say")),
                NO_CANDIDATES);

        assertEquals("Q31", eventId(disambiguator.disambiguate(graph(), alignments(), claim())));
    }

    @Test
    public void testNonRootOverlayBeatsNonRootMaster() {
        OntologyDisambiguator disambiguator = disambiguator(
                table("overlay", "cure-01", qnode("Q10", "cure")),
                table("master", "cure-01", qnode("Q11", "heal")),
                NO_CANDIDATES);

        assertEquals("Q10", eventId(disambiguator.disambiguate(graph(), alignments(), claim())));
    }

    @Test
    public void testMasterFillsInForEmptyOverlay() {
        OntologyDisambiguator disambiguator = disambiguator(
                table("overlay"),
                table("master", "cure-01", qnode("Q11", "heal")),
                NO_CANDIDATES);

        assertEquals("Q11", eventId(disambiguator.disambiguate(graph(), alignments(), claim())));
    }

    @Test
    public void testNoEntryAnywhere() {
        OntologyDisambiguator disambiguator = disambiguator(table("overlay"), table("master"), NO_CANDIDATES);
        assertFalse(disambiguator.disambiguate(graph(), alignments(), claim()).isPresent());
    }

    @Test
    public void testOverlayTieBreakBySimilarity() {
        OntologyDisambiguator disambiguator = disambiguator(
                table("overlay", "say-01", qnode("Q40", "speak"), qnode("Q30", "say")),
                table("master"),
                NO_CANDIDATES);

        assertEquals("Q30", eventId(disambiguator.disambiguate(graph(), alignments(), claim())));
    }

    @Test
    public void testMasterPrefersExactStemName() throws IOException {
        // treat-03 only has master entries, three of them
        AMR amr = new AMR(new String[]{"they", "treat", "patients"});
        amr.addNode("t", "treat-03");
        amr.addNode("y", "they");
        amr.addNode("p", "patient");
        amr.addArc("t", ":ARG0", "y");
        amr.addArc("t", ":ARG1", "p");
        OntologyTableGenerator generator = new OntologyTableGenerator(new ObjectMapper());
        File master = OntologyFixtures.masterSource();
        OntologyTables tables = new OntologyTables(
                new OntologyTable("overlay", generator.overlayTable(OntologyFixtures.overlaySource())),
                new OntologyTable("master", generator.masterTable(master)),
                generator.hierarchy(master));
        OntologyDisambiguator disambiguator = new OntologyDisambiguator(tables, NO_CANDIDATES, new WhitespaceAnnotator(), 1);

        Optional<ClaimSemantics> semantics = disambiguator.disambiguate(amr, Collections.emptyList(), claim());
        assertEquals("Q1", eventId(semantics));
        assertEquals("treat", semantics.get().event.text);
    }

    @Test
    public void testArgumentsAreLinked() {
        List<String> queries = new ArrayList<>();
        EntitySearchService search = (sentence, query, k) -> {
            queries.add(query);
            assertEquals(SENTENCE, sentence);
            if (query.equals("vaccines")) {
                EntityCandidate vaccine = new EntityCandidate("Q134808", "vaccine", "substance that induces immunity", query);
                return new EntitySearchResult(Collections.emptyList(), Collections.singletonList(vaccine));
            }
            return EntitySearchResult.EMPTY;
        };
        AMR amr = graph();
        amr.addNode("x", "vaccinate-01");
        amr.addArc("c", ":ARG2", "x");
        OntologyDisambiguator disambiguator = disambiguator(
                table("overlay", "say-01", qnode("Q30", "say"), "cure-01", qnode("Q10", "cure", "A0", "curer", "A1", "patient", "A2", "means")),
                table("master", "say-01", qnode("Q31", "say")),
                search);

        // say-01 is the root label and its overlay event declares no arguments
        Optional<ClaimSemantics> semantics = disambiguator.disambiguate(amr, alignments(), claim());
        assertEquals("Q30", eventId(semantics));
        assertTrue(semantics.get().args.isEmpty());

        disambiguator = disambiguator(
                table("overlay", "cure-01", qnode("Q10", "cure", "A0", "curer", "A1", "patient", "A2", "means")),
                table("master"),
                search);
        semantics = disambiguator.disambiguate(amr, alignments(), claim());
        assertEquals("Q10", eventId(semantics));
        Map<String, ClaimArg> args = semantics.get().args;
        assertEquals(Collections.singleton("curer"), args.keySet());
        ClaimArg curer = args.get("curer");
        assertEquals("vaccine", curer.text);
        assertEquals("Q134808", curer.qnodeId);
        assertEquals("vaccines", curer.fromQuery);
        assertEquals(new Pair<>(12, 20), curer.span);
        // The unaligned vaccinate-01 filler is searched as "vaccinate"
        assertEquals(Arrays.asList("vaccines", "patients", "vaccinate"), queries);
    }

    @Test
    public void testFailingSearchLeavesArgumentsOut() {
        EntitySearchService failing = (sentence, query, k) -> {
            throw new IllegalStateException("search service down");
        };
        OntologyDisambiguator disambiguator = disambiguator(
                table("overlay", "say-01", qnode("Q30", "say", "A0", "speaker")),
                table("master"),
                failing);

        Optional<ClaimSemantics> semantics = disambiguator.disambiguate(graph(), alignments(), claim());
        assertEquals("Q30", eventId(semantics));
        assertTrue(semantics.get().args.isEmpty());
    }
}
