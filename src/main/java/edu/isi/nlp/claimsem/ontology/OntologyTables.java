package edu.isi.nlp.claimsem.ontology;

import com.fasterxml.jackson.databind.ObjectMapper;
import edu.stanford.nlp.util.logging.Redwood;

import java.io.File;
import java.io.IOException;
import java.util.List;
import java.util.Map;

import static edu.stanford.nlp.util.logging.Redwood.Util.endTrack;
import static edu.stanford.nlp.util.logging.Redwood.Util.forceTrack;

/**
 * The overlay and master tables plus the master is-a hierarchy, loaded once and shared read-only.
 *
 * A derived table missing from disk is regenerated from its raw source and written back, so the
 * first run of a fresh checkout pays for the derivation.
 */
public class OntologyTables {
    private static final Redwood.RedwoodChannels log = Redwood.channels(OntologyTables.class);

    public static final String OVERLAY = "overlay";
    public static final String MASTER = "master";

    public final OntologyTable overlay;
    public final OntologyTable master;
    public final QNodeHierarchy hierarchy;

    public OntologyTables(OntologyTable overlay, OntologyTable master, QNodeHierarchy hierarchy) {
        this.overlay = overlay;
        this.master = master;
        this.hierarchy = hierarchy;
    }

    /**
     * @throws java.io.FileNotFoundException if a derived table is missing and so is its raw source
     */
    public static OntologyTables load(File masterTable, File masterSource,
                                      File overlayTable, File overlaySource) throws IOException {
        ObjectMapper mapper = new ObjectMapper();
        OntologyTableGenerator generator = new OntologyTableGenerator(mapper);

        if (!masterTable.exists()) {
            forceTrack("Generating " + masterTable.getName());
            log.info("Could not find " + masterTable + "; generating it from " + masterSource);
            Map<String, List<QNode>> table = generator.masterTable(masterSource);
            generator.write(table, masterTable);
            endTrack("Generating " + masterTable.getName());
        }
        if (!overlayTable.exists()) {
            forceTrack("Generating " + overlayTable.getName());
            log.info("Could not find " + overlayTable + "; generating it from " + overlaySource);
            Map<String, List<QNode>> table = generator.overlayTable(overlaySource);
            generator.write(table, overlayTable);
            endTrack("Generating " + overlayTable.getName());
        }

        OntologyTable master = OntologyTable.read(MASTER, masterTable, mapper);
        OntologyTable overlay = OntologyTable.read(OVERLAY, overlayTable, mapper);

        QNodeHierarchy hierarchy;
        if (masterSource.exists()) {
            hierarchy = generator.hierarchy(masterSource);
        } else {
            log.warn("No raw master source at " + masterSource + "; generality tie-break disabled");
            hierarchy = QNodeHierarchy.EMPTY;
        }
        log.info("Loaded " + overlay + ", " + master + ", " + hierarchy.size() + " events with parents");
        return new OntologyTables(overlay, master, hierarchy);
    }
}
