package edu.isi.nlp.claimsem.pipeline;

import edu.isi.nlp.claimsem.annotation.CoreNLPAnnotator;
import edu.stanford.nlp.io.IOUtils;
import edu.stanford.nlp.util.ArgumentParser;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;

/**
 * Settings for {@link ClaimSemanticsPipeline}. Defaults come from {@code claimsem.properties} on the
 * classpath; anything passed in explicitly wins.
 */
public class ClaimSemanticsOptions {

    public static final String DEFAULTS_RESOURCE = "claimsem.properties";

    public enum Domain {
        /** Fixed COVID-19 claim templates. */
        COVID,
        /** Free claims, with entity types as clues. */
        GENERAL
    }

    @ArgumentParser.Option(name = "ontology.dir", gloss = "Directory holding the ontology tables and their raw sources")
    public String ontologyDir = "ontology";

    @ArgumentParser.Option(name = "ontology.master", gloss = "Derived master table, relative to ontology.dir")
    public String masterTable = "pb_to_qnode_master.json";

    @ArgumentParser.Option(name = "ontology.overlay", gloss = "Derived overlay table, relative to ontology.dir")
    public String overlayTable = "pb_to_qnode_overlay.json";

    @ArgumentParser.Option(name = "ontology.master.source", gloss = "Raw master ontology, relative to ontology.dir")
    public String masterSource = "qe_master.json";

    @ArgumentParser.Option(name = "ontology.overlay.source", gloss = "Raw overlay ontology, relative to ontology.dir")
    public String overlaySource = "xpo_dwd_overlay_v2.json";

    @ArgumentParser.Option(name = "domain", gloss = "covid for templated claims, general otherwise")
    public String domain = "covid";

    @ArgumentParser.Option(name = "corenlp.annotators", gloss = "Annotators for the linguistic annotation pipeline")
    public String annotators = CoreNLPAnnotator.DEFAULT_ANNOTATORS;

    @ArgumentParser.Option(name = "search.k", gloss = "Candidates requested from entity search per argument")
    public int searchK = 1;

    public ClaimSemanticsOptions() {
    }

    public ClaimSemanticsOptions(Properties props) throws IOException {
        Properties merged = defaults();
        merged.putAll(props);
        ArgumentParser.fillOptions(this, merged);
    }

    public static Properties defaults() throws IOException {
        Properties props = new Properties();
        try (InputStream in = IOUtils.getInputStreamFromURLOrClasspathOrFileSystem(DEFAULTS_RESOURCE)) {
            props.load(in);
        }
        return props;
    }

    public Domain getDomain() {
        try {
            return Domain.valueOf(domain.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown domain '" + domain + "'; expected covid or general", e);
        }
    }

    public File file(String name) {
        return new File(ontologyDir, name);
    }
}
