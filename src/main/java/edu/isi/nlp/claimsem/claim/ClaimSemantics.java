package edu.isi.nlp.claimsem.claim;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * An event plus whichever of its ontology roles we managed to fill.
 */
public class ClaimSemantics {
    public final ClaimEvent event;
    /** Ontology role name ("agent", "patient", ...) to argument. Roles we could not fill are absent. */
    public final Map<String, ClaimArg> args;

    public ClaimSemantics(ClaimEvent event, Map<String, ClaimArg> args) {
        this.event = event;
        this.args = Collections.unmodifiableMap(new LinkedHashMap<>(args));
    }

    @Override
    public String toString() {
        return "ClaimSemantics{event=" + event + ", args=" + args + '}';
    }
}
