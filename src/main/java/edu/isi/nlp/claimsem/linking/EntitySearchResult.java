package edu.isi.nlp.claimsem.linking;

import java.util.Collections;
import java.util.List;

/**
 * Ranked candidates for a query. {@code options} holds the candidates the search service is
 * confident about, {@code allOptions} everything it retrieved.
 */
public class EntitySearchResult {
    public static final EntitySearchResult EMPTY = new EntitySearchResult(Collections.emptyList(), Collections.emptyList());

    public final List<EntityCandidate> options;
    public final List<EntityCandidate> allOptions;

    public EntitySearchResult(List<EntityCandidate> options, List<EntityCandidate> allOptions) {
        this.options = Collections.unmodifiableList(options);
        this.allOptions = Collections.unmodifiableList(allOptions);
    }

    /**
     * The top confident candidate, else the top retrieved one, else null.
     */
    public EntityCandidate best() {
        if (!options.isEmpty()) return options.get(0);
        if (!allOptions.isEmpty()) return allOptions.get(0);
        return null;
    }
}
