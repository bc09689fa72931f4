package edu.isi.nlp.claimsem.linking;

/**
 * Candidate generation against a Wikidata-like knowledge base. Implementations live outside this
 * project; they may throw unchecked exceptions when the backing service fails.
 */
public interface EntitySearchService {

    /**
     * @param sentence the full sentence, for context
     * @param query    the span to link
     * @param k        how many candidates to ask for
     */
    EntitySearchResult search(String sentence, String query, int k);
}
