package edu.isi.nlp.claimsem.ontology;

import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * The is-a parents of each ontology event, by qnode id.
 */
public class QNodeHierarchy {
    public static final QNodeHierarchy EMPTY = new QNodeHierarchy(Collections.emptyMap());

    private final Map<String, List<String>> parents;

    public QNodeHierarchy(Map<String, List<String>> parents) {
        this.parents = parents;
    }

    public List<String> parentsOf(String qnode) {
        List<String> found = parents.get(qnode);
        return found == null ? Collections.emptyList() : found;
    }

    public int size() {
        return parents.size();
    }
}
