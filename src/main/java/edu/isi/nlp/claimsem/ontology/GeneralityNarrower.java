package edu.isi.nlp.claimsem.ontology;

import edu.isi.nlp.claimsem.amr.AMRConstants;

import java.util.*;

/**
 * Picks the most general of several ontology events for one PropBank label by walking up the
 * is-a hierarchy, staying inside the candidate set.
 */
public class GeneralityNarrower {
    private final QNodeHierarchy hierarchy;

    public GeneralityNarrower(QNodeHierarchy hierarchy) {
        this.hierarchy = hierarchy;
    }

    /**
     * @return the candidate named exactly like the label's stem, else the single candidate the
     * parent links converge on, else null
     */
    public QNode mostGeneral(String pbLabel, List<QNode> candidates) {
        Map<String, QNode> byId = new LinkedHashMap<>();
        for (QNode candidate : candidates) {
            byId.putIfAbsent(candidate.qnode, candidate);
        }
        String stem = AMRConstants.frameStem(pbLabel);
        String found = narrowDown(new LinkedHashSet<>(byId.keySet()), byId, stem, new HashSet<>());
        return found == null ? null : byId.get(found);
    }

    private String narrowDown(Set<String> current, Map<String, QNode> byId, String stem, Set<Set<String>> seen) {
        seen.add(current);
        Set<String> keep = new LinkedHashSet<>();
        for (String qnode : current) {
            if (stem.equals(byId.get(qnode).name)) {
                return qnode;
            }
            for (String parent : hierarchy.parentsOf(qnode)) {
                if (byId.containsKey(parent)) keep.add(parent);
            }
        }
        if (keep.isEmpty()) return null;
        if (keep.size() == 1) return keep.iterator().next();
        // Parent links that lead back to a set we already tried never converge
        if (seen.contains(keep)) return null;
        return narrowDown(keep, byId, stem, seen);
    }
}
