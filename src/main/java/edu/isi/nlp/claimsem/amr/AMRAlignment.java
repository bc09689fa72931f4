package edu.isi.nlp.claimsem.amr;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * One alignment from the graph producer: a group of node refs tied to a group of token indices.
 * Either side may be empty.
 */
public class AMRAlignment {
    public final List<String> nodeRefs;
    public final List<Integer> tokens;

    public AMRAlignment(List<String> nodeRefs, List<Integer> tokens) {
        this.nodeRefs = Collections.unmodifiableList(new ArrayList<>(nodeRefs));
        this.tokens = Collections.unmodifiableList(new ArrayList<>(tokens));
    }

    public static AMRAlignment of(String nodeRef, Integer... tokens) {
        return new AMRAlignment(Collections.singletonList(nodeRef), Arrays.asList(tokens));
    }

    @Override
    public String toString() {
        return nodeRefs + "->" + tokens;
    }
}
