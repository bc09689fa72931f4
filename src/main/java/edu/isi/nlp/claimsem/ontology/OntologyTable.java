package edu.isi.nlp.claimsem.ontology;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.File;
import java.io.IOException;
import java.util.*;

/**
 * PropBank label (treat-03) to the ontology events it may denote, in source order.
 */
public class OntologyTable {
    private static final TypeReference<LinkedHashMap<String, List<QNode>>> TABLE_TYPE =
            new TypeReference<LinkedHashMap<String, List<QNode>>>() {};

    public final String name;
    private final Map<String, List<QNode>> entries;

    public OntologyTable(String name, Map<String, List<QNode>> entries) {
        this.name = name;
        this.entries = entries;
    }

    public static OntologyTable read(String name, File file, ObjectMapper mapper) throws IOException {
        Map<String, List<QNode>> entries = mapper.readValue(file, TABLE_TYPE);
        return new OntologyTable(name, entries);
    }

    /**
     * @return the candidates for the label, empty if the table has none
     */
    public List<QNode> candidates(String pbLabel) {
        List<QNode> found = entries.get(pbLabel);
        return found == null ? Collections.emptyList() : found;
    }

    public int size() {
        return entries.size();
    }

    @Override
    public String toString() {
        return "OntologyTable{" + name + ", " + entries.size() + " labels}";
    }
}
