package edu.isi.nlp.claimsem.ontology;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * An event entry of the ontology, as stored in the PropBank-keyed tables.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class QNode {
    @JsonProperty("qnode")
    public String qnode;

    @JsonProperty("name")
    public String name;

    @JsonProperty("definition")
    public String definition;

    /** Short role code ("A0", "A1", "loc", "time") to argument. */
    @JsonProperty("args")
    public Map<String, QNodeArg> args = new LinkedHashMap<>();

    public QNode() {
    }

    public QNode(String qnode, String name, String definition, Map<String, QNodeArg> args) {
        this.qnode = qnode;
        this.name = name;
        this.definition = definition;
        this.args = args;
    }

    public boolean hasArgs() {
        return args != null && !args.isEmpty();
    }

    @Override
    public String toString() {
        return qnode + " (" + name + ")";
    }
}
