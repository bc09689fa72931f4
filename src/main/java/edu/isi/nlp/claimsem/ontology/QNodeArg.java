package edu.isi.nlp.claimsem.ontology;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.List;

/**
 * A declared argument of an ontology event: the role name it is reported under, and the type
 * constraints on its filler. Constraint shapes differ between the overlay and master sources, so
 * they are kept as raw JSON.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class QNodeArg {
    @JsonProperty("constraints")
    public List<JsonNode> constraints = new ArrayList<>();

    @JsonProperty("text_role")
    public String textRole;

    public QNodeArg() {
    }

    public QNodeArg(List<JsonNode> constraints, String textRole) {
        this.constraints = constraints;
        this.textRole = textRole;
    }

    @Override
    public String toString() {
        return textRole;
    }
}
