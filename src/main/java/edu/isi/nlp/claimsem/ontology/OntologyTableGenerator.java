package edu.isi.nlp.claimsem.ontology;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import edu.stanford.nlp.util.logging.Redwood;

import java.io.File;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.util.*;

/**
 * Builds the PropBank-keyed lookup tables from the raw ontology documents.
 *
 * The master source is a JSON array of events:
 * <pre>
 *   {"id": "Q12", "name": "cure_Q12", "def": "...", "pb": "cure.01",
 *    "roles": {"A0-agent": [["...", "doctor_Q39631"]]}, "parents": ["treatment_Q179661"]}
 * </pre>
 * The overlay source groups events under {@code "events"}, each listing its PropBank rolesets in
 * {@code ldc_types[].pb_rolesets} and its arguments as {@code "A1_ppt_patient"}-style names.
 */
public class OntologyTableGenerator {
    private static final Redwood.RedwoodChannels log = Redwood.channels(OntologyTableGenerator.class);

    /** Argument name prefixes that are followed by the real role code. */
    private static final Set<String> MODIFIER_PREFIXES = new HashSet<String>() {{
        add("AM");
        add("Ax");
        add("mnr");
    }};

    private final ObjectMapper mapper;

    public OntologyTableGenerator(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public Map<String, List<QNode>> masterTable(File masterSource) throws IOException {
        Map<String, List<QNode>> table = new LinkedHashMap<>();
        for (JsonNode event : readSource(masterSource)) {
            Map<String, QNodeArg> args = new LinkedHashMap<>();
            Iterator<Map.Entry<String, JsonNode>> roles = event.path("roles").fields();
            while (roles.hasNext()) {
                Map.Entry<String, JsonNode> role = roles.next();
                List<JsonNode> constraints = new ArrayList<>();
                for (JsonNode constraint : role.getValue()) {
                    if (constraint.size() == 0) continue;
                    // The last element carries the constrained type as name_Qid
                    String typeString = constraint.get(constraint.size() - 1).asText();
                    if (typeString.equals("None")) continue;
                    int split = typeString.lastIndexOf('_');
                    ObjectNode formatted = mapper.createObjectNode();
                    formatted.put("name", split < 0 ? "" : typeString.substring(0, split).replace("+", ""));
                    formatted.put("wd_node", typeString.substring(split + 1));
                    constraints.add(formatted);
                }
                String[] roleParts = role.getKey().split("-");
                args.put(roleParts[0], new QNodeArg(constraints, joinFrom(roleParts, 1)));
            }

            QNode qnode = new QNode(
                    event.path("id").asText(null),
                    nameBeforeId(event.path("name").asText("")),
                    event.path("def").asText(null),
                    args);
            String pb = event.path("pb").asText().replace(".", "-");
            table.computeIfAbsent(pb, k -> new ArrayList<>()).add(qnode);
        }
        log.info("Derived " + table.size() + " PropBank labels from " + masterSource);
        return table;
    }

    public Map<String, List<QNode>> overlayTable(File overlaySource) throws IOException {
        Map<String, List<QNode>> table = new LinkedHashMap<>();
        JsonNode events = readSource(overlaySource).path("events");
        Iterator<JsonNode> groups = events.elements();
        while (groups.hasNext()) {
            for (JsonNode event : groups.next()) {
                Map<String, QNodeArg> args = new LinkedHashMap<>();
                for (JsonNode arg : event.path("arguments")) {
                    String[] parts = arg.path("name").asText("").split("_");
                    String code = MODIFIER_PREFIXES.contains(parts[0]) && parts.length > 1 ? parts[1] : parts[0];
                    if (code.isEmpty()) continue;
                    List<JsonNode> constraints = new ArrayList<>();
                    arg.path("constraints").forEach(constraints::add);
                    args.put(code, new QNodeArg(constraints, joinFrom(parts, 2)));
                }

                QNode qnode = new QNode(
                        event.path("wd_node").asText(null),
                        event.path("name").asText(null),
                        event.path("wd_description").asText(null),
                        args);
                for (JsonNode ldcType : event.path("ldc_types")) {
                    for (JsonNode roleset : ldcType.path("pb_rolesets")) {
                        String pb = roleset.asText().replace(".", "-").replace("_", "-");
                        table.computeIfAbsent(pb, k -> new ArrayList<>()).add(qnode);
                    }
                }
            }
        }
        log.info("Derived " + table.size() + " PropBank labels from " + overlaySource);
        return table;
    }

    /**
     * Parent ids of each event in the master source. Parents are written name_Qid.
     */
    public QNodeHierarchy hierarchy(File masterSource) throws IOException {
        Map<String, List<String>> parents = new HashMap<>();
        for (JsonNode event : readSource(masterSource)) {
            List<String> ids = new ArrayList<>();
            for (JsonNode parent : event.path("parents")) {
                String text = parent.asText();
                ids.add(text.substring(text.lastIndexOf('_') + 1));
            }
            parents.put(event.path("id").asText(), ids);
        }
        return new QNodeHierarchy(parents);
    }

    public void write(Map<String, List<QNode>> table, File out) throws IOException {
        File dir = out.getAbsoluteFile().getParentFile();
        if (dir != null && !dir.exists() && !dir.mkdirs()) {
            throw new IOException("Could not create directory " + dir);
        }
        mapper.writerWithDefaultPrettyPrinter().writeValue(out, table);
    }

    private JsonNode readSource(File source) throws IOException {
        if (!source.exists()) {
            throw new FileNotFoundException("Raw ontology source not found: " + source);
        }
        return mapper.readTree(source);
    }

    static String nameBeforeId(String name) {
        int i = name.indexOf("_Q");
        return i < 0 ? name : name.substring(0, i);
    }

    private static String joinFrom(String[] parts, int start) {
        if (start >= parts.length) return "";
        return String.join("-", Arrays.copyOfRange(parts, start, parts.length));
    }
}
