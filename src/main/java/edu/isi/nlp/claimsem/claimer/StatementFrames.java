package edu.isi.nlp.claimsem.claimer;

import edu.isi.nlp.claimsem.amr.AMRConstants;
import edu.stanford.nlp.io.IOUtils;

import java.io.BufferedReader;
import java.io.IOException;
import java.util.*;

/**
 * The verbs that evoke a saying or reasoning event, taken from the FrameNet lexical units of the
 * Statement and Reasoning frames. Multi-word units are hyphenated to line up with AMR concepts
 * ("point out" becomes point-out).
 */
public class StatementFrames {

    public static final String DEFAULT_PATH = "edu/isi/nlp/claimsem/claimer/framenet-lexical-units.tsv";
    public static final List<String> DEFAULT_FRAMES = Collections.unmodifiableList(Arrays.asList("Statement", "Reasoning"));

    private final Set<String> verbs;

    public StatementFrames(Set<String> verbs) {
        this.verbs = Collections.unmodifiableSet(new HashSet<>(verbs));
    }

    public static StatementFrames load() throws IOException {
        return load(DEFAULT_PATH, DEFAULT_FRAMES);
    }

    /**
     * Reads "frame TAB lemma.pos" lines from the classpath or file system, keeping the verbs of the
     * requested frames.
     */
    public static StatementFrames load(String path, Collection<String> frames) throws IOException {
        Set<String> verbs = new HashSet<>();
        try (BufferedReader reader = IOUtils.readerFromString(path)) {
            String line;
            while ((line = reader.readLine()) != null) {
                line = line.trim();
                if (line.isEmpty() || line.startsWith("#")) continue;
                String[] fields = line.split("\t");
                if (fields.length != 2) {
                    throw new IOException("Malformed lexical unit line in " + path + ": " + line);
                }
                if (!frames.contains(fields[0])) continue;
                int dot = fields[1].lastIndexOf('.');
                if (dot < 0) continue;
                String word = fields[1].substring(0, dot);
                String pos = fields[1].substring(dot + 1);
                if (pos.equals("v")) {
                    verbs.add(word.replace(' ', '-'));
                }
            }
        }
        return new StatementFrames(verbs);
    }

    /**
     * Whether an AMR concept (say-01, point-out-02) names a statement or reasoning event.
     */
    public boolean isStatementNode(String title) {
        return verbs.contains(AMRConstants.stripSense(title));
    }

    public Set<String> getVerbs() {
        return verbs;
    }
}
