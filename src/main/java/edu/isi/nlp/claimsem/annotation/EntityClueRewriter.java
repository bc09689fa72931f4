package edu.isi.nlp.claimsem.annotation;

import edu.stanford.nlp.ling.CoreLabel;

import java.util.*;
import java.util.stream.Collectors;

/**
 * Collapses Stanford NER output into the coarse entity clues the x-variable rules look for.
 * Contiguous tokens sharing a tag form one entity.
 */
public class EntityClueRewriter {

    private static final Set<String> NORP_TAGS = Collections.unmodifiableSet(new HashSet<String>() {{
        add("NATIONALITY");
        add("RELIGION");
        add("IDEOLOGY");
    }});

    private EntityClueRewriter() {
    }

    static String rewrite(String chunk, String ner) {
        if (NORP_TAGS.contains(ner)) {
            return EntityClue.NORP;
        }
        switch (ner) {
            case "PERSON":
                return EntityClue.PERSON;
            case "ORGANIZATION":
                return EntityClue.ORG;
            case "COUNTRY":
                // Stanford tags "Chinese" as NATIONALITY but an adjectival country name still
                // reads as a nationality
                return chunk.endsWith("ese") || chunk.endsWith("ian") ? EntityClue.NORP : ner;
            default:
                return ner;
        }
    }

    /**
     * Entity text to clue type, in sentence order.
     */
    public static Map<String, String> clues(List<CoreLabel> sentence) {
        Map<String, String> clues = new LinkedHashMap<>();
        int entityStart = -1;
        for (int i = 0; i <= sentence.size(); ++i) {
            String ner = i < sentence.size() ? nerOf(sentence.get(i)) : "O";
            if (entityStart >= 0) {
                String entityNER = nerOf(sentence.get(entityStart));
                if (!ner.equals(entityNER)) {
                    String gloss = String.join(" ", sentence.subList(entityStart, i).stream()
                            .map(CoreLabel::word).collect(Collectors.toList()));
                    clues.put(gloss, rewrite(gloss, entityNER));
                    entityStart = ner.equals("O") ? -1 : i;
                }
            } else if (!ner.equals("O")) {
                entityStart = i;
            }
        }
        return clues;
    }

    private static String nerOf(CoreLabel token) {
        String ner = token.ner();
        return ner == null ? "O" : ner;
    }
}
