package edu.isi.nlp.claimsem.claim;

import edu.stanford.nlp.ling.CoreLabel;
import edu.stanford.nlp.process.CoreLabelTokenFactory;
import edu.stanford.nlp.process.PTBTokenizer;
import edu.stanford.nlp.util.Pair;

import java.io.StringReader;
import java.util.*;

/**
 * Token text to every character span it occupies in a sentence.
 */
public class TokenOffsets {

    private TokenOffsets() {
    }

    public static Map<String, List<Pair<Integer, Integer>>> fromSentence(String sentence) {
        PTBTokenizer<CoreLabel> tokenizer = new PTBTokenizer<>(new StringReader(sentence),
                new CoreLabelTokenFactory(), "invertible=true,ptb3Escaping=false");
        Map<String, List<Pair<Integer, Integer>>> offsets = new LinkedHashMap<>();
        while (tokenizer.hasNext()) {
            CoreLabel token = tokenizer.next();
            offsets.computeIfAbsent(token.originalText(), k -> new ArrayList<>())
                    .add(new Pair<>(token.beginPosition(), token.endPosition()));
        }
        return offsets;
    }
}
