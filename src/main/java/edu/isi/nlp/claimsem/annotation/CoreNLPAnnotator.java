package edu.isi.nlp.claimsem.annotation;

import edu.stanford.nlp.ling.CoreAnnotations;
import edu.stanford.nlp.ling.CoreLabel;
import edu.stanford.nlp.pipeline.Annotation;
import edu.stanford.nlp.pipeline.StanfordCoreNLP;
import edu.stanford.nlp.util.logging.Redwood;

import java.util.*;

/**
 * A {@link LinguisticAnnotator} backed by a Stanford CoreNLP pipeline. The pipeline is built on
 * first use, since loading the tagger and NER models is slow.
 */
public class CoreNLPAnnotator implements LinguisticAnnotator {
    private static final Redwood.RedwoodChannels log = Redwood.channels(CoreNLPAnnotator.class);

    public static final String DEFAULT_ANNOTATORS = "tokenize, ssplit, pos, lemma, ner";

    private static final Set<String> AUXILIARY_LEMMAS = Collections.unmodifiableSet(new HashSet<String>() {{
        add("be");
        add("have");
        add("do");
    }});

    private final Properties props;
    private StanfordCoreNLP coreNLP;

    public CoreNLPAnnotator() {
        this(DEFAULT_ANNOTATORS);
    }

    public CoreNLPAnnotator(String annotators) {
        this(pipelineProperties(annotators));
    }

    /**
     * @param props full CoreNLP pipeline properties; "annotators" must be set
     */
    public CoreNLPAnnotator(Properties props) {
        this.props = props;
    }

    static Properties pipelineProperties(String annotators) {
        Properties props = new Properties();
        props.put("annotators", annotators);
        props.put("tokenize.options", "invertible=true,ptb3Escaping=false");
        return props;
    }

    /**
     * Annotation errors propagate to the caller.
     */
    private synchronized Annotation run(String text) {
        if (coreNLP == null) {
            log.info("Loading CoreNLP pipeline: " + props.getProperty("annotators"));
            coreNLP = new StanfordCoreNLP(props);
        }
        Annotation annotation = new Annotation(text);
        coreNLP.annotate(annotation);
        return annotation;
    }

    @Override
    public List<AnnotatedToken> annotate(String text) {
        List<AnnotatedToken> tokens = new ArrayList<>();
        for (CoreLabel token : run(text).get(CoreAnnotations.TokensAnnotation.class)) {
            tokens.add(new AnnotatedToken(token.originalText(), token.lemma(),
                    universalPos(token.tag(), token.lemma()), token.ner(),
                    token.beginPosition(), token.endPosition()));
        }
        return tokens;
    }

    @Override
    public Map<String, String> entityClues(String text) {
        return EntityClueRewriter.clues(run(text).get(CoreAnnotations.TokensAnnotation.class));
    }

    /**
     * Maps a Penn Treebank tag onto the universal tag set.
     */
    public static String universalPos(String tag, String lemma) {
        if (tag == null) return "X";
        if (tag.startsWith("VB")) {
            return lemma != null && AUXILIARY_LEMMAS.contains(lemma.toLowerCase()) ? "AUX" : "VERB";
        }
        if (tag.startsWith("JJ")) return "ADJ";
        if (tag.startsWith("NNP")) return "PROPN";
        if (tag.startsWith("NN")) return "NOUN";
        if (tag.startsWith("RB") || tag.equals("WRB")) return "ADV";
        if (tag.startsWith("PRP") || tag.startsWith("WP")) return "PRON";
        switch (tag) {
            case "MD":
                return "AUX";
            case "DT":
            case "PDT":
            case "WDT":
                return "DET";
            case "IN":
                return "ADP";
            case "CC":
                return "CCONJ";
            case "CD":
                return "NUM";
            case "RP":
            case "TO":
            case "POS":
                return "PART";
            case "UH":
                return "INTJ";
            case "SYM":
                return "SYM";
            case "FW":
                return "X";
            default:
                return tag.matches("[^A-Za-z]+") ? "PUNCT" : "X";
        }
    }
}
