package edu.isi.nlp.claimsem.annotation;

import edu.stanford.nlp.ling.CoreAnnotation;
import edu.stanford.nlp.pipeline.Annotation;
import edu.stanford.nlp.pipeline.Annotator;

import java.util.Collections;
import java.util.Properties;
import java.util.Set;

/**
 * A CoreNLP annotator that fails on every document, registered through customAnnotatorClass.
 */
public class FailingAnnotator implements Annotator {

    public FailingAnnotator(String name, Properties props) {
    }

    @Override
    public void annotate(Annotation annotation) {
        throw new IllegalStateException("cannot annotate " + annotation);
    }

    @Override
    public Set<Class<? extends CoreAnnotation>> requirementsSatisfied() {
        return Collections.emptySet();
    }

    @Override
    public Set<Class<? extends CoreAnnotation>> requires() {
        return Collections.emptySet();
    }
}
