package edu.isi.nlp.claimsem.amr;

import java.util.*;
import java.util.regex.Pattern;

/**
 * Lexical constants shared by the graph walkers.
 */
public class AMRConstants {

    /** A single-word PropBank frame, e.g. treat-03. Matched against the start of a title. */
    public static final Pattern PROPBANK_PATTERN = Pattern.compile("[a-z]*-[0-9]{2}");

    /** Also admits hyphenated frames such as have-name-91. Matched against the start of a title. */
    public static final Pattern FRAME_LABEL_PATTERN = Pattern.compile("[a-z-]+-[0-9]{2}");

    private static final Pattern SENSE_SUFFIX = Pattern.compile("-[0-9]+$");

    /** Same membership semantics as Python's string.punctuation containment test. */
    public static final String PUNCTUATION = "!\"#$%&'()*+,-./:;<=>?@[\\]^_`{|}~";

    public static final Set<String> placeTypes = Collections.unmodifiableSet(new LinkedHashSet<>(
            Arrays.asList("city", "state", "country", "continent")));

    /** Template words that precede "-X" when the unknown is a place. */
    public static final Set<String> placeVariables = Collections.unmodifiableSet(new LinkedHashSet<>(
            Arrays.asList("facility", "location", "place")));

    public static final Set<String> namedEntityTypes = Collections.unmodifiableSet(new LinkedHashSet<>(
            Arrays.asList("person", "organization")));

    public static boolean isPropBankFrame(String title) {
        return title != null && PROPBANK_PATTERN.matcher(title).lookingAt();
    }

    public static boolean isFrameLabel(String title) {
        return title != null && FRAME_LABEL_PATTERN.matcher(title).lookingAt();
    }

    /**
     * cure-01 becomes cure; titles without a numeric sense are returned as-is.
     */
    public static String stripSense(String title) {
        return SENSE_SUFFIX.matcher(title).replaceFirst("");
    }

    /**
     * Everything before the last hyphen: have-name-91 becomes have-name, person stays person.
     */
    public static String frameStem(String title) {
        int i = title.lastIndexOf('-');
        return i < 0 ? title : title.substring(0, i);
    }

    public static boolean isPunctuation(String token) {
        return PUNCTUATION.contains(token);
    }
}
