package com.event.reconciliation.similarity;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Similarity of two organization names, used only as a fuzzy-tier gate.
 *
 * <p>Both names are canonicalized (lowercased, punctuation replaced by spaces, whitespace
 * collapsed) and then scored:</p>
 * <ol>
 *   <li>identical canonical names score 1.0</li>
 *   <li>a blank name against a non-blank one scores 0.0</li>
 *   <li>one name containing the other at a word boundary ("Marietta High School" /
 *       "Marietta High School NHS") scores {@link #CONTAINMENT_SCORE}</li>
 *   <li>otherwise the {@link LevenshteinSimilarity} ratio of the canonical names</li>
 * </ol>
 */
public class OrganizationNameSimilarity implements SimilarityAlgorithm {
    private static final Logger log = LoggerFactory.getLogger(OrganizationNameSimilarity.class);

    /**
     * Score for a name that extends or abbreviates the other by whole words.
     */
    public static final double CONTAINMENT_SCORE = 0.9;

    private static final Pattern PUNCTUATION = Pattern.compile("[^\\p{L}\\p{N}\\s]");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private final LevenshteinSimilarity levenshtein = new LevenshteinSimilarity();

    @Override
    public double compute(String s1, String s2) {
        String a = canonicalize(s1);
        String b = canonicalize(s2);
        if (a.equals(b)) {
            return 1.0;
        }
        if (a.isEmpty() || b.isEmpty()) {
            return 0.0;
        }

        double score;
        if (containsWords(a, b) || containsWords(b, a)) {
            score = CONTAINMENT_SCORE;
        } else {
            score = levenshtein.compute(a, b);
        }
        log.debug("Organization similarity '{}' vs '{}' = {}", a, b, score);
        return score;
    }

    @Override
    public String getName() {
        return "OrganizationName";
    }

    /**
     * Lowercases, turns punctuation into spaces and collapses whitespace.
     */
    public static String canonicalize(String name) {
        if (name == null) {
            return "";
        }
        String lowered = name.toLowerCase(Locale.ROOT);
        return WHITESPACE.matcher(PUNCTUATION.matcher(lowered).replaceAll(" ")).replaceAll(" ").trim();
    }

    private static boolean containsWords(String longer, String shorter) {
        if (longer.length() <= shorter.length()) {
            return false;
        }
        return (" " + longer + " ").contains(" " + shorter + " ");
    }
}
