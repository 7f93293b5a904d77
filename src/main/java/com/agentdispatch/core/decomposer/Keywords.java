package com.agentdispatch.core.decomposer;

import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;

/**
 * Word-level helpers shared by the rule-based decomposer and the dependency rules.
 */
public final class Keywords {

    private static final Set<String> STOP_WORDS = Set.of(
            "a", "an", "and", "are", "as", "at", "be", "by", "can", "for", "from", "has", "have",
            "in", "into", "is", "it", "its", "must", "of", "on", "or", "should", "so", "that",
            "the", "their", "then", "this", "to", "with", "will", "all", "any", "each", "when",
            "which", "who", "users", "user", "system", "support", "supports", "allow", "allows",
            "implement", "build", "create", "write", "add", "make", "provide", "tests", "test",
            "review", "document", "research", "results", "result", "new", "using", "via");

    private Keywords() {}

    /**
     * Lower-cased words of at least three letters that are not stop words, in order of
     * first appearance.
     */
    public static Set<String> significant(String text) {
        var words = new LinkedHashSet<String>();
        if (text == null) {
            return words;
        }
        for (String token : text.toLowerCase(Locale.ROOT).split("[^a-z0-9]+")) {
            if (token.length() >= 3 && !STOP_WORDS.contains(token)) {
                words.add(token);
            }
        }
        return words;
    }

    /**
     * Short kebab-case slug from the first significant words, e.g. "user-login-jwt".
     */
    public static String slug(String text, int maxWords) {
        var words = significant(text);
        var sb = new StringBuilder();
        for (String word : words) {
            if (maxWords-- == 0) {
                break;
            }
            if (sb.length() > 0) {
                sb.append('-');
            }
            sb.append(word);
        }
        return sb.length() == 0 ? "item" : sb.toString();
    }

    /**
     * Index of the earliest whole-word (prefix) occurrence of any keyword, or -1.
     */
    public static int earliest(String lowerText, Set<String> keywords) {
        int best = -1;
        for (String keyword : keywords) {
            int from = 0;
            int idx;
            while ((idx = lowerText.indexOf(keyword, from)) >= 0) {
                boolean wordStart = idx == 0 || !Character.isLetterOrDigit(lowerText.charAt(idx - 1));
                if (wordStart) {
                    if (best < 0 || idx < best) {
                        best = idx;
                    }
                    break;
                }
                from = idx + 1;
            }
        }
        return best;
    }
}
