package com.lsemantica.core.pipeline.intent;

import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Text normalization shared by intent matching and edit planning.
 */
public final class SearchText {

    private static final Set<String> STOP_WORDS = Set.of(
            "a", "an", "and", "as", "at", "by", "for", "from", "in", "into", "of", "on", "or", "the", "to", "with");
    private static final Pattern TOKEN = Pattern.compile("[a-z0-9]+");

    private SearchText() {}

    /** Lowercases, turns {@code _} and {@code -} runs and punctuation into spaces, collapses whitespace. */
    public static String normalize(String value) {
        return value.toLowerCase(Locale.ROOT)
                .replaceAll("[_-]+", " ")
                .replaceAll("[^a-z0-9\\s]+", " ")
                .replaceAll("\\s+", " ")
                .trim();
    }

    /** Unique, sorted tokens of the normalized text, without stop words. */
    public static List<String> tokenize(String value) {
        Matcher matcher = TOKEN.matcher(normalize(value));
        TreeSet<String> tokens = new TreeSet<>();
        while (matcher.find()) {
            String token = matcher.group();
            if (!STOP_WORDS.contains(token)) {
                tokens.add(token);
            }
        }
        return List.copyOf(tokens);
    }
}
