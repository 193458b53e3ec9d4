package com.itguru.service.support;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Case-insensitive term lookup. A term must start on a word boundary, so "ids" never
 * fires on "kids"; multi-word terms match as a phrase. {@link #of} also requires a
 * boundary after the term, {@link #stemsOf} accepts any word ending after it
 * ("vpn" matches "VPNs", "docker" matches "Dockerfile", "active directory" matches
 * "active directories").
 */
public final class KeywordMatcher {

    private final List<Term> terms;

    private KeywordMatcher(List<Term> terms) {
        this.terms = terms;
    }

    public static KeywordMatcher of(Collection<String> rawTerms) {
        return compile(rawTerms, false);
    }

    public static KeywordMatcher of(String... rawTerms) {
        return of(List.of(rawTerms));
    }

    /** Matches each term as the start of a word, so plurals and compounds count. */
    public static KeywordMatcher stemsOf(Collection<String> rawTerms) {
        return compile(rawTerms, true);
    }

    public static KeywordMatcher stemsOf(String... rawTerms) {
        return stemsOf(List.of(rawTerms));
    }

    private static KeywordMatcher compile(Collection<String> rawTerms, boolean openEnded) {
        List<Term> compiled = new ArrayList<>();
        if (rawTerms != null) {
            for (String raw : rawTerms) {
                if (raw == null || raw.isBlank()) continue;
                String term = raw.trim().toLowerCase(Locale.ROOT);
                String body = openEnded ? stem(term) : Pattern.quote(term) + "(?![\\p{L}\\p{N}])";
                Pattern p = Pattern.compile("(?<![\\p{L}\\p{N}])" + body,
                        Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
                compiled.add(new Term(term, p));
            }
        }
        return new KeywordMatcher(List.copyOf(compiled));
    }

    // "directory" -> "director(y|ies)"
    private static String stem(String term) {
        if (term.length() > 3 && term.endsWith("y")) {
            return Pattern.quote(term.substring(0, term.length() - 1)) + "(?:y|ies)";
        }
        return Pattern.quote(term);
    }

    /** First configured term (in configuration order) present in {@code text}. */
    public Optional<String> firstMatch(String text) {
        if (text == null || text.isEmpty()) return Optional.empty();
        for (Term t : terms) {
            if (t.pattern().matcher(text).find()) return Optional.of(t.term());
        }
        return Optional.empty();
    }

    public boolean matchesAny(String text) {
        return firstMatch(text).isPresent();
    }

    public int size() {
        return terms.size();
    }

    private record Term(String term, Pattern pattern) {}
}
