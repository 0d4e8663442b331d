package dev.repowarden.classifier.triage;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Case-insensitive substring search over a keyword list. Returns the first
 * keyword in list order that occurs in the text.
 */
final class KeywordMatcher {

    private KeywordMatcher() {}

    static Optional<String> firstMatch(String text, List<String> keywords) {
        if (text == null || text.isEmpty()) return Optional.empty();
        String haystack = text.toLowerCase(Locale.ROOT);
        return keywords.stream()
                .filter(k -> k != null && !k.isEmpty())
                .filter(k -> haystack.contains(k.toLowerCase(Locale.ROOT)))
                .findFirst();
    }
}
