package dev.hiringvault.ai;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;

/**
 * Case insensitive whole-term matching, also for terms such as "C++" or ".NET".
 */
final class KeywordMatcher {

    private static final Map<String, Pattern> PATTERN_CACHE = new ConcurrentHashMap<>();

    private KeywordMatcher() {
    }

    static boolean containsTerm(String text, String term) {
        if (text == null || term == null || term.isBlank()) {
            return false;
        }
        String regex = "(?<![\\w])" + Pattern.quote(term.trim()) + "(?![\\w])";
        Pattern pattern = PATTERN_CACHE.computeIfAbsent(regex,
                k -> Pattern.compile(k, Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE));
        return pattern.matcher(text).find();
    }

    /**
     * Terms of the vocabulary that occur in the text, in vocabulary order.
     */
    static Set<String> findTerms(String text, Collection<String> vocabulary) {
        Set<String> found = new LinkedHashSet<>();
        for (String term : vocabulary) {
            if (containsTerm(text, term)) {
                found.add(term.trim());
            }
        }
        return found;
    }
}
