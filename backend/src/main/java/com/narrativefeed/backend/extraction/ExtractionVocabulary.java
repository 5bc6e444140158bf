package com.narrativefeed.backend.extraction;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;
import lombok.Getter;

/**
 * Word lists the extractor filters and classifies against. Immutable once built.
 */
@Getter
public final class ExtractionVocabulary {

    public static final Set<String> DEFAULT_STOP_WORDS = Set.of(
            "the", "a", "an", "and", "or", "but", "in", "on", "at", "to", "for",
            "of", "with", "by", "from", "up", "about", "into", "through", "during",
            "is", "are", "was", "were", "be", "been", "being", "have", "has", "had",
            "do", "does", "did", "will", "would", "should", "could", "may", "might",
            "can", "this", "that", "these", "those", "i", "you", "he", "she", "it",
            "we", "they", "them", "their", "what", "which", "who", "when", "where",
            "why", "how", "all", "each", "every", "both", "few", "more", "most",
            "other", "some", "such", "no", "nor", "not", "only", "own", "same",
            "so", "than", "too", "very", "s", "t", "just", "don", "now", "said",
            "after", "before", "over", "under", "again", "then", "there", "here",
            "also", "while", "says", "amid", "its", "our", "your", "his", "her"
    );

    public static final Set<String> DEFAULT_GENERIC_TERMS = Set.of(
            "market", "markets", "trading", "traders", "investors", "investment",
            "stock", "stocks", "shares", "price", "prices", "company", "companies",
            "business", "financial", "economic", "economy", "sector", "industry",
            "announced", "announcement", "reported", "reports", "showed", "today",
            "week", "year", "news", "update"
    );

    public static final Set<String> DEFAULT_ORGANIZATION_INDICATORS = Set.of(
            "Corp", "Inc", "LLC", "Ltd", "Group", "Holdings", "Partners",
            "Bank", "Capital", "Fund", "Management", "Technologies", "Systems"
    );

    private final Set<String> stopWords;
    private final Set<String> genericTerms;
    private final Set<String> organizationIndicators;

    public ExtractionVocabulary(Collection<String> stopWords,
                                Collection<String> genericTerms,
                                Collection<String> organizationIndicators) {
        this.stopWords = lowerCased(stopWords);
        this.genericTerms = lowerCased(genericTerms);
        this.organizationIndicators = Set.copyOf(organizationIndicators);
    }

    public static ExtractionVocabulary defaults() {
        return new ExtractionVocabulary(DEFAULT_STOP_WORDS, DEFAULT_GENERIC_TERMS, DEFAULT_ORGANIZATION_INDICATORS);
    }

    /**
     * Defaults extended with extra entries; additions never remove a default.
     */
    public static ExtractionVocabulary defaultsWith(Collection<String> extraStopWords,
                                                    Collection<String> extraGenericTerms,
                                                    Collection<String> extraOrganizationIndicators) {
        return new ExtractionVocabulary(
                union(DEFAULT_STOP_WORDS, extraStopWords),
                union(DEFAULT_GENERIC_TERMS, extraGenericTerms),
                union(DEFAULT_ORGANIZATION_INDICATORS, extraOrganizationIndicators));
    }

    public boolean isOrganizationIndicator(String word) {
        return organizationIndicators.contains(word);
    }

    private static Set<String> union(Set<String> base, Collection<String> extra) {
        Set<String> merged = new LinkedHashSet<>(base);
        if (extra != null) {
            extra.stream()
                    .filter(s -> s != null && !s.isBlank())
                    .map(String::trim)
                    .forEach(merged::add);
        }
        return merged;
    }

    private static Set<String> lowerCased(Collection<String> words) {
        Set<String> result = new LinkedHashSet<>();
        for (String word : words) {
            result.add(word.toLowerCase(Locale.ROOT));
        }
        return Set.copyOf(result);
    }
}
