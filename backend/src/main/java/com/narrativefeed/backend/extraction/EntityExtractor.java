package com.narrativefeed.backend.extraction;

import com.narrativefeed.backend.common.exception.ConfigurationException;
import com.narrativefeed.backend.extraction.dto.ExtractedEntity;
import com.narrativefeed.backend.extraction.entity.EntityType;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.RequiredArgsConstructor;
import lombok.Value;

/**
 * Rule-based entity extraction: tickers by sigil, people and organizations by capitalization,
 * keywords by filtered word frequency. Pure and deterministic; holds no mutable state.
 */
@RequiredArgsConstructor
public class EntityExtractor {

    private static final Pattern TICKER_PATTERN = Pattern.compile("\\$[A-Z]{1,5}\\b");
    // Two to four consecutive capitalized words: "Jensen Huang", "Federal Reserve Bank"
    private static final Pattern CAPITALIZED_SPAN = Pattern.compile("\\b[A-Z][a-z]+(?:\\s+[A-Z][a-z]+){1,3}\\b");
    private static final Pattern NON_WORD = Pattern.compile("[^\\w\\s]");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern NUMERIC = Pattern.compile("^\\d+$");
    private static final int MIN_KEYWORD_LENGTH = 4;
    // Longer tokens are URLs, hashes or run-together markup rather than names or topics
    private static final int MAX_ENTITY_LENGTH = 100;

    private final ExtractionVocabulary vocabulary;

    /**
     * Extract all entities of one item. The title is counted twice for keyword ranking only.
     */
    public List<ExtractedEntity> extract(String title, String body, int maxKeywords) {
        if (maxKeywords < 0) {
            throw new ConfigurationException("maxKeywords must not be negative, got " + maxKeywords);
        }
        String safeTitle = title != null ? title : "";
        String safeBody = body != null ? body : "";
        if (safeTitle.isBlank() && safeBody.isBlank()) {
            return List.of();
        }

        Set<ExtractedEntity> entities = new LinkedHashSet<>();

        Set<String> tickers = new TreeSet<>(extractTickers(safeTitle));
        tickers.addAll(extractTickers(safeBody));
        tickers.forEach(t -> entities.add(ExtractedEntity.of(t, EntityType.TICKER)));

        NamedEntities named = extractNamedEntities(safeTitle).merge(extractNamedEntities(safeBody));
        named.getPeople().forEach(p -> entities.add(ExtractedEntity.of(p, EntityType.PERSON)));
        named.getOrganizations().forEach(o -> entities.add(ExtractedEntity.of(o, EntityType.ORGANIZATION)));

        String weighted = safeTitle + " " + safeTitle + " " + safeBody;
        extractKeywords(weighted, maxKeywords)
                .forEach(k -> entities.add(ExtractedEntity.of(k, EntityType.KEYWORD)));

        return List.copyOf(entities);
    }

    /**
     * Unique sigil-prefixed tickers, alphabetical.
     */
    public List<String> extractTickers(String text) {
        Set<String> found = new TreeSet<>();
        Matcher matcher = TICKER_PATTERN.matcher(text == null ? "" : text);
        while (matcher.find()) {
            found.add(matcher.group());
        }
        return new ArrayList<>(found);
    }

    /**
     * People and organizations from capitalized spans. A span is an organization when it holds an
     * indicator word or has three or more words; a plain two-word span is a person unless the same
     * text was already seen as an organization.
     */
    public NamedEntities extractNamedEntities(String text) {
        Set<String> people = new TreeSet<>();
        Set<String> organizations = new TreeSet<>();
        Matcher matcher = CAPITALIZED_SPAN.matcher(text == null ? "" : text);

        while (matcher.find()) {
            String span = WHITESPACE.matcher(matcher.group().trim()).replaceAll(" ");
            if (span.length() < 3 || span.length() > MAX_ENTITY_LENGTH) {
                continue;
            }
            String[] words = span.split(" ");
            boolean hasIndicator = false;
            for (String word : words) {
                if (vocabulary.isOrganizationIndicator(word)) {
                    hasIndicator = true;
                    break;
                }
            }
            if (hasIndicator || words.length > 2) {
                organizations.add(span);
            } else if (words.length == 2) {
                people.add(span);
            }
        }
        people.removeAll(organizations);
        return new NamedEntities(people, organizations);
    }

    /**
     * Top keywords by frequency; ties keep first-occurrence order.
     */
    public List<String> extractKeywords(String text, int limit) {
        if (text == null || text.isBlank() || limit <= 0) {
            return List.of();
        }
        String cleaned = NON_WORD.matcher(text.toLowerCase(Locale.ROOT)).replaceAll(" ");

        Map<String, Integer> frequency = new LinkedHashMap<>();
        for (String word : WHITESPACE.split(cleaned.trim())) {
            if (isKeywordCandidate(word)) {
                frequency.merge(word, 1, Integer::sum);
            }
        }

        // stable sort keeps insertion (first occurrence) order among equal counts
        List<Map.Entry<String, Integer>> ranked = new ArrayList<>(frequency.entrySet());
        ranked.sort((a, b) -> Integer.compare(b.getValue(), a.getValue()));

        List<String> keywords = new ArrayList<>();
        for (int i = 0; i < ranked.size() && i < limit; i++) {
            keywords.add(ranked.get(i).getKey());
        }
        return keywords;
    }

    private boolean isKeywordCandidate(String word) {
        return word.length() >= MIN_KEYWORD_LENGTH
                && word.length() <= MAX_ENTITY_LENGTH
                && !vocabulary.getStopWords().contains(word)
                && !vocabulary.getGenericTerms().contains(word)
                && !NUMERIC.matcher(word).matches();
    }

    /**
     * People and organizations found in one text, each sorted.
     */
    @Value
    public static class NamedEntities {
        Set<String> people;
        Set<String> organizations;

        NamedEntities merge(NamedEntities other) {
            Set<String> mergedOrgs = new TreeSet<>(organizations);
            mergedOrgs.addAll(other.organizations);
            Set<String> mergedPeople = new TreeSet<>(people);
            mergedPeople.addAll(other.people);
            mergedPeople.removeAll(mergedOrgs);
            return new NamedEntities(mergedPeople, mergedOrgs);
        }
    }
}
