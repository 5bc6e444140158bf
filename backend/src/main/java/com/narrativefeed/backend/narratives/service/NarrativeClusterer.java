package com.narrativefeed.backend.narratives.service;

import com.narrativefeed.backend.extraction.dto.ExtractedEntity;
import com.narrativefeed.backend.extraction.entity.EntityType;
import com.narrativefeed.backend.narratives.dto.ContentSnapshot;
import com.narrativefeed.backend.narratives.dto.DetectionConfig;
import com.narrativefeed.backend.narratives.dto.NarrativeCandidate;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.stream.Collectors;
import org.springframework.stereotype.Component;

/**
 * Groups content snapshots that share significant entities into narrative candidates.
 * <p>
 * Seeds are visited ticker first, then person, then organization, each alphabetically. A seed's
 * not-yet-assigned items become a candidate when there are enough of them and they all share
 * enough tickers, people or organizations. Keywords are reported but never seed or qualify a group.
 * The result depends only on the input set, not on its order.
 */
@Component
public class NarrativeClusterer {

    private static final int TITLE_TICKER_LIMIT = 3;
    private static final int SUMMARY_ENTITY_LIMIT = 5;
    private static final int SUMMARY_ENTITY_SHOWN = 3;

    private static final Comparator<ContentSnapshot> NEWEST_FIRST =
            Comparator.comparing(ContentSnapshot::getPublishedAt, Comparator.reverseOrder())
                    .thenComparing(ContentSnapshot::getItemId);

    public List<NarrativeCandidate> detect(List<ContentSnapshot> items, DetectionConfig config) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        config.validate();
        if (items == null || items.isEmpty()) {
            return List.of();
        }

        // First snapshot per id wins; sorted so iteration order never depends on the caller
        Map<String, ContentSnapshot> byId = new TreeMap<>();
        for (ContentSnapshot item : items) {
            byId.putIfAbsent(item.getItemId(), item);
        }

        TreeMap<ExtractedEntity, TreeSet<String>> index = new TreeMap<>(ExtractedEntity.BY_PRIORITY_THEN_TEXT);
        for (ContentSnapshot item : byId.values()) {
            for (ExtractedEntity entity : item.getEntities()) {
                if (entity.getType().isSignificant()) {
                    index.computeIfAbsent(entity, k -> new TreeSet<>()).add(item.getItemId());
                }
            }
        }

        Set<String> assigned = new HashSet<>();
        List<NarrativeCandidate> candidates = new ArrayList<>();
        for (TreeSet<String> seededIds : index.values()) {
            List<ContentSnapshot> members = seededIds.stream()
                    .filter(id -> !assigned.contains(id))
                    .map(byId::get)
                    .toList();
            if (members.size() < config.getMinItems()) {
                continue;
            }

            List<ExtractedEntity> shared = sharedOf(members, true);
            if (shared.size() < config.getMinSharedEntities()) {
                continue;
            }

            candidates.add(buildCandidate(members, shared));
            members.forEach(member -> assigned.add(member.getItemId()));
        }
        return candidates;
    }

    private NarrativeCandidate buildCandidate(List<ContentSnapshot> members, List<ExtractedEntity> shared) {
        List<ContentSnapshot> ordered = members.stream().sorted(NEWEST_FIRST).toList();
        LocalDateTime latest = ordered.get(0).getPublishedAt();
        LocalDateTime earliest = ordered.get(ordered.size() - 1).getPublishedAt();
        List<String> sharedKeywords = sharedOf(members, false).stream()
                .map(ExtractedEntity::getText)
                .toList();

        return new NarrativeCandidate(
                buildTitle(shared),
                buildSummary(ordered.size(), shared, earliest, latest),
                ordered.stream().map(ContentSnapshot::getItemId).toList(),
                shared,
                sharedKeywords,
                earliest,
                latest);
    }

    /**
     * Entities present in every member, significant ones or keywords only
     */
    private static List<ExtractedEntity> sharedOf(List<ContentSnapshot> members, boolean significant) {
        Set<ExtractedEntity> shared = members.get(0).getEntities().stream()
                .filter(e -> e.getType().isSignificant() == significant)
                .collect(Collectors.toCollection(LinkedHashSet::new));
        for (int i = 1; i < members.size() && !shared.isEmpty(); i++) {
            shared.retainAll(members.get(i).getEntities());
        }
        return shared.stream().sorted(ExtractedEntity.BY_PRIORITY_THEN_TEXT).toList();
    }

    static String buildTitle(List<ExtractedEntity> shared) {
        List<String> tickers = textsOf(shared, EntityType.TICKER);
        if (!tickers.isEmpty()) {
            return String.join(", ", tickers.subList(0, Math.min(TITLE_TICKER_LIMIT, tickers.size()))) + " Market Movement";
        }
        List<String> people = textsOf(shared, EntityType.PERSON);
        if (!people.isEmpty()) {
            return people.get(0) + " Developments";
        }
        List<String> organizations = textsOf(shared, EntityType.ORGANIZATION);
        if (!organizations.isEmpty()) {
            return organizations.get(0) + " News";
        }
        return shared.stream().limit(SUMMARY_ENTITY_SHOWN).map(ExtractedEntity::getText)
                .collect(Collectors.joining(", ")) + " Updates";
    }

    static String buildSummary(int itemCount, List<ExtractedEntity> shared, LocalDateTime earliest, LocalDateTime latest) {
        List<String> entities = shared.stream()
                .limit(SUMMARY_ENTITY_LIMIT)
                .map(ExtractedEntity::getText)
                .toList();
        String entityList = entities.size() > SUMMARY_ENTITY_SHOWN
                ? String.join(", ", entities.subList(0, SUMMARY_ENTITY_SHOWN)) + " and " + (entities.size() - SUMMARY_ENTITY_SHOWN) + " more"
                : String.join(", ", entities);
        return String.format("%d items discussing %s over the last %s", itemCount, entityList, describeSpan(earliest, latest));
    }

    static String describeSpan(LocalDateTime earliest, LocalDateTime latest) {
        long hours = Duration.between(earliest, latest).toHours();
        if (hours < 2) {
            return "hour";
        }
        if (hours < 24) {
            return hours + " hours";
        }
        long days = hours / 24;
        return days == 1 ? "day" : days + " days";
    }

    private static List<String> textsOf(List<ExtractedEntity> entities, EntityType type) {
        return entities.stream()
                .filter(e -> e.getType() == type)
                .map(ExtractedEntity::getText)
                .toList();
    }
}
