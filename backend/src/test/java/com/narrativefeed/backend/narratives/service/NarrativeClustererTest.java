package com.narrativefeed.backend.narratives.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.narrativefeed.backend.common.exception.ConfigurationException;
import com.narrativefeed.backend.extraction.dto.ExtractedEntity;
import com.narrativefeed.backend.extraction.entity.EntityType;
import com.narrativefeed.backend.narratives.dto.ContentSnapshot;
import com.narrativefeed.backend.narratives.dto.DetectionConfig;
import com.narrativefeed.backend.narratives.dto.NarrativeCandidate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Random;
import java.util.Set;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class NarrativeClustererTest {

    private static final LocalDateTime BASE = LocalDateTime.of(2026, 3, 10, 8, 0);
    private static final DetectionConfig DEFAULT_CONFIG = new DetectionConfig(3, 24, 2);

    private static final ExtractedEntity NVDA = ExtractedEntity.of("$NVDA", EntityType.TICKER);
    private static final ExtractedEntity HUANG = ExtractedEntity.of("Jensen Huang", EntityType.PERSON);
    private static final ExtractedEntity CHIPS = ExtractedEntity.of("chips", EntityType.KEYWORD);

    private final NarrativeClusterer clusterer = new NarrativeClusterer();

    private static ContentSnapshot item(String id, int hoursAfterBase, ExtractedEntity... entities) {
        return new ContentSnapshot(id, BASE.plusHours(hoursAfterBase), Set.of(entities));
    }

    @Nested
    @DisplayName("grouping")
    class Grouping {

        @Test
        @DisplayName("three items sharing a ticker and a person form one candidate")
        void threeItemsShareTwoEntities() {
            List<NarrativeCandidate> candidates = clusterer.detect(List.of(
                    item("n1", 0, NVDA, HUANG, CHIPS),
                    item("n2", 2, NVDA, HUANG, CHIPS),
                    item("n3", 5, NVDA, HUANG, CHIPS)), DEFAULT_CONFIG);

            assertThat(candidates).hasSize(1);
            NarrativeCandidate candidate = candidates.get(0);
            assertThat(candidate.getSharedEntities()).containsExactly(NVDA, HUANG);
            assertThat(candidate.getSharedKeywords()).containsExactly("chips");
            assertThat(candidate.getTitle()).isEqualTo("$NVDA Market Movement");
            assertThat(candidate.getSummary()).isEqualTo("3 items discussing $NVDA, Jensen Huang over the last 5 hours");
            assertThat(candidate.getLinkedItemIds()).containsExactly("n3", "n2", "n1");
            assertThat(candidate.getEarliestPublishedAt()).isEqualTo(BASE);
            assertThat(candidate.getLatestPublishedAt()).isEqualTo(BASE.plusHours(5));
        }

        @Test
        @DisplayName("two items are not enough")
        void belowMinItems() {
            assertThat(clusterer.detect(List.of(
                    item("n1", 0, NVDA, HUANG),
                    item("n2", 1, NVDA, HUANG)), DEFAULT_CONFIG)).isEmpty();
        }

        @Test
        @DisplayName("a single shared entity is not enough")
        void belowMinShared() {
            assertThat(clusterer.detect(List.of(
                    item("n1", 0, NVDA),
                    item("n2", 1, NVDA),
                    item("n3", 2, NVDA)), DEFAULT_CONFIG)).isEmpty();
        }

        @Test
        @DisplayName("shared keywords never count towards the threshold")
        void keywordsDoNotQualify() {
            assertThat(clusterer.detect(List.of(
                    item("n1", 0, NVDA, CHIPS),
                    item("n2", 1, NVDA, CHIPS),
                    item("n3", 2, NVDA, CHIPS)), DEFAULT_CONFIG)).isEmpty();
        }

        @Test
        @DisplayName("items without entities produce nothing")
        void noEntities() {
            assertThat(clusterer.detect(List.of(item("n1", 0), item("n2", 0), item("n3", 0)), DEFAULT_CONFIG)).isEmpty();
            assertThat(clusterer.detect(List.of(), DEFAULT_CONFIG)).isEmpty();
        }
    }

    @Nested
    @DisplayName("assignment")
    class Assignment {

        private final ExtractedEntity aapl = ExtractedEntity.of("$AAPL", EntityType.TICKER);
        private final ExtractedEntity cook = ExtractedEntity.of("Tim Cook", EntityType.PERSON);
        private final ExtractedEntity tsla = ExtractedEntity.of("$TSLA", EntityType.TICKER);
        private final ExtractedEntity musk = ExtractedEntity.of("Elon Musk", EntityType.PERSON);

        private List<ContentSnapshot> overlapping() {
            return List.of(
                    item("a1", 0, aapl, cook, tsla, musk),
                    item("a2", 1, aapl, cook),
                    item("a3", 2, aapl, cook),
                    item("t1", 3, tsla, musk),
                    item("t2", 4, tsla, musk),
                    item("t3", 5, tsla, musk));
        }

        @Test
        @DisplayName("an item joins at most one candidate, earliest seed first")
        void noDoubleAssignment() {
            List<NarrativeCandidate> candidates = clusterer.detect(overlapping(), DEFAULT_CONFIG);

            assertThat(candidates).hasSize(2);
            assertThat(candidates.get(0).getTitle()).isEqualTo("$AAPL Market Movement");
            assertThat(candidates.get(0).getLinkedItemIds()).containsExactlyInAnyOrder("a1", "a2", "a3");
            assertThat(candidates.get(1).getTitle()).isEqualTo("$TSLA Market Movement");
            assertThat(candidates.get(1).getLinkedItemIds()).containsExactlyInAnyOrder("t1", "t2", "t3");

            Set<String> seen = new HashSet<>();
            candidates.forEach(c -> c.getLinkedItemIds().forEach(id -> assertThat(seen.add(id)).isTrue()));
        }

        @Test
        @DisplayName("input order does not change the result")
        void deterministic() {
            List<NarrativeCandidate> expected = clusterer.detect(overlapping(), DEFAULT_CONFIG);

            List<ContentSnapshot> shuffled = new ArrayList<>(overlapping());
            Collections.shuffle(shuffled, new Random(42));
            assertThat(clusterer.detect(shuffled, DEFAULT_CONFIG)).isEqualTo(expected);

            Collections.reverse(shuffled);
            assertThat(clusterer.detect(shuffled, DEFAULT_CONFIG)).isEqualTo(expected);
        }
    }

    @Nested
    @DisplayName("titles and summaries")
    class Wording {

        @Test
        @DisplayName("person seed without tickers")
        void personTitle() {
            ExtractedEntity musk = ExtractedEntity.of("Elon Musk", EntityType.PERSON);
            ExtractedEntity org = ExtractedEntity.of("Orbital Holdings", EntityType.ORGANIZATION);

            List<NarrativeCandidate> candidates = clusterer.detect(List.of(
                    item("p1", 0, musk, org), item("p2", 0, musk, org), item("p3", 1, musk, org)), DEFAULT_CONFIG);

            assertThat(candidates).extracting(NarrativeCandidate::getTitle).containsExactly("Elon Musk Developments");
            assertThat(candidates.get(0).getSummary()).endsWith("over the last hour");
        }

        @Test
        @DisplayName("organizations only")
        void organizationTitle() {
            ExtractedEntity apex = ExtractedEntity.of("Apex Capital Group", EntityType.ORGANIZATION);
            ExtractedEntity fed = ExtractedEntity.of("Federal Reserve Bank", EntityType.ORGANIZATION);

            List<NarrativeCandidate> candidates = clusterer.detect(List.of(
                    item("o1", 0, apex, fed), item("o2", 30, apex, fed), item("o3", 50, apex, fed)), DEFAULT_CONFIG);

            assertThat(candidates).extracting(NarrativeCandidate::getTitle).containsExactly("Apex Capital Group News");
            assertThat(candidates.get(0).getSummary()).endsWith("over the last 2 days");
        }

        @Test
        @DisplayName("at most three tickers in the title and three entities in the summary")
        void manyTickers() {
            ExtractedEntity a = ExtractedEntity.of("$AMD", EntityType.TICKER);
            ExtractedEntity b = ExtractedEntity.of("$INTC", EntityType.TICKER);
            ExtractedEntity c = ExtractedEntity.of("$NVDA", EntityType.TICKER);
            ExtractedEntity d = ExtractedEntity.of("$TSM", EntityType.TICKER);

            List<NarrativeCandidate> candidates = clusterer.detect(List.of(
                    item("m1", 0, a, b, c, d), item("m2", 0, a, b, c, d), item("m3", 0, a, b, c, d)), DEFAULT_CONFIG);

            assertThat(candidates.get(0).getTitle()).isEqualTo("$AMD, $INTC, $NVDA Market Movement");
            assertThat(candidates.get(0).getSummary())
                    .isEqualTo("3 items discussing $AMD, $INTC, $NVDA and 1 more over the last hour");
        }
    }

    @Nested
    @DisplayName("configuration")
    class Configuration {

        @Test
        @DisplayName("non-positive thresholds are rejected before any work")
        void invalidThresholds() {
            List<ContentSnapshot> items = List.of(item("n1", 0, NVDA, HUANG));

            assertThatThrownBy(() -> clusterer.detect(items, new DetectionConfig(0, 24, 2)))
                    .isInstanceOf(ConfigurationException.class);
            assertThatThrownBy(() -> clusterer.detect(items, new DetectionConfig(3, -1, 2)))
                    .isInstanceOf(ConfigurationException.class);
            assertThatThrownBy(() -> clusterer.detect(List.of(), new DetectionConfig(3, 24, 0)))
                    .isInstanceOf(ConfigurationException.class);
        }

        @Test
        @DisplayName("a lower item threshold admits pairs")
        void lowerThreshold() {
            assertThat(clusterer.detect(List.of(
                    item("n1", 0, NVDA, HUANG),
                    item("n2", 1, NVDA, HUANG)), new DetectionConfig(2, 24, 2))).hasSize(1);
        }
    }
}
