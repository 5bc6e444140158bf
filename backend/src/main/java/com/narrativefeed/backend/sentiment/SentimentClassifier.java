package com.narrativefeed.backend.sentiment;

import com.narrativefeed.backend.sentiment.dto.SentimentExplanation;
import com.narrativefeed.backend.sentiment.dto.SentimentStats;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.RequiredArgsConstructor;

/**
 * Keyword-tally sentiment. Every whole-word occurrence of a lexicon term counts once; the side with
 * more hits wins and a tie (including no hits) is neutral.
 * <p>
 * Negation is not handled: "no decline" still counts a bearish hit.
 */
@RequiredArgsConstructor
public class SentimentClassifier {

    private static final Pattern WORD = Pattern.compile("[a-z]+");

    private final SentimentLexicon lexicon;

    public Sentiment classify(String text) {
        return explain(text).getSentiment();
    }

    /**
     * Narrative variant: the title is counted twice before the summary.
     */
    public Sentiment classifyNarrative(String title, String summary) {
        String safeTitle = title != null ? title : "";
        String safeSummary = summary != null ? summary : "";
        return classify(safeTitle + " " + safeTitle + " " + safeSummary);
    }

    public SentimentExplanation explain(String text) {
        List<String> bullishMatches = new ArrayList<>();
        List<String> bearishMatches = new ArrayList<>();
        if (text != null && !text.isEmpty()) {
            Matcher matcher = WORD.matcher(text.toLowerCase(Locale.ROOT));
            while (matcher.find()) {
                String word = matcher.group();
                if (lexicon.getBullishTerms().contains(word)) {
                    bullishMatches.add(word);
                } else if (lexicon.getBearishTerms().contains(word)) {
                    bearishMatches.add(word);
                }
            }
        }
        return new SentimentExplanation(decide(bullishMatches.size(), bearishMatches.size()),
                List.copyOf(bullishMatches), List.copyOf(bearishMatches));
    }

    /**
     * Label counts and rounded percentages over a set of labels
     */
    public SentimentStats stats(List<Sentiment> sentiments) {
        int bullish = 0;
        int bearish = 0;
        int neutral = 0;
        for (Sentiment sentiment : sentiments) {
            switch (sentiment) {
                case BULLISH -> bullish++;
                case BEARISH -> bearish++;
                default -> neutral++;
            }
        }
        int total = sentiments.size();
        return new SentimentStats(bullish, bearish, neutral, total,
                percent(bullish, total), percent(bearish, total), percent(neutral, total));
    }

    static Sentiment decide(int bullishCount, int bearishCount) {
        if (bullishCount > bearishCount) {
            return Sentiment.BULLISH;
        }
        if (bearishCount > bullishCount) {
            return Sentiment.BEARISH;
        }
        return Sentiment.NEUTRAL;
    }

    private static int percent(int part, int total) {
        return total > 0 ? (int) Math.round(part * 100.0 / total) : 0;
    }
}
