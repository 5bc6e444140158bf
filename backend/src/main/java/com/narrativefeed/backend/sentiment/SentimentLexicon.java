package com.narrativefeed.backend.sentiment;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;
import lombok.Getter;

/**
 * Bullish and bearish term lists. Immutable; the same term must not appear in both.
 */
@Getter
public final class SentimentLexicon {

    public static final Set<String> DEFAULT_BULLISH_TERMS = Set.of(
            // price action
            "surge", "surges", "surged", "surging",
            "rally", "rallies", "rallied", "rallying",
            "gain", "gains", "gained", "gaining",
            "rise", "rises", "rose", "rising",
            "climb", "climbs", "climbed", "climbing",
            "jump", "jumps", "jumped", "jumping",
            "soar", "soars", "soared", "soaring",
            "spike", "spikes", "spiked", "spiking",
            "boom", "booming", "breakout", "breakthrough",
            // tone
            "bullish", "optimistic", "positive",
            "strong", "strength", "robust",
            "growth", "growing", "expansion",
            "record", "high", "highs", "peak",
            "outperform", "outperformed", "outperforming",
            "upgrade", "upgraded", "upgrades",
            "beat", "beats", "exceeded", "exceeds",
            // market structure
            "demand", "buying", "accumulation",
            "confidence", "momentum", "innovation",
            "profit", "profits", "profitable",
            "revenue", "earnings", "success"
    );

    public static final Set<String> DEFAULT_BEARISH_TERMS = Set.of(
            // price action
            "fall", "falls", "fell", "falling",
            "drop", "drops", "dropped", "dropping",
            "decline", "declines", "declined", "declining",
            "plunge", "plunges", "plunged", "plunging",
            "crash", "crashes", "crashed", "crashing",
            "tumble", "tumbles", "tumbled", "tumbling",
            "sink", "sinks", "sank", "sinking",
            "slump", "slumps", "slumped", "slumping",
            // tone
            "bearish", "pessimistic", "negative",
            "weak", "weakness", "struggling",
            "loss", "losses", "losing", "lost",
            "underperform", "underperformed", "underperforming",
            "downgrade", "downgraded", "downgrades",
            "miss", "missed", "misses", "below",
            // risk and concern
            "concern", "concerns", "worried", "worry",
            "risk", "risks", "risky",
            "fear", "fears", "panic",
            "crisis", "problem", "problems",
            "threat", "threatens", "threatened",
            "investigation", "lawsuit", "probe",
            "volatility", "volatile", "unstable",
            "recession", "slowdown", "contraction"
    );

    private final Set<String> bullishTerms;
    private final Set<String> bearishTerms;

    public SentimentLexicon(Collection<String> bullishTerms, Collection<String> bearishTerms) {
        this.bullishTerms = normalize(bullishTerms);
        this.bearishTerms = normalize(bearishTerms);
        Set<String> overlap = new LinkedHashSet<>(this.bullishTerms);
        overlap.retainAll(this.bearishTerms);
        if (!overlap.isEmpty()) {
            throw new IllegalArgumentException("Terms listed as both bullish and bearish: " + overlap);
        }
    }

    public static SentimentLexicon defaults() {
        return new SentimentLexicon(DEFAULT_BULLISH_TERMS, DEFAULT_BEARISH_TERMS);
    }

    private static Set<String> normalize(Collection<String> terms) {
        Set<String> result = new LinkedHashSet<>();
        for (String term : terms) {
            if (term != null && !term.isBlank()) {
                result.add(term.trim().toLowerCase(Locale.ROOT));
            }
        }
        return Set.copyOf(result);
    }
}
