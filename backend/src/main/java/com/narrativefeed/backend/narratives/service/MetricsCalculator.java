package com.narrativefeed.backend.narratives.service;

import com.narrativefeed.backend.narratives.MetricsProperties;
import com.narrativefeed.backend.narratives.dto.MetricResult;
import com.narrativefeed.backend.narratives.entity.MetricPeriod;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Mention count and velocity for one narrative and period.
 * <p>
 * The current window is {@code [now - L, now]} and the previous one {@code [now - 2L, now - L)}, so an item
 * published exactly at {@code now - L} belongs to the current window only.
 */
@Component
@RequiredArgsConstructor
public class MetricsCalculator {

    private final Clock clock;
    private final MetricsProperties properties;

    public MetricResult calculate(Long narrativeId, MetricPeriod period, ItemTimestampsProvider provider) {
        Duration length = properties.lengthOf(period);
        LocalDateTime now = LocalDateTime.now(clock);
        LocalDateTime currentStart = now.minus(length);
        LocalDateTime previousStart = currentStart.minus(length);

        List<LocalDateTime> published = provider.publishedTimesFor(narrativeId);
        int current = 0;
        int previous = 0;
        for (LocalDateTime at : published) {
            if (at == null || at.isAfter(now)) {
                continue;
            }
            if (!at.isBefore(currentStart)) {
                current++;
            } else if (!at.isBefore(previousStart)) {
                previous++;
            }
        }
        return new MetricResult(narrativeId, period, current, previous, velocity(current, previous));
    }

    /**
     * Percent change rounded to two decimals. Growth from nothing counts as 100.
     */
    public static double velocity(int current, int previous) {
        if (previous == 0) {
            return current > 0 ? 100.0 : 0.0;
        }
        double change = (current - previous) * 100.0 / previous;
        return BigDecimal.valueOf(change).setScale(2, RoundingMode.HALF_UP).doubleValue();
    }
}
