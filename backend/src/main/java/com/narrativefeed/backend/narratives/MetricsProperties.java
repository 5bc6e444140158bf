package com.narrativefeed.backend.narratives;

import com.narrativefeed.backend.common.exception.ConfigurationException;
import com.narrativefeed.backend.narratives.entity.MetricPeriod;
import java.time.Duration;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Data
@Component
@ConfigurationProperties(prefix = "narrative.metrics")
public class MetricsProperties {
    private boolean enabled = true;
    private Duration shortPeriod = Duration.ofHours(1);
    private Duration longPeriod = Duration.ofHours(24);

    // Only metrics calculated this recently count as trending
    private Duration trendingLookback = Duration.ofHours(2);

    private int retentionDays = 7;

    public Duration lengthOf(MetricPeriod period) {
        Duration length = period == MetricPeriod.SHORT ? shortPeriod : longPeriod;
        if (length == null || length.isZero() || length.isNegative()) {
            throw new ConfigurationException("Period " + period.getCode() + " must have a positive length, got " + length);
        }
        return length;
    }
}
