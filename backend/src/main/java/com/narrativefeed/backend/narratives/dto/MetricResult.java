package com.narrativefeed.backend.narratives.dto;

import com.narrativefeed.backend.narratives.entity.MetricPeriod;
import lombok.Value;

@Value
public class MetricResult {
    Long narrativeId;
    MetricPeriod period;
    int mentionCount;
    int previousCount;
    double velocity;
}
