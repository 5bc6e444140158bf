package com.narrativefeed.backend.pipeline;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Data
@Component
@ConfigurationProperties(prefix = "narrative.pipeline")
public class PipelineProperties {
    // Run metrics at the end of every pipeline run
    private boolean metricsOnProcess = true;
}
