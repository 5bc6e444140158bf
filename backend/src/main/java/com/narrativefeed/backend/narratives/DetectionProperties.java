package com.narrativefeed.backend.narratives;

import com.narrativefeed.backend.narratives.dto.DetectionConfig;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Data
@Component
@ConfigurationProperties(prefix = "narrative.detection")
public class DetectionProperties {
    private int minItems = 3;
    private int windowHours = 24;
    private int minSharedEntities = 2;

    // How long a narrative stays open for extension
    private int activeDays = 7;

    public DetectionConfig toConfig() {
        return new DetectionConfig(minItems, windowHours, minSharedEntities);
    }
}
