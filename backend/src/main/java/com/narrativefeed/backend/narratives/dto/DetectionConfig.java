package com.narrativefeed.backend.narratives.dto;

import com.narrativefeed.backend.common.exception.ConfigurationException;
import lombok.Value;

@Value
public class DetectionConfig {
    int minItems;
    int windowHours;
    int minSharedEntities;

    public DetectionConfig validate() {
        ConfigurationException.requirePositive("minItems", minItems);
        ConfigurationException.requirePositive("windowHours", windowHours);
        ConfigurationException.requirePositive("minSharedEntities", minSharedEntities);
        return this;
    }
}
