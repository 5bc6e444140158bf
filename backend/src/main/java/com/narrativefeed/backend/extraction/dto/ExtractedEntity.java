package com.narrativefeed.backend.extraction.dto;

import com.narrativefeed.backend.extraction.entity.EntityType;
import java.util.Comparator;
import lombok.Value;

@Value
public class ExtractedEntity {
    public static final Comparator<ExtractedEntity> BY_PRIORITY_THEN_TEXT =
            Comparator.comparingInt((ExtractedEntity e) -> e.getType().getPriority())
                    .thenComparing(ExtractedEntity::getText);

    String text;
    EntityType type;

    public static ExtractedEntity of(String text, EntityType type) {
        return new ExtractedEntity(text, type);
    }
}
