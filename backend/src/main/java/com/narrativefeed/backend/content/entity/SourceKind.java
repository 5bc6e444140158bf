package com.narrativefeed.backend.content.entity;

import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public enum SourceKind {
    ARTICLE("article", "News article"),
    SOCIAL_POST("social-post", "Social post");

    private final String code;
    private final String displayName;

    public static SourceKind fromCode(String code) {
        if (code == null) throw new IllegalArgumentException("code cannot be null");
        String normalized = code.trim().replace('_', '-');
        for (SourceKind kind : values()) {
            if (kind.code.equalsIgnoreCase(normalized) || kind.name().equalsIgnoreCase(code.trim())) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Code " + code + " is not a valid SourceKind");
    }
}
