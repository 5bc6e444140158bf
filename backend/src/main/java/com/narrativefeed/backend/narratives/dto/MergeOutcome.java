package com.narrativefeed.backend.narratives.dto;

import lombok.Value;

@Value
public class MergeOutcome {
    Long narrativeId;
    boolean created;
    int linksAdded;

    public boolean isLinkSetChanged() {
        return created || linksAdded > 0;
    }
}
