package com.narrativefeed.backend.narratives.dto;

import com.narrativefeed.backend.common.dto.BatchFailure;
import java.util.ArrayList;
import java.util.List;
import lombok.Data;

@Data
public class MetricsUpdateResult {
    private int calculated;
    private int stored;
    private List<BatchFailure> failures = new ArrayList<>();

    public void recordFailure(String id, String reason) {
        failures.add(new BatchFailure(id, reason));
    }
}
