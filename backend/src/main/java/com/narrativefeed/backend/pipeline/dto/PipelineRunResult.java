package com.narrativefeed.backend.pipeline.dto;

import com.narrativefeed.backend.common.dto.BatchResult;
import com.narrativefeed.backend.narratives.dto.MetricsUpdateResult;
import java.util.ArrayList;
import java.util.List;
import lombok.Data;

/**
 * Per-step outcome of one pipeline run. Steps that did not run keep their empty defaults.
 */
@Data
public class PipelineRunResult {
    private BatchResult ingestion = BatchResult.empty();
    private BatchResult extraction = BatchResult.empty();
    private int candidatesDetected;
    private int narrativesCreated;
    private int narrativesExtended;
    private List<Long> changedNarrativeIds = new ArrayList<>();
    private BatchResult merge = BatchResult.empty();
    private BatchResult sentiment = BatchResult.empty();
    private MetricsUpdateResult metrics;
    private boolean detectionSkipped;
    private long durationMs;
}
