package com.narrativefeed.backend.common.dto;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import lombok.Getter;

/**
 * Outcome of a collect-and-continue batch: ids that went through and the ones that did not, with a reason.
 */
@Getter
public class BatchResult {
    private final List<String> succeeded = Collections.synchronizedList(new ArrayList<>());
    private final List<BatchFailure> failed = Collections.synchronizedList(new ArrayList<>());

    public static BatchResult empty() {
        return new BatchResult();
    }

    public void success(String id) {
        succeeded.add(id);
    }

    public void failure(String id, String reason) {
        failed.add(new BatchFailure(id, reason));
    }

    public int getSucceededCount() {
        return succeeded.size();
    }

    public int getFailedCount() {
        return failed.size();
    }

    public boolean hasFailures() {
        return !failed.isEmpty();
    }
}
