package com.flagship.ad_escrow.posting;

import com.flagship.ad_escrow.error.PlacementFailedException;
import lombok.Value;

import java.util.UUID;

@Value
public class PostingResult {

    public enum Outcome {
        POSTED,
        RETRY_SCHEDULED,
        FAILED,
        SKIPPED
    }

    UUID campaignId;
    Outcome outcome;
    int attempt;
    String placementRef;
    PlacementFailedException failure;

    public static PostingResult posted(UUID campaignId, int attempt, String placementRef) {
        return new PostingResult(campaignId, Outcome.POSTED, attempt, placementRef, null);
    }

    public static PostingResult retryScheduled(UUID campaignId, int attempt) {
        return new PostingResult(campaignId, Outcome.RETRY_SCHEDULED, attempt, null, null);
    }

    public static PostingResult failed(UUID campaignId, int attempt, PlacementFailedException failure) {
        return new PostingResult(campaignId, Outcome.FAILED, attempt, null, failure);
    }

    public static PostingResult skipped(UUID campaignId, int attempt) {
        return new PostingResult(campaignId, Outcome.SKIPPED, attempt, null, null);
    }

    public boolean isPosted() {
        return outcome == Outcome.POSTED;
    }
}
