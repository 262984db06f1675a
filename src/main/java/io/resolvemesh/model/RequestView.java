package io.resolvemesh.model;

import io.resolvemesh.util.RequestIds;

/**
 * One outstanding request as reported by the on-chain view. Timestamp is in epoch seconds.
 */
public record RequestView(String identifier, long requestTimestamp, String ancillaryData, String requester) {
    public String requestId() {
        return RequestIds.compute(identifier, requestTimestamp, ancillaryData);
    }
}
