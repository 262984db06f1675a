package io.resolvemesh.execution;

import java.time.Duration;
import java.util.List;

public record SandboxJob(String requestId, long attemptEpoch, String code, Duration timeout, List<String> allowedHosts) {
    public SandboxJob {
        allowedHosts = allowedHosts == null ? List.of() : List.copyOf(allowedHosts);
    }
}
