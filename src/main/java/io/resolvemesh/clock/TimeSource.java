package io.resolvemesh.clock;

import io.resolvemesh.exception.ClockSyncException;

@FunctionalInterface
public interface TimeSource {
    TimeSample fetchTime() throws ClockSyncException;
}
