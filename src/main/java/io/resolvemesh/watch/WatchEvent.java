package io.resolvemesh.watch;

public record WatchEvent(Kind kind, String requestId) {
    public enum Kind {
        NEW,
        CHANGED,
        GONE
    }
}
