package io.resolvemesh.watch;

import io.resolvemesh.config.EngineSettings;
import io.resolvemesh.config.ResolveMeshConfig;
import io.resolvemesh.exception.TransientChainException;
import io.resolvemesh.model.RequestView;
import io.resolvemesh.storage.Database;
import io.resolvemesh.storage.LifecycleStore;
import io.resolvemesh.testing.FakeOracleChain;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Stream;

final class RequestWatcherTest {
    private static final long NOW = 1_700_000_000_000L;

    @Test
    void mirrorsOutstandingSetIntoStore() throws Exception {
        Path root = Files.createTempDirectory("resolvemesh-test-watcher-");
        try {
            FakeOracleChain chain = new FakeOracleChain();
            LifecycleStore store = openStore(root);
            RequestWatcher watcher = new RequestWatcher(chain, store, EngineSettings::defaults);
            RequestView first = chain.publish(new RequestView("YES_OR_NO_QUERY", 1_700_000_000L, "q: first?", "0xalice"));
            RequestView second = chain.publish(new RequestView("YES_OR_NO_QUERY", 1_700_000_100L,
                    "q: second?, resolve_after: 1700003600, deadline: 1700007200", "0xbob"));

            List<WatchEvent> events = watcher.scan(NOW);
            Assertions.assertEquals(List.of(
                    new WatchEvent(WatchEvent.Kind.NEW, first.requestId()),
                    new WatchEvent(WatchEvent.Kind.NEW, second.requestId())), events);
            Assertions.assertTrue(watcher.scan(NOW + 1_000L).isEmpty());

            EngineSettings settings = EngineSettings.defaults();
            long earliest = (1_700_000_000L + settings.graceSeconds()) * 1_000L;
            Assertions.assertEquals(earliest, store.get(first.requestId()).orElseThrow().earliestResolveAtMs());
            Assertions.assertEquals(earliest + settings.resolutionWindowSeconds() * 1_000L,
                    store.get(first.requestId()).orElseThrow().deadlineAtMs());
            Assertions.assertEquals(1_700_003_600_000L, store.get(second.requestId()).orElseThrow().earliestResolveAtMs());
            Assertions.assertEquals(1_700_007_200_000L, store.get(second.requestId()).orElseThrow().deadlineAtMs());

            chain.publish(new RequestView("YES_OR_NO_QUERY", 1_700_000_000L, "q: first?", "0xcarol"));
            Assertions.assertEquals(List.of(new WatchEvent(WatchEvent.Kind.CHANGED, first.requestId())), watcher.scan(NOW + 2_000L));
            Assertions.assertEquals("0xcarol", store.get(first.requestId()).orElseThrow().requester());

            Assertions.assertEquals(2L, watcher.poll().count());
            Assertions.assertEquals(2L, watcher.poll().count());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void vanishedRequestIsGoneOnlyOnceSettledAndNotPendingOurs() throws Exception {
        Path root = Files.createTempDirectory("resolvemesh-test-watcher-");
        try {
            FakeOracleChain chain = new FakeOracleChain();
            LifecycleStore store = openStore(root);
            RequestWatcher watcher = new RequestWatcher(chain, store, EngineSettings::defaults);
            String withdrawn = chain.publish(new RequestView("YES_OR_NO_QUERY", 1L, "q: a?", "0xr")).requestId();
            String settled = chain.publish(new RequestView("YES_OR_NO_QUERY", 2L, "q: b?", "0xr")).requestId();
            String ours = chain.publish(new RequestView("YES_OR_NO_QUERY", 3L, "q: c?", "0xr")).requestId();
            watcher.scan(NOW);

            store.insertPendingSettlement(ours, "0xtx", "1000000000000000000", 0L, "hash", 1, NOW);
            chain.withdraw(withdrawn);
            chain.settleExternally(settled);
            chain.settleExternally(ours);

            Assertions.assertEquals(List.of(new WatchEvent(WatchEvent.Kind.GONE, settled)), watcher.scan(NOW + 1_000L));

            store.markSettlementFailed("0xtx", "dropped", NOW + 2_000L);
            List<WatchEvent> later = watcher.scan(NOW + 3_000L);
            Assertions.assertTrue(later.contains(new WatchEvent(WatchEvent.Kind.GONE, ours)));
            Assertions.assertFalse(later.contains(new WatchEvent(WatchEvent.Kind.GONE, withdrawn)));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void listingFailurePropagates() throws Exception {
        Path root = Files.createTempDirectory("resolvemesh-test-watcher-");
        try {
            FakeOracleChain chain = new FakeOracleChain();
            RequestWatcher watcher = new RequestWatcher(chain, openStore(root), EngineSettings::defaults);
            chain.failListing(true);
            Assertions.assertThrows(TransientChainException.class, () -> watcher.scan(NOW));
            chain.failListing(false);
            Assertions.assertTrue(watcher.scan(NOW).isEmpty());
        } finally {
            deleteRecursively(root);
        }
    }

    private static LifecycleStore openStore(Path root) {
        Database database = new Database(ResolveMeshConfig.fromRoot(root.toString()));
        database.init();
        return new LifecycleStore(database);
    }

    private static void deleteRecursively(Path root) throws IOException {
        if (root == null || !Files.exists(root)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(root)) {
            for (Path path : walk.sorted((a, b) -> Integer.compare(b.getNameCount(), a.getNameCount())).toList()) {
                Files.deleteIfExists(path);
            }
        }
    }
}
