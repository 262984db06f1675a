package io.resolvemesh.storage;

import io.resolvemesh.config.ResolveMeshConfig;
import io.resolvemesh.exception.IllegalTransitionException;
import io.resolvemesh.model.ConfirmationState;
import io.resolvemesh.model.Decision;
import io.resolvemesh.model.FailureClass;
import io.resolvemesh.model.Finalization;
import io.resolvemesh.model.LifecycleState;
import io.resolvemesh.model.Outcome;
import io.resolvemesh.model.RequestView;
import io.resolvemesh.model.ResolutionRequest;
import io.resolvemesh.model.SettlementRecord;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.stream.Stream;

final class LifecycleStoreTest {
    private static final long NOW = 1_700_000_000_000L;

    @Test
    void observeDistinguishesNewUnchangedChangedAndTerminal() throws Exception {
        Path root = Files.createTempDirectory("resolvemesh-test-observe-");
        try {
            LifecycleStore store = openStore(root);
            RequestView view = view(1L, "0xrequester");

            LifecycleStore.ObserveResult created = store.observe(view, NOW, NOW + 60_000L, NOW);
            Assertions.assertEquals(LifecycleStore.ObserveKind.NEW, created.kind());
            Assertions.assertEquals(LifecycleState.SCHEDULED, created.request().state());
            Assertions.assertEquals(0L, created.request().attemptEpoch());

            Assertions.assertEquals(LifecycleStore.ObserveKind.UNCHANGED,
                    store.observe(view, NOW, NOW + 60_000L, NOW + 1L).kind());

            LifecycleStore.ObserveResult moved = store.observe(view(1L, "0xsomeone-else"), NOW, NOW + 60_000L, NOW + 2L);
            Assertions.assertEquals(LifecycleStore.ObserveKind.CHANGED, moved.kind());
            Assertions.assertEquals("0xsomeone-else", moved.request().requester());

            store.finalizeExternal(view.requestId(), "settled elsewhere", NOW + 3L);
            Assertions.assertEquals(LifecycleStore.ObserveKind.TERMINAL,
                    store.observe(view, NOW + 5_000L, NOW + 90_000L, NOW + 4L).kind());
            Assertions.assertEquals(NOW + 60_000L, store.get(view.requestId()).orElseThrow().deadlineAtMs());
            Assertions.assertEquals(2, store.transitions(view.requestId()).size());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void staleEpochCannotCompleteAnAbandonedAttempt() throws Exception {
        Path root = Files.createTempDirectory("resolvemesh-test-epoch-");
        try {
            LifecycleStore store = openStore(root);
            String id = store.observe(view(2L, "0xr"), NOW, NOW + 60_000L, NOW).request().requestId();

            LifecycleStore.AttemptGrant grant = store.tryBeginAttempt(id, true, NOW + 1L);
            Assertions.assertTrue(grant.started());
            Assertions.assertEquals(1L, grant.attemptEpoch());
            Assertions.assertEquals(1, grant.attemptNumber());
            Assertions.assertFalse(store.tryBeginAttempt(id, true, NOW + 2L).started());

            LifecycleStore.TransitionResult forced = store.forceRetry(id, "hung", NOW + 3L);
            Assertions.assertTrue(forced.applied());
            Assertions.assertEquals(2L, forced.request().attemptEpoch());
            Assertions.assertEquals(0, forced.request().attemptCount());
            Assertions.assertEquals("operator force-retry: hung", forced.request().lastError());

            Assertions.assertEquals(LifecycleStore.TransitionOutcome.STALE,
                    store.completeWithRetry(id, grant.attemptEpoch(), retry("late failure", NOW + 4L)).outcome());
            Assertions.assertFalse(store.markAccepted(id, grant.attemptEpoch(), 1, NOW + 5L).applied());
            Assertions.assertFalse(store.finalizeSettled(id, grant.attemptEpoch(), NOW + 6L).applied());

            ResolutionRequest current = store.get(id).orElseThrow();
            Assertions.assertEquals(LifecycleState.WAITING_RETRY, current.state());
            Assertions.assertNull(current.acceptedRevision());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void settlementPathRunsThroughAcceptedAndSettled() throws Exception {
        Path root = Files.createTempDirectory("resolvemesh-test-settle-");
        try {
            LifecycleStore store = openStore(root);
            String id = store.observe(view(3L, "0xr"), NOW, NOW + 60_000L, NOW).request().requestId();
            long epoch = store.tryBeginAttempt(id, true, NOW).attemptEpoch();

            Assertions.assertTrue(store.markAccepted(id, epoch, 1, NOW + 1L).applied());
            Assertions.assertTrue(store.get(id).orElseThrow().isAccepted());

            SettlementRecord pending = store.insertPendingSettlement(id, "0xtx1", "1000", 7L, "abc", 1, NOW + 2L);
            Assertions.assertEquals(ConfirmationState.PENDING, pending.confirmationState());
            Assertions.assertThrows(IllegalStateException.class,
                    () -> store.insertPendingSettlement(id, "0xtx2", "1000", 8L, "abc", 1, NOW + 3L));
            Assertions.assertFalse(store.forceRetry(id, "operator", NOW + 3L).applied());

            Assertions.assertEquals(ConfirmationState.CONFIRMED, store.markSettlementConfirmed("0xtx1", NOW + 4L).confirmationState());
            Assertions.assertEquals("0xtx1", store.liveSettlement(id).orElseThrow().txHash());

            LifecycleStore.TransitionResult done = store.finalizeSettled(id, epoch, NOW + 5L);
            Assertions.assertTrue(done.applied());
            Assertions.assertEquals(Finalization.SETTLED, done.request().finalization());
            Assertions.assertEquals(epoch, done.request().attemptEpoch());
            Assertions.assertEquals(1, store.countByFinalization().get("SETTLED"));
            Assertions.assertEquals(0, store.countByFinalization().get("DEFAULTED"));
            Assertions.assertEquals(1, store.countByState().get("FINALIZED"));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void failedSettlementFreesTheSlotForAnotherTransaction() throws Exception {
        Path root = Files.createTempDirectory("resolvemesh-test-failed-tx-");
        try {
            LifecycleStore store = openStore(root);
            String id = store.observe(view(4L, "0xr"), NOW, NOW + 60_000L, NOW).request().requestId();
            store.insertPendingSettlement(id, "0xtx1", "0", 1L, "abc", 1, NOW);

            SettlementRecord failed = store.markSettlementFailed("0xtx1", "reverted: out of gas", NOW + 1L);
            Assertions.assertEquals(ConfirmationState.FAILED, failed.confirmationState());
            Assertions.assertEquals("reverted: out of gas", failed.error());
            Assertions.assertTrue(store.liveSettlement(id).isEmpty());

            store.insertPendingSettlement(id, "0xtx2", "0", 2L, "abc", 1, NOW + 2L);
            Assertions.assertEquals(2, store.settlements(id).size());
            Assertions.assertThrows(IllegalStateException.class, () -> store.markSettlementConfirmed("0xunknown", NOW));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void illegalFinalizationsAreRefused() throws Exception {
        Path root = Files.createTempDirectory("resolvemesh-test-illegal-");
        try {
            LifecycleStore store = openStore(root);
            String id = store.observe(view(5L, "0xr"), NOW, NOW + 60_000L, NOW).request().requestId();
            Assertions.assertThrows(IllegalTransitionException.class, () -> store.finalizeSettled(id, 0L, NOW));

            store.tryBeginAttempt(id, true, NOW);
            Assertions.assertThrows(IllegalTransitionException.class, () -> store.finalizeDefaulted(id, "late", NOW));
            Assertions.assertEquals(LifecycleState.RESOLVING, store.get(id).orElseThrow().state());

            store.completeWithRetry(id, 1L, retry("boom", NOW + 1L));
            Assertions.assertThrows(IllegalTransitionException.class,
                    () -> store.completeWithRetry(id, 1L, retry("again", NOW + 2L)));

            LifecycleStore.TransitionResult defaulted = store.finalizeDefaulted(id, "deadline passed", NOW + 3L);
            Assertions.assertTrue(defaulted.applied());
            Assertions.assertEquals(2L, defaulted.request().attemptEpoch());
            Assertions.assertEquals("deadline passed", defaulted.request().lastError());
            Assertions.assertFalse(store.finalizeExternal(id, "late", NOW + 4L).applied());
            Assertions.assertEquals("request already finalized",
                    store.recordOverride(id, Outcome.binary(Decision.TRUE), "x", NOW + 5L).message());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void overrideReschedulesWaitingRequestAndClearsOperatorFlag() throws Exception {
        Path root = Files.createTempDirectory("resolvemesh-test-override-");
        try {
            LifecycleStore store = openStore(root);
            String id = store.observe(view(6L, "0xr"), NOW, NOW + 60_000L, NOW).request().requestId();
            store.tryBeginAttempt(id, true, NOW);
            store.completeWithRetry(id, 1L, new LifecycleStore.RetryUpdate("unauthorized", FailureClass.AUTHORIZATION_PERMANENT,
                    NOW + 50_000L, true, true, NOW + 1L));
            Assertions.assertEquals(1, store.countNeedingOperator());

            LifecycleStore.TransitionResult out = store.recordOverride(id, Outcome.binary(Decision.FALSE), "manual", NOW + 2L);
            Assertions.assertTrue(out.applied());
            Assertions.assertFalse(out.request().needsOperator());
            Assertions.assertEquals(NOW + 2L, out.request().nextEligibleAtMs());
            Assertions.assertEquals(Outcome.binary(Decision.FALSE), out.request().overrideOutcome());
            Assertions.assertEquals(0, store.countNeedingOperator());

            LifecycleStore.AttemptGrant operator = store.tryBeginAttempt(id, false, NOW + 3L);
            Assertions.assertTrue(operator.started());
            Assertions.assertEquals(1, operator.attemptNumber());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void reclaimMovesResolvingRowsBackToWaiting() throws Exception {
        Path root = Files.createTempDirectory("resolvemesh-test-reclaim-");
        try {
            LifecycleStore store = openStore(root);
            String a = store.observe(view(7L, "0xr"), NOW, NOW + 60_000L, NOW).request().requestId();
            String b = store.observe(view(8L, "0xr"), NOW, NOW + 60_000L, NOW).request().requestId();
            store.tryBeginAttempt(a, true, NOW);

            Assertions.assertEquals(1, store.reclaimInterrupted(NOW + 10L));
            ResolutionRequest reclaimed = store.get(a).orElseThrow();
            Assertions.assertEquals(LifecycleState.WAITING_RETRY, reclaimed.state());
            Assertions.assertEquals("interrupted by restart", reclaimed.lastError());
            Assertions.assertEquals(FailureClass.TRANSIENT_INFRASTRUCTURE, reclaimed.lastErrorClass());
            Assertions.assertEquals(NOW + 10L, reclaimed.nextEligibleAtMs());
            Assertions.assertEquals(LifecycleState.SCHEDULED, store.get(b).orElseThrow().state());
            Assertions.assertEquals(0, store.reclaimInterrupted(NOW + 20L));
            Assertions.assertEquals(2, store.listActive().size());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void randomOperationSequencesOnlyRecordLegalTransitions() throws Exception {
        Path root = Files.createTempDirectory("resolvemesh-test-random-");
        try {
            LifecycleStore store = openStore(root);
            List<String> ids = new ArrayList<>();
            for (long i = 0; i < 3; i++) {
                ids.add(store.observe(view(100L + i, "0xr"), NOW, NOW + 60_000L, NOW).request().requestId());
            }
            Random random = new Random(42L);
            long now = NOW;
            for (int step = 0; step < 300; step++) {
                String id = ids.get(random.nextInt(ids.size()));
                ResolutionRequest current = store.get(id).orElseThrow();
                long epoch = random.nextInt(4) == 0 ? Math.max(0L, current.attemptEpoch() - 1L) : current.attemptEpoch();
                now++;
                try {
                    switch (random.nextInt(8)) {
                        case 0, 1 -> store.tryBeginAttempt(id, random.nextBoolean(), now);
                        case 2 -> store.completeWithRetry(id, epoch, retry("step " + step, now));
                        case 3 -> store.markAccepted(id, epoch, 1, now);
                        case 4 -> store.finalizeSettled(id, epoch, now);
                        case 5 -> store.finalizeDefaulted(id, "deadline", now);
                        case 6 -> store.forceRetry(id, "operator", now);
                        default -> {
                            if (random.nextInt(10) == 0) {
                                store.finalizeExternal(id, "elsewhere", now);
                            } else {
                                store.reclaimInterrupted(now);
                            }
                        }
                    }
                } catch (IllegalTransitionException refused) {
                    Assertions.assertNotNull(refused.getMessage());
                }
            }

            for (String id : ids) {
                List<LifecycleStore.TransitionRow> rows = store.transitions(id);
                Assertions.assertNull(rows.get(0).fromState());
                Assertions.assertEquals(LifecycleState.SCHEDULED, rows.get(0).toState());
                for (int i = 1; i < rows.size(); i++) {
                    LifecycleStore.TransitionRow row = rows.get(i);
                    Assertions.assertEquals(rows.get(i - 1).toState(), row.fromState(), "broken chain for " + id);
                    Assertions.assertTrue(LifecycleTransitions.isLegal(row.fromState(), row.toState(), row.finalization()),
                            "illegal edge " + row.fromState() + " -> " + row.toState());
                    Assertions.assertNotEquals(LifecycleState.FINALIZED, row.fromState());
                }
                Assertions.assertEquals(rows.get(rows.size() - 1).toState(), store.get(id).orElseThrow().state());
            }
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void concurrentBeginAndFinalizeHaveASingleWinner() throws Exception {
        Path root = Files.createTempDirectory("resolvemesh-test-contention-");
        ExecutorService pool = Executors.newFixedThreadPool(8);
        try {
            LifecycleStore store = openStore(root);
            String id = store.observe(view(9L, "0xr"), NOW, NOW + 60_000L, NOW).request().requestId();

            List<Boolean> begun = race(pool, 8, i -> store.tryBeginAttempt(id, true, NOW + i).started());
            Assertions.assertEquals(1, begun.stream().filter(Boolean::booleanValue).count());
            ResolutionRequest resolving = store.get(id).orElseThrow();
            Assertions.assertEquals(LifecycleState.RESOLVING, resolving.state());
            Assertions.assertEquals(1L, resolving.attemptEpoch());
            Assertions.assertEquals(1, resolving.attemptCount());

            List<Boolean> finalized = race(pool, 8, i -> (i % 2 == 0
                    ? store.finalizeSettled(id, 1L, NOW + 100L + i)
                    : store.finalizeExternal(id, "settled elsewhere", NOW + 100L + i)).applied());
            Assertions.assertEquals(1, finalized.stream().filter(Boolean::booleanValue).count());
            Assertions.assertEquals(LifecycleState.FINALIZED, store.get(id).orElseThrow().state());
            Assertions.assertEquals(3, store.transitions(id).size());
        } finally {
            pool.shutdownNow();
            deleteRecursively(root);
        }
    }

    private static List<Boolean> race(ExecutorService pool, int threads, IndexedCall call) throws Exception {
        CountDownLatch start = new CountDownLatch(1);
        List<Future<Boolean>> futures = new ArrayList<>();
        for (int i = 0; i < threads; i++) {
            int index = i;
            Callable<Boolean> task = () -> {
                start.await();
                return call.run(index);
            };
            futures.add(pool.submit(task));
        }
        start.countDown();
        List<Boolean> out = new ArrayList<>();
        for (Future<Boolean> future : futures) {
            out.add(future.get(30, TimeUnit.SECONDS));
        }
        return out;
    }

    private interface IndexedCall {
        boolean run(int index);
    }

    private static LifecycleStore openStore(Path root) {
        Database database = new Database(ResolveMeshConfig.fromRoot(root.toString()));
        database.init();
        return new LifecycleStore(database);
    }

    private static RequestView view(long timestamp, String requester) {
        return new RequestView("YES_OR_NO_QUERY", timestamp, "q: test " + timestamp, requester);
    }

    private static LifecycleStore.RetryUpdate retry(String error, long nowMs) {
        return new LifecycleStore.RetryUpdate(error, FailureClass.TRANSIENT_INFRASTRUCTURE, nowMs + 1_000L, false, false, nowMs);
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
