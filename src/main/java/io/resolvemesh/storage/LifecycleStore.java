package io.resolvemesh.storage;

import io.resolvemesh.model.ConfirmationState;
import io.resolvemesh.model.Decision;
import io.resolvemesh.model.FailureClass;
import io.resolvemesh.model.Finalization;
import io.resolvemesh.model.LifecycleState;
import io.resolvemesh.model.Outcome;
import io.resolvemesh.model.RequestView;
import io.resolvemesh.model.ResolutionRequest;
import io.resolvemesh.model.SettlementRecord;

import java.math.BigDecimal;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Single writer of request lifecycle state. Every state change is a conditional update inside a
 * SQLite transaction, fenced by {@code attempt_epoch}, and appended to {@code state_transitions}.
 */
public final class LifecycleStore {
    private static final int LOCK_STRIPES = 64;
    private static final String REQUEST_COLUMNS = """
            request_id,identifier,request_timestamp,ancillary_data,requester,earliest_resolve_at_ms,deadline_at_ms,
            state,finalization,attempt_count,attempt_epoch,last_error,last_error_class,last_attempt_at_ms,
            next_eligible_at_ms,needs_operator,accepted_revision,override_decision,override_value,override_reason,
            created_at_ms,updated_at_ms""";
    private static final String SETTLEMENT_COLUMNS = """
            id,request_id,tx_hash,submitted_price,nonce,evidence_hash,evidence_revision,confirmation_state,error,
            confirmation_waits,submitted_at_ms,updated_at_ms""";

    private final Database database;
    private final Object[] locks;

    public LifecycleStore(Database database) {
        this.database = Objects.requireNonNull(database, "database");
        this.locks = new Object[LOCK_STRIPES];
        for (int i = 0; i < LOCK_STRIPES; i++) {
            locks[i] = new Object();
        }
    }

    public ObserveResult observe(RequestView view, long earliestResolveAtMs, long deadlineAtMs, long nowMs) {
        String requestId = view.requestId();
        synchronized (lockFor(requestId)) {
            try (Connection c = database.openConnection()) {
                c.setAutoCommit(false);
                try {
                    ResolutionRequest existing = readRequest(c, requestId);
                    if (existing == null) {
                        try (PreparedStatement ps = c.prepareStatement("""
                                INSERT INTO requests(request_id,identifier,request_timestamp,ancillary_data,requester,
                                    earliest_resolve_at_ms,deadline_at_ms,state,attempt_count,attempt_epoch,needs_operator,
                                    created_at_ms,updated_at_ms)
                                VALUES(?,?,?,?,?,?,?,?,0,0,0,?,?)
                                """)) {
                            ps.setString(1, requestId);
                            ps.setString(2, view.identifier());
                            ps.setLong(3, view.requestTimestamp());
                            ps.setString(4, view.ancillaryData() == null ? "" : view.ancillaryData());
                            ps.setString(5, view.requester());
                            ps.setLong(6, earliestResolveAtMs);
                            ps.setLong(7, deadlineAtMs);
                            ps.setString(8, LifecycleState.SCHEDULED.name());
                            ps.setLong(9, nowMs);
                            ps.setLong(10, nowMs);
                            ps.executeUpdate();
                        }
                        appendTransition(c, requestId, null, LifecycleState.SCHEDULED, null, 0L, "observed", nowMs);
                        c.commit();
                        return new ObserveResult(ObserveKind.NEW, readRequestOrThrow(requestId));
                    }
                    if (existing.state().isTerminal()) {
                        c.commit();
                        return new ObserveResult(ObserveKind.TERMINAL, existing);
                    }
                    boolean changed = existing.earliestResolveAtMs() != earliestResolveAtMs
                            || existing.deadlineAtMs() != deadlineAtMs
                            || !Objects.equals(existing.requester(), view.requester());
                    if (!changed) {
                        c.commit();
                        return new ObserveResult(ObserveKind.UNCHANGED, existing);
                    }
                    try (PreparedStatement ps = c.prepareStatement(
                            "UPDATE requests SET earliest_resolve_at_ms=?,deadline_at_ms=?,requester=?,updated_at_ms=? WHERE request_id=? AND state<>?")) {
                        ps.setLong(1, earliestResolveAtMs);
                        ps.setLong(2, deadlineAtMs);
                        ps.setString(3, view.requester());
                        ps.setLong(4, nowMs);
                        ps.setString(5, requestId);
                        ps.setString(6, LifecycleState.FINALIZED.name());
                        ps.executeUpdate();
                    }
                    c.commit();
                    return new ObserveResult(ObserveKind.CHANGED, readRequestOrThrow(requestId));
                } catch (SQLException | RuntimeException e) {
                    c.rollback();
                    throw e;
                } finally {
                    c.setAutoCommit(true);
                }
            } catch (SQLException e) {
                throw new RuntimeException("Failed to record observed request", e);
            }
        }
    }

    public Optional<ResolutionRequest> get(String requestId) {
        try (Connection c = database.openConnection()) {
            return Optional.ofNullable(readRequest(c, requestId));
        } catch (SQLException e) {
            throw new RuntimeException("Failed to load request", e);
        }
    }

    public List<ResolutionRequest> list(LifecycleState state, int limit) {
        String sql = state == null
                ? "SELECT " + REQUEST_COLUMNS + " FROM requests ORDER BY updated_at_ms DESC LIMIT ?"
                : "SELECT " + REQUEST_COLUMNS + " FROM requests WHERE state=? ORDER BY updated_at_ms DESC LIMIT ?";
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            int idx = 1;
            if (state != null) {
                ps.setString(idx++, state.name());
            }
            ps.setInt(idx, Math.max(1, limit));
            return readRequests(ps);
        } catch (SQLException e) {
            throw new RuntimeException("Failed to list requests", e);
        }
    }

    public List<ResolutionRequest> listActive() {
        try (Connection c = database.openConnection();
             PreparedStatement ps = c.prepareStatement(
                     "SELECT " + REQUEST_COLUMNS + " FROM requests WHERE state<>? ORDER BY earliest_resolve_at_ms ASC")) {
            ps.setString(1, LifecycleState.FINALIZED.name());
            return readRequests(ps);
        } catch (SQLException e) {
            throw new RuntimeException("Failed to list active requests", e);
        }
    }

    public AttemptGrant tryBeginAttempt(String requestId, boolean countsAsAttempt, long nowMs) {
        synchronized (lockFor(requestId)) {
            try (Connection c = database.openConnection()) {
                c.setAutoCommit(false);
                try {
                    ResolutionRequest row = readRequest(c, requestId);
                    if (row == null
                            || (row.state() != LifecycleState.SCHEDULED && row.state() != LifecycleState.WAITING_RETRY)) {
                        c.commit();
                        return AttemptGrant.conflict(row);
                    }
                    LifecycleTransitions.require(requestId, row.state(), LifecycleState.RESOLVING, null);
                    long epoch = row.attemptEpoch() + 1L;
                    int attempts = row.attemptCount() + (countsAsAttempt ? 1 : 0);
                    try (PreparedStatement ps = c.prepareStatement("""
                            UPDATE requests SET state=?,attempt_epoch=?,attempt_count=?,
                                last_attempt_at_ms=CASE WHEN ? THEN ? ELSE last_attempt_at_ms END,
                                next_eligible_at_ms=NULL,updated_at_ms=?
                            WHERE request_id=? AND state=? AND attempt_epoch=?
                            """)) {
                        ps.setString(1, LifecycleState.RESOLVING.name());
                        ps.setLong(2, epoch);
                        ps.setInt(3, attempts);
                        ps.setBoolean(4, countsAsAttempt);
                        ps.setLong(5, nowMs);
                        ps.setLong(6, nowMs);
                        ps.setString(7, requestId);
                        ps.setString(8, row.state().name());
                        ps.setLong(9, row.attemptEpoch());
                        if (ps.executeUpdate() == 0) {
                            c.commit();
                            return AttemptGrant.conflict(row);
                        }
                    }
                    appendTransition(c, requestId, row.state(), LifecycleState.RESOLVING, null, epoch,
                            countsAsAttempt ? "attempt " + attempts : "settlement resume", nowMs);
                    c.commit();
                    return AttemptGrant.granted(epoch, attempts, readRequestOrThrow(requestId));
                } catch (SQLException | RuntimeException e) {
                    c.rollback();
                    throw e;
                } finally {
                    c.setAutoCommit(true);
                }
            } catch (SQLException e) {
                throw new RuntimeException("Failed to begin attempt", e);
            }
        }
    }

    public TransitionResult completeWithRetry(String requestId, long attemptEpoch, RetryUpdate update) {
        synchronized (lockFor(requestId)) {
            try (Connection c = database.openConnection()) {
                c.setAutoCommit(false);
                try {
                    ResolutionRequest row = readRequest(c, requestId);
                    if (isStale(row, attemptEpoch)) {
                        c.commit();
                        return TransitionResult.stale(row);
                    }
                    LifecycleTransitions.require(requestId, row.state(), LifecycleState.WAITING_RETRY, null);
                    try (PreparedStatement ps = c.prepareStatement("""
                            UPDATE requests SET state=?,last_error=?,last_error_class=?,next_eligible_at_ms=?,
                                needs_operator=?,
                                accepted_revision=CASE WHEN ? THEN NULL ELSE accepted_revision END,
                                updated_at_ms=?
                            WHERE request_id=? AND state=? AND attempt_epoch=?
                            """)) {
                        ps.setString(1, LifecycleState.WAITING_RETRY.name());
                        ps.setString(2, update.error());
                        ps.setString(3, update.failureClass() == null ? null : update.failureClass().name());
                        ps.setLong(4, update.nextEligibleAtMs());
                        ps.setInt(5, update.needsOperator() ? 1 : 0);
                        ps.setBoolean(6, update.clearAccepted());
                        ps.setLong(7, update.nowMs());
                        ps.setString(8, requestId);
                        ps.setString(9, row.state().name());
                        ps.setLong(10, attemptEpoch);
                        if (ps.executeUpdate() == 0) {
                            c.commit();
                            return TransitionResult.stale(row);
                        }
                    }
                    appendTransition(c, requestId, row.state(), LifecycleState.WAITING_RETRY, null, attemptEpoch,
                            update.error(), update.nowMs());
                    c.commit();
                    return TransitionResult.applied(readRequestOrThrow(requestId));
                } catch (SQLException | RuntimeException e) {
                    c.rollback();
                    throw e;
                } finally {
                    c.setAutoCommit(true);
                }
            } catch (SQLException e) {
                throw new RuntimeException("Failed to schedule retry", e);
            }
        }
    }

    public TransitionResult markAccepted(String requestId, long attemptEpoch, int evidenceRevision, long nowMs) {
        synchronized (lockFor(requestId)) {
            try (Connection c = database.openConnection();
                 PreparedStatement ps = c.prepareStatement("""
                         UPDATE requests SET accepted_revision=?,last_error=NULL,last_error_class=NULL,updated_at_ms=?
                         WHERE request_id=? AND state=? AND attempt_epoch=?
                         """)) {
                ps.setInt(1, evidenceRevision);
                ps.setLong(2, nowMs);
                ps.setString(3, requestId);
                ps.setString(4, LifecycleState.RESOLVING.name());
                ps.setLong(5, attemptEpoch);
                int updated = ps.executeUpdate();
                ResolutionRequest row = readRequest(c, requestId);
                return updated == 0 ? TransitionResult.stale(row) : TransitionResult.applied(row);
            } catch (SQLException e) {
                throw new RuntimeException("Failed to mark accepted", e);
            }
        }
    }

    public TransitionResult finalizeSettled(String requestId, long attemptEpoch, long nowMs) {
        return finalizeRequest(requestId, attemptEpoch, Finalization.SETTLED, "settlement confirmed", nowMs);
    }

    public TransitionResult finalizeDefaulted(String requestId, String reason, long nowMs) {
        return finalizeRequest(requestId, null, Finalization.DEFAULTED, reason, nowMs);
    }

    public TransitionResult finalizeExternal(String requestId, String reason, long nowMs) {
        return finalizeRequest(requestId, null, Finalization.EXTERNAL, reason, nowMs);
    }

    private TransitionResult finalizeRequest(String requestId, Long expectedEpoch, Finalization finalization,
                                             String reason, long nowMs) {
        synchronized (lockFor(requestId)) {
            try (Connection c = database.openConnection()) {
                c.setAutoCommit(false);
                try {
                    ResolutionRequest row = readRequest(c, requestId);
                    if (row == null || row.state().isTerminal()
                            || (expectedEpoch != null && row.attemptEpoch() != expectedEpoch)) {
                        c.commit();
                        return TransitionResult.stale(row);
                    }
                    LifecycleTransitions.require(requestId, row.state(), LifecycleState.FINALIZED, finalization);
                    // Settled keeps its epoch; other finalizations fence any attempt still in flight.
                    long epoch = finalization == Finalization.SETTLED ? row.attemptEpoch() : row.attemptEpoch() + 1L;
                    try (PreparedStatement ps = c.prepareStatement("""
                            UPDATE requests SET state=?,finalization=?,attempt_epoch=?,next_eligible_at_ms=NULL,
                                needs_operator=0,last_error=CASE WHEN ? THEN last_error ELSE ? END,updated_at_ms=?
                            WHERE request_id=? AND state=? AND attempt_epoch=?
                            """)) {
                        ps.setString(1, LifecycleState.FINALIZED.name());
                        ps.setString(2, finalization.name());
                        ps.setLong(3, epoch);
                        ps.setBoolean(4, finalization == Finalization.SETTLED);
                        ps.setString(5, reason);
                        ps.setLong(6, nowMs);
                        ps.setString(7, requestId);
                        ps.setString(8, row.state().name());
                        ps.setLong(9, row.attemptEpoch());
                        if (ps.executeUpdate() == 0) {
                            c.commit();
                            return TransitionResult.stale(row);
                        }
                    }
                    appendTransition(c, requestId, row.state(), LifecycleState.FINALIZED, finalization, epoch, reason, nowMs);
                    c.commit();
                    return TransitionResult.applied(readRequestOrThrow(requestId));
                } catch (SQLException | RuntimeException e) {
                    c.rollback();
                    throw e;
                } finally {
                    c.setAutoCommit(true);
                }
            } catch (SQLException e) {
                throw new RuntimeException("Failed to finalize request", e);
            }
        }
    }

    public TransitionResult forceRetry(String requestId, String reason, long nowMs) {
        synchronized (lockFor(requestId)) {
            try (Connection c = database.openConnection()) {
                c.setAutoCommit(false);
                try {
                    ResolutionRequest row = readRequest(c, requestId);
                    if (row == null) {
                        c.commit();
                        return TransitionResult.rejected(null, "unknown request: " + requestId);
                    }
                    if (row.state() != LifecycleState.RESOLVING && row.state() != LifecycleState.WAITING_RETRY) {
                        c.commit();
                        return TransitionResult.rejected(row, "force-retry not allowed in state " + row.state());
                    }
                    SettlementRecord live = readLiveSettlement(c, requestId);
                    if (live != null && live.confirmationState() == ConfirmationState.PENDING) {
                        c.commit();
                        return TransitionResult.rejected(row, "settlement transaction pending: " + live.txHash());
                    }
                    String error = "operator force-retry: " + (reason == null || reason.isBlank() ? "no reason" : reason.trim());
                    long epoch = row.attemptEpoch() + 1L;
                    try (PreparedStatement ps = c.prepareStatement("""
                            UPDATE requests SET state=?,attempt_epoch=?,attempt_count=0,next_eligible_at_ms=?,
                                needs_operator=0,last_error=?,updated_at_ms=?
                            WHERE request_id=? AND state=? AND attempt_epoch=?
                            """)) {
                        ps.setString(1, LifecycleState.WAITING_RETRY.name());
                        ps.setLong(2, epoch);
                        ps.setLong(3, nowMs);
                        ps.setString(4, error);
                        ps.setLong(5, nowMs);
                        ps.setString(6, requestId);
                        ps.setString(7, row.state().name());
                        ps.setLong(8, row.attemptEpoch());
                        if (ps.executeUpdate() == 0) {
                            c.commit();
                            return TransitionResult.stale(row);
                        }
                    }
                    if (row.state() == LifecycleState.RESOLVING) {
                        LifecycleTransitions.require(requestId, row.state(), LifecycleState.WAITING_RETRY, null);
                        appendTransition(c, requestId, row.state(), LifecycleState.WAITING_RETRY, null, epoch, error, nowMs);
                    }
                    c.commit();
                    return TransitionResult.applied(readRequestOrThrow(requestId));
                } catch (SQLException | RuntimeException e) {
                    c.rollback();
                    throw e;
                } finally {
                    c.setAutoCommit(true);
                }
            } catch (SQLException e) {
                throw new RuntimeException("Failed to force retry", e);
            }
        }
    }

    public TransitionResult recordOverride(String requestId, Outcome outcome, String reason, long nowMs) {
        Objects.requireNonNull(outcome, "outcome");
        synchronized (lockFor(requestId)) {
            try (Connection c = database.openConnection();
                 PreparedStatement ps = c.prepareStatement("""
                         UPDATE requests SET override_decision=?,override_value=?,override_reason=?,needs_operator=0,
                             next_eligible_at_ms=CASE WHEN state=? THEN ? ELSE next_eligible_at_ms END,updated_at_ms=?
                         WHERE request_id=? AND state<>?
                         """)) {
                ps.setString(1, outcome.decision().name());
                ps.setString(2, outcome.value() == null ? null : outcome.value().toPlainString());
                ps.setString(3, reason);
                ps.setString(4, LifecycleState.WAITING_RETRY.name());
                ps.setLong(5, nowMs);
                ps.setLong(6, nowMs);
                ps.setString(7, requestId);
                ps.setString(8, LifecycleState.FINALIZED.name());
                int updated = ps.executeUpdate();
                ResolutionRequest row = readRequest(c, requestId);
                if (updated == 0) {
                    return TransitionResult.rejected(row, row == null
                            ? "unknown request: " + requestId
                            : "request already finalized");
                }
                return TransitionResult.applied(row);
            } catch (SQLException e) {
                throw new RuntimeException("Failed to record operator outcome", e);
            }
        }
    }

    /**
     * Moves requests left in {@code RESOLVING} by a previous process to {@code WAITING_RETRY}.
     */
    public int reclaimInterrupted(long nowMs) {
        List<ResolutionRequest> resolving = list(LifecycleState.RESOLVING, Integer.MAX_VALUE);
        int reclaimed = 0;
        for (ResolutionRequest row : resolving) {
            TransitionResult out = completeWithRetry(row.requestId(), row.attemptEpoch(), new RetryUpdate(
                    "interrupted by restart",
                    FailureClass.TRANSIENT_INFRASTRUCTURE,
                    nowMs,
                    row.needsOperator(),
                    false,
                    nowMs
            ));
            if (out.applied()) {
                reclaimed++;
            }
        }
        return reclaimed;
    }

    public List<TransitionRow> transitions(String requestId) {
        try (Connection c = database.openConnection();
             PreparedStatement ps = c.prepareStatement("""
                     SELECT id,request_id,from_state,to_state,finalization,attempt_epoch,reason,occurred_at_ms
                     FROM state_transitions WHERE request_id=? ORDER BY id ASC
                     """)) {
            ps.setString(1, requestId);
            List<TransitionRow> out = new ArrayList<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    String from = rs.getString("from_state");
                    String fin = rs.getString("finalization");
                    out.add(new TransitionRow(
                            rs.getLong("id"),
                            rs.getString("request_id"),
                            from == null ? null : LifecycleState.valueOf(from),
                            LifecycleState.valueOf(rs.getString("to_state")),
                            fin == null ? null : Finalization.valueOf(fin),
                            rs.getLong("attempt_epoch"),
                            rs.getString("reason"),
                            rs.getLong("occurred_at_ms")
                    ));
                }
            }
            return out;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to load transitions", e);
        }
    }

    public Map<String, Integer> countByState() {
        Map<String, Integer> out = new LinkedHashMap<>();
        for (LifecycleState state : LifecycleState.values()) {
            out.put(state.name(), 0);
        }
        countGrouped("SELECT state AS k, COUNT(1) AS c FROM requests GROUP BY state", out);
        return out;
    }

    public Map<String, Integer> countByFinalization() {
        Map<String, Integer> out = new LinkedHashMap<>();
        for (Finalization f : Finalization.values()) {
            out.put(f.name(), 0);
        }
        countGrouped("SELECT finalization AS k, COUNT(1) AS c FROM requests WHERE finalization IS NOT NULL GROUP BY finalization", out);
        return out;
    }

    public int countNeedingOperator() {
        try (Connection c = database.openConnection();
             PreparedStatement ps = c.prepareStatement("SELECT COUNT(1) FROM requests WHERE needs_operator=1 AND state<>?")) {
            ps.setString(1, LifecycleState.FINALIZED.name());
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? rs.getInt(1) : 0;
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to count operator queue", e);
        }
    }

    private void countGrouped(String sql, Map<String, Integer> out) {
        try (Connection c = database.openConnection();
             PreparedStatement ps = c.prepareStatement(sql);
             ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                out.put(rs.getString("k"), rs.getInt("c"));
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to count requests", e);
        }
    }

    public Optional<SettlementRecord> liveSettlement(String requestId) {
        try (Connection c = database.openConnection()) {
            return Optional.ofNullable(readLiveSettlement(c, requestId));
        } catch (SQLException e) {
            throw new RuntimeException("Failed to load settlement", e);
        }
    }

    public List<SettlementRecord> settlements(String requestId) {
        try (Connection c = database.openConnection();
             PreparedStatement ps = c.prepareStatement(
                     "SELECT " + SETTLEMENT_COLUMNS + " FROM settlements WHERE request_id=? ORDER BY id ASC")) {
            ps.setString(1, requestId);
            List<SettlementRecord> out = new ArrayList<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(mapSettlement(rs));
                }
            }
            return out;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to list settlements", e);
        }
    }

    public SettlementRecord insertPendingSettlement(String requestId, String txHash, String price, long nonce,
                                                    String evidenceHash, int evidenceRevision, long nowMs) {
        synchronized (lockFor(requestId)) {
            try (Connection c = database.openConnection()) {
                c.setAutoCommit(false);
                try {
                    SettlementRecord live = readLiveSettlement(c, requestId);
                    if (live != null) {
                        throw new IllegalStateException("Live settlement already exists for " + requestId + ": " + live.txHash());
                    }
                    // A FAILED row with the same hash is the same signed transaction being sent again.
                    try (PreparedStatement ps = c.prepareStatement("""
                            INSERT INTO settlements(request_id,tx_hash,submitted_price,nonce,evidence_hash,evidence_revision,
                                confirmation_state,submitted_at_ms,updated_at_ms)
                            VALUES(?,?,?,?,?,?,?,?,?)
                            ON CONFLICT(tx_hash) DO UPDATE SET
                                confirmation_state=excluded.confirmation_state,
                                error=NULL,
                                confirmation_waits=0,
                                submitted_at_ms=excluded.submitted_at_ms,
                                updated_at_ms=excluded.updated_at_ms
                            WHERE settlements.confirmation_state='FAILED' AND settlements.request_id=excluded.request_id
                            """)) {
                        ps.setString(1, requestId);
                        ps.setString(2, txHash);
                        ps.setString(3, price);
                        ps.setLong(4, nonce);
                        ps.setString(5, evidenceHash);
                        ps.setInt(6, evidenceRevision);
                        ps.setString(7, ConfirmationState.PENDING.name());
                        ps.setLong(8, nowMs);
                        ps.setLong(9, nowMs);
                        ps.executeUpdate();
                    }
                    SettlementRecord inserted = readLiveSettlement(c, requestId);
                    if (inserted == null || !inserted.txHash().equals(txHash)) {
                        throw new IllegalStateException("Settlement transaction " + txHash + " belongs to another request");
                    }
                    c.commit();
                    return inserted;
                } catch (SQLException | RuntimeException e) {
                    c.rollback();
                    throw e;
                } finally {
                    c.setAutoCommit(true);
                }
            } catch (SQLException e) {
                throw new RuntimeException("Failed to record pending settlement", e);
            }
        }
    }

    /**
     * Counts one confirmation wait that ended without a receipt. Only PENDING rows are counted.
     */
    public SettlementRecord recordConfirmationWait(String txHash, long nowMs) {
        try (Connection c = database.openConnection()) {
            try (PreparedStatement ps = c.prepareStatement(
                    "UPDATE settlements SET confirmation_waits=confirmation_waits+1,updated_at_ms=? WHERE tx_hash=? AND confirmation_state=?")) {
                ps.setLong(1, nowMs);
                ps.setString(2, txHash);
                ps.setString(3, ConfirmationState.PENDING.name());
                ps.executeUpdate();
            }
            return readSettlementByHash(c, txHash);
        } catch (SQLException e) {
            throw new RuntimeException("Failed to record confirmation wait", e);
        }
    }

    public SettlementRecord markSettlementConfirmed(String txHash, long nowMs) {
        return closeSettlement(txHash, ConfirmationState.CONFIRMED, null, nowMs);
    }

    public SettlementRecord markSettlementFailed(String txHash, String error, long nowMs) {
        return closeSettlement(txHash, ConfirmationState.FAILED, error, nowMs);
    }

    private SettlementRecord closeSettlement(String txHash, ConfirmationState target, String error, long nowMs) {
        try (Connection c = database.openConnection()) {
            try (PreparedStatement ps = c.prepareStatement(
                    "UPDATE settlements SET confirmation_state=?,error=?,updated_at_ms=? WHERE tx_hash=? AND confirmation_state=?")) {
                ps.setString(1, target.name());
                ps.setString(2, error);
                ps.setLong(3, nowMs);
                ps.setString(4, txHash);
                ps.setString(5, ConfirmationState.PENDING.name());
                ps.executeUpdate();
            }
            return readSettlementByHash(c, txHash);
        } catch (SQLException e) {
            throw new RuntimeException("Failed to update settlement", e);
        }
    }

    private SettlementRecord readSettlementByHash(Connection c, String txHash) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement(
                "SELECT " + SETTLEMENT_COLUMNS + " FROM settlements WHERE tx_hash=?")) {
            ps.setString(1, txHash);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) {
                    throw new IllegalStateException("Unknown settlement transaction: " + txHash);
                }
                return mapSettlement(rs);
            }
        }
    }

    public void recordClockSync(long offsetMs, long syncedAtMs, long authoritativeMs, String proof, long nowMs) {
        try (Connection c = database.openConnection();
             PreparedStatement ps = c.prepareStatement(
                     "INSERT INTO clock_anchor(offset_ms,synced_at_ms,authoritative_ms,proof,recorded_at_ms) VALUES(?,?,?,?,?)")) {
            ps.setLong(1, offsetMs);
            ps.setLong(2, syncedAtMs);
            ps.setLong(3, authoritativeMs);
            ps.setString(4, proof);
            ps.setLong(5, nowMs);
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new RuntimeException("Failed to record clock sync", e);
        }
    }

    public Optional<ClockSyncRow> lastClockSync() {
        try (Connection c = database.openConnection();
             PreparedStatement ps = c.prepareStatement(
                     "SELECT offset_ms,synced_at_ms,authoritative_ms,proof,recorded_at_ms FROM clock_anchor ORDER BY id DESC LIMIT 1");
             ResultSet rs = ps.executeQuery()) {
            if (!rs.next()) {
                return Optional.empty();
            }
            return Optional.of(new ClockSyncRow(
                    rs.getLong("offset_ms"),
                    rs.getLong("synced_at_ms"),
                    rs.getLong("authoritative_ms"),
                    rs.getString("proof"),
                    rs.getLong("recorded_at_ms")
            ));
        } catch (SQLException e) {
            throw new RuntimeException("Failed to load clock sync", e);
        }
    }

    private Object lockFor(String requestId) {
        return locks[Math.floorMod(requestId == null ? 0 : requestId.hashCode(), LOCK_STRIPES)];
    }

    private static boolean isStale(ResolutionRequest row, long expectedEpoch) {
        return row == null || row.state().isTerminal() || row.attemptEpoch() != expectedEpoch;
    }

    private void appendTransition(Connection c, String requestId, LifecycleState from, LifecycleState to,
                                  Finalization finalization, long epoch, String reason, long nowMs) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement("""
                INSERT INTO state_transitions(request_id,from_state,to_state,finalization,attempt_epoch,reason,occurred_at_ms)
                VALUES(?,?,?,?,?,?,?)
                """)) {
            ps.setString(1, requestId);
            ps.setString(2, from == null ? null : from.name());
            ps.setString(3, to.name());
            ps.setString(4, finalization == null ? null : finalization.name());
            ps.setLong(5, epoch);
            ps.setString(6, reason);
            ps.setLong(7, nowMs);
            ps.executeUpdate();
        }
    }

    private ResolutionRequest readRequestOrThrow(String requestId) {
        return get(requestId).orElseThrow(() -> new IllegalStateException("Request vanished: " + requestId));
    }

    private ResolutionRequest readRequest(Connection c, String requestId) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement("SELECT " + REQUEST_COLUMNS + " FROM requests WHERE request_id=?")) {
            ps.setString(1, requestId);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? mapRequest(rs) : null;
            }
        }
    }

    private List<ResolutionRequest> readRequests(PreparedStatement ps) throws SQLException {
        List<ResolutionRequest> out = new ArrayList<>();
        try (ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                out.add(mapRequest(rs));
            }
        }
        return out;
    }

    private SettlementRecord readLiveSettlement(Connection c, String requestId) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement(
                "SELECT " + SETTLEMENT_COLUMNS + " FROM settlements WHERE request_id=? AND confirmation_state IN (?,?) ORDER BY id DESC LIMIT 1")) {
            ps.setString(1, requestId);
            ps.setString(2, ConfirmationState.PENDING.name());
            ps.setString(3, ConfirmationState.CONFIRMED.name());
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? mapSettlement(rs) : null;
            }
        }
    }

    private static ResolutionRequest mapRequest(ResultSet rs) throws SQLException {
        String finalization = rs.getString("finalization");
        String errorClass = rs.getString("last_error_class");
        String overrideDecision = rs.getString("override_decision");
        String overrideValue = rs.getString("override_value");
        return new ResolutionRequest(
                rs.getString("request_id"),
                rs.getString("identifier"),
                rs.getLong("request_timestamp"),
                rs.getString("ancillary_data"),
                rs.getString("requester"),
                rs.getLong("earliest_resolve_at_ms"),
                rs.getLong("deadline_at_ms"),
                LifecycleState.valueOf(rs.getString("state")),
                finalization == null ? null : Finalization.valueOf(finalization),
                rs.getInt("attempt_count"),
                rs.getLong("attempt_epoch"),
                rs.getString("last_error"),
                errorClass == null ? null : FailureClass.valueOf(errorClass),
                nullableLong(rs, "last_attempt_at_ms"),
                nullableLong(rs, "next_eligible_at_ms"),
                rs.getInt("needs_operator") == 1,
                nullableInt(rs, "accepted_revision"),
                overrideDecision == null ? null : Decision.valueOf(overrideDecision),
                overrideValue == null ? null : new BigDecimal(overrideValue),
                rs.getString("override_reason"),
                rs.getLong("created_at_ms"),
                rs.getLong("updated_at_ms")
        );
    }

    private static SettlementRecord mapSettlement(ResultSet rs) throws SQLException {
        return new SettlementRecord(
                rs.getLong("id"),
                rs.getString("request_id"),
                rs.getString("tx_hash"),
                rs.getString("submitted_price"),
                rs.getLong("nonce"),
                rs.getString("evidence_hash"),
                rs.getInt("evidence_revision"),
                ConfirmationState.valueOf(rs.getString("confirmation_state")),
                rs.getString("error"),
                rs.getInt("confirmation_waits"),
                rs.getLong("submitted_at_ms"),
                rs.getLong("updated_at_ms")
        );
    }

    private static Long nullableLong(ResultSet rs, String column) throws SQLException {
        long value = rs.getLong(column);
        return rs.wasNull() ? null : value;
    }

    private static Integer nullableInt(ResultSet rs, String column) throws SQLException {
        int value = rs.getInt(column);
        return rs.wasNull() ? null : value;
    }

    public enum ObserveKind { NEW, UNCHANGED, CHANGED, TERMINAL }
    public record ObserveResult(ObserveKind kind, ResolutionRequest request) {}
    public record RetryUpdate(String error, FailureClass failureClass, long nextEligibleAtMs, boolean needsOperator,
                              boolean clearAccepted, long nowMs) {}
    public record AttemptGrant(boolean started, long attemptEpoch, int attemptNumber, ResolutionRequest request) {
        public static AttemptGrant granted(long attemptEpoch, int attemptNumber, ResolutionRequest request) {
            return new AttemptGrant(true, attemptEpoch, attemptNumber, request);
        }

        public static AttemptGrant conflict(ResolutionRequest current) {
            return new AttemptGrant(false, 0L, 0, current);
        }
    }
    public enum TransitionOutcome { APPLIED, STALE, REJECTED }
    public record TransitionResult(TransitionOutcome outcome, ResolutionRequest request, String message) {
        public static TransitionResult applied(ResolutionRequest request) {
            return new TransitionResult(TransitionOutcome.APPLIED, request, null);
        }

        public static TransitionResult stale(ResolutionRequest current) {
            return new TransitionResult(TransitionOutcome.STALE, current, "stale attempt epoch or terminal state");
        }

        public static TransitionResult rejected(ResolutionRequest current, String message) {
            return new TransitionResult(TransitionOutcome.REJECTED, current, message);
        }

        public boolean applied() {
            return outcome == TransitionOutcome.APPLIED;
        }
    }
    public record TransitionRow(long id, String requestId, LifecycleState fromState, LifecycleState toState,
                                Finalization finalization, long attemptEpoch, String reason, long occurredAtMs) {}
    public record ClockSyncRow(long offsetMs, long syncedAtMs, long authoritativeMs, String proof, long recordedAtMs) {}
}
