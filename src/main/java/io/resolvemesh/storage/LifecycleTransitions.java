package io.resolvemesh.storage;

import io.resolvemesh.exception.IllegalTransitionException;
import io.resolvemesh.model.Finalization;
import io.resolvemesh.model.LifecycleState;

import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Legal edges of the request state machine. {@code FINALIZED} is terminal.
 */
public final class LifecycleTransitions {
    private static final Map<LifecycleState, Set<LifecycleState>> EDGES = new EnumMap<>(LifecycleState.class);
    private static final Map<LifecycleState, Set<Finalization>> FINALIZATIONS = new EnumMap<>(LifecycleState.class);

    static {
        EDGES.put(LifecycleState.SCHEDULED, EnumSet.of(LifecycleState.RESOLVING, LifecycleState.FINALIZED));
        EDGES.put(LifecycleState.RESOLVING, EnumSet.of(LifecycleState.WAITING_RETRY, LifecycleState.FINALIZED));
        EDGES.put(LifecycleState.WAITING_RETRY, EnumSet.of(LifecycleState.RESOLVING, LifecycleState.FINALIZED));
        EDGES.put(LifecycleState.FINALIZED, EnumSet.noneOf(LifecycleState.class));

        // A deadline can pass before the first attempt was ever eligible to run.
        FINALIZATIONS.put(LifecycleState.SCHEDULED, EnumSet.of(Finalization.DEFAULTED, Finalization.EXTERNAL));
        FINALIZATIONS.put(LifecycleState.RESOLVING, EnumSet.of(Finalization.SETTLED, Finalization.EXTERNAL));
        FINALIZATIONS.put(LifecycleState.WAITING_RETRY, EnumSet.of(Finalization.DEFAULTED, Finalization.EXTERNAL));
        FINALIZATIONS.put(LifecycleState.FINALIZED, EnumSet.noneOf(Finalization.class));
    }

    private LifecycleTransitions() {
    }

    public static boolean isLegal(LifecycleState from, LifecycleState to, Finalization finalization) {
        if (from == null || to == null) {
            return false;
        }
        if (!EDGES.get(from).contains(to)) {
            return false;
        }
        if (to == LifecycleState.FINALIZED) {
            return finalization != null && FINALIZATIONS.get(from).contains(finalization);
        }
        return finalization == null;
    }

    public static void require(String requestId, LifecycleState from, LifecycleState to, Finalization finalization) {
        if (!isLegal(from, to, finalization)) {
            throw new IllegalTransitionException(requestId, from, to, finalization);
        }
    }
}
