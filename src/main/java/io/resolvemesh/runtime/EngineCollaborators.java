package io.resolvemesh.runtime;

import io.resolvemesh.chain.OracleChain;
import io.resolvemesh.chain.ResolverAuthorization;
import io.resolvemesh.clock.TimeSource;
import io.resolvemesh.execution.CodeGenerator;
import io.resolvemesh.execution.Sandbox;
import io.resolvemesh.execution.TemplateRegistry;

import java.time.Clock;
import java.util.Objects;
import java.util.concurrent.Executor;

/**
 * External services the engine drives. {@code codeGenerator} may be null when only templates are used;
 * {@code templates} null means load from the data root; null executors mean engine-owned pools.
 */
public record EngineCollaborators(
        OracleChain chain,
        ResolverAuthorization authorization,
        TimeSource timeSource,
        Sandbox sandbox,
        CodeGenerator codeGenerator,
        TemplateRegistry templates,
        Clock clock,
        Executor workers,
        Executor settlementWorkers
) {
    public EngineCollaborators {
        Objects.requireNonNull(chain, "chain");
        Objects.requireNonNull(authorization, "authorization");
        Objects.requireNonNull(timeSource, "timeSource");
        Objects.requireNonNull(sandbox, "sandbox");
        clock = clock == null ? Clock.systemUTC() : clock;
    }

    public static EngineCollaborators of(OracleChain chain, ResolverAuthorization authorization, TimeSource timeSource,
                                         Sandbox sandbox, CodeGenerator codeGenerator) {
        return new EngineCollaborators(chain, authorization, timeSource, sandbox, codeGenerator, null, null, null, null);
    }
}
