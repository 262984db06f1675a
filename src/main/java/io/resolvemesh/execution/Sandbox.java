package io.resolvemesh.execution;

import io.resolvemesh.exception.SandboxUnavailableException;

/**
 * Opaque code-execution service. Isolation (filesystem, network beyond the allow-list) is the
 * implementation's responsibility.
 */
public interface Sandbox {
    SandboxResult execute(SandboxJob job) throws SandboxUnavailableException;
}
