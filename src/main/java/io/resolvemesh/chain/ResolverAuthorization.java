package io.resolvemesh.chain;

/**
 * Capability check for the settlement signer. Queried before every submission; never cached.
 */
@FunctionalInterface
public interface ResolverAuthorization {
    boolean isAuthorized(String signer);
}
