/**
 * Engine facade: wires the lifecycle store, clock anchor, watcher, scheduler, executor, verifier and
 * settlement submitter, and owns the background loops.
 *
 * <p>{@link io.resolvemesh.runtime.ResolutionEngine#detached} opens the same data root without any
 * chain or sandbox collaborators so operator tooling can query state and record overrides while a
 * daemon process owns resolution.
 */
package io.resolvemesh.runtime;
