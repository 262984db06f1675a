/**
 * ResolveMesh source tree root.
 *
 * <p>Primary entry points while reading code:
 *
 * <ul>
 *   <li>{@code io.resolvemesh.Main} bootstraps the operator CLI.</li>
 *   <li>{@code io.resolvemesh.runtime.ResolutionEngine} wires collaborators and runs the background loops.</li>
 *   <li>{@code io.resolvemesh.scheduler.ResolutionScheduler} decides eligibility, dispatch, retries and defaults.</li>
 *   <li>{@code io.resolvemesh.storage.LifecycleStore} is the authoritative, single-writer lifecycle record.</li>
 * </ul>
 */
package io.resolvemesh;
