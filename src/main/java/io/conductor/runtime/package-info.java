/**
 * Runtime facade.
 *
 * <p>{@link io.conductor.runtime.ConductorRuntime} wires the ledger, dispatch guard, lifecycle
 * reporter, abandonment watchdog, launcher and audit log for one data root. The CLI is a thin layer
 * over it; the detached execution process uses the same facade through {@code run}.
 */
package io.conductor.runtime;
