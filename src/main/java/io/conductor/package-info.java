/**
 * Conductor: admission control and lifecycle tracking for coding agents launched as detached processes.
 */
package io.conductor;
