/**
 * Process-level wiring: one {@link io.workledger.runtime.WorkLedgerRuntime} per data root, exposing
 * one method per externally invocable action and recording state changes in the audit trail.
 */
package io.workledger.runtime;
