package com.kernos.ledger;

/**
 * Append-only store for kernel ledger records.
 * {@link KernelLedger} wraps all calls in try/catch so a failing store never affects the kernel.
 */
public interface LedgerStore {

    void append(LedgerRecord record);
}
