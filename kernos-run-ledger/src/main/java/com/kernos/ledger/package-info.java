/**
 * Event ledger for a kernel: {@link com.kernos.ledger.KernelLedger} listens for committed changes and
 * appends them to a {@link com.kernos.ledger.LedgerStore}.
 */
package com.kernos.ledger;
