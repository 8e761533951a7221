package com.kernos.ledger;

import com.kernos.kernel.KernelEvent;
import com.kernos.kernel.KernelEventListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Fail-safe kernel listener that records every committed event. All writes delegate to {@link LedgerStore};
 * any exception from the store is caught, logged, and not rethrown so the kernel never sees it.
 */
public final class KernelLedger implements KernelEventListener {

    private static final Logger log = LoggerFactory.getLogger(KernelLedger.class);

    private final LedgerStore store;

    public KernelLedger(LedgerStore store) {
        this.store = store != null ? store : new NoOpLedgerStore();
    }

    public LedgerStore getStore() {
        return store;
    }

    @Override
    public void onEvent(KernelEvent event) {
        try {
            store.append(LedgerRecord.from(event));
        } catch (Throwable t) {
            log.warn("Ledger append failed (event #{} {}); kernel continues. Error: {}",
                    event.sequence(), event.type(), t.getMessage(), t);
        }
    }
}
