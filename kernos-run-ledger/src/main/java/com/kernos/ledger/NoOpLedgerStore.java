package com.kernos.ledger;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** No-op LedgerStore when no ledger file is configured. Logs so the event trail is still visible. */
public final class NoOpLedgerStore implements LedgerStore {

    private static final Logger log = LoggerFactory.getLogger(NoOpLedgerStore.class);

    @Override
    public void append(LedgerRecord record) {
        log.debug("Ledger (no-op): #{} {} | action={} | subject={} | keycode={} | persistence skipped",
                record.getSequence(), record.getType(), record.getAction(), record.getSubject(), record.getKeycode());
    }
}
