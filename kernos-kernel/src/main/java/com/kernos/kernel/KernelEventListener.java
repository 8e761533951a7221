package com.kernos.kernel;

/**
 * Observer of committed kernel changes (ledger, metrics, audit). Listeners are observer-only:
 * if one throws, the kernel logs the failure and keeps delivering to the others; the change stays committed.
 */
@FunctionalInterface
public interface KernelEventListener {

    void onEvent(KernelEvent event);
}
