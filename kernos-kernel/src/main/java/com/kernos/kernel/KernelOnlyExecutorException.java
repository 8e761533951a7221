package com.kernos.kernel;

/**
 * Thrown when an administrative action is submitted by anyone other than the current executor.
 */
public final class KernelOnlyExecutorException extends KernelException {

    private final Address caller;

    public KernelOnlyExecutorException(Address caller) {
        super(ErrorCategory.AUTHORIZATION, "Only the executor may submit kernel actions; caller=" + caller);
        this.caller = caller;
    }

    public Address getCaller() {
        return caller;
    }
}
