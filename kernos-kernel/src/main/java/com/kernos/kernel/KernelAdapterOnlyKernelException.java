package com.kernos.kernel;

/**
 * Thrown when a module or policy receives an administrative callback from a kernel it does not trust.
 */
public final class KernelAdapterOnlyKernelException extends KernelException {

    private final Address adapter;
    private final Address caller;

    public KernelAdapterOnlyKernelException(Address adapter, Address caller) {
        super(ErrorCategory.AUTHORIZATION,
                String.format("Adapter %s only accepts calls from its kernel; caller=%s", adapter, caller));
        this.adapter = adapter;
        this.caller = caller;
    }

    public Address getAdapter() {
        return adapter;
    }

    public Address getCaller() {
        return caller;
    }
}
