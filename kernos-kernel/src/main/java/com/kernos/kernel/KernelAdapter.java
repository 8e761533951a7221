package com.kernos.kernel;

import java.util.Objects;

/**
 * Common base of {@link Module} and {@link Policy}: an address plus the kernel this adapter trusts.
 * Administrative callbacks are accepted only from the trusted kernel; only {@link Actions#MIGRATE_KERNEL}
 * moves that trust.
 */
public abstract class KernelAdapter {

    private final Address address;
    private volatile Kernel kernel;

    protected KernelAdapter(Kernel kernel) {
        this.kernel = Objects.requireNonNull(kernel, "kernel");
        this.address = Address.create(getClass().getSimpleName());
    }

    /** Kernel this adapter currently trusts. */
    public final Kernel getKernel() {
        return kernel;
    }

    public final Address getAddress() {
        return address;
    }

    final void onlyKernel(Kernel caller) {
        if (caller == null || caller != kernel) {
            throw new KernelAdapterOnlyKernelException(address, caller != null ? caller.getAddress() : null);
        }
    }

    final void changeKernel(Kernel caller, Kernel newKernel) {
        onlyKernel(caller);
        kernel = Objects.requireNonNull(newKernel, "newKernel");
    }

    @Override
    public String toString() {
        return address.toString();
    }
}
