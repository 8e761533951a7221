package com.kernos.bootstrap;

import com.kernos.config.KernelConfig;
import com.kernos.kernel.Address;
import com.kernos.kernel.Kernel;
import com.kernos.kernel.Module;
import com.kernos.kernel.Policy;
import com.kernos.ledger.KernelLedger;
import io.micrometer.core.instrument.MeterRegistry;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Wrapper object returned from bootstrap: the kernel, the executor address allowed to administer it,
 * and the listeners attached to it.
 */
public final class BootstrapContext {

    private final KernelConfig config;
    private final Kernel kernel;
    private final Address executor;
    private final KernelLedger ledger;
    private final MeterRegistry meterRegistry;
    private final List<Module> modules;
    private final List<Policy> policies;

    BootstrapContext(KernelConfig config, Kernel kernel, Address executor, KernelLedger ledger,
                     MeterRegistry meterRegistry, List<Module> modules, List<Policy> policies) {
        this.config = Objects.requireNonNull(config, "config");
        this.kernel = Objects.requireNonNull(kernel, "kernel");
        this.executor = Objects.requireNonNull(executor, "executor");
        this.ledger = ledger;
        this.meterRegistry = meterRegistry;
        this.modules = List.copyOf(modules);
        this.policies = List.copyOf(policies);
    }

    public KernelConfig getConfig() {
        return config;
    }

    public Kernel getKernel() {
        return kernel;
    }

    /** Executor address; pass it to {@link Kernel#executeAction} for further administration. */
    public Address getExecutor() {
        return executor;
    }

    /** Present when KERNOS_LEDGER is enabled. */
    public Optional<KernelLedger> getLedger() {
        return Optional.ofNullable(ledger);
    }

    /** Present when KERNOS_METRICS is enabled. */
    public Optional<MeterRegistry> getMeterRegistry() {
        return Optional.ofNullable(meterRegistry);
    }

    /** Modules installed at bootstrap, in installation order. */
    public List<Module> getModules() {
        return modules;
    }

    /** Policies activated at bootstrap, in activation order. */
    public List<Policy> getPolicies() {
        return policies;
    }
}
