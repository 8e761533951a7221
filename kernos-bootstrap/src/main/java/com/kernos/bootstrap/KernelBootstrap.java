package com.kernos.bootstrap;

import com.kernos.config.KernelConfig;
import com.kernos.features.metrics.KernelMetricsListener;
import com.kernos.kernel.Address;
import com.kernos.kernel.Instruction;
import com.kernos.kernel.Kernel;
import com.kernos.kernel.Module;
import com.kernos.kernel.Policy;
import com.kernos.ledger.JsonLinesLedgerStore;
import com.kernos.ledger.KernelLedger;
import com.kernos.ledger.LedgerStore;
import com.kernos.ledger.NoOpLedgerStore;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.ServiceLoader;

/**
 * Bootstrap for a kernel: creates the executor and kernel from {@link KernelConfig}, attaches the ledger
 * and metrics listeners, then installs every enabled module and activates every enabled policy in one
 * atomic batch. If any step of the batch fails, nothing is installed and the failure propagates.
 */
public final class KernelBootstrap {

    private static final Logger log = LoggerFactory.getLogger(KernelBootstrap.class);

    private KernelBootstrap() {
    }

    /** Loads configuration from environment and discovers providers with {@link ServiceLoader}. */
    public static BootstrapContext initialize() {
        log.info("Bootstrap: loading configuration from environment");
        return initialize(KernelConfig.fromEnvironment());
    }

    /**
     * Same as {@link #initialize()} with explicit configuration. Providers are discovered only when
     * {@link KernelConfig#isDiscoverProviders()} is true.
     */
    public static BootstrapContext initialize(KernelConfig config) {
        List<ModuleProvider> moduleProviders = new ArrayList<>();
        List<PolicyProvider> policyProviders = new ArrayList<>();
        if (config.isDiscoverProviders()) {
            ServiceLoader.load(ModuleProvider.class).forEach(moduleProviders::add);
            ServiceLoader.load(PolicyProvider.class).forEach(policyProviders::add);
            log.info("Bootstrap: discovered {} module provider(s) and {} policy provider(s)",
                    moduleProviders.size(), policyProviders.size());
        }
        return initialize(config, moduleProviders, policyProviders);
    }

    public static BootstrapContext initialize(KernelConfig config,
                                              List<ModuleProvider> moduleProviders,
                                              List<PolicyProvider> policyProviders) {
        log.info("Bootstrap: {}", config);
        Address executor = Address.create(config.getExecutorLabel());
        Kernel kernel = new Kernel(executor);

        KernelLedger ledger = null;
        if (config.isLedgerEnabled()) {
            ledger = new KernelLedger(createLedgerStore(config.getLedgerFile()));
            kernel.addListener(ledger);
        }
        MeterRegistry meterRegistry = null;
        if (config.isMetricsEnabled()) {
            meterRegistry = KernelMetricsListener.attach(kernel).getRegistry();
        }

        List<Module> modules = new ArrayList<>();
        for (ModuleProvider provider : moduleProviders) {
            if (!provider.isEnabled()) {
                log.info("Bootstrap: module provider {} disabled; skipped", provider.getName());
                continue;
            }
            modules.add(provider.createModule(kernel));
        }
        List<Policy> policies = new ArrayList<>();
        for (PolicyProvider provider : policyProviders) {
            if (!provider.isEnabled()) {
                log.info("Bootstrap: policy provider {} disabled; skipped", provider.getName());
                continue;
            }
            policies.add(provider.createPolicy(kernel));
        }

        List<Instruction> batch = new ArrayList<>();
        modules.forEach(m -> batch.add(Instruction.installModule(m)));
        policies.forEach(p -> batch.add(Instruction.activatePolicy(p)));
        kernel.executeInstructions(executor, batch);
        log.info("Bootstrap: kernel {} ready with {} module(s) {} and {} active policies",
                kernel.getAddress(), modules.size(), kernel.getAllKeycodes(), policies.size());

        return new BootstrapContext(config, kernel, executor, ledger, meterRegistry, modules, policies);
    }

    private static LedgerStore createLedgerStore(Optional<Path> file) {
        if (file.isPresent()) {
            log.info("Bootstrap: kernel ledger writes to {}", file.get().toAbsolutePath());
            return new JsonLinesLedgerStore(file.get());
        }
        log.info("Bootstrap: no KERNOS_LEDGER_FILE; kernel ledger only logs");
        return new NoOpLedgerStore();
    }
}
