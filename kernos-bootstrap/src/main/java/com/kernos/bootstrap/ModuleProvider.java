package com.kernos.bootstrap;

import com.kernos.kernel.Kernel;
import com.kernos.kernel.Module;

/**
 * SPI for modules installed at bootstrap. Implementations are discovered via {@link java.util.ServiceLoader}
 * (META-INF/services/com.kernos.bootstrap.ModuleProvider) or passed to
 * {@link KernelBootstrap#initialize(com.kernos.config.KernelConfig, java.util.List, java.util.List)}.
 */
public interface ModuleProvider {

    /** Name used in logs (e.g. "treasury"). */
    String getName();

    /** Creates the module, trusting {@code kernel}. Called once per bootstrap. */
    Module createModule(Kernel kernel);

    /**
     * Whether this provider should be installed. Override to skip installation when its environment is unset.
     */
    default boolean isEnabled() {
        return true;
    }
}
