package com.kernos.features.metrics;

import com.kernos.kernel.Kernel;
import com.kernos.kernel.KernelEvent;
import com.kernos.kernel.KernelEventListener;
import com.kernos.kernel.KernelEventType;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.util.Objects;

/**
 * Records kernel activity on a Micrometer registry: a counter per committed event type, a counter per
 * executed action, and gauges for granted permissions, installed modules and active policies.
 * Meters are tagged with the kernel address so several kernels can share one registry.
 */
public final class KernelMetricsListener implements KernelEventListener {

    static final String EVENTS = "kernos.kernel.events";
    static final String ACTIONS = "kernos.kernel.actions";
    static final String PERMISSIONS_GRANTED = "kernos.kernel.permissions.granted";
    static final String MODULES_INSTALLED = "kernos.kernel.modules.installed";
    static final String POLICIES_ACTIVE = "kernos.kernel.policies.active";

    private final MeterRegistry registry;
    private final String kernelTag;

    private KernelMetricsListener(MeterRegistry registry, Kernel kernel) {
        this.registry = registry;
        this.kernelTag = kernel.getAddress().toString();
    }

    /** Registers gauges for {@code kernel} on a new {@link SimpleMeterRegistry} and subscribes to its events. */
    public static KernelMetricsListener attach(Kernel kernel) {
        return attach(kernel, new SimpleMeterRegistry());
    }

    public static KernelMetricsListener attach(Kernel kernel, MeterRegistry registry) {
        Objects.requireNonNull(kernel, "kernel");
        Objects.requireNonNull(registry, "registry");
        KernelMetricsListener listener = new KernelMetricsListener(registry, kernel);
        Gauge.builder(PERMISSIONS_GRANTED, kernel, Kernel::getPermissionCount)
                .tag("kernel", listener.kernelTag)
                .register(registry);
        Gauge.builder(MODULES_INSTALLED, kernel, k -> k.getAllKeycodes().size())
                .tag("kernel", listener.kernelTag)
                .register(registry);
        Gauge.builder(POLICIES_ACTIVE, kernel, k -> k.getActivePolicies().size())
                .tag("kernel", listener.kernelTag)
                .register(registry);
        kernel.addListener(listener);
        return listener;
    }

    public MeterRegistry getRegistry() {
        return registry;
    }

    @Override
    public void onEvent(KernelEvent event) {
        registry.counter(EVENTS, "kernel", kernelTag, "type", event.type().name()).increment();
        if (event.type() == KernelEventType.ACTION_EXECUTED && event.action() != null) {
            registry.counter(ACTIONS, "kernel", kernelTag, "action", event.action().name()).increment();
        }
    }
}
