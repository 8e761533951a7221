package com.kernos.kernel;

import com.kernos.keycode.Keycode;

import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;

/**
 * Long-lived unit owning protocol state. Subclasses report a constant {@link #getKeycode()} and
 * {@link #getVersion()}, and guard every mutating entry point with {@link #permissioned(Capability, String)}:
 * <pre>{@code
 * public void withdraw(Capability caller, long amount) {
 *     permissioned(caller, WITHDRAW);
 *     balance -= amount;
 * }
 * }</pre>
 * Read-only queries may stay unguarded.
 */
public abstract class Module extends KernelAdapter {

    private final AtomicBoolean entered = new AtomicBoolean();

    protected Module(Kernel kernel) {
        super(kernel);
    }

    /** Keycode this module is installed under. Must be constant. */
    public abstract Keycode getKeycode();

    /** Implementation version. Must be constant. */
    public abstract Version getVersion();

    /**
     * Called by the trusted kernel right after this module is installed or swapped in by an upgrade.
     * Use it to cache kernel-issued state (e.g. read the predecessor's state). Throwing aborts the action.
     */
    protected void init() {
    }

    final void initFromKernel(Kernel caller) {
        onlyKernel(caller);
        init();
    }

    /**
     * Aborts unless {@code caller} is a valid capability of a policy granted {@code (getKeycode(), entryPoint)}
     * and this instance is the module currently installed for its keycode.
     *
     * @throws ModulePolicyNotPermittedException otherwise
     */
    protected final void permissioned(Capability caller, String entryPoint) {
        getKernel().requirePermission(caller, this, entryPoint);
    }

    /**
     * Runs {@code body} while holding this module's busy flag. A nested or concurrent entry fails with
     * {@link ModuleReentrancyException}. Use around sections that mutate state and then call out.
     */
    protected final void nonReentrant(Runnable body) {
        nonReentrant(() -> {
            body.run();
            return null;
        });
    }

    protected final <T> T nonReentrant(Supplier<T> body) {
        if (!entered.compareAndSet(false, true)) {
            throw new ModuleReentrancyException(getKeycode());
        }
        try {
            return body.get();
        } finally {
            entered.set(false);
        }
    }
}
