package com.kernos.kernel;

import com.kernos.keycode.Keycode;

import java.util.List;

/**
 * Stateless-by-convention logic that calls module entry points with the {@link Capability} the
 * kernel issued at activation. The kernel calls the hooks below only while (re)activating or
 * refreshing the policy; nothing survives a deactivate/reactivate cycle implicitly.
 * <p>
 * Typical shape:
 * <pre>{@code
 * protected List<Keycode> configureDependencies() {
 *     treasury = getModule(TRSRY, Treasury.class);
 *     requireMajorVersion(treasury, 1);
 *     return List.of(TRSRY);
 * }
 *
 * protected List<Permission> requestPermissions() {
 *     return List.of(Permission.of(TRSRY, Treasury.WITHDRAW));
 * }
 *
 * public void pay(long amount) {
 *     treasury.withdraw(getCapability(), amount);
 * }
 * }</pre>
 */
public abstract class Policy extends KernelAdapter {

    protected Policy(Kernel kernel) {
        super(kernel);
    }

    /**
     * Keycodes this policy depends on. Called at activation and again after any upgrade of one of them,
     * so cached module references should be (re)resolved here. Every keycode must be installed.
     */
    protected List<Keycode> configureDependencies() {
        return List.of();
    }

    /** Entry points this policy needs. Called at activation; the kernel grants exactly these. */
    protected List<Permission> requestPermissions() {
        return List.of();
    }

    /**
     * First phase of an upgrade refresh, called before the registry swaps {@code keycode} to
     * {@code candidate}. Throw to veto the upgrade. Must not change any state.
     */
    protected void verifyUpgrade(Keycode keycode, Module candidate) {
    }

    /** Whether the trusted kernel currently has this policy active. */
    public final boolean isActive() {
        return getKernel().isPolicyActive(this);
    }

    /**
     * Capability issued at the current activation.
     *
     * @throws KernelPolicyNotActivatedException if the policy is not active in its kernel
     */
    protected final Capability getCapability() {
        return getKernel().capabilityFor(this);
    }

    /**
     * Module installed for {@code keycode}, as {@code type}.
     *
     * @throws PolicyModuleDoesNotExistException if nothing is installed or the module has another type
     */
    protected final <M extends Module> M getModule(Keycode keycode, Class<M> type) {
        Module module = getKernel().getModuleForKeycode(keycode)
                .orElseThrow(() -> new PolicyModuleDoesNotExistException(keycode));
        if (!type.isInstance(module)) {
            throw new PolicyModuleDoesNotExistException(keycode, type);
        }
        return type.cast(module);
    }

    /** @throws PolicyWrongModuleVersionException unless {@code module} has major version {@code expectedMajor} */
    protected final void requireMajorVersion(Module module, int expectedMajor) {
        Version v = module.getVersion();
        if (v.major() != expectedMajor) {
            throw new PolicyWrongModuleVersionException(module.getKeycode(), expectedMajor, v);
        }
    }

    final List<Keycode> declareDependencies(Kernel caller) {
        onlyKernel(caller);
        List<Keycode> deps = configureDependencies();
        return deps != null ? List.copyOf(deps) : List.of();
    }

    final List<Permission> declarePermissions(Kernel caller) {
        onlyKernel(caller);
        List<Permission> requests = requestPermissions();
        return requests != null ? List.copyOf(requests) : List.of();
    }

    final void verifyUpgradeFromKernel(Kernel caller, Keycode keycode, Module candidate) {
        onlyKernel(caller);
        verifyUpgrade(keycode, candidate);
    }
}
