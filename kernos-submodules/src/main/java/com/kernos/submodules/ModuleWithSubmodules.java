package com.kernos.submodules;

import com.kernos.kernel.Capability;
import com.kernos.kernel.Kernel;
import com.kernos.kernel.Module;
import com.kernos.keycode.InvalidSubKeycodeException;
import com.kernos.keycode.SubKeycode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Module hosting its own table of {@link Submodule}s. Policies manage and use the table through the
 * permissioned entry points below; submodules accept calls only with this module's
 * {@link ParentCapability}.
 */
public abstract class ModuleWithSubmodules extends Module {

    public static final String INSTALL_SUBMODULE = "installSubmodule";
    public static final String UPGRADE_SUBMODULE = "upgradeSubmodule";
    public static final String EXEC_ON_SUBMODULE = "execOnSubmodule";

    private static final Logger log = LoggerFactory.getLogger(ModuleWithSubmodules.class);

    private final ParentCapability parentCapability = new ParentCapability(this);
    private final Map<SubKeycode, Submodule> submodules = new LinkedHashMap<>();

    protected ModuleWithSubmodules(Kernel kernel) {
        super(kernel);
    }

    /**
     * Registers {@code submodule} under its sub-keycode and calls its init hook.
     *
     * @throws InvalidSubKeycodeException                    if the sub-keycode is outside this module's namespace
     * @throws SubmoduleInvalidParentException               if the submodule is bound to another module
     * @throws SubmoduleAlreadyInstalledException            if the sub-keycode is taken
     */
    public void installSubmodule(Capability caller, Submodule submodule) {
        permissioned(caller, INSTALL_SUBMODULE);
        nonReentrant(() -> {
            SubKeycode subKeycode = checkBinding(submodule);
            if (submodules.containsKey(subKeycode)) {
                throw new SubmoduleAlreadyInstalledException(subKeycode);
            }
            validateSubmodule(submodule);
            submodules.put(subKeycode, submodule);
            try {
                submodule.initFromParent(parentCapability);
            } catch (RuntimeException e) {
                submodules.remove(subKeycode);
                throw e;
            }
            log.info("Installed submodule {} (version {}) in {}", subKeycode, submodule.getVersion(), getKeycode());
        });
    }

    /**
     * Replaces the submodule installed under {@code replacement}'s sub-keycode. The previous instance is
     * restored if the replacement's init hook fails.
     *
     * @throws InvalidSubmoduleUpgradeException if nothing is installed there or it is the same instance
     */
    public void upgradeSubmodule(Capability caller, Submodule replacement) {
        permissioned(caller, UPGRADE_SUBMODULE);
        nonReentrant(() -> {
            SubKeycode subKeycode = checkBinding(replacement);
            Submodule current = submodules.get(subKeycode);
            if (current == null || current == replacement) {
                throw new InvalidSubmoduleUpgradeException(subKeycode);
            }
            validateSubmodule(replacement);
            submodules.put(subKeycode, replacement);
            try {
                replacement.initFromParent(parentCapability);
            } catch (RuntimeException e) {
                submodules.put(subKeycode, current);
                throw e;
            }
            log.info("Upgraded submodule {} from {} to {} in {}", subKeycode, current.getVersion(),
                    replacement.getVersion(), getKeycode());
        });
    }

    /**
     * Runs {@code call} against the submodule installed under {@code subKeycode}. The call receives a parent
     * token that only that submodule accepts and that is revoked when the call returns.
     *
     * @throws SubmoduleNotInstalledException if nothing is installed there
     * @throws SubmoduleExecutionException    if {@code call} fails
     */
    public <T> T execOnSubmodule(Capability caller, SubKeycode subKeycode, SubmoduleCall<T> call) {
        permissioned(caller, EXEC_ON_SUBMODULE);
        Submodule submodule = getSubmoduleIfInstalled(subKeycode);
        return nonReentrant(() -> {
            ParentCapability scoped = new ParentCapability(this, submodule);
            try {
                return call.apply(submodule, scoped);
            } catch (RuntimeException e) {
                throw new SubmoduleExecutionException(subKeycode, e);
            } finally {
                scoped.revoke();
            }
        });
    }

    /**
     * Module-specific structural checks run before a submodule is registered or swapped in. Throw to reject.
     */
    protected void validateSubmodule(Submodule submodule) {
    }

    /** Token for calling privileged entry points of this module's own submodules. */
    protected final ParentCapability asParent() {
        return parentCapability;
    }

    /** @throws SubmoduleNotInstalledException if nothing is installed under {@code subKeycode} */
    protected final Submodule getSubmoduleIfInstalled(SubKeycode subKeycode) {
        Submodule submodule = subKeycode != null ? submodules.get(subKeycode) : null;
        if (submodule == null) {
            throw new SubmoduleNotInstalledException(subKeycode);
        }
        return submodule;
    }

    private SubKeycode checkBinding(Submodule submodule) {
        SubKeycode subKeycode = submodule.getSubKeycode();
        if (subKeycode == null) {
            throw new InvalidSubKeycodeException(null, "submodule " + submodule.getAddress() + " reports no sub-keycode");
        }
        subKeycode.ensureParent(getKeycode());
        if (submodule.getParent() != this) {
            throw new SubmoduleInvalidParentException(subKeycode);
        }
        return subKeycode;
    }

    // ---- queries ----

    /** Installed sub-keycodes in registration order. */
    public List<SubKeycode> getSubmodules() {
        return List.copyOf(submodules.keySet());
    }

    public Optional<Submodule> getSubmoduleForKeycode(SubKeycode subKeycode) {
        return Optional.ofNullable(submodules.get(subKeycode));
    }

    public int getSubmoduleCount() {
        return submodules.size();
    }

    public boolean isSubmoduleInstalled(SubKeycode subKeycode) {
        return submodules.containsKey(subKeycode);
    }
}
