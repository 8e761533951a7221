package com.kernos.kernel;

import com.kernos.keycode.Keycode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Registry of modules and policies plus the permission matrix between them. All administrative
 * changes go through {@link #executeAction(Address, Actions, Object)} or
 * {@link #executeInstructions(Address, List)}, callable only by the current executor.
 * <p>
 * Every action (or batch) is atomic: kernel state is copied before it runs and restored if any step
 * throws, and the adapter-side changes it made (trusted-kernel pointers, refreshed policy caches) are
 * undone in reverse order. Events are published to listeners only after commit.
 * <p>
 * Actions are serialized on this instance. An action that re-enters the kernel from a hook fails with
 * {@link KernelReentrancyException}; read-only queries from hooks are allowed.
 */
public final class Kernel {

    private static final Logger log = LoggerFactory.getLogger(Kernel.class);

    private final Address address;
    private final List<KernelEventListener> listeners = new CopyOnWriteArrayList<>();
    private KernelState state;
    private boolean executing;
    private long eventSequence;
    private long capabilitySerial;

    public Kernel(Address executor) {
        this.address = Address.create("Kernel");
        this.state = new KernelState(Objects.requireNonNull(executor, "executor"));
        log.info("Kernel {} created with executor {}", address, executor);
    }

    public Address getAddress() {
        return address;
    }

    public void addListener(KernelEventListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener"));
    }

    public void removeListener(KernelEventListener listener) {
        listeners.remove(listener);
    }

    /**
     * Applies one administrative action.
     *
     * @param caller identity of the caller; must be the current executor
     * @param action what to do
     * @param target module, policy, address or kernel, depending on {@code action}
     * @throws KernelOnlyExecutorException if {@code caller} is not the executor
     * @throws KernelException             for any other rejection; the kernel is left unchanged
     */
    public synchronized void executeAction(Address caller, Actions action, Object target) {
        requireExecutor(caller);
        apply(List.of(new Instruction(action, target)), action);
    }

    /**
     * Applies a batch of instructions as one atomic action: either all of them take effect, or none.
     */
    public synchronized void executeInstructions(Address caller, List<Instruction> instructions) {
        requireExecutor(caller);
        Objects.requireNonNull(instructions, "instructions");
        if (instructions.isEmpty()) {
            return;
        }
        List<Instruction> batch = List.copyOf(instructions);
        apply(batch, batch.get(0).action());
    }

    private void requireExecutor(Address caller) {
        if (caller == null || !caller.equals(state.executor)) {
            throw new KernelOnlyExecutorException(caller);
        }
    }

    private void apply(List<Instruction> instructions, Actions first) {
        if (executing) {
            throw new KernelReentrancyException(first);
        }
        requireNotRetired();
        executing = true;
        ActionContext ctx = new ActionContext(state.copy());
        try {
            for (Instruction instruction : instructions) {
                requireNotRetired();
                dispatch(instruction, ctx);
                ctx.event(KernelEventType.ACTION_EXECUTED, instruction.action(), subjectOf(instruction), null, null, null);
            }
        } catch (RuntimeException e) {
            rollback(ctx, e);
            throw e;
        } finally {
            executing = false;
        }
        publish(ctx.events);
    }

    private void requireNotRetired() {
        if (state.successor != null) {
            throw new KernelRetiredException(address, state.successor.getAddress());
        }
    }

    private void dispatch(Instruction instruction, ActionContext ctx) {
        Object target = instruction.target();
        switch (instruction.action()) {
            case INSTALL_MODULE -> installModule((Module) target, ctx);
            case UPGRADE_MODULE -> upgradeModule((Module) target, ctx);
            case DEPRECATE_MODULE -> deprecateModule((Module) target, ctx);
            case ACTIVATE_POLICY -> activatePolicy((Policy) target, ctx);
            case DEACTIVATE_POLICY -> deactivatePolicy((Policy) target, ctx);
            case CHANGE_EXECUTOR -> changeExecutor((Address) target, ctx);
            case MIGRATE_KERNEL -> migrateKernel((Kernel) target, ctx);
            default -> throw new KernelInvalidTargetException(instruction.action(), "unsupported action");
        }
    }

    private void rollback(ActionContext ctx, RuntimeException failure) {
        state = ctx.snapshot;
        for (int i = ctx.undo.size() - 1; i >= 0; i--) {
            try {
                ctx.undo.get(i).run();
            } catch (RuntimeException e) {
                failure.addSuppressed(e);
                log.error("Kernel {}: compensation step failed after aborted action: {}", address, e.getMessage(), e);
            }
        }
        log.warn("Kernel {}: action aborted, state restored: {}", address, failure.getMessage());
    }

    // ---- actions ----

    private void installModule(Module module, ActionContext ctx) {
        module.onlyKernel(this);
        Keycode keycode = keycodeOf(module, Actions.INSTALL_MODULE);
        if (state.modules.containsKey(keycode)) {
            throw new KernelModuleAlreadyInstalledException(keycode);
        }
        state.modules.put(keycode, new ModuleRecord(keycode, module, module.getVersion()));
        state.moduleKeycodes.put(module.getAddress(), keycode);
        module.initFromKernel(this);
        ctx.event(KernelEventType.MODULE_INSTALLED, Actions.INSTALL_MODULE, module.getAddress(), keycode, null, null);
    }

    private void upgradeModule(Module candidate, ActionContext ctx) {
        candidate.onlyKernel(this);
        Keycode keycode = keycodeOf(candidate, Actions.UPGRADE_MODULE);
        ModuleRecord current = state.modules.get(keycode);
        if (current == null || current.module() == candidate) {
            throw new KernelInvalidModuleUpgradeException(keycode);
        }
        List<PolicyRecord> dependents = activeDependents(keycode);

        // Phase 1: every dependent may veto before anything changes.
        for (PolicyRecord dependent : dependents) {
            try {
                dependent.policy().verifyUpgradeFromKernel(this, keycode, candidate);
            } catch (RuntimeException e) {
                throw new KernelRefreshFailedException(dependent.address(), keycode,
                        KernelRefreshFailedException.Phase.VERIFY, e);
            }
        }

        state.modules.put(keycode, new ModuleRecord(keycode, candidate, candidate.getVersion()));
        state.moduleKeycodes.remove(current.address());
        state.moduleKeycodes.put(candidate.getAddress(), keycode);
        candidate.initFromKernel(this);

        // Phase 2: dependents re-resolve against the new registry.
        for (PolicyRecord dependent : dependents) {
            Policy policy = dependent.policy();
            ctx.undo(() -> policy.declareDependencies(this));
            try {
                List<Keycode> deps = policy.declareDependencies(this);
                requireInstalled(deps);
                state.policies.put(dependent.address(), dependent.withDependencies(deps));
            } catch (RuntimeException e) {
                throw new KernelRefreshFailedException(dependent.address(), keycode,
                        KernelRefreshFailedException.Phase.COMMIT, e);
            }
        }
        ctx.event(KernelEventType.MODULE_UPGRADED, Actions.UPGRADE_MODULE, candidate.getAddress(), keycode, null,
                current.address());
    }

    private void deprecateModule(Module module, ActionContext ctx) {
        Keycode keycode = keycodeOf(module, Actions.DEPRECATE_MODULE);
        ModuleRecord current = state.modules.get(keycode);
        if (current == null || current.module() != module) {
            throw new KernelModuleNotInstalledException(keycode);
        }
        Set<Address> users = new LinkedHashSet<>();
        for (PolicyRecord dependent : activeDependents(keycode)) {
            users.add(dependent.address());
        }
        users.addAll(state.permissions.holdersFor(keycode));
        if (!users.isEmpty()) {
            throw new KernelModuleInUseException(keycode, new ArrayList<>(users));
        }
        state.modules.remove(keycode);
        state.moduleKeycodes.remove(module.getAddress());
        ctx.event(KernelEventType.MODULE_DEPRECATED, Actions.DEPRECATE_MODULE, module.getAddress(), keycode, null, null);
    }

    private void activatePolicy(Policy policy, ActionContext ctx) {
        policy.onlyKernel(this);
        Address policyAddress = policy.getAddress();
        PolicyRecord existing = state.policies.get(policyAddress);
        if (existing != null && existing.active()) {
            throw new KernelPolicyAlreadyActivatedException(policyAddress);
        }
        List<Keycode> deps = policy.declareDependencies(this);
        requireInstalled(deps);
        state.policies.put(policyAddress, new PolicyRecord(policy, true, deps));

        List<Permission> requests = policy.declarePermissions(this);
        for (Permission request : requests) {
            requireInstalled(request.keycode());
        }
        for (Permission request : requests) {
            if (state.permissions.grant(policyAddress, request)) {
                ctx.event(KernelEventType.PERMISSION_GRANTED, Actions.ACTIVATE_POLICY, policyAddress,
                        request.keycode(), request.entryPoint(), null);
            }
        }
        state.capabilities.put(policyAddress, new Capability(this, policyAddress, ++capabilitySerial));
        ctx.event(KernelEventType.POLICY_ACTIVATED, Actions.ACTIVATE_POLICY, policyAddress, null, null, null);
    }

    private void deactivatePolicy(Policy policy, ActionContext ctx) {
        Address policyAddress = policy.getAddress();
        PolicyRecord existing = state.policies.get(policyAddress);
        if (existing == null || !existing.active()) {
            throw new KernelPolicyNotActivatedException(policyAddress);
        }
        for (Permission revoked : state.permissions.revokeAll(policyAddress)) {
            ctx.event(KernelEventType.PERMISSION_REVOKED, Actions.DEACTIVATE_POLICY, policyAddress,
                    revoked.keycode(), revoked.entryPoint(), null);
        }
        state.capabilities.remove(policyAddress);
        state.policies.put(policyAddress, existing.withActive(false));
        ctx.event(KernelEventType.POLICY_DEACTIVATED, Actions.DEACTIVATE_POLICY, policyAddress, null, null, null);
    }

    private void changeExecutor(Address newExecutor, ActionContext ctx) {
        Address previous = state.executor;
        state.executor = newExecutor;
        ctx.event(KernelEventType.EXECUTOR_CHANGED, Actions.CHANGE_EXECUTOR, newExecutor, null, null, previous);
    }

    private void migrateKernel(Kernel target, ActionContext ctx) {
        if (target == this) {
            throw new KernelInvalidTargetException(Actions.MIGRATE_KERNEL, "cannot migrate a kernel to itself");
        }
        if (target.isRetired()) {
            throw new KernelInvalidTargetException(Actions.MIGRATE_KERNEL, "target kernel " + target.getAddress()
                    + " is retired");
        }
        for (ModuleRecord record : state.modules.values()) {
            Module module = record.module();
            module.changeKernel(this, target);
            ctx.undo(() -> module.changeKernel(target, this));
        }
        // Moved policies no longer hold anything here; the successor grants afresh on activation.
        for (PolicyRecord record : new ArrayList<>(state.policies.values())) {
            if (!record.active()) continue;
            Policy policy = record.policy();
            Address policyAddress = record.address();
            policy.changeKernel(this, target);
            ctx.undo(() -> policy.changeKernel(target, this));
            for (Permission revoked : state.permissions.revokeAll(policyAddress)) {
                ctx.event(KernelEventType.PERMISSION_REVOKED, Actions.MIGRATE_KERNEL, policyAddress,
                        revoked.keycode(), revoked.entryPoint(), null);
            }
            state.policies.put(policyAddress, record.withActive(false));
            ctx.event(KernelEventType.POLICY_DEACTIVATED, Actions.MIGRATE_KERNEL, policyAddress, null, null, null);
        }
        state.capabilities.clear();
        state.successor = target;
        ctx.event(KernelEventType.KERNEL_MIGRATED, Actions.MIGRATE_KERNEL, target.getAddress(), null, null, null);
    }

    // ---- helpers ----

    private Keycode keycodeOf(Module module, Actions action) {
        Keycode keycode = module.getKeycode();
        if (keycode == null) {
            throw new KernelInvalidTargetException(action, "module " + module.getAddress() + " reports no keycode");
        }
        return keycode;
    }

    private void requireInstalled(List<Keycode> keycodes) {
        for (Keycode keycode : keycodes) {
            requireInstalled(keycode);
        }
    }

    private void requireInstalled(Keycode keycode) {
        if (keycode == null || !state.modules.containsKey(keycode)) {
            throw new KernelModuleNotInstalledException(keycode);
        }
    }

    private List<PolicyRecord> activeDependents(Keycode keycode) {
        List<PolicyRecord> out = new ArrayList<>();
        for (PolicyRecord record : state.policies.values()) {
            if (record.active() && record.dependsOn(keycode)) {
                out.add(record);
            }
        }
        return out;
    }

    private static Address subjectOf(Instruction instruction) {
        Object target = instruction.target();
        if (target instanceof KernelAdapter adapter) return adapter.getAddress();
        if (target instanceof Kernel kernel) return kernel.getAddress();
        return (Address) target;
    }

    private void publish(List<PendingEvent> pending) {
        for (PendingEvent p : pending) {
            KernelEvent event = new KernelEvent(++eventSequence, System.currentTimeMillis(), address,
                    p.type(), p.action(), p.subject(), p.keycode(), p.entryPoint(), p.previous());
            logEvent(event);
            for (KernelEventListener listener : listeners) {
                try {
                    listener.onEvent(event);
                } catch (RuntimeException e) {
                    log.warn("Kernel {}: listener {} failed on event {} #{}: {}", address, listener, event.type(),
                            event.sequence(), e.getMessage(), e);
                }
            }
        }
    }

    private void logEvent(KernelEvent event) {
        switch (event.type()) {
            case PERMISSION_GRANTED, PERMISSION_REVOKED -> log.debug("Kernel {}: {} {} -> {}.{}", address,
                    event.type(), event.subject(), event.keycode(), event.entryPoint());
            case ACTION_EXECUTED -> log.debug("Kernel {}: executed {} on {}", address, event.action(), event.subject());
            default -> log.info("Kernel {}: {} {}{}", address, event.type(), event.subject(),
                    event.keycode() != null ? " (" + event.keycode() + ")" : "");
        }
    }

    // ---- calls from adapters ----

    synchronized void requirePermission(Capability caller, Module module, String entryPoint) {
        Address holder = caller != null ? caller.getHolder() : null;
        Keycode keycode = module.getKeycode();
        boolean permitted = caller != null
                && state.successor == null
                && caller.getIssuer() == this
                && state.capabilities.get(holder) == caller
                && isInstalledInstance(module)
                && state.permissions.isGranted(holder, keycode, entryPoint);
        if (!permitted) {
            throw new ModulePolicyNotPermittedException(holder, keycode, entryPoint);
        }
    }

    synchronized Capability capabilityFor(Policy policy) {
        Capability capability = state.capabilities.get(policy.getAddress());
        if (capability == null) {
            throw new KernelPolicyNotActivatedException(policy.getAddress());
        }
        return capability;
    }

    private boolean isInstalledInstance(Module module) {
        Keycode keycode = module.getKeycode();
        if (keycode == null) return false;
        ModuleRecord record = state.modules.get(keycode);
        return record != null && record.module() == module;
    }

    // ---- queries ----

    public synchronized Address getExecutor() {
        return state.executor;
    }

    /** Whether {@code policy} currently holds the permission {@code (keycode, entryPoint)}. */
    public synchronized boolean hasPermission(Address policy, Keycode keycode, String entryPoint) {
        return state.permissions.isGranted(policy, keycode, entryPoint);
    }

    public synchronized Set<Permission> getPermissions(Address policy) {
        return state.permissions.grantedTo(policy);
    }

    public synchronized Optional<Module> getModuleForKeycode(Keycode keycode) {
        ModuleRecord record = state.modules.get(keycode);
        return record != null ? Optional.of(record.module()) : Optional.empty();
    }

    /** Keycode {@code module} is installed under, if it is the currently installed instance. */
    public synchronized Optional<Keycode> getKeycodeForModule(Module module) {
        return Optional.ofNullable(state.moduleKeycodes.get(module.getAddress()));
    }

    public synchronized Optional<ModuleRecord> getModuleRecord(Keycode keycode) {
        return Optional.ofNullable(state.modules.get(keycode));
    }

    public synchronized boolean isModuleInstalled(Keycode keycode) {
        return state.modules.containsKey(keycode);
    }

    /** Installed keycodes in installation order. */
    public synchronized List<Keycode> getAllKeycodes() {
        return List.copyOf(state.modules.keySet());
    }

    public synchronized boolean isPolicyActive(Policy policy) {
        return isPolicyActive(policy.getAddress());
    }

    public synchronized boolean isPolicyActive(Address policy) {
        PolicyRecord record = state.policies.get(policy);
        return record != null && record.active();
    }

    public synchronized Optional<PolicyRecord> getPolicyRecord(Address policy) {
        return Optional.ofNullable(state.policies.get(policy));
    }

    public synchronized List<Policy> getActivePolicies() {
        List<Policy> out = new ArrayList<>();
        for (PolicyRecord record : state.policies.values()) {
            if (record.active()) out.add(record.policy());
        }
        return Collections.unmodifiableList(out);
    }

    /** Active policies that declared {@code keycode} as a dependency. */
    public synchronized List<Policy> getModuleDependents(Keycode keycode) {
        List<Policy> out = new ArrayList<>();
        for (PolicyRecord record : activeDependents(keycode)) {
            out.add(record.policy());
        }
        return Collections.unmodifiableList(out);
    }

    public synchronized int getPermissionCount() {
        return state.permissions.size();
    }

    /** Whether this kernel was migrated away from. A retired kernel rejects all actions. */
    public synchronized boolean isRetired() {
        return state.successor != null;
    }

    public synchronized Optional<Kernel> getSuccessor() {
        return Optional.ofNullable(state.successor);
    }

    @Override
    public String toString() {
        return address.toString();
    }

    /** Work list of one action: the pre-action snapshot, compensations and events awaiting commit. */
    private static final class ActionContext {
        final KernelState snapshot;
        final List<Runnable> undo = new ArrayList<>();
        final List<PendingEvent> events = new ArrayList<>();

        ActionContext(KernelState snapshot) {
            this.snapshot = snapshot;
        }

        void undo(Runnable step) {
            undo.add(step);
        }

        void event(KernelEventType type, Actions action, Address subject, Keycode keycode, String entryPoint,
                   Address previous) {
            events.add(new PendingEvent(type, action, subject, keycode, entryPoint, previous));
        }
    }

    private record PendingEvent(KernelEventType type, Actions action, Address subject, Keycode keycode,
                                String entryPoint, Address previous) {
    }
}
