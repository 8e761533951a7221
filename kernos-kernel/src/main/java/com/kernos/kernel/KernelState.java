package com.kernos.kernel;

import com.kernos.keycode.Keycode;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Everything the kernel owns: registry, policy set, permission matrix, issued capabilities, executor
 * and (after migration) successor. Copied before each action so a failed action can be discarded whole.
 */
final class KernelState {

    Address executor;
    Kernel successor;
    final Map<Keycode, ModuleRecord> modules = new LinkedHashMap<>();
    final Map<Address, Keycode> moduleKeycodes = new HashMap<>();
    final Map<Address, PolicyRecord> policies = new LinkedHashMap<>();
    final Map<Address, Capability> capabilities = new HashMap<>();
    final PermissionMatrix permissions;

    KernelState(Address executor) {
        this(executor, new PermissionMatrix());
    }

    private KernelState(Address executor, PermissionMatrix permissions) {
        this.executor = executor;
        this.permissions = permissions;
    }

    KernelState copy() {
        KernelState out = new KernelState(executor, permissions.copy());
        out.successor = successor;
        out.modules.putAll(modules);
        out.moduleKeycodes.putAll(moduleKeycodes);
        out.policies.putAll(policies);
        out.capabilities.putAll(capabilities);
        return out;
    }
}
