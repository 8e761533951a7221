package com.kernos.kernel;

import com.kernos.keycode.Keycode;

import java.util.List;

/**
 * Registry entry for a policy the kernel has seen. Inactive records are kept so the address stays known.
 *
 * @param policy       the policy
 * @param active       whether it currently holds grants
 * @param dependencies keycodes declared at the last activation or upgrade refresh
 */
public record PolicyRecord(Policy policy, boolean active, List<Keycode> dependencies) {

    public PolicyRecord {
        dependencies = dependencies != null ? List.copyOf(dependencies) : List.of();
    }

    public Address address() {
        return policy.getAddress();
    }

    PolicyRecord withActive(boolean value) {
        return new PolicyRecord(policy, value, dependencies);
    }

    PolicyRecord withDependencies(List<Keycode> value) {
        return new PolicyRecord(policy, active, value);
    }

    boolean dependsOn(Keycode keycode) {
        return dependencies.contains(keycode);
    }
}
