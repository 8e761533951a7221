package com.kernos.kernel;

import com.kernos.keycode.Keycode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Set of granted {@code (policy, keycode, entryPoint)} triples, indexed by policy.
 * Mutated only by the kernel dispatcher.
 */
final class PermissionMatrix {

    private final Map<Address, Set<Permission>> grants = new LinkedHashMap<>();

    PermissionMatrix copy() {
        PermissionMatrix out = new PermissionMatrix();
        grants.forEach((policy, set) -> out.grants.put(policy, new LinkedHashSet<>(set)));
        return out;
    }

    /** @return true if the triple was not granted before */
    boolean grant(Address policy, Permission permission) {
        return grants.computeIfAbsent(policy, k -> new LinkedHashSet<>()).add(permission);
    }

    boolean isGranted(Address policy, Keycode keycode, String entryPoint) {
        if (policy == null || keycode == null || entryPoint == null) return false;
        Set<Permission> set = grants.get(policy);
        return set != null && set.contains(new Permission(keycode, entryPoint));
    }

    Set<Permission> grantedTo(Address policy) {
        Set<Permission> set = grants.get(policy);
        return set != null ? Collections.unmodifiableSet(new LinkedHashSet<>(set)) : Set.of();
    }

    /** Removes every grant of {@code policy}, returning what was removed in grant order. */
    List<Permission> revokeAll(Address policy) {
        Set<Permission> removed = grants.remove(policy);
        return removed != null ? new ArrayList<>(removed) : List.of();
    }

    /** Policies holding at least one grant on {@code keycode}. */
    List<Address> holdersFor(Keycode keycode) {
        List<Address> out = new ArrayList<>();
        grants.forEach((policy, set) -> {
            for (Permission p : set) {
                if (p.keycode().equals(keycode)) {
                    out.add(policy);
                    return;
                }
            }
        });
        return out;
    }

    int size() {
        int n = 0;
        for (Set<Permission> set : grants.values()) n += set.size();
        return n;
    }
}
