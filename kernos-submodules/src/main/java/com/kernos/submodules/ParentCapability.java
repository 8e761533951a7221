package com.kernos.submodules;

/**
 * Token a {@link ModuleWithSubmodules} passes to its own submodules. The parent keeps one long-lived
 * token for itself; calls it runs on behalf of a policy get a token scoped to one submodule that is
 * revoked as soon as the call returns.
 */
public final class ParentCapability {

    private final ModuleWithSubmodules owner;
    private final Submodule scope;
    private volatile boolean revoked;

    ParentCapability(ModuleWithSubmodules owner) {
        this(owner, null);
    }

    ParentCapability(ModuleWithSubmodules owner, Submodule scope) {
        this.owner = owner;
        this.scope = scope;
    }

    ModuleWithSubmodules getOwner() {
        return owner;
    }

    /** Whether this token may be presented to {@code submodule}. */
    boolean covers(Submodule submodule) {
        return !revoked && (scope == null || scope == submodule);
    }

    void revoke() {
        revoked = true;
    }

    @Override
    public String toString() {
        return "ParentCapability{" + owner.getKeycode() + (scope != null ? ", " + scope.getSubKeycode() : "")
                + (revoked ? ", revoked" : "") + "}";
    }
}
