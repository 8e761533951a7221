package com.kernos.kernel;

/**
 * Administrative actions accepted by {@link Kernel#executeAction(Address, Actions, Object)},
 * each with the kind of target it expects.
 */
public enum Actions {

    /** Adds a module under a free keycode and calls its init hook. */
    INSTALL_MODULE(Module.class),

    /** Replaces the module behind an installed keycode; dependents refresh in two phases. */
    UPGRADE_MODULE(Module.class),

    /** Removes an installed module no active policy uses. */
    DEPRECATE_MODULE(Module.class),

    /** Records a policy, resolves its dependencies and grants its requested permissions. */
    ACTIVATE_POLICY(Policy.class),

    /** Revokes every grant of a policy and clears its active flag. */
    DEACTIVATE_POLICY(Policy.class),

    /** Replaces the executor address. */
    CHANGE_EXECUTOR(Address.class),

    /** Moves every installed module and active policy to a new kernel and retires this one. */
    MIGRATE_KERNEL(Kernel.class);

    private final Class<?> targetType;

    Actions(Class<?> targetType) {
        this.targetType = targetType;
    }

    /** Type the target of this action must have. */
    public Class<?> getTargetType() {
        return targetType;
    }
}
