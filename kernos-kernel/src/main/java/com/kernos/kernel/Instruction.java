package com.kernos.kernel;

/**
 * One administrative step: an action plus its target. The target type is checked on construction,
 * so a batch of instructions is rejected before any of it runs.
 */
public record Instruction(Actions action, Object target) {

    public Instruction {
        if (action == null) {
            throw new KernelInvalidTargetException(null, "action must not be null");
        }
        if (target == null) {
            throw new KernelInvalidTargetException(action, "target must not be null");
        }
        if (!action.getTargetType().isInstance(target)) {
            throw new KernelInvalidTargetException(action, "expected " + action.getTargetType().getSimpleName()
                    + " but got " + target.getClass().getSimpleName());
        }
    }

    public static Instruction installModule(Module module) {
        return new Instruction(Actions.INSTALL_MODULE, module);
    }

    public static Instruction upgradeModule(Module module) {
        return new Instruction(Actions.UPGRADE_MODULE, module);
    }

    public static Instruction deprecateModule(Module module) {
        return new Instruction(Actions.DEPRECATE_MODULE, module);
    }

    public static Instruction activatePolicy(Policy policy) {
        return new Instruction(Actions.ACTIVATE_POLICY, policy);
    }

    public static Instruction deactivatePolicy(Policy policy) {
        return new Instruction(Actions.DEACTIVATE_POLICY, policy);
    }

    public static Instruction changeExecutor(Address executor) {
        return new Instruction(Actions.CHANGE_EXECUTOR, executor);
    }

    public static Instruction migrateKernel(Kernel kernel) {
        return new Instruction(Actions.MIGRATE_KERNEL, kernel);
    }
}
