package com.kernos.kernel;

/** Thrown when a hook re-enters the administrative dispatcher while an action is still in progress. */
public final class KernelReentrancyException extends KernelException {

    private final Actions action;

    public KernelReentrancyException(Actions action) {
        super(ErrorCategory.CONSISTENCY, "Kernel action re-entered while another action is in progress: " + action);
        this.action = action;
    }

    /** Action that attempted to re-enter; null for a batch. */
    public Actions getAction() {
        return action;
    }
}
