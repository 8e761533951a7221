package com.kernos.kernel;

/** Thrown when an action's target is missing or of the wrong kind for the action. */
public final class KernelInvalidTargetException extends KernelException {

    private final Actions action;

    public KernelInvalidTargetException(Actions action, String reason) {
        super(ErrorCategory.IDENTITY, String.format("Invalid target for %s: %s", action, reason));
        this.action = action;
    }

    public Actions getAction() {
        return action;
    }
}
