package com.kernos.kernel;

/** Thrown when activating a policy that is already active. */
public final class KernelPolicyAlreadyActivatedException extends KernelException {

    private final Address policy;

    public KernelPolicyAlreadyActivatedException(Address policy) {
        super(ErrorCategory.LIFECYCLE, "Policy already activated: " + policy);
        this.policy = policy;
    }

    public Address getPolicy() {
        return policy;
    }
}
