package com.kernos.kernel;

/** Thrown when deactivating, or using the capability of, a policy that is not active. */
public final class KernelPolicyNotActivatedException extends KernelException {

    private final Address policy;

    public KernelPolicyNotActivatedException(Address policy) {
        super(ErrorCategory.LIFECYCLE, "Policy not activated: " + policy);
        this.policy = policy;
    }

    public Address getPolicy() {
        return policy;
    }
}
