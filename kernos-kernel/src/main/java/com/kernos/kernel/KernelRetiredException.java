package com.kernos.kernel;

/** Thrown when submitting an action to a kernel that has migrated its modules to a successor. */
public final class KernelRetiredException extends KernelException {

    private final Address kernel;
    private final Address successor;

    public KernelRetiredException(Address kernel, Address successor) {
        super(ErrorCategory.LIFECYCLE,
                String.format("Kernel %s is retired; actions go to successor %s", kernel, successor));
        this.kernel = kernel;
        this.successor = successor;
    }

    public Address getKernel() {
        return kernel;
    }

    public Address getSuccessor() {
        return successor;
    }
}
