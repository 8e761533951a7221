package com.kernos.kernel;

/**
 * Base of every failure raised by the kernel, modules, policies and submodules.
 * The enclosing call aborts and leaves kernel state untouched; callers resubmit a corrected action.
 */
public abstract class KernelException extends RuntimeException {

    private final ErrorCategory category;

    protected KernelException(ErrorCategory category, String message) {
        super(message);
        this.category = category;
    }

    protected KernelException(ErrorCategory category, String message, Throwable cause) {
        super(message, cause);
        this.category = category;
    }

    public ErrorCategory getCategory() {
        return category;
    }
}
