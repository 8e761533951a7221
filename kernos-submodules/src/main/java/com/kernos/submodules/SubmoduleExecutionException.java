package com.kernos.submodules;

import com.kernos.kernel.ErrorCategory;
import com.kernos.kernel.KernelException;
import com.kernos.keycode.SubKeycode;

/** Wraps a failure raised while running a {@link SubmoduleCall}. */
public final class SubmoduleExecutionException extends KernelException {

    private final SubKeycode subKeycode;

    public SubmoduleExecutionException(SubKeycode subKeycode, Throwable cause) {
        super(ErrorCategory.CONSISTENCY,
                String.format("Call on submodule %s failed: %s", subKeycode, cause.getMessage()), cause);
        this.subKeycode = subKeycode;
    }

    public SubKeycode getSubKeycode() {
        return subKeycode;
    }
}
