package com.kernos.submodules;

import com.kernos.kernel.ErrorCategory;
import com.kernos.kernel.KernelException;
import com.kernos.keycode.SubKeycode;

public final class SubmoduleNotInstalledException extends KernelException {

    private final SubKeycode subKeycode;

    public SubmoduleNotInstalledException(SubKeycode subKeycode) {
        super(ErrorCategory.LIFECYCLE, String.format("Submodule %s is not installed", subKeycode));
        this.subKeycode = subKeycode;
    }

    public SubKeycode getSubKeycode() {
        return subKeycode;
    }
}
