package com.kernos.kernel;

import com.kernos.keycode.Keycode;

/**
 * Registry entry for an installed module. The keycode is fixed; {@code module} changes on upgrade.
 *
 * @param keycode keycode the module is installed under
 * @param module  currently installed implementation
 * @param version version the module reported when it was installed or upgraded
 */
public record ModuleRecord(Keycode keycode, Module module, Version version) {

    /** Address of the installed implementation. */
    public Address address() {
        return module.getAddress();
    }
}
