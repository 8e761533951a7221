package com.kernos.submodules;

import com.kernos.kernel.Capability;
import com.kernos.kernel.Kernel;
import com.kernos.kernel.Permission;
import com.kernos.kernel.Policy;
import com.kernos.keycode.Keycode;

import java.util.List;

class SubmodulePolicy extends Policy {

    List<Permission> requests = List.of(
            Permission.of(MockParentModule.KEYCODE, ModuleWithSubmodules.INSTALL_SUBMODULE),
            Permission.of(MockParentModule.KEYCODE, ModuleWithSubmodules.UPGRADE_SUBMODULE),
            Permission.of(MockParentModule.KEYCODE, ModuleWithSubmodules.EXEC_ON_SUBMODULE));

    SubmodulePolicy(Kernel kernel) {
        super(kernel);
    }

    @Override
    protected List<Keycode> configureDependencies() {
        return List.of(MockParentModule.KEYCODE);
    }

    @Override
    protected List<Permission> requestPermissions() {
        return requests;
    }

    Capability capability() {
        return getCapability();
    }
}
