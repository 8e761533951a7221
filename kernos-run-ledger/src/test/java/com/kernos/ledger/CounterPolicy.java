package com.kernos.ledger;

import com.kernos.kernel.Kernel;
import com.kernos.kernel.Permission;
import com.kernos.kernel.Policy;
import com.kernos.keycode.Keycode;

import java.util.List;

class CounterPolicy extends Policy {

    CounterPolicy(Kernel kernel) {
        super(kernel);
    }

    @Override
    protected List<Keycode> configureDependencies() {
        return List.of(CounterModule.KEYCODE);
    }

    @Override
    protected List<Permission> requestPermissions() {
        return List.of(Permission.of(CounterModule.KEYCODE, "increment"));
    }
}
