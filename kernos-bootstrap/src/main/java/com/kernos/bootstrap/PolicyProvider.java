package com.kernos.bootstrap;

import com.kernos.kernel.Kernel;
import com.kernos.kernel.Policy;

/**
 * SPI for policies activated at bootstrap, after every module is installed.
 * Discovered via META-INF/services/com.kernos.bootstrap.PolicyProvider.
 */
public interface PolicyProvider {

    String getName();

    Policy createPolicy(Kernel kernel);

    default boolean isEnabled() {
        return true;
    }
}
