/**
 * Kernel startup: {@link com.kernos.bootstrap.KernelBootstrap} wires configuration, ledger and metrics,
 * and installs what {@link com.kernos.bootstrap.ModuleProvider}s and {@link com.kernos.bootstrap.PolicyProvider}s supply.
 */
package com.kernos.bootstrap;
