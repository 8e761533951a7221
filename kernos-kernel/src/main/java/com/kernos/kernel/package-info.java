/**
 * Kernel, module and policy base types.
 * <ul>
 *   <li>{@link com.kernos.kernel.Kernel} – registry, permission matrix and the executor-only action dispatcher</li>
 *   <li>{@link com.kernos.kernel.Module} – state-owning unit with permissioned entry points</li>
 *   <li>{@link com.kernos.kernel.Policy} – logic unit that calls modules with its {@link com.kernos.kernel.Capability}</li>
 *   <li>{@link com.kernos.kernel.KernelEventListener} – receives committed changes</li>
 * </ul>
 * Rejections are {@link com.kernos.kernel.KernelException} subclasses, grouped by {@link com.kernos.kernel.ErrorCategory}.
 */
package com.kernos.kernel;
