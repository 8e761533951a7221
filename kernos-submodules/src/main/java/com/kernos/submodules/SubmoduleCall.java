package com.kernos.submodules;

/**
 * Work run against one installed submodule on behalf of a permitted policy.
 *
 * @param <T> result type
 */
@FunctionalInterface
public interface SubmoduleCall<T> {

    T apply(Submodule submodule, ParentCapability parent);
}
