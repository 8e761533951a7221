package com.kernos.kernel;

/** Kinds of {@link KernelEvent}. */
public enum KernelEventType {
    MODULE_INSTALLED,
    MODULE_UPGRADED,
    MODULE_DEPRECATED,
    POLICY_ACTIVATED,
    POLICY_DEACTIVATED,
    PERMISSION_GRANTED,
    PERMISSION_REVOKED,
    EXECUTOR_CHANGED,
    KERNEL_MIGRATED,
    /** One per applied instruction, after the events it caused. */
    ACTION_EXECUTED
}
