package com.kernos.kernel;

/**
 * Classification of kernel failures. Every category aborts the whole enclosing call; none is retried.
 */
public enum ErrorCategory {

    /** Malformed or duplicate identifiers, cross-wired parents, wrong target types. */
    IDENTITY,

    /** Caller is not the executor, not permitted, or not the trusted kernel/parent. */
    AUTHORIZATION,

    /** Action would skip or repeat a lifecycle transition. */
    LIFECYCLE,

    /** A dependent could not be kept consistent (refresh failure, reentrancy, version mismatch). */
    CONSISTENCY
}
