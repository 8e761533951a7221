package com.kernos.kernel;

import com.kernos.keycode.Keycode;

/**
 * Observable record of a committed kernel change. Published to {@link KernelEventListener}s only
 * after the whole action or batch succeeded; an aborted action publishes nothing.
 *
 * @param sequence        per-kernel sequence number, strictly increasing
 * @param timestampMillis commit time
 * @param kernel          kernel that applied the change
 * @param type            what changed
 * @param action          instruction that caused the change
 * @param subject         module, policy, new executor or new kernel
 * @param keycode         module keycode, when applicable
 * @param entryPoint      entry point, for permission events
 * @param previous        replaced module or executor, for upgrade and executor change
 */
public record KernelEvent(
        long sequence,
        long timestampMillis,
        Address kernel,
        KernelEventType type,
        Actions action,
        Address subject,
        Keycode keycode,
        String entryPoint,
        Address previous
) {
}
