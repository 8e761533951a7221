/**
 * Identifier codec for the kernel: fixed-width module names and namespaced submodule names.
 * <ul>
 *   <li>{@link com.kernos.keycode.Keycode} – five upper-case letters naming one installed module (e.g. {@code TRSRY})</li>
 *   <li>{@link com.kernos.keycode.SubKeycode} – {@code <keycode>.<suffix>} naming a submodule inside its parent's namespace</li>
 *   <li>{@link com.kernos.keycode.InvalidKeycodeException} / {@link com.kernos.keycode.InvalidSubKeycodeException} – malformed input</li>
 * </ul>
 * Both types validate at conversion; a constructed instance is always well-formed.
 */
package com.kernos.keycode;
