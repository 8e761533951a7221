/**
 * Per-module plugin tables. A {@link com.kernos.submodules.ModuleWithSubmodules} registers
 * {@link com.kernos.submodules.Submodule}s under {@link com.kernos.keycode.SubKeycode}s in its own namespace
 * and calls them with {@link com.kernos.submodules.ParentCapability} tokens only it issues.
 */
package com.kernos.submodules;
