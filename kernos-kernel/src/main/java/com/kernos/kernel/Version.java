package com.kernos.kernel;

/**
 * (major, minor) version reported by a module or submodule. Each part fits in an unsigned byte.
 * Policies typically pin the major version of the modules they depend on.
 */
public record Version(int major, int minor) implements Comparable<Version> {

    public Version {
        if (major < 0 || major > 255) throw new IllegalArgumentException("major must be 0..255: " + major);
        if (minor < 0 || minor > 255) throw new IllegalArgumentException("minor must be 0..255: " + minor);
    }

    public static Version of(int major, int minor) {
        return new Version(major, minor);
    }

    @Override
    public int compareTo(Version other) {
        return major != other.major ? Integer.compare(major, other.major) : Integer.compare(minor, other.minor);
    }

    @Override
    public String toString() {
        return major + "." + minor;
    }
}
