package com.kernos.kernel;

/**
 * Caller token the kernel issues to a policy when it is activated. Module entry points take it as
 * the caller identity and pass it to {@link Module#permissioned(Capability, String)}.
 * <p>
 * Only the kernel can create one. It is valid while it is the token the issuing kernel currently
 * holds for the policy: deactivation, reactivation (which issues a fresh token) and kernel
 * migration all invalidate it.
 */
public final class Capability {

    private final Kernel issuer;
    private final Address holder;
    private final long serial;

    Capability(Kernel issuer, Address holder, long serial) {
        this.issuer = issuer;
        this.holder = holder;
        this.serial = serial;
    }

    Kernel getIssuer() {
        return issuer;
    }

    /** Address of the policy this token was issued to. */
    public Address getHolder() {
        return holder;
    }

    /** Issue number within the issuing kernel. */
    public long getSerial() {
        return serial;
    }

    @Override
    public String toString() {
        return "Capability{" + holder + ", serial=" + serial + "}";
    }
}
