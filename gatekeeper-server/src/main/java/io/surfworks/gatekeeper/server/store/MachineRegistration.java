package io.surfworks.gatekeeper.server.store;

/**
 * Outcome of {@link LicenseStore#registerMachine}.
 */
public enum MachineRegistration {
    /** The machine took a free seat (new, or reactivated). */
    ADMITTED,
    /** The machine already held an active seat; last-seen was updated. */
    REFRESHED,
    /** Every seat is taken; nothing was written. */
    LIMIT_EXCEEDED;

    public boolean isAdmitted() {
        return this != LIMIT_EXCEEDED;
    }
}
