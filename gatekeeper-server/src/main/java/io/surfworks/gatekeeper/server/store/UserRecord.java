package io.surfworks.gatekeeper.server.store;

/**
 * A license owner.
 *
 * @param id user id
 * @param email unique email, or null when the provider did not send one
 * @param name display name, may be null
 */
public record UserRecord(String id, String email, String name) {}
