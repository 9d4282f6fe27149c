package org.livo.warehouse.security;

/**
 * One-way password hashing used by user management.
 */
public interface PasswordHasher {

    String hash(String rawPassword);

    boolean matches(String rawPassword, String storedHash);
}
