package org.livo.warehouse.security;

import lombok.Value;

import java.util.Collection;
import java.util.Set;

/**
 * The authenticated operator behind a call. Resolved once at the request boundary
 * and passed explicitly to every operation.
 */
@Value
public class ActingUser {

    Long id;
    Set<String> roles;

    public static ActingUser of(Long id, Collection<String> roles) {
        if (id == null) {
            throw new IllegalArgumentException("acting user id is required");
        }
        return new ActingUser(id, Set.copyOf(roles));
    }
}
