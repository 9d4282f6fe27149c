package org.livo.warehouse.security;

import java.util.Collection;
import java.util.Map;

/**
 * Total order over role names.
 * <p>
 * Built once from configuration and shared read-only. Unknown role names rank 0,
 * so a user holding only unknown roles manages nobody and can be managed by any ranked user.
 * <p>
 * Two comparison rules:
 * - assigning a role: acting rank >= role rank (a holder may grant its own rank)
 * - managing a user:  acting rank >  target rank (peers cannot touch each other, nor themselves)
 */
public class RoleHierarchy {

    private final Map<String, Integer> ranks;

    public RoleHierarchy(Map<String, Integer> ranks) {
        ranks.forEach((role, rank) -> {
            if (rank == null || rank < 1) {
                throw new IllegalArgumentException("role '" + role + "' must have a positive rank");
            }
        });
        this.ranks = Map.copyOf(ranks);
    }

    public boolean isKnown(String roleName) {
        return roleName != null && ranks.containsKey(roleName);
    }

    /**
     * @return the configured rank, or 0 for an unknown role
     */
    public int rankOf(String roleName) {
        if (roleName == null) {
            return 0;
        }
        return ranks.getOrDefault(roleName, 0);
    }

    public int effectiveRank(Collection<String> roleNames) {
        int max = 0;
        for (String roleName : roleNames) {
            max = Math.max(max, rankOf(roleName));
        }
        return max;
    }

    public boolean canAssign(Collection<String> actingRoles, String targetRoleName) {
        return isKnown(targetRoleName) && effectiveRank(actingRoles) >= rankOf(targetRoleName);
    }

    public boolean canManageUser(Collection<String> actingRoles, Collection<String> targetUserRoles) {
        return effectiveRank(actingRoles) > effectiveRank(targetUserRoles);
    }

    /**
     * Profile and password edits: equal rank is enough.
     */
    public boolean canUpdateUser(Collection<String> actingRoles, Collection<String> targetUserRoles) {
        return effectiveRank(actingRoles) >= effectiveRank(targetUserRoles);
    }
}
