package org.livo.warehouse.security;

import lombok.extern.slf4j.Slf4j;
import org.livo.warehouse.domain.User;
import org.livo.warehouse.exception.ForbiddenException;
import org.springframework.stereotype.Component;

/**
 * Permit/deny decisions for an {@link ActingUser}, backed by the {@link RoleHierarchy}.
 * <p>
 * Callers run existence checks first, so a denial here is always distinguishable
 * from a missing entity.
 */
@Slf4j
@Component
public class AuthorizationGuard {

    private final RoleHierarchy roleHierarchy;

    public AuthorizationGuard(RoleHierarchy roleHierarchy) {
        this.roleHierarchy = roleHierarchy;
    }

    public boolean canAssign(ActingUser actor, String roleName) {
        return roleHierarchy.canAssign(actor.getRoles(), roleName);
    }

    public boolean canManageUser(ActingUser actor, User target) {
        return roleHierarchy.canManageUser(actor.getRoles(), target.getRoles());
    }

    /**
     * Require the actor's effective rank to reach the rank of {@code roleName}.
     */
    public void requireRank(ActingUser actor, String roleName, String action) {
        if (roleHierarchy.effectiveRank(actor.getRoles()) < roleHierarchy.rankOf(roleName)
                || !roleHierarchy.isKnown(roleName)) {
            log.warn("[Permission denied] action={}, actorId={}, actorRoles={}, requiredRole={}",
                    action, actor.getId(), actor.getRoles(), roleName);
            throw new ForbiddenException("Insufficient permissions to " + action);
        }
    }

    public void requireCanAssign(ActingUser actor, String roleName, String action) {
        if (!canAssign(actor, roleName)) {
            log.warn("[Permission denied] action={}, actorId={}, actorRoles={}, role={}",
                    action, actor.getId(), actor.getRoles(), roleName);
            throw new ForbiddenException("Insufficient permissions to " + action + " role '" + roleName + "'");
        }
    }

    public void requireCanManageUser(ActingUser actor, User target, String action) {
        if (!canManageUser(actor, target)) {
            log.warn("[Permission denied] action={}, actorId={}, targetUserId={}, targetRoles={}",
                    action, actor.getId(), target.getId(), target.getRoles());
            throw new ForbiddenException("Insufficient permissions to " + action + " this user");
        }
    }

    public void requireCanUpdateUser(ActingUser actor, User target, String action) {
        if (!roleHierarchy.canUpdateUser(actor.getRoles(), target.getRoles())) {
            log.warn("[Permission denied] action={}, actorId={}, targetUserId={}, targetRoles={}",
                    action, actor.getId(), target.getId(), target.getRoles());
            throw new ForbiddenException("Insufficient permissions to " + action + " this user");
        }
    }
}
