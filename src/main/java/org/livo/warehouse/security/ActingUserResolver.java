package org.livo.warehouse.security;

import lombok.extern.slf4j.Slf4j;
import org.livo.warehouse.domain.User;
import org.livo.warehouse.exception.ForbiddenException;
import org.livo.warehouse.service.IUserService;
import org.springframework.stereotype.Component;

/**
 * Turns the authenticated user id forwarded by the gateway ({@code X-User-Id}) into an {@link ActingUser}
 * with its current role names. Roles are read per request and never cached.
 */
@Slf4j
@Component
public class ActingUserResolver {

    public static final String USER_ID_HEADER = "X-User-Id";

    private final IUserService userService;

    public ActingUserResolver(IUserService userService) {
        this.userService = userService;
    }

    public ActingUser resolve(Long userId) {
        User user = userService.getWithRoles(userId);
        if (user == null || !Boolean.TRUE.equals(user.getIsActive())) {
            log.warn("[Acting user rejected] userId={}, exists={}", userId, user != null);
            throw new ForbiddenException("User " + userId + " is unknown or inactive");
        }
        return ActingUser.of(user.getId(), user.getRoles());
    }
}
