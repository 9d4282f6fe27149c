package org.livo.warehouse.security;

import com.baomidou.mybatisplus.core.conditions.query.LambdaQueryWrapper;
import lombok.extern.slf4j.Slf4j;
import org.livo.warehouse.domain.User;
import org.livo.warehouse.exception.UnauthenticatedException;
import org.livo.warehouse.service.IUserService;
import org.springframework.stereotype.Component;

/**
 * Checks a username and password typed in on the spot, for example a coordinator
 * approving an action on a picker's handheld.
 * <p>
 * Unknown user, inactive account and wrong password all fail the same way.
 */
@Slf4j
@Component
public class CredentialVerifier {

    private final IUserService userService;
    private final PasswordHasher passwordHasher;

    public CredentialVerifier(IUserService userService, PasswordHasher passwordHasher) {
        this.userService = userService;
        this.passwordHasher = passwordHasher;
    }

    /**
     * @return the credential holder with its role names
     * @throws UnauthenticatedException when the credentials do not match an active account
     */
    public ActingUser verify(String username, String rawPassword) {
        User user = userService.getOne(new LambdaQueryWrapper<User>().eq(User::getUsername, username));
        if (user == null || !Boolean.TRUE.equals(user.getIsActive())
                || !passwordHasher.matches(rawPassword, user.getPassword())) {
            log.warn("[Credential check failed] username={}, exists={}", username, user != null);
            throw new UnauthenticatedException("Invalid credentials for " + username);
        }
        return ActingUser.of(user.getId(), userService.listRoleNames(user.getId()));
    }
}
