package org.livo.warehouse.business;

import com.baomidou.mybatisplus.core.conditions.query.LambdaQueryWrapper;
import org.junit.jupiter.api.Test;
import org.livo.warehouse.domain.User;
import org.livo.warehouse.dto.CreateUserRequest;
import org.livo.warehouse.dto.PageResult;
import org.livo.warehouse.dto.ProfileUpdateRequest;
import org.livo.warehouse.exception.ConflictException;
import org.livo.warehouse.exception.ForbiddenException;
import org.livo.warehouse.exception.NotFoundException;
import org.livo.warehouse.exception.ValidationFailedException;
import org.livo.warehouse.security.ActingUser;
import org.livo.warehouse.security.PasswordHasher;
import org.livo.warehouse.service.IUserService;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@SpringBootTest
@ActiveProfiles("test")
@Transactional
class UserManagementServiceIntegrationTest {

    @Autowired
    private UserManagementService userManagementService;

    @Autowired
    private IUserService userService;

    @Autowired
    private PasswordHasher passwordHasher;

    private ActingUser actor(String username) {
        User user = userByName(username);
        return ActingUser.of(user.getId(), userService.listRoleNames(user.getId()));
    }

    private User userByName(String username) {
        return userService.getOne(new LambdaQueryWrapper<User>().eq(User::getUsername, username));
    }

    private static CreateUserRequest newUser(String username, String role) {
        return CreateUserRequest.builder()
                .username(username)
                .email(username + "@livo.test")
                .password("secret123")
                .fullName("Test " + username)
                .initialRole(role)
                .build();
    }

    @Test
    void coordinatorCanGrantCoordinatorButAdminCannot() {
        Long targetId = userByName("picker2").getId();

        User updated = userManagementService.assignRole(targetId, "coordinator", actor("coord"));
        assertTrue(updated.hasRole("coordinator"));

        Long otherId = userByName("qc1").getId();
        assertThrows(ForbiddenException.class,
                () -> userManagementService.assignRole(otherId, "coordinator", actor("admin1")));
    }

    @Test
    void assigningAHeldRoleIsAConflict() {
        Long pickerId = userByName("picker1").getId();

        assertThrows(ConflictException.class,
                () -> userManagementService.assignRole(pickerId, "picker", actor("coord")));
    }

    @Test
    void existenceIsCheckedBeforePermission() {
        ActingUser picker = actor("picker1");
        Long qcId = userByName("qc1").getId();

        assertThrows(NotFoundException.class,
                () -> userManagementService.assignRole(Long.MAX_VALUE, "superadmin", picker));
        assertThrows(NotFoundException.class,
                () -> userManagementService.assignRole(qcId, "no-such-role", picker));
    }

    @Test
    void removeRoleRevokesTheGrant() {
        Long pickerId = userByName("picker2").getId();

        User updated = userManagementService.removeRole(pickerId, "picker", actor("coord"));

        assertFalse(updated.hasRole("picker"));
        assertThrows(NotFoundException.class,
                () -> userManagementService.removeRole(pickerId, "picker", actor("coord")));
    }

    @Test
    void createUserDefaultsToGuestAndHashesThePassword() {
        User created = userManagementService.createUser(newUser("newbie", null), actor("coord"));

        assertEquals(List.of("guest"), created.getRoles());
        User stored = userService.getById(created.getId());
        assertTrue(passwordHasher.matches("secret123", stored.getPassword()));
    }

    @Test
    void createUserChecksTheInitialRole() {
        assertThrows(ForbiddenException.class,
                () -> userManagementService.createUser(newUser("sneaky", "superadmin"), actor("coord")));
        assertThrows(ValidationFailedException.class,
                () -> userManagementService.createUser(newUser("lost", "no-such-role"), actor("coord")));
        assertThrows(ConflictException.class,
                () -> userManagementService.createUser(newUser("picker1", "picker"), actor("coord")));
        assertNull(userByName("sneaky"));
    }

    @Test
    void deletionNeedsStrictlyHigherRank() {
        User peer = userManagementService.createUser(newUser("peer", "coordinator"), actor("root"));
        ActingUser coordinator = actor("coord");

        assertThrows(ForbiddenException.class, () -> userManagementService.deleteUser(peer.getId(), coordinator));
        assertThrows(ForbiddenException.class, () -> userManagementService.deleteUser(coordinator.getId(), coordinator));

        userManagementService.deleteUser(peer.getId(), actor("root"));
        assertNull(userService.getById(peer.getId()));
        assertThrows(NotFoundException.class, () -> userManagementService.getUser(peer.getId()));
    }

    @Test
    void passwordResetAllowsPeersAndRevokesRefreshToken() {
        User finance = userManagementService.createUser(newUser("fin", "finance"), actor("root"));
        finance.setRefreshToken("token-abc");
        userService.updateById(finance);

        userManagementService.resetPassword(finance.getId(), "another-pass", actor("admin1"));

        User stored = userService.getById(finance.getId());
        assertNull(stored.getRefreshToken());
        assertTrue(passwordHasher.matches("another-pass", stored.getPassword()));
        assertThrows(ForbiddenException.class,
                () -> userManagementService.resetPassword(finance.getId(), "x-pass-1", actor("picker1")));
    }

    @Test
    void profileEmailMustStayUnique() {
        Long qcId = userByName("qc1").getId();
        ProfileUpdateRequest request = new ProfileUpdateRequest(null, "coord@livo.test");

        assertThrows(ConflictException.class,
                () -> userManagementService.updateProfile(qcId, request, actor("coord")));

        User updated = userManagementService.updateProfile(qcId,
                new ProfileUpdateRequest("Quinn Q.", null), actor("coord"));
        assertEquals("Quinn Q.", updated.getFullName());
        assertEquals("qc1@livo.test", updated.getEmail());
    }

    @Test
    void statusChangeNeedsCoordinator() {
        Long qcId = userByName("qc1").getId();

        assertThrows(ForbiddenException.class,
                () -> userManagementService.updateStatus(qcId, false, actor("admin1")));
        assertFalse(userManagementService.updateStatus(qcId, false, actor("coord")).getIsActive());
    }

    @Test
    void listUsersSearchesCaseInsensitively() {
        PageResult<User> page = userManagementService.listUsers(1, 10, "PICKER");

        assertEquals(2L, page.getTotal());
        assertEquals("picker1", page.getItems().get(0).getUsername());
        assertEquals(List.of("picker"), page.getItems().get(0).getRoles());
    }

    @Test
    void listUsersRejectsNonPositivePaging() {
        assertThrows(ValidationFailedException.class, () -> userManagementService.listUsers(0, 10, null));
        assertThrows(ValidationFailedException.class, () -> userManagementService.listUsers(-1, 10, null));
        assertThrows(ValidationFailedException.class, () -> userManagementService.listUsers(1, 0, null));
    }

    @Test
    void listUsersSearchTreatsWildcardsLiterally() {
        assertEquals(0L, userManagementService.listUsers(1, 10, "picker_").getTotal());
        assertEquals(0L, userManagementService.listUsers(1, 10, "%").getTotal());
    }

    @Test
    void rolesAreListedInSeedOrder() {
        assertEquals("superadmin", userManagementService.listRoles().get(0).getName());
        assertEquals(13, userManagementService.listRoles().size());
    }
}
