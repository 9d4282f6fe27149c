package org.livo.warehouse.controller;

import jakarta.validation.Valid;
import org.livo.warehouse.business.UserManagementService;
import org.livo.warehouse.domain.Role;
import org.livo.warehouse.domain.User;
import org.livo.warehouse.dto.CreateUserRequest;
import org.livo.warehouse.dto.PageResult;
import org.livo.warehouse.dto.PasswordResetRequest;
import org.livo.warehouse.dto.ProfileUpdateRequest;
import org.livo.warehouse.dto.RoleRequest;
import org.livo.warehouse.dto.UserStatusRequest;
import org.livo.warehouse.security.ActingUser;
import org.livo.warehouse.security.ActingUserResolver;
import org.livo.warehouse.util.ResponseUtil;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/user-manager")
public class UserManagerController {

    private final UserManagementService userManagementService;
    private final ActingUserResolver actingUserResolver;

    public UserManagerController(UserManagementService userManagementService,
                                 ActingUserResolver actingUserResolver) {
        this.userManagementService = userManagementService;
        this.actingUserResolver = actingUserResolver;
    }

    @GetMapping("/roles")
    public ResponseEntity<Map<String, Object>> listRoles(
            @RequestHeader(ActingUserResolver.USER_ID_HEADER) Long userId) {
        actingUserResolver.resolve(userId);
        List<Role> roles = userManagementService.listRoles();
        return ResponseEntity.ok(ResponseUtil.success("Roles retrieved successfully", roles));
    }

    @GetMapping("/users")
    public ResponseEntity<Map<String, Object>> listUsers(
            @RequestHeader(ActingUserResolver.USER_ID_HEADER) Long userId,
            @RequestParam(defaultValue = "1") int page,
            @RequestParam(defaultValue = "10") int limit,
            @RequestParam(required = false) String search) {
        actingUserResolver.resolve(userId);
        PageResult<User> users = userManagementService.listUsers(page, limit, search);
        return ResponseEntity.ok(ResponseUtil.success("Users retrieved successfully", users));
    }

    @GetMapping("/users/{id}")
    public ResponseEntity<Map<String, Object>> getUser(
            @RequestHeader(ActingUserResolver.USER_ID_HEADER) Long userId,
            @PathVariable Long id) {
        actingUserResolver.resolve(userId);
        return ResponseEntity.ok(ResponseUtil.success("User retrieved successfully", userManagementService.getUser(id)));
    }

    @PostMapping("/users")
    public ResponseEntity<Map<String, Object>> createUser(
            @RequestHeader(ActingUserResolver.USER_ID_HEADER) Long userId,
            @Valid @RequestBody CreateUserRequest request) {
        ActingUser actor = actingUserResolver.resolve(userId);
        User user = userManagementService.createUser(request, actor);
        return ResponseEntity.status(HttpStatus.CREATED).body(ResponseUtil.success("User created successfully", user));
    }

    @DeleteMapping("/users/{id}")
    public ResponseEntity<Map<String, Object>> deleteUser(
            @RequestHeader(ActingUserResolver.USER_ID_HEADER) Long userId,
            @PathVariable Long id) {
        ActingUser actor = actingUserResolver.resolve(userId);
        userManagementService.deleteUser(id, actor);
        return ResponseEntity.ok(ResponseUtil.success("User deleted successfully"));
    }

    @PutMapping("/users/{id}/password")
    public ResponseEntity<Map<String, Object>> resetPassword(
            @RequestHeader(ActingUserResolver.USER_ID_HEADER) Long userId,
            @PathVariable Long id,
            @Valid @RequestBody PasswordResetRequest request) {
        ActingUser actor = actingUserResolver.resolve(userId);
        userManagementService.resetPassword(id, request.getNewPassword(), actor);
        return ResponseEntity.ok(ResponseUtil.success("Password updated successfully"));
    }

    @PutMapping("/users/{id}/profile")
    public ResponseEntity<Map<String, Object>> updateProfile(
            @RequestHeader(ActingUserResolver.USER_ID_HEADER) Long userId,
            @PathVariable Long id,
            @Valid @RequestBody ProfileUpdateRequest request) {
        ActingUser actor = actingUserResolver.resolve(userId);
        User user = userManagementService.updateProfile(id, request, actor);
        return ResponseEntity.ok(ResponseUtil.success("User profile updated successfully", user));
    }

    @PutMapping("/users/{id}/status")
    public ResponseEntity<Map<String, Object>> updateStatus(
            @RequestHeader(ActingUserResolver.USER_ID_HEADER) Long userId,
            @PathVariable Long id,
            @Valid @RequestBody UserStatusRequest request) {
        ActingUser actor = actingUserResolver.resolve(userId);
        User user = userManagementService.updateStatus(id, request.getActive(), actor);
        return ResponseEntity.ok(ResponseUtil.success("User status updated successfully", user));
    }

    @PostMapping("/users/{id}/roles")
    public ResponseEntity<Map<String, Object>> assignRole(
            @RequestHeader(ActingUserResolver.USER_ID_HEADER) Long userId,
            @PathVariable Long id,
            @Valid @RequestBody RoleRequest request) {
        ActingUser actor = actingUserResolver.resolve(userId);
        User user = userManagementService.assignRole(id, request.getRoleName(), actor);
        return ResponseEntity.ok(ResponseUtil.success("Role assigned successfully", user));
    }

    @DeleteMapping("/users/{id}/roles")
    public ResponseEntity<Map<String, Object>> removeRole(
            @RequestHeader(ActingUserResolver.USER_ID_HEADER) Long userId,
            @PathVariable Long id,
            @Valid @RequestBody RoleRequest request) {
        ActingUser actor = actingUserResolver.resolve(userId);
        User user = userManagementService.removeRole(id, request.getRoleName(), actor);
        return ResponseEntity.ok(ResponseUtil.success("Role removed successfully", user));
    }
}
