package org.livo.warehouse.business;

import com.baomidou.mybatisplus.core.conditions.query.LambdaQueryWrapper;
import com.baomidou.mybatisplus.core.conditions.update.LambdaUpdateWrapper;
import lombok.extern.slf4j.Slf4j;
import org.livo.warehouse.config.WarehouseProperties;
import org.livo.warehouse.domain.Role;
import org.livo.warehouse.domain.User;
import org.livo.warehouse.domain.UserRole;
import org.livo.warehouse.dto.CreateUserRequest;
import org.livo.warehouse.dto.PageResult;
import org.livo.warehouse.dto.ProfileUpdateRequest;
import org.livo.warehouse.exception.ConflictException;
import org.livo.warehouse.exception.ForbiddenException;
import org.livo.warehouse.exception.NotFoundException;
import org.livo.warehouse.exception.ValidationFailedException;
import org.livo.warehouse.mapper.UserRoleMapper;
import org.livo.warehouse.security.ActingUser;
import org.livo.warehouse.security.AuthorizationGuard;
import org.livo.warehouse.security.PasswordHasher;
import org.livo.warehouse.service.IRoleService;
import org.livo.warehouse.service.IUserService;
import org.livo.warehouse.util.LikePatternUtil;
import org.livo.warehouse.util.TraceIdUtil;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Objects;

/**
 * User and role administration.
 * <p>
 * Existence checks always run before permission checks, so NotFound and Forbidden stay distinct.
 */
@Slf4j
@Service
public class UserManagementService {

    private final IUserService userService;
    private final IRoleService roleService;
    private final UserRoleMapper userRoleMapper;
    private final AuthorizationGuard authorizationGuard;
    private final PasswordHasher passwordHasher;
    private final WarehouseProperties properties;
    private final Clock clock;

    public UserManagementService(IUserService userService,
                                 IRoleService roleService,
                                 UserRoleMapper userRoleMapper,
                                 AuthorizationGuard authorizationGuard,
                                 PasswordHasher passwordHasher,
                                 WarehouseProperties properties,
                                 Clock clock) {
        this.userService = userService;
        this.roleService = roleService;
        this.userRoleMapper = userRoleMapper;
        this.authorizationGuard = authorizationGuard;
        this.passwordHasher = passwordHasher;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Grant a role. The actor's effective rank must reach the role's rank.
     */
    @Transactional(rollbackFor = Exception.class)
    public User assignRole(Long userId, String roleName, ActingUser actor) {
        User user = requireUser(userId);
        Role role = requireRole(roleName);
        if (user.hasRole(roleName)) {
            throw new ConflictException("User " + userId + " already has role '" + roleName + "'");
        }
        authorizationGuard.requireCanAssign(actor, roleName, "assign");

        userRoleMapper.insert(UserRole.builder()
                .userId(userId)
                .roleId(role.getId())
                .assignedBy(actor.getId())
                .createdAt(now())
                .build());

        log.info("[Role assigned] userId={}, role={}, assignedBy={}, traceId={}",
                userId, roleName, actor.getId(), TraceIdUtil.getTraceId());
        return userService.getWithRoles(userId);
    }

    @Transactional(rollbackFor = Exception.class)
    public User removeRole(Long userId, String roleName, ActingUser actor) {
        User user = requireUser(userId);
        Role role = requireRole(roleName);
        if (!user.hasRole(roleName)) {
            throw new NotFoundException("User " + userId + " does not have role '" + roleName + "'");
        }
        authorizationGuard.requireCanAssign(actor, roleName, "remove");

        userRoleMapper.delete(new LambdaQueryWrapper<UserRole>()
                .eq(UserRole::getUserId, userId)
                .eq(UserRole::getRoleId, role.getId()));

        log.info("[Role removed] userId={}, role={}, removedBy={}, traceId={}",
                userId, roleName, actor.getId(), TraceIdUtil.getTraceId());
        return userService.getWithRoles(userId);
    }

    /**
     * Create an account with one initial role, the configured default when none is given.
     * The role grant is checked before anything is written.
     */
    @Transactional(rollbackFor = Exception.class)
    public User createUser(CreateUserRequest request, ActingUser actor) {
        if (userService.existsByUsername(request.getUsername())
                || userService.existsByEmail(request.getEmail(), null)) {
            throw new ConflictException("Username or email already taken");
        }

        String roleName = StringUtils.hasText(request.getInitialRole())
                ? request.getInitialRole()
                : properties.getUsers().getDefaultRole();
        Role role = roleService.getByName(roleName);
        if (role == null) {
            throw new ValidationFailedException("Invalid role specified: " + roleName);
        }
        if (StringUtils.hasText(request.getInitialRole())) {
            authorizationGuard.requireCanAssign(actor, roleName, "assign");
        }

        LocalDateTime now = now();
        User user = User.builder()
                .username(request.getUsername())
                .email(request.getEmail())
                .password(passwordHasher.hash(request.getPassword()))
                .fullName(request.getFullName())
                .isActive(request.isActive())
                .deleted(0)
                .createdAt(now)
                .updatedAt(now)
                .build();
        userService.save(user);

        userRoleMapper.insert(UserRole.builder()
                .userId(user.getId())
                .roleId(role.getId())
                .assignedBy(actor.getId())
                .createdAt(now)
                .build());

        log.info("[User created] userId={}, username={}, role={}, createdBy={}, traceId={}",
                user.getId(), user.getUsername(), roleName, actor.getId(), TraceIdUtil.getTraceId());
        return userService.getWithRoles(user.getId());
    }

    /**
     * Soft-delete a user and drop its role grants. Needs a strictly higher rank, never allowed on oneself.
     */
    @Transactional(rollbackFor = Exception.class)
    public void deleteUser(Long userId, ActingUser actor) {
        User user = requireUser(userId);
        if (Objects.equals(userId, actor.getId())) {
            log.warn("[Permission denied] action=delete self, actorId={}", actor.getId());
            throw new ForbiddenException("Cannot delete your own account");
        }
        authorizationGuard.requireCanManageUser(actor, user, "delete");

        userRoleMapper.delete(new LambdaQueryWrapper<UserRole>().eq(UserRole::getUserId, userId));
        userService.removeById(userId);

        log.info("[User deleted] userId={}, username={}, deletedBy={}, traceId={}",
                userId, user.getUsername(), actor.getId(), TraceIdUtil.getTraceId());
    }

    /**
     * Set a new password and revoke the refresh token.
     */
    @Transactional(rollbackFor = Exception.class)
    public void resetPassword(Long userId, String newPassword, ActingUser actor) {
        User user = requireUser(userId);
        authorizationGuard.requireCanUpdateUser(actor, user, "reset the password of");

        userService.update(new LambdaUpdateWrapper<User>()
                .eq(User::getId, userId)
                .set(User::getPassword, passwordHasher.hash(newPassword))
                .set(User::getRefreshToken, null)
                .set(User::getUpdatedAt, now()));

        log.info("[Password reset] userId={}, actorId={}, traceId={}",
                userId, actor.getId(), TraceIdUtil.getTraceId());
    }

    @Transactional(rollbackFor = Exception.class)
    public User updateProfile(Long userId, ProfileUpdateRequest request, ActingUser actor) {
        User user = requireUser(userId);
        authorizationGuard.requireCanUpdateUser(actor, user, "update");
        if (StringUtils.hasText(request.getEmail()) && userService.existsByEmail(request.getEmail(), userId)) {
            throw new ConflictException("Email already taken by another user");
        }

        if (StringUtils.hasText(request.getFullName())) {
            user.setFullName(request.getFullName());
        }
        if (StringUtils.hasText(request.getEmail())) {
            user.setEmail(request.getEmail());
        }
        user.setUpdatedAt(now());
        userService.updateById(user);

        log.info("[Profile updated] userId={}, actorId={}, traceId={}",
                userId, actor.getId(), TraceIdUtil.getTraceId());
        return user;
    }

    @Transactional(rollbackFor = Exception.class)
    public User updateStatus(Long userId, boolean active, ActingUser actor) {
        User user = requireUser(userId);
        authorizationGuard.requireRank(actor, properties.getUsers().getStatusRole(), "change user status");

        user.setIsActive(active);
        user.setUpdatedAt(now());
        userService.updateById(user);

        log.info("[User status updated] userId={}, active={}, actorId={}, traceId={}",
                userId, active, actor.getId(), TraceIdUtil.getTraceId());
        return user;
    }

    public User getUser(Long userId) {
        return requireUser(userId);
    }

    /**
     * Users ordered by id, optionally filtered by a case-insensitive match on username or full name.
     */
    public PageResult<User> listUsers(int page, int limit, String search) {
        if (page < 1 || limit < 1) {
            throw new ValidationFailedException("page and limit must be positive");
        }
        LambdaQueryWrapper<User> query = new LambdaQueryWrapper<>();
        if (StringUtils.hasText(search)) {
            String pattern = LikePatternUtil.contains(search.trim());
            query.and(w -> w.apply("username ILIKE {0}", pattern).or().apply("full_name ILIKE {0}", pattern));
        }
        long total = userService.count(query);

        query.orderByAsc(User::getId).last("LIMIT " + limit + " OFFSET " + (long) (page - 1) * limit);
        List<User> users = userService.list(query);
        users.forEach(user -> user.setRoles(userService.listRoleNames(user.getId())));
        return new PageResult<>(users, page, limit, total);
    }

    public List<Role> listRoles() {
        return roleService.list(new LambdaQueryWrapper<Role>().orderByAsc(Role::getId));
    }

    private User requireUser(Long userId) {
        User user = userService.getWithRoles(userId);
        if (user == null) {
            throw NotFoundException.user(userId);
        }
        return user;
    }

    private Role requireRole(String roleName) {
        Role role = roleService.getByName(roleName);
        if (role == null) {
            throw NotFoundException.role(roleName);
        }
        return role;
    }

    private LocalDateTime now() {
        return LocalDateTime.now(clock);
    }
}
