package org.livo.warehouse.service.impl;

import com.baomidou.mybatisplus.core.conditions.query.LambdaQueryWrapper;
import com.baomidou.mybatisplus.extension.service.impl.ServiceImpl;
import lombok.RequiredArgsConstructor;
import org.livo.warehouse.domain.User;
import org.livo.warehouse.mapper.UserMapper;
import org.livo.warehouse.mapper.UserRoleMapper;
import org.livo.warehouse.service.IUserService;
import org.springframework.stereotype.Service;

import java.util.List;

@Service
@RequiredArgsConstructor
public class UserServiceImpl extends ServiceImpl<UserMapper, User> implements IUserService {

    private final UserMapper userMapper;
    private final UserRoleMapper userRoleMapper;

    @Override
    public User getWithRoles(Long userId) {
        if (userId == null) {
            return null;
        }
        User user = userMapper.selectById(userId);
        if (user != null) {
            user.setRoles(listRoleNames(userId));
        }
        return user;
    }

    @Override
    public List<String> listRoleNames(Long userId) {
        return userRoleMapper.selectRoleNamesByUserId(userId);
    }

    @Override
    public boolean existsByUsername(String username) {
        return userMapper.selectCount(new LambdaQueryWrapper<User>()
                .eq(User::getUsername, username)) > 0;
    }

    @Override
    public boolean existsByEmail(String email, Long excludeUserId) {
        return userMapper.selectCount(new LambdaQueryWrapper<User>()
                .eq(User::getEmail, email)
                .ne(excludeUserId != null, User::getId, excludeUserId)) > 0;
    }
}
