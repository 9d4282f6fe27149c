package org.livo.warehouse.service;

import com.baomidou.mybatisplus.extension.service.IService;
import org.livo.warehouse.domain.User;

import java.util.List;

public interface IUserService extends IService<User> {

    /**
     * @return the user with {@link User#getRoles()} filled, or null
     */
    User getWithRoles(Long userId);

    List<String> listRoleNames(Long userId);

    boolean existsByUsername(String username);

    /**
     * @param excludeUserId user to ignore, null to check everyone
     */
    boolean existsByEmail(String email, Long excludeUserId);
}
