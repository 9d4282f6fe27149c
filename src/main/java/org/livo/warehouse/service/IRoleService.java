package org.livo.warehouse.service;

import com.baomidou.mybatisplus.extension.service.IService;
import org.livo.warehouse.domain.Role;

public interface IRoleService extends IService<Role> {

    Role getByName(String name);
}
