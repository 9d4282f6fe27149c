package org.livo.warehouse.service.impl;

import com.baomidou.mybatisplus.core.conditions.query.LambdaQueryWrapper;
import com.baomidou.mybatisplus.extension.service.impl.ServiceImpl;
import org.livo.warehouse.domain.Role;
import org.livo.warehouse.mapper.RoleMapper;
import org.livo.warehouse.service.IRoleService;
import org.springframework.stereotype.Service;

@Service
public class RoleServiceImpl extends ServiceImpl<RoleMapper, Role> implements IRoleService {

    @Override
    public Role getByName(String name) {
        return baseMapper.selectOne(new LambdaQueryWrapper<Role>().eq(Role::getName, name));
    }
}
