package com.imperium.mindjournal.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.imperium.mindjournal.model.entity.User;

public interface UserMapper extends BaseMapper<User> {
}
