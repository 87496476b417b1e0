package com.imperium.mindjournal.service;

import com.baomidou.mybatisplus.extension.service.IService;
import com.imperium.mindjournal.model.entity.User;

public interface UserService extends IService<User> {
}
