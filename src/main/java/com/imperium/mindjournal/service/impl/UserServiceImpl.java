package com.imperium.mindjournal.service.impl;

import com.baomidou.mybatisplus.extension.service.impl.ServiceImpl;
import com.imperium.mindjournal.mapper.UserMapper;
import com.imperium.mindjournal.model.entity.User;
import com.imperium.mindjournal.service.UserService;
import org.springframework.stereotype.Service;

@Service
public class UserServiceImpl extends ServiceImpl<UserMapper, User> implements UserService {
}
