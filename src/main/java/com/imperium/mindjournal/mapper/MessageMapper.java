package com.imperium.mindjournal.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.imperium.mindjournal.model.entity.Message;

public interface MessageMapper extends BaseMapper<Message> {
}
