package com.imperium.mindjournal.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.imperium.mindjournal.model.entity.Conversation;

public interface ConversationMapper extends BaseMapper<Conversation> {
}
