package com.imperium.mindjournal.service;

import com.baomidou.mybatisplus.extension.service.IService;
import com.imperium.mindjournal.model.entity.Conversation;

/**
 * 会话服务，用于加载/保存会话。
 */
public interface ConversationService extends IService<Conversation> {
}
