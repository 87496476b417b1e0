package com.imperium.mindjournal.service;

import com.baomidou.mybatisplus.extension.service.IService;
import com.imperium.mindjournal.model.entity.Message;

/**
 * 消息服务，用于加载/保存会话消息。
 */
public interface MessageService extends IService<Message> {
}
