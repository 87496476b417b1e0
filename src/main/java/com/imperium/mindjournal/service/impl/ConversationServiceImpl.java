package com.imperium.mindjournal.service.impl;

import com.baomidou.mybatisplus.extension.service.impl.ServiceImpl;
import com.imperium.mindjournal.mapper.ConversationMapper;
import com.imperium.mindjournal.model.entity.Conversation;
import com.imperium.mindjournal.service.ConversationService;
import org.springframework.stereotype.Service;

@Service
public class ConversationServiceImpl extends ServiceImpl<ConversationMapper, Conversation> implements ConversationService {
}
