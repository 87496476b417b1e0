package com.imperium.mindjournal.service.impl;

import com.baomidou.mybatisplus.extension.service.impl.ServiceImpl;
import com.imperium.mindjournal.mapper.MessageMapper;
import com.imperium.mindjournal.model.entity.Message;
import com.imperium.mindjournal.service.MessageService;
import org.springframework.stereotype.Service;

@Service
public class MessageServiceImpl extends ServiceImpl<MessageMapper, Message> implements MessageService {
}
