package com.imperium.mindjournal.service.impl;

import com.baomidou.mybatisplus.extension.service.impl.ServiceImpl;
import com.imperium.mindjournal.mapper.JournalEntryMapper;
import com.imperium.mindjournal.model.entity.JournalEntry;
import com.imperium.mindjournal.service.JournalEntryService;
import org.springframework.stereotype.Service;

@Service
public class JournalEntryServiceImpl extends ServiceImpl<JournalEntryMapper, JournalEntry> implements JournalEntryService {
}
