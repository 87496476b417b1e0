package com.imperium.mindjournal.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.imperium.mindjournal.model.entity.JournalEntry;

public interface JournalEntryMapper extends BaseMapper<JournalEntry> {
}
