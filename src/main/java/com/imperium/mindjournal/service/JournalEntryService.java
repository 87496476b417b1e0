package com.imperium.mindjournal.service;

import com.baomidou.mybatisplus.extension.service.IService;
import com.imperium.mindjournal.model.entity.JournalEntry;

/**
 * 日记条目服务（只读使用）。
 */
public interface JournalEntryService extends IService<JournalEntry> {
}
