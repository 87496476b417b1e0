package com.imperium.mindjournal.policy;

/**
 * 日记上下文策略：最近 N 天内的最近 M 条。
 */
public final class JournalContextPolicy {

    /** 回溯窗口（天） */
    public static final int DEFAULT_WINDOW_DAYS = 3;

    /** 最多注入的日记条数 */
    public static final int DEFAULT_MAX_ENTRIES = 3;

    /** 注入 prompt 时的前缀 */
    public static final String CONTEXT_PREFIX = "Context from user's journal: ";

    private JournalContextPolicy() {}
}
