package com.imperium.mindjournal.model.entity;

import com.baomidou.mybatisplus.annotation.TableField;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * 日记条目实体，对应 journal_entries 表。
 * 条目的增删改由日记服务负责，对话编排只读取最近内容作为上下文。
 */
@Data
@AllArgsConstructor
@NoArgsConstructor
@TableName("journal_entries")
public class JournalEntry {

    /** 条目ID */
    @TableId
    private String id;

    /** 所属用户ID */
    @TableField("user_id")
    private String userId;

    /** 标题，可为空 */
    private String title;

    /** 正文 */
    private String content;

    /** 心情（emoji） */
    private String mood;

    /** 类型：text | voice | quick */
    @TableField("entry_type")
    private String entryType;

    /** 字数 */
    @TableField("word_count")
    private Integer wordCount;

    /** 创建时间 */
    @TableField("created_at")
    private LocalDateTime createdAt;

    /** 最后更新时间 */
    @TableField("updated_at")
    private LocalDateTime updatedAt;
}
