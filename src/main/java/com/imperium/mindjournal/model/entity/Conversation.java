package com.imperium.mindjournal.model.entity;

import com.baomidou.mybatisplus.annotation.TableField;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * 会话表实体，对应 conversations 表。
 */
@Data
@AllArgsConstructor
@NoArgsConstructor
@TableName("conversations")
public class Conversation {

    /** 会话ID */
    @TableId
    private String id;

    /** 所属用户ID */
    @TableField("user_id")
    private String userId;

    /** 会话标题（未设置时取自首条用户消息） */
    private String title;

    /** 是否已归档；归档会话不参与「当前活跃会话」的解析 */
    private Boolean archived;

    /** 创建时间 */
    @TableField("created_at")
    private LocalDateTime createdAt;

    /** 最后更新时间，每次新消息都会刷新 */
    @TableField("updated_at")
    private LocalDateTime updatedAt;
}
