package com.imperium.mindjournal.model.entity;

import com.baomidou.mybatisplus.annotation.TableField;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;
import com.baomidou.mybatisplus.extension.handlers.JacksonTypeHandler;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.Map;

/**
 * 消息表实体，对应 messages 表。创建后不可变。
 */
@Data
@AllArgsConstructor
@NoArgsConstructor
@TableName(value = "messages", autoResultMap = true)
public class Message {

    public static final String ROLE_USER = "user";
    public static final String ROLE_ASSISTANT = "assistant";

    /** 消息ID */
    @TableId
    private String id;

    /** 所属会话ID */
    @TableField("conversation_id")
    private String conversationId;

    /** 角色：user | assistant | system */
    private String role;

    /** 消息内容 */
    private String content;

    /** 自由格式的元数据（模型名、耗时等），以 JSON 存储 */
    @TableField(value = "metadata", typeHandler = JacksonTypeHandler.class)
    private Map<String, Object> metadata;

    /** 创建时间 */
    @TableField("created_at")
    private LocalDateTime createdAt;
}
